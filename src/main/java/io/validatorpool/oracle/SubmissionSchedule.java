package io.validatorpool.oracle;

/**
 * Fixed L2 block cadence: block {@code startingBlockNumber} was produced at {@code startingTimestamp} and a
 * new block follows every {@code l2BlockTime} seconds. Checkpoints cover {@code submissionInterval} blocks.
 */
public record SubmissionSchedule(
        long startingBlockNumber,
        long startingTimestamp,
        long l2BlockTime,
        long submissionInterval
) {
    public SubmissionSchedule {
        if (startingBlockNumber < 0L || startingTimestamp < 0L) {
            throw new IllegalArgumentException("starting block and timestamp must not be negative");
        }
        if (l2BlockTime <= 0L || submissionInterval <= 0L) {
            throw new IllegalArgumentException("l2BlockTime and submissionInterval must be positive");
        }
    }

    public long blockNumberFor(long checkpointIndex) {
        return startingBlockNumber + (checkpointIndex + 1L) * submissionInterval;
    }

    public long deadlineFor(long l2BlockNumber) {
        if (l2BlockNumber < startingBlockNumber) {
            throw new IllegalArgumentException("block " + l2BlockNumber + " precedes starting block " + startingBlockNumber);
        }
        return startingTimestamp + (l2BlockNumber - startingBlockNumber) * l2BlockTime;
    }

    public long intervalSeconds() {
        return submissionInterval * l2BlockTime;
    }
}
