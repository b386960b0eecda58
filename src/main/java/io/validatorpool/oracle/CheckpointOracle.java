package io.validatorpool.oracle;

import io.validatorpool.model.Checkpoint;

import java.util.Optional;

/**
 * Read side of checkpoint storage, as consumed by the pool.
 */
public interface CheckpointOracle {

    long nextExpectedIndex();

    long nextExpectedBlockNumber();

    /**
     * Index of the most recently accepted checkpoint, or {@code -1} when none has been accepted yet.
     */
    long latestAcceptedIndex();

    Optional<Checkpoint> getCheckpoint(long index);

    /**
     * Earliest L1 time (epoch seconds) at which a checkpoint for {@code l2BlockNumber} may be submitted.
     */
    long expectedDeadline(long l2BlockNumber);
}
