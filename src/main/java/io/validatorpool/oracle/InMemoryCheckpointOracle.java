package io.validatorpool.oracle;

import io.validatorpool.error.ErrorKind;
import io.validatorpool.error.ValidatorPoolException;
import io.validatorpool.model.Address;
import io.validatorpool.model.Checkpoint;
import io.validatorpool.pool.ValidatorPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Checkpoint storage kept in memory, driving the pool the way an on-chain output oracle would: it accepts
 * the next checkpoint from whoever is on turn and bonds the submitter's stake right away.
 *
 * <p>Reads take no lock, so the pool may query the oracle while {@link #submitCheckpoint} holds the
 * submission lock and calls back into the pool.
 */
public final class InMemoryCheckpointOracle implements CheckpointOracle {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCheckpointOracle.class);

    private final SubmissionSchedule schedule;
    private final Address self;
    private final List<Checkpoint> checkpoints = new CopyOnWriteArrayList<>();
    private final Object submitLock = new Object();
    private volatile ValidatorPool pool;

    public InMemoryCheckpointOracle(SubmissionSchedule schedule, Address self) {
        this.schedule = schedule;
        this.self = self;
    }

    /**
     * Address the pool knows this storage by; must match the pool's configured checkpoint storage.
     */
    public Address address() {
        return self;
    }

    public SubmissionSchedule schedule() {
        return schedule;
    }

    public void connect(ValidatorPool pool) {
        this.pool = pool;
    }

    @Override
    public long nextExpectedIndex() {
        return checkpoints.size();
    }

    @Override
    public long nextExpectedBlockNumber() {
        return schedule.blockNumberFor(nextExpectedIndex());
    }

    @Override
    public long latestAcceptedIndex() {
        return checkpoints.size() - 1L;
    }

    @Override
    public Optional<Checkpoint> getCheckpoint(long index) {
        if (index < 0L || index >= checkpoints.size()) {
            return Optional.empty();
        }
        return Optional.of(checkpoints.get((int) index));
    }

    @Override
    public long expectedDeadline(long l2BlockNumber) {
        return schedule.deadlineFor(l2BlockNumber);
    }

    public Checkpoint submitCheckpoint(Address submitter, long l2BlockNumber, String outputRoot, long now) {
        ValidatorPool target = pool;
        if (target == null) {
            throw new IllegalStateException("checkpoint storage is not connected to a validator pool");
        }
        synchronized (submitLock) {
            long expectedBlock = nextExpectedBlockNumber();
            if (l2BlockNumber != expectedBlock) {
                throw new ValidatorPoolException(ErrorKind.INVALID_CHECKPOINT,
                        "expected L2 block " + expectedBlock + ", got " + l2BlockNumber);
            }
            long deadline = expectedDeadline(l2BlockNumber);
            if (now < deadline) {
                throw new ValidatorPoolException(ErrorKind.INVALID_CHECKPOINT,
                        "L2 block " + l2BlockNumber + " cannot be checkpointed before " + deadline + ", now " + now);
            }
            if (outputRoot == null || outputRoot.isBlank()) {
                throw new ValidatorPoolException(ErrorKind.INVALID_CHECKPOINT, "output root must not be blank");
            }
            if (!target.nextValidator(now).permits(submitter)) {
                throw ValidatorPoolException.unauthorized(submitter + " is not on turn for L2 block " + l2BlockNumber);
            }
            long index = nextExpectedIndex();
            Checkpoint checkpoint = new Checkpoint(index, submitter, l2BlockNumber, outputRoot, now);
            checkpoints.add(checkpoint);
            try {
                target.createBond(self, index, target.parameters().minBondAmount(),
                        now + target.parameters().finalizationPeriod(), now);
            } catch (RuntimeException e) {
                checkpoints.remove(checkpoints.size() - 1);
                throw e;
            }
            log.info("Checkpoint {} accepted for L2 block {} from {}", index, l2BlockNumber, submitter);
            return checkpoint;
        }
    }
}
