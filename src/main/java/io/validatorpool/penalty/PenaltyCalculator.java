package io.validatorpool.penalty;

/**
 * Converts the delay of a checkpoint past its expected deadline into a penalty, in seconds.
 *
 * <p>The first {@code nonPenaltyPeriod} seconds after the deadline are free; the penalty then grows one
 * for one with the delay. At most one full round of delay is folded back, and the result never exceeds
 * {@code penaltyPeriod}.
 */
public final class PenaltyCalculator {
    private final long nonPenaltyPeriod;
    private final long penaltyPeriod;

    public PenaltyCalculator(long nonPenaltyPeriod, long penaltyPeriod) {
        if (nonPenaltyPeriod < 0L || penaltyPeriod < 0L) {
            throw new IllegalArgumentException("periods must not be negative");
        }
        this.nonPenaltyPeriod = nonPenaltyPeriod;
        this.penaltyPeriod = penaltyPeriod;
    }

    public long roundDuration() {
        return nonPenaltyPeriod + penaltyPeriod;
    }

    public long penaltyPeriod() {
        return penaltyPeriod;
    }

    public long penalty(long acceptedAt, long expectedDeadline) {
        long elapsed = acceptedAt - expectedDeadline;
        if (elapsed > roundDuration()) {
            elapsed -= roundDuration();
        }
        long penalty = Math.max(0L, elapsed - nonPenaltyPeriod);
        return Math.min(penalty, penaltyPeriod);
    }
}
