package io.validatorpool.model;

public record Bond(
        long checkpointIndex,
        long amount,
        long expiresAt,
        Address submitter
) {
    public boolean expiredAt(long now) {
        return now >= expiresAt;
    }
}
