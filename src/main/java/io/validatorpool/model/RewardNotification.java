package io.validatorpool.model;

/**
 * Reward/penalty notice forwarded to the reward vault when a bond is released.
 */
public record RewardNotification(
        Address beneficiary,
        long checkpointIndex,
        long l2BlockNumber,
        long penalty,
        long penaltyPeriod
) {
}
