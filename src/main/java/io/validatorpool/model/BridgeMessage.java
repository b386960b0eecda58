package io.validatorpool.model;

public record BridgeMessage(
        long outboxId,
        Address target,
        String payload,
        long gasLimit,
        long createdAt
) {
}
