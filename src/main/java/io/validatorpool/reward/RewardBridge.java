package io.validatorpool.reward;

import io.validatorpool.model.BridgeMessage;

/**
 * Cross-layer messenger that carries reward notifications to the reward vault. Delivery is
 * fire-and-forget: a normal return means the message was handed over, nothing more.
 */
@FunctionalInterface
public interface RewardBridge {
    void send(BridgeMessage message);
}
