package io.validatorpool.ledger;

public enum MembershipChange {
    JOINED,
    LEFT,
    UNCHANGED
}
