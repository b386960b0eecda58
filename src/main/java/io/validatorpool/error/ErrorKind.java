package io.validatorpool.error;

public enum ErrorKind {
    UNAUTHORIZED("caller is not the expected collaborator"),
    INSUFFICIENT_FUNDS("balance too low for the requested debit"),
    ZERO_OR_BELOW_MINIMUM("amount is non-positive or under the minimum bond"),
    BOND_ALREADY_EXISTS("a bond already exists for the checkpoint"),
    NO_SUCH_BOND("no bond exists for the checkpoint"),
    NOT_YET_EXPIRED("bond has not reached its expiry"),
    UNKNOWN_CHECKPOINT("checkpoint storage has no such checkpoint"),
    INVALID_CHECKPOINT("checkpoint submission rejected by storage");

    private final String desc;

    ErrorKind(String desc) {
        this.desc = desc;
    }

    public String desc() {
        return desc;
    }
}
