package io.validatorpool.storage;

public final class PoolStateKeys {
    public static final String ROTATION_CURSOR = "rotation_cursor";
    public static final String VALIDATOR_COUNT = "validator_count";

    private PoolStateKeys() {
    }
}
