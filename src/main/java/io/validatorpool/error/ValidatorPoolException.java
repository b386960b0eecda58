package io.validatorpool.error;

/**
 * Rejected pool operation. The pool never partially applies a rejected call, so callers may inspect
 * {@link #kind()} and retry with different arguments.
 */
public class ValidatorPoolException extends RuntimeException {
    private final ErrorKind kind;

    public ValidatorPoolException(ErrorKind kind, String message) {
        super("[" + kind.name() + "] " + message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static ValidatorPoolException unauthorized(String message) {
        return new ValidatorPoolException(ErrorKind.UNAUTHORIZED, message);
    }

    public static ValidatorPoolException insufficientFunds(String message) {
        return new ValidatorPoolException(ErrorKind.INSUFFICIENT_FUNDS, message);
    }

    public static ValidatorPoolException belowMinimum(String message) {
        return new ValidatorPoolException(ErrorKind.ZERO_OR_BELOW_MINIMUM, message);
    }

    public static ValidatorPoolException noSuchBond(long checkpointIndex) {
        return new ValidatorPoolException(ErrorKind.NO_SUCH_BOND, "no bond for checkpoint " + checkpointIndex);
    }
}
