package io.validatorpool.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Who may submit the next checkpoint: a specific validator, or anyone during the public round.
 */
public record Assignment(Kind kind, Address validator) {

    public enum Kind {
        ASSIGNED,
        PUBLIC_ROUND
    }

    public Assignment {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.ASSIGNED && validator == null) {
            throw new IllegalArgumentException("assigned turn requires a validator");
        }
        if (kind == Kind.PUBLIC_ROUND && validator != null) {
            throw new IllegalArgumentException("public round carries no validator");
        }
    }

    public static Assignment assigned(Address validator) {
        return new Assignment(Kind.ASSIGNED, validator);
    }

    public static Assignment publicRound() {
        return new Assignment(Kind.PUBLIC_ROUND, null);
    }

    public boolean isPublicRound() {
        return kind == Kind.PUBLIC_ROUND;
    }

    public Optional<Address> assignedValidator() {
        return Optional.ofNullable(validator);
    }

    public boolean permits(Address submitter) {
        return isPublicRound() || validator.equals(submitter);
    }

    public Address toAddress(Address publicRoundSentinel) {
        return isPublicRound() ? publicRoundSentinel : validator;
    }
}
