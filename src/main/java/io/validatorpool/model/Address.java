package io.validatorpool.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * A 20-byte account address in {@code 0x}-prefixed lowercase hex form.
 */
public record Address(String value) implements Comparable<Address> {
    public static final int HEX_LENGTH = 40;

    public Address {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        if (!trimmed.startsWith("0x") || trimmed.length() != HEX_LENGTH + 2) {
            throw new IllegalArgumentException("address must be 0x followed by " + HEX_LENGTH + " hex chars: " + value);
        }
        for (int i = 2; i < trimmed.length(); i++) {
            if (Character.digit(trimmed.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("invalid hex character in address: " + value);
            }
        }
        value = trimmed;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Address of(String raw) {
        return new Address(raw);
    }

    /**
     * All-ones address, used as the public-round sentinel unless configured otherwise.
     */
    public static Address maxValue() {
        return new Address("0x" + "f".repeat(HEX_LENGTH));
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public int compareTo(Address other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
