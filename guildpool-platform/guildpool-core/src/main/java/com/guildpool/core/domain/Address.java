package com.guildpool.core.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A 20-byte account identifier in its canonical {@code 0x}-prefixed lower-case hex form.
 */
public record Address(String value) implements Comparable<Address> {

    private static final Pattern HEX_ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "Address cannot be null");
        value = value.trim().toLowerCase(Locale.ROOT);
        if (!HEX_ADDRESS.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
    }

    public static Address of(String value) {
        return new Address(value);
    }

    public boolean isZero() {
        return equals(ZERO);
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
