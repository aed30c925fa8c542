// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.relaykit.primitives.Hex;

/**
 * Hex-encoded 20-byte account address.
 * <p>
 * Used for signer addresses, call destinations and the relay's own address.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so two addresses differing only in
 * checksum casing are equal.
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = Pattern.compile("^0x[0-9a-fA-F]{" + (BYTE_LENGTH * 2) + "}$");

    /**
     * The zero address ({@code 0x0000000000000000000000000000000000000000}).
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether {@code candidate} is a well-formed address string.
     *
     * @param candidate the string to check, may be null
     * @return true if {@code new Address(candidate)} would succeed
     */
    public static boolean isValid(final String candidate) {
        return candidate != null && HEX.matcher(candidate).matches();
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + Hex.encodeNoPrefix(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
