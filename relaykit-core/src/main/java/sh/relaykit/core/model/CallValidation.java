// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.model;

import java.util.regex.Pattern;

import sh.relaykit.primitives.Hex;

/**
 * Shared field checks for relayed call descriptors.
 */
final class CallValidation {

    private static final Pattern DECIMAL = Pattern.compile("^[0-9]+$");

    private CallValidation() {
    }

    static String requireCallData(final String data) {
        if (!Hex.isPrefixedHex(data)) {
            throw new IllegalArgumentException("Call data must be 0x-prefixed hex: " + data);
        }
        return data;
    }

    /**
     * Values are decimal strings in the chain's base unit; they are never
     * converted to a floating type.
     */
    static String requireDecimalValue(final String value) {
        if (value == null || !DECIMAL.matcher(value).matches()) {
            throw new IllegalArgumentException("Value must be a non-negative decimal integer string: " + value);
        }
        return value;
    }
}
