// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.primitives;

/**
 * Hex helpers for the {@code 0x}-prefixed strings used throughout relay payloads.
 *
 * <p>
 * Call data, addresses, signatures and hashes all travel to the relay as
 * lowercase {@code 0x}-prefixed hex. Decoding accepts either case and an
 * optional prefix.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLES = new int[128];

    static {
        java.util.Arrays.fill(NIBBLES, -1);
        for (int i = 0; i <= 9; i++) {
            NIBBLES['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLES['a' + i] = 10 + i;
            NIBBLES['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without {@code 0x} prefix.
     *
     * @param hexString the string to decode
     * @return the decoded bytes (empty for {@code "0x"})
     * @throws IllegalArgumentException if the input is null, has odd length or contains non-hex characters
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("Hex string cannot be null");
        }
        final String digits = cleanPrefix(hexString);
        if ((digits.length() & 1) == 1) {
            throw new IllegalArgumentException("Hex string must have an even length: " + hexString);
        }

        final byte[] out = new byte[digits.length() / 2];
        for (int i = 0; i < out.length; i++) {
            final int high = nibble(digits.charAt(2 * i), hexString);
            final int low = nibble(digits.charAt(2 * i + 1), hexString);
            out[i] = (byte) ((high << 4) | low);
        }
        return out;
    }

    /**
     * Encodes bytes as lowercase hex with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string with {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Encodes bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string without {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }
        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[2 * i] = HEX_CHARS[v >>> 4];
            chars[2 * i + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Removes a leading {@code 0x}/{@code 0X} if present.
     *
     * @param hexString the string to clean
     * @return the string without prefix
     * @throws IllegalArgumentException if {@code hexString} is {@code null}
     */
    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("Hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    /**
     * Returns {@code true} if the string starts with {@code 0x} (case-insensitive).
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    /**
     * Returns {@code true} if the value is a {@code 0x}-prefixed string of whole bytes.
     * <p>
     * {@code "0x"} on its own is valid and denotes empty call data.
     *
     * @param value the candidate string, may be null
     * @return whether the value is well-formed prefixed hex
     */
    public static boolean isPrefixedHex(final String value) {
        if (!hasPrefix(value) || (value.length() & 1) == 1) {
            return false;
        }
        for (int i = 2; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c >= NIBBLES.length || NIBBLES[c] == -1) {
                return false;
            }
        }
        return true;
    }

    private static int nibble(final char c, final String originalInput) {
        if (c >= NIBBLES.length || NIBBLES[c] == -1) {
            throw new IllegalArgumentException("Invalid hex character in: " + originalInput);
        }
        return NIBBLES[c];
    }
}
