// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.relaykit.primitives.Hex;

/**
 * ECDSA signature over secp256k1.
 *
 * <p>
 * For personal-sign (EIP-191) signatures handed to the relay, {@code v} is
 * 27 or 28. Raw signatures produced by {@link PrivateKey#sign(byte[])} carry
 * the bare y-parity (0 or 1).
 *
 * @param r first 32 bytes of signature
 * @param s second 32 bytes of signature (low-s normalized)
 * @param v recovery id, optionally offset by 27
 * @since 0.1.0
 */
public record Signature(byte[] r, byte[] s, int v) {

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");
        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }
        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    /**
     * Parses a 65-byte {@code r || s || v} hex signature.
     *
     * @param hex the encoded signature, with or without {@code 0x}
     * @return the decoded signature
     * @throws IllegalArgumentException if the input is not 65 bytes of hex
     */
    public static Signature fromHex(final String hex) {
        final byte[] raw = Hex.decode(hex);
        if (raw.length != 65) {
            throw new IllegalArgumentException("Signature must be 65 bytes, got " + raw.length);
        }
        return new Signature(
                Arrays.copyOfRange(raw, 0, 32),
                Arrays.copyOfRange(raw, 32, 64),
                raw[64] & 0xFF);
    }

    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    /**
     * Returns the y-parity (0 or 1) regardless of the 27 offset.
     */
    public int recoveryId() {
        return v >= 27 ? v - 27 : v;
    }

    /**
     * Encodes the signature as the 65-byte {@code r || s || v} hex string relays expect.
     *
     * @return {@code 0x}-prefixed 130-digit hex
     */
    public String toHex() {
        final byte[] out = new byte[65];
        System.arraycopy(r, 0, out, 0, 32);
        System.arraycopy(s, 0, out, 32, 32);
        out[64] = (byte) v;
        return Hex.encode(out);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Signature other)) {
            return false;
        }
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[r=32 bytes, s=32 bytes, v=" + v + "]";
    }
}
