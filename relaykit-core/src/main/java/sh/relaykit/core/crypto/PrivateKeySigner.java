// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import javax.security.auth.Destroyable;

import sh.relaykit.core.types.Address;

/**
 * {@link Signer} backed by a locally held private key.
 * <p>
 * The address is derived once at construction, so {@link #address()} never fails.
 */
public final class PrivateKeySigner implements Signer, Destroyable {

    private final PrivateKey privateKey;
    private final Address address;

    /**
     * Creates a signer from a hex-encoded private key.
     *
     * @param privateKeyHex the private key (with or without 0x prefix)
     * @throws IllegalArgumentException if the private key is invalid
     */
    public PrivateKeySigner(final String privateKeyHex) {
        this(PrivateKey.fromHex(privateKeyHex));
    }

    public PrivateKeySigner(final PrivateKey privateKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
        this.address = privateKey.toAddress();
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public Signature signMessage(final byte[] message) {
        final Signature raw = privateKey.sign(personalMessageHash(message));
        return new Signature(raw.r(), raw.s(), raw.v() + 27);
    }

    /**
     * Computes the EIP-191 digest a personal signature over {@code message} commits to.
     *
     * @param message the raw message bytes
     * @return the 32-byte digest
     */
    public static byte[] personalMessageHash(final byte[] message) {
        Objects.requireNonNull(message, "message cannot be null");
        return Keccak256.hash(personalMessagePrefix(message.length), message);
    }

    private static byte[] personalMessagePrefix(final int length) {
        return ("\u0019Ethereum Signed Message:\n" + length).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void destroy() {
        privateKey.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return privateKey.isDestroyed();
    }

    @Override
    public String toString() {
        return "PrivateKeySigner[address=" + address + "]";
    }
}
