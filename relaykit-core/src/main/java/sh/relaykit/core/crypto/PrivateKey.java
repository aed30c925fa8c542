// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import sh.relaykit.core.types.Address;
import sh.relaykit.primitives.Hex;

/**
 * secp256k1 private key held by a backend signer.
 *
 * <p>
 * Provides address derivation, deterministic signing of 32-byte digests and
 * address recovery for verifying signatures produced elsewhere.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("0x59c6...");
 * Address address = key.toAddress();
 *
 * byte[] digest = Keccak256.hash(payload);
 * Signature signature = key.sign(digest);
 * assert PrivateKey.recoverAddress(digest, signature).equals(address);
 * }</pre>
 *
 * <p>
 * {@link #destroy()} drops the key references; later use fails with
 * {@link IllegalStateException}. {@link BigInteger} is immutable, so the
 * material itself cannot be zeroed.
 *
 * @since 0.1.0
 */
public final class PrivateKey implements Destroyable {

    private static final int PRIVATE_KEY_SIZE = 32;
    private static final ECDomainParameters CURVE = FastSigner.curve();

    private volatile BigInteger privateKeyValue;
    private volatile ECPoint publicKey;
    private volatile boolean destroyed = false;

    private PrivateKey(final byte[] keyBytes) {
        try {
            if (keyBytes.length != PRIVATE_KEY_SIZE) {
                throw new IllegalArgumentException(
                        "Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
            }
            final BigInteger value = new BigInteger(1, keyBytes);
            if (value.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (value.compareTo(CURVE.getN()) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }
            this.privateKeyValue = value;
            this.publicKey = new FixedPointCombMultiplier().multiply(CURVE.getG(), value).normalize();
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Creates a private key from a hex string.
     *
     * @param hexString hex-encoded private key (with or without 0x prefix)
     * @return private key instance
     * @throws IllegalArgumentException if the string is not hex or the key is out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hexString.trim()));
    }

    /**
     * Derives the account address: the last 20 bytes of the Keccak-256 hash of
     * the uncompressed public key without its {@code 0x04} tag.
     *
     * @return the address controlled by this key
     * @throws IllegalStateException if the key has been destroyed
     */
    public Address toAddress() {
        final ECPoint pubKey;
        synchronized (this) {
            checkNotDestroyed();
            pubKey = publicKey;
        }
        return addressOf(pubKey);
    }

    /**
     * Signs a 32-byte digest using deterministic ECDSA (RFC 6979).
     *
     * @param messageHash 32-byte digest
     * @return signature with v in {0, 1}
     * @throws IllegalArgumentException if the digest is not 32 bytes
     * @throws IllegalStateException if the key has been destroyed
     */
    public Signature sign(final byte[] messageHash) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + messageHash.length);
        }
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = privateKeyValue;
        }
        return FastSigner.sign(messageHash, key);
    }

    /**
     * Recovers the signing address from a digest and signature.
     * Accepts {@code v} as bare parity (0/1) or personal-sign encoded (27/28).
     *
     * @param messageHash 32-byte digest that was signed
     * @param signature   the signature
     * @return recovered address
     * @throws IllegalArgumentException if recovery fails
     */
    public static Address recoverAddress(final byte[] messageHash, final Signature signature) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes");
        }
        final int recoveryId = signature.recoveryId();
        if (recoveryId != 0 && recoveryId != 1) {
            throw new IllegalArgumentException("Unsupported recovery id: " + signature.v());
        }

        final BigInteger n = CURVE.getN();
        final BigInteger r = new BigInteger(1, signature.r());
        final BigInteger s = new BigInteger(1, signature.s());
        if (r.signum() <= 0 || s.signum() <= 0 || r.compareTo(n) >= 0 || s.compareTo(n) >= 0) {
            throw new IllegalArgumentException("Signature components out of range");
        }

        final ECPoint bigR;
        try {
            bigR = CURVE.getCurve().decodePoint(encodeCompressed(r, recoveryId == 1));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to recover public key from signature", e);
        }

        // Q = r^-1 * (s*R - e*G)
        final BigInteger e = new BigInteger(1, messageHash);
        final BigInteger rInv = r.modInverse(n);
        final ECPoint q = bigR.multiply(rInv.multiply(s).mod(n))
                .subtract(CURVE.getG().multiply(rInv.multiply(e).mod(n)))
                .normalize();
        if (q.isInfinity()) {
            throw new IllegalArgumentException("Failed to recover public key from signature");
        }
        return addressOf(q);
    }

    private static Address addressOf(final ECPoint pubKey) {
        final byte[] encoded = pubKey.getEncoded(false);
        final byte[] hash = Keccak256.hash(Arrays.copyOfRange(encoded, 1, encoded.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    private static byte[] encodeCompressed(final BigInteger x, final boolean oddY) {
        final byte[] encoded = new byte[33];
        encoded[0] = (byte) (oddY ? 0x03 : 0x02);
        final byte[] xBytes = x.toByteArray();
        final int off = xBytes.length > 32 ? 1 : 0;
        System.arraycopy(xBytes, off, encoded, 33 - (xBytes.length - off), xBytes.length - off);
        return encoded;
    }

    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            privateKeyValue = null;
            publicKey = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    /**
     * Never includes key material; shows the derived address instead.
     */
    @Override
    public String toString() {
        try {
            return "PrivateKey[address=" + toAddress() + "]";
        } catch (IllegalStateException e) {
            return "PrivateKey[destroyed]";
        }
    }
}
