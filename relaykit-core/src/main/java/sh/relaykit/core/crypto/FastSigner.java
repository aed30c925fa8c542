// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.crypto;

import java.math.BigInteger;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

/**
 * Deterministic secp256k1 ECDSA (RFC 6979) that yields the recovery id
 * directly from the nonce point.
 * <p>
 * Signatures are low-s normalized (EIP-2). The returned {@code v} is the raw
 * y-parity, 0 or 1; callers add 27 where a personal-sign encoding is needed.
 * <p>
 * Thread-safe: each call owns its {@link HMacDSAKCalculator} and the shared
 * multiplier holds no mutable state.
 */
final class FastSigner {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());
    private static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);
    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private FastSigner() {
    }

    /**
     * Signs a 32-byte digest.
     *
     * @param messageHash 32-byte hash
     * @param privateKey  private key scalar
     * @return signature with v in {0, 1}
     */
    static Signature sign(final byte[] messageHash, final BigInteger privateKey) {
        final BigInteger n = CURVE.getN();
        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(n, privateKey, messageHash);

        final BigInteger z = new BigInteger(1, messageHash);
        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();
            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(n);
            if (r.signum() == 0) {
                continue;
            }

            BigInteger s = k.modInverse(n).multiply(z.add(r.multiply(privateKey))).mod(n);
            if (s.signum() == 0) {
                continue;
            }

            int v = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;
            // flipping s negates R, which flips its y parity
            if (s.compareTo(HALF_CURVE_ORDER) > 0) {
                s = n.subtract(s);
                v ^= 1;
            }
            return new Signature(toBytes32(r), toBytes32(s), v);
        }
    }

    static ECDomainParameters curve() {
        return CURVE;
    }

    private static byte[] toBytes32(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        if (bytes.length == 32) {
            return bytes;
        }
        final byte[] result = new byte[32];
        if (bytes.length < 32) {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        } else {
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        }
        return result;
    }
}
