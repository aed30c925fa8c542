// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.crypto;

import sh.relaykit.core.types.Address;

/**
 * A key holder that can identify itself and authorize relay requests.
 * <p>
 * Relay submissions are authorized with EIP-191 personal signatures over a
 * payload digest, so this is the only signing capability required. Local keys,
 * KMS backends and hardware wallets can all implement it.
 */
public interface Signer {

    /**
     * Returns the address associated with this signer.
     *
     * @return the signer's account address
     */
    Address address();

    /**
     * Signs a raw message according to EIP-191 ({@code personal_sign}).
     * <p>
     * The implementation prefixes the message with
     * {@code "\u0019Ethereum Signed Message:\n" + message.length}, hashes it with
     * Keccak-256 and signs the digest. The returned {@code v} is 27 or 28.
     *
     * @param message the raw message bytes to sign
     * @return the EIP-191 compatible signature
     */
    Signature signMessage(byte[] message);
}
