// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import sh.relaykit.core.crypto.Signature;
import sh.relaykit.core.error.NoAddressAvailableException;
import sh.relaykit.core.types.Address;

/**
 * The signer configured for a relayer.
 *
 * <p>
 * Backend signers know their address immediately. Frontend signers learn it
 * once the interactive signer answers; until then {@link #resolvedAddress()}
 * is empty and {@link #addressReady()} is pending. The address is resolved at
 * most once.
 *
 * @since 0.1.0
 */
public sealed interface RelaySigner permits BackendRelaySigner, FrontendRelaySigner {

    /**
     * Completes with the wallet address once it is known. Every call observes
     * the same outcome.
     */
    CompletableFuture<Address> addressReady();

    /**
     * Returns the address if already resolved, without waiting.
     */
    Optional<Address> resolvedAddress();

    /**
     * @throws NoAddressAvailableException if the address is not resolved yet
     */
    default Address requireAddress() {
        return resolvedAddress().orElseThrow(() -> new NoAddressAvailableException(
                "Signer address is not available yet; pass an address explicitly or wait for addressReady()"));
    }

    /**
     * Produces an EIP-191 personal-sign signature over {@code message}.
     */
    CompletableFuture<Signature> signMessage(byte[] message);

    /**
     * Creates the signer for a signing mode.
     *
     * @throws sh.relaykit.core.error.InvalidPrivateKeyException for a malformed backend key
     */
    static RelaySigner from(final SigningMode mode) {
        if (mode instanceof SigningMode.Backend backend) {
            return new BackendRelaySigner(backend.privateKey());
        }
        return new FrontendRelaySigner(((SigningMode.Frontend) mode).signer());
    }
}
