// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import sh.relaykit.core.crypto.Signature;
import sh.relaykit.core.crypto.Signer;
import sh.relaykit.core.types.Address;

/**
 * A signer owned by someone else, typically a browser wallet or a remote
 * signing service, whose address and signatures arrive asynchronously.
 *
 * <p>
 * {@link #signMessage(byte[])} must produce an EIP-191 personal-sign
 * signature over the given bytes, as {@code personal_sign} does.
 *
 * @since 0.1.0
 */
public interface InteractiveSigner {

    /**
     * Requests the wallet address. Called once, when the relayer is created.
     */
    CompletableFuture<Address> requestAddress();

    CompletableFuture<Signature> signMessage(byte[] message);

    /**
     * Adapts a local {@link Signer}; the futures complete immediately.
     */
    static InteractiveSigner of(final Signer signer) {
        Objects.requireNonNull(signer, "signer");
        return new InteractiveSigner() {
            @Override
            public CompletableFuture<Address> requestAddress() {
                return CompletableFuture.completedFuture(signer.address());
            }

            @Override
            public CompletableFuture<Signature> signMessage(final byte[] message) {
                return CompletableFuture.completedFuture(signer.signMessage(message));
            }
        };
    }
}
