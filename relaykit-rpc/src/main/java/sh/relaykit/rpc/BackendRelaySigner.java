// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import javax.security.auth.Destroyable;

import sh.relaykit.core.crypto.PrivateKeySigner;
import sh.relaykit.core.crypto.Signature;
import sh.relaykit.core.error.InvalidPrivateKeyException;
import sh.relaykit.core.types.Address;

/**
 * Signs with a private key held in process. The address is derived at
 * construction.
 */
public final class BackendRelaySigner implements RelaySigner, Destroyable {

    private final PrivateKeySigner signer;
    private final CompletableFuture<Address> ready;

    /**
     * @throws InvalidPrivateKeyException if {@code privateKeyHex} is not a valid secp256k1 key
     */
    public BackendRelaySigner(final String privateKeyHex) {
        Objects.requireNonNull(privateKeyHex, "privateKeyHex");
        try {
            this.signer = new PrivateKeySigner(privateKeyHex);
        } catch (IllegalArgumentException e) {
            throw new InvalidPrivateKeyException("Backend private key is malformed", e);
        }
        this.ready = CompletableFuture.completedFuture(signer.address());
    }

    @Override
    public CompletableFuture<Address> addressReady() {
        return ready.copy();
    }

    @Override
    public Optional<Address> resolvedAddress() {
        return Optional.of(signer.address());
    }

    @Override
    public Address requireAddress() {
        return signer.address();
    }

    @Override
    public CompletableFuture<Signature> signMessage(final byte[] message) {
        try {
            return CompletableFuture.completedFuture(signer.signMessage(message));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public void destroy() {
        signer.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return signer.isDestroyed();
    }

    @Override
    public String toString() {
        return "BackendRelaySigner[address=" + signer.address() + "]";
    }
}
