// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import sh.relaykit.core.DebugLogger;
import sh.relaykit.core.crypto.Signature;
import sh.relaykit.core.error.NoAddressAvailableException;
import sh.relaykit.core.types.Address;

/**
 * Delegates to an {@link InteractiveSigner}.
 *
 * <p>
 * The address request is issued once, at construction. Its result is cached
 * before {@link #addressReady()} completes, so a caller that has observed
 * completion always sees the address through {@link #resolvedAddress()}. If
 * the request fails the address stays absent and {@code addressReady()} fails
 * with the same cause.
 */
public final class FrontendRelaySigner implements RelaySigner {

    private final InteractiveSigner signer;
    private final AtomicReference<Address> address = new AtomicReference<>();
    private final CompletableFuture<Address> ready;

    public FrontendRelaySigner(final InteractiveSigner signer) {
        this.signer = Objects.requireNonNull(signer, "signer");
        this.ready = request(signer).thenApply(this::cache);
        ready.whenComplete((resolved, error) -> {
            if (error != null) {
                DebugLogger.log("Frontend signer address resolution failed: %s", error.getMessage());
            }
        });
    }

    private static CompletableFuture<Address> request(final InteractiveSigner signer) {
        try {
            final CompletableFuture<Address> future = signer.requestAddress();
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(
                            new NoAddressAvailableException("Interactive signer returned no address request"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Address cache(final Address resolved) {
        if (resolved == null) {
            throw new NoAddressAvailableException("Interactive signer resolved no address");
        }
        address.compareAndSet(null, resolved);
        return address.get();
    }

    @Override
    public CompletableFuture<Address> addressReady() {
        return ready.copy();
    }

    @Override
    public Optional<Address> resolvedAddress() {
        return Optional.ofNullable(address.get());
    }

    @Override
    public CompletableFuture<Signature> signMessage(final byte[] message) {
        try {
            return signer.signMessage(message.clone());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public String toString() {
        return "FrontendRelaySigner[address=" + address.get() + "]";
    }
}
