// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

import sh.relaykit.core.error.NoAddressAvailableException;
import sh.relaykit.core.error.RelayTransportException;
import sh.relaykit.core.types.Address;
import sh.relaykit.rpc.internal.Futures;

/**
 * Reads the relay's next nonce for an address.
 *
 * <p>
 * Without an explicit address the signer's address is used, but only if it
 * has already resolved: this never waits on an interactive signer.
 */
public final class NonceResolver {

    public static final String DEFAULT_SIGNER_TYPE = RelayEndpoints.NONCE_EOA;

    private final RelayApi api;
    private final RelaySigner signer;

    public NonceResolver(final RelayApi api, final RelaySigner signer) {
        this.api = Objects.requireNonNull(api, "api");
        this.signer = Objects.requireNonNull(signer, "signer");
    }

    /**
     * Fails with {@link NoAddressAvailableException} when {@code address} is
     * {@code null} and the signer has no address yet. The nonce is returned
     * exactly as the relay reports it.
     */
    public CompletableFuture<String> getNonce(final @Nullable Address address, final @Nullable String signerType) {
        final Optional<Address> target = address != null ? Optional.of(address) : signer.resolvedAddress();
        if (target.isEmpty()) {
            return CompletableFuture.failedFuture(new NoAddressAvailableException(
                    "No address available for nonce lookup; pass an address or wait for the signer"));
        }
        final Address resolved = target.get();
        final String type = signerType == null ? DEFAULT_SIGNER_TYPE : signerType;
        return api.getNonce(resolved, type).handle((node, error) -> {
            if (error != null) {
                throw Futures.propagate(withContext(Futures.unwrap(error), resolved));
            }
            return RelayResponses.nonce(node);
        });
    }

    private static Throwable withContext(final Throwable error, final Address address) {
        if (error instanceof RelayTransportException transport) {
            return transport.withContext("Failed to get nonce for " + address);
        }
        return error;
    }
}
