// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JsonNode;

import org.jspecify.annotations.Nullable;

import sh.relaykit.core.DebugLogger;
import sh.relaykit.core.LogFormatter;
import sh.relaykit.core.error.RelayTransportException;
import sh.relaykit.core.model.ProxyCall;
import sh.relaykit.core.model.SafeCall;
import sh.relaykit.core.types.Address;

/**
 * Asynchronous binding of the relay's HTTP contract.
 *
 * <p>
 * Reads map one-to-one onto endpoints. Submissions fetch the signer's nonce,
 * build a {@link RelaySubmission}, have the signer personal-sign its digest
 * and post it. Replies are returned raw; see {@link RelayResponses}.
 *
 * <p>
 * Blocking provider calls run on the supplied executor, like
 * {@code supplyAsync(() -> provider.get(...), executor)}. Once that executor
 * has been shut down, every call returns a future failed with
 * {@link RelayTransportException}.
 */
public final class RelayApi {

    private final RelayProvider provider;
    private final RelaySigner signer;
    private final long chainId;
    private final Executor executor;

    public RelayApi(
            final RelayProvider provider, final RelaySigner signer, final long chainId, final Executor executor) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.chainId = chainId;
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public CompletableFuture<JsonNode> getRelayAddress() {
        return async(() -> provider.get(RelayEndpoints.RELAY_ADDRESS, Map.of()));
    }

    public CompletableFuture<JsonNode> getNonce(final Address address, final String signerType) {
        final Map<String, String> query = new LinkedHashMap<>();
        query.put(RelayEndpoints.PARAM_ADDRESS, address.value());
        query.put(RelayEndpoints.PARAM_TYPE, signerType);
        return async(() -> provider.get(RelayEndpoints.NONCE, query));
    }

    public CompletableFuture<JsonNode> executeProxyTransactions(
            final List<ProxyCall> calls, final @Nullable String metadata) {
        return submit(RelayEndpoints.TYPE_PROXY, RelayEndpoints.NONCE_EOA, calls, metadata);
    }

    public CompletableFuture<JsonNode> executeSafeTransactions(
            final List<SafeCall> calls, final @Nullable String metadata) {
        return submit(RelayEndpoints.TYPE_SAFE, RelayEndpoints.NONCE_SAFE, calls, metadata);
    }

    public CompletableFuture<JsonNode> deploySafe() {
        return submit(RelayEndpoints.TYPE_SAFE_CREATE, RelayEndpoints.NONCE_SAFE, List.of(), null);
    }

    public CompletableFuture<JsonNode> getTransaction(final String transactionId) {
        return async(() -> provider.get(RelayEndpoints.TRANSACTION, Map.of(RelayEndpoints.PARAM_ID, transactionId)));
    }

    public CompletableFuture<JsonNode> getTransactions(final Address owner) {
        return async(() -> provider.get(
                RelayEndpoints.TRANSACTIONS, Map.of(RelayEndpoints.PARAM_ADDRESS, owner.value())));
    }

    public RelayProvider provider() {
        return provider;
    }

    public RelaySigner signer() {
        return signer;
    }

    public long chainId() {
        return chainId;
    }

    public Executor executor() {
        return executor;
    }

    private CompletableFuture<JsonNode> submit(
            final String type, final String nonceKind, final List<?> calls, final @Nullable String metadata) {
        return signer.addressReady()
                .thenCompose(from -> getNonce(from, nonceKind)
                        .thenApply(RelayResponses::nonce)
                        .thenCompose(nonce -> sign(RelaySubmission.unsigned(type, from, chainId, nonce, calls, metadata))))
                .thenCompose(signed -> async(() -> provider.post(RelayEndpoints.SUBMIT, signed)));
    }

    private CompletableFuture<RelaySubmission> sign(final RelaySubmission unsigned) {
        DebugLogger.logTx(LogFormatter.formatSubmit(
                unsigned.type(), unsigned.from().value(), unsigned.nonce(), unsigned.calls().size()));
        return signer.signMessage(unsigned.digest())
                .thenApply(signature -> unsigned.withSignature(signature.toHex()));
    }

    private CompletableFuture<JsonNode> async(final Supplier<JsonNode> call) {
        try {
            return CompletableFuture.supplyAsync(call, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new RelayTransportException("Relay client is closed", e));
        }
    }
}
