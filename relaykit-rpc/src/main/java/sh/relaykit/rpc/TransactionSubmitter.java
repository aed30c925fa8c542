// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JsonNode;

import org.jspecify.annotations.Nullable;

import sh.relaykit.core.DebugLogger;
import sh.relaykit.core.LogFormatter;
import sh.relaykit.core.error.MalformedRelayResponseException;
import sh.relaykit.core.error.NoAddressAvailableException;
import sh.relaykit.core.error.RelayRejectedException;
import sh.relaykit.core.error.RelayTransportException;
import sh.relaykit.core.model.ProxyCall;
import sh.relaykit.core.model.SafeCall;
import sh.relaykit.core.model.TransactionRecord;
import sh.relaykit.rpc.internal.Futures;

/**
 * Submits call batches and wallet deployments, returning the relay's
 * canonical record for each.
 *
 * <p>
 * Every accepted submission yields a record with a non-empty id. Failures
 * surface as {@link RelayRejectedException} naming the operation, except
 * {@link MalformedRelayResponseException} and
 * {@link NoAddressAvailableException}, which propagate as-is. Nothing is
 * retried here: a retry could produce a duplicate on-chain transaction.
 */
public final class TransactionSubmitter {

    static final String OP_PROXY = "execute proxy transactions";
    static final String OP_SAFE = "execute safe transactions";
    static final String OP_DEPLOY = "deploy safe";

    private final RelayApi api;

    public TransactionSubmitter(final RelayApi api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    /**
     * Submits calls for execution through the signer's proxy wallet, in order.
     *
     * @throws IllegalArgumentException if {@code calls} is empty; nothing is sent
     */
    public CompletableFuture<TransactionRecord> submitProxyBatch(
            final List<ProxyCall> calls, final @Nullable String metadata) {
        final List<ProxyCall> batch = requireBatch(calls);
        return accept(OP_PROXY, () -> api.executeProxyTransactions(batch, metadata));
    }

    /**
     * Submits calls for execution through the signer's Safe wallet, in order.
     *
     * @throws IllegalArgumentException if {@code calls} is empty; nothing is sent
     */
    public CompletableFuture<TransactionRecord> submitSafeBatch(
            final List<SafeCall> calls, final @Nullable String metadata) {
        final List<SafeCall> batch = requireBatch(calls);
        return accept(OP_SAFE, () -> api.executeSafeTransactions(batch, metadata));
    }

    /**
     * Requests deployment of the signer's Safe wallet. The relay decides what
     * happens when the wallet already exists.
     */
    public CompletableFuture<TransactionRecord> deploySafeWallet() {
        return accept(OP_DEPLOY, api::deploySafe);
    }

    private static <T> List<T> requireBatch(final List<T> calls) {
        Objects.requireNonNull(calls, "calls");
        if (calls.isEmpty()) {
            throw new IllegalArgumentException("At least one call is required");
        }
        return List.copyOf(calls);
    }

    private static CompletableFuture<TransactionRecord> accept(
            final String operation, final Supplier<CompletableFuture<JsonNode>> call) {
        CompletableFuture<JsonNode> reply;
        try {
            reply = call.get();
        } catch (RuntimeException e) {
            reply = CompletableFuture.failedFuture(e);
        }
        return reply.handle((node, error) -> {
            if (error != null) {
                throw Futures.propagate(reject(operation, Futures.unwrap(error)));
            }
            final TransactionRecord record = RelayResponses.normalize(node, operation);
            DebugLogger.logTx(LogFormatter.formatAccepted(record.id(), record.state()));
            return record;
        });
    }

    private static RuntimeException reject(final String operation, final Throwable cause) {
        if (cause instanceof MalformedRelayResponseException
                || cause instanceof NoAddressAvailableException
                || cause instanceof RelayRejectedException) {
            return (RuntimeException) cause;
        }
        final String message = cause instanceof RelayTransportException transport
                ? transport.reason()
                : String.valueOf(cause.getMessage());
        return new RelayRejectedException(operation, message, cause);
    }
}
