// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

import org.jspecify.annotations.Nullable;

import sh.relaykit.core.DebugLogger;
import sh.relaykit.core.error.RelayCancelledException;
import sh.relaykit.core.error.RelayException;
import sh.relaykit.core.error.RelayTransportException;
import sh.relaykit.core.model.ProxyCall;
import sh.relaykit.core.model.SafeCall;
import sh.relaykit.core.model.TransactionRecord;
import sh.relaykit.core.types.Address;
import sh.relaykit.rpc.internal.Futures;

/**
 * Entry point for gasless transactions through a relay service.
 *
 * <p>
 * The relay pays gas; this client signs what should be executed, submits it,
 * and tracks the relay's progress until the transaction is confirmed.
 *
 * <pre>{@code
 * try (Relayer relayer = Relayer.create(RelayerConfig.builder().backend(key).build())) {
 *     TransactionRecord tx = relayer.submitProxyBatch(List.of(call)).join();
 *     Optional<TransactionRecord> confirmed = relayer.waitForTransaction(tx.id());
 * }
 * }</pre>
 *
 * <p>
 * Creating a relayer never contacts the relay. In frontend mode the wallet
 * address is requested from the interactive signer at creation and resolves
 * in the background; see {@link #addressReady()}.
 *
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe.
 *
 * @since 0.1.0
 */
public final class Relayer implements AutoCloseable {

    private final RelayerConfig config;
    private final RelayProvider provider;
    private final RelaySigner signer;
    private final RelayApi api;
    private final TransactionSubmitter submitter;
    private final NonceResolver nonces;
    private final ConfirmationPoller poller;
    private final @Nullable ExecutorService ownedExecutor;

    private Relayer(
            final RelayerConfig config,
            final RelayProvider provider,
            final Executor executor,
            final @Nullable ExecutorService ownedExecutor) {
        this.config = Objects.requireNonNull(config, "config");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.signer = RelaySigner.from(config.signingMode());
        this.api = new RelayApi(provider, signer, config.chainId(), executor);
        this.submitter = new TransactionSubmitter(api);
        this.nonces = new NonceResolver(api, signer);
        this.poller = new ConfirmationPoller(this::getTransaction);
        this.ownedExecutor = ownedExecutor;
        DebugLogger.log("Relayer created: %s", config);
    }

    /**
     * Creates a relayer talking HTTP to {@link RelayerConfig#relayUrl()}.
     *
     * @throws sh.relaykit.core.error.InvalidPrivateKeyException for a malformed backend key
     */
    public static Relayer create(final RelayerConfig config) {
        return create(config, HttpRelayProvider.from(config));
    }

    /**
     * Creates a relayer over a caller-supplied transport, which it closes on
     * {@link #close()}.
     */
    public static Relayer create(final RelayerConfig config, final RelayProvider provider) {
        final ExecutorService executor = RelayExecutors.newIoBoundExecutor();
        try {
            return new Relayer(config, provider, executor, executor);
        } catch (RuntimeException e) {
            executor.shutdownNow();
            throw e;
        }
    }

    /**
     * Creates a relayer whose blocking calls run on {@code executor}. The
     * executor is not shut down by {@link #close()}.
     */
    public static Relayer create(final RelayerConfig config, final RelayProvider provider, final Executor executor) {
        return new Relayer(config, provider, executor, null);
    }

    // Submission

    public CompletableFuture<TransactionRecord> submitProxyBatch(final List<ProxyCall> calls) {
        return submitter.submitProxyBatch(calls, null);
    }

    public CompletableFuture<TransactionRecord> submitProxyBatch(
            final List<ProxyCall> calls, final @Nullable String metadata) {
        return submitter.submitProxyBatch(calls, metadata);
    }

    public CompletableFuture<TransactionRecord> submitSafeBatch(final List<SafeCall> calls) {
        return submitter.submitSafeBatch(calls, null);
    }

    public CompletableFuture<TransactionRecord> submitSafeBatch(
            final List<SafeCall> calls, final @Nullable String metadata) {
        return submitter.submitSafeBatch(calls, metadata);
    }

    public CompletableFuture<TransactionRecord> deploySafeWallet() {
        return submitter.deploySafeWallet();
    }

    // Queries

    /**
     * Returns the address the relay submits from.
     */
    public CompletableFuture<Address> getRelayerAddress() {
        return api.getRelayAddress().handle((node, error) -> {
            if (error != null) {
                throw Futures.propagate(withContext(Futures.unwrap(error), "Failed to get relayer address"));
            }
            return RelayResponses.relayAddress(node);
        });
    }

    /**
     * Returns the EOA nonce of the signer's address.
     *
     * @see NonceResolver#getNonce(Address, String)
     */
    public CompletableFuture<String> getNonce() {
        return nonces.getNonce(null, NonceResolver.DEFAULT_SIGNER_TYPE);
    }

    public CompletableFuture<String> getNonce(final @Nullable Address address) {
        return nonces.getNonce(address, NonceResolver.DEFAULT_SIGNER_TYPE);
    }

    public CompletableFuture<String> getNonce(final @Nullable Address address, final String signerType) {
        return nonces.getNonce(address, signerType);
    }

    /**
     * Returns the state history of a transaction, newest first. An unknown id
     * may yield an empty list or a transport error, depending on the relay.
     */
    public CompletableFuture<List<TransactionRecord>> getTransaction(final String transactionId) {
        Objects.requireNonNull(transactionId, "transactionId");
        return api.getTransaction(transactionId).handle((node, error) -> {
            if (error != null) {
                throw Futures.propagate(
                        withContext(Futures.unwrap(error), "Failed to get transaction " + transactionId));
            }
            return RelayResponses.normalizeList(node, "transaction");
        });
    }

    /**
     * Returns the transactions of the signer's address, waiting for a
     * frontend signer's address if needed.
     */
    public CompletableFuture<List<TransactionRecord>> getTransactions() {
        return signer.addressReady()
                .thenCompose(owner -> api.getTransactions(owner).handle((node, error) -> {
                    if (error != null) {
                        throw Futures.propagate(
                                withContext(Futures.unwrap(error), "Failed to get transactions for " + owner));
                    }
                    return RelayResponses.normalizeList(node, "transactions");
                }));
    }

    // Confirmation

    /**
     * Polls {@code transactionId} with {@link PollOptions#defaults()}.
     *
     * <p>
     * Cancelling the returned future stops polling and surfaces as
     * {@link CancellationException};
     * {@link #waitForTransaction(String)} reports the same as
     * {@link RelayCancelledException}.
     */
    public CompletableFuture<Optional<TransactionRecord>> awaitConfirmation(final String transactionId) {
        return poller.await(transactionId, PollOptions.defaults());
    }

    public CompletableFuture<Optional<TransactionRecord>> awaitConfirmation(
            final String transactionId, final PollOptions options) {
        return poller.await(transactionId, options);
    }

    public CompletableFuture<Optional<TransactionRecord>> awaitConfirmation(
            final String transactionId,
            final Set<String> desiredStates,
            final String failState,
            final int maxPolls,
            final long pollIntervalMillis) {
        return poller.await(transactionId,
                new PollOptions(desiredStates, failState, maxPolls, Duration.ofMillis(pollIntervalMillis)));
    }

    /**
     * Blocks until {@link #awaitConfirmation(String)} completes.
     *
     * @return the confirmed record, or empty if the transaction failed or was
     *         not confirmed within the poll budget
     * @throws RelayCancelledException if the calling thread is interrupted
     */
    public Optional<TransactionRecord> waitForTransaction(final String transactionId) {
        return waitForTransaction(transactionId, PollOptions.defaults());
    }

    public Optional<TransactionRecord> waitForTransaction(final String transactionId, final PollOptions options) {
        final CompletableFuture<Optional<TransactionRecord>> wait = poller.await(transactionId, options);
        try {
            return wait.get();
        } catch (InterruptedException e) {
            wait.cancel(true);
            Thread.currentThread().interrupt();
            throw new RelayCancelledException(transactionId, e);
        } catch (CancellationException e) {
            throw new RelayCancelledException(transactionId, e);
        } catch (ExecutionException e) {
            final Throwable cause = Futures.unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new RelayTransportException("Failed to wait for relay transaction " + transactionId, cause);
        }
    }

    // Identity

    /**
     * Returns the signer's address if it has resolved.
     */
    public Optional<Address> walletAddress() {
        return signer.resolvedAddress();
    }

    /**
     * Completes when the signer's address is known; immediately in backend mode.
     */
    public CompletableFuture<Address> addressReady() {
        return signer.addressReady();
    }

    public RelaySigner signer() {
        return signer;
    }

    /**
     * Returns the underlying transport for endpoints this client does not wrap.
     */
    public RelayProvider provider() {
        return provider;
    }

    public RelayerConfig config() {
        return config;
    }

    @Override
    public void close() {
        try {
            provider.close();
        } catch (Exception e) {
            DebugLogger.log("Failed to close relay provider: %s", e.getMessage());
        } finally {
            if (ownedExecutor != null) {
                ownedExecutor.shutdownNow();
            }
        }
    }

    private static Throwable withContext(final Throwable error, final String context) {
        if (error instanceof RelayTransportException transport) {
            return transport.withContext(context);
        }
        if (error instanceof RelayException) {
            return error;
        }
        return new RelayTransportException(context, error);
    }
}
