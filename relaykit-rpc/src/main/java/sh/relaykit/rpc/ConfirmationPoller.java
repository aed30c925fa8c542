// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import sh.relaykit.core.DebugLogger;
import sh.relaykit.core.LogFormatter;
import sh.relaykit.core.error.RelayException;
import sh.relaykit.core.error.RelayTransportException;
import sh.relaykit.core.model.TransactionRecord;
import sh.relaykit.rpc.internal.Futures;

/**
 * Polls a relayed transaction until it reaches a desired state, reaches the
 * fail state, or the poll budget runs out.
 *
 * <p>
 * Polls are strictly sequential: the next lookup is scheduled only after the
 * previous one has answered, and never after the last allowed poll. Waiting
 * between polls uses {@link CompletableFuture#delayedExecutor}, so no thread
 * is held while a wait is in progress. A lookup that cannot be scheduled,
 * for instance after the relayer was closed, fails the wait.
 *
 * <pre>{@code
 * poller.await("tx-1", PollOptions.defaults())
 *         .thenAccept(result -> result.ifPresentOrElse(
 *                 record -> System.out.println("confirmed " + record.transactionHash()),
 *                 () -> System.out.println("not confirmed")));
 * }</pre>
 */
public final class ConfirmationPoller {

    private final TransactionLookup lookup;

    public ConfirmationPoller(final TransactionLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    /**
     * Starts a wait.
     *
     * <p>
     * The future completes with the record that reached a desired state, or
     * empty when the fail state was seen or {@code maxPolls} lookups passed
     * without a terminal state. An empty history counts as a non-terminal
     * poll. Lookup failures fail the future. Cancelling the future stops any
     * further lookups; its getters then throw the JDK's
     * {@link java.util.concurrent.CancellationException}.
     */
    public CompletableFuture<Optional<TransactionRecord>> await(
            final String transactionId, final PollOptions options) {
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(options, "options");

        DebugLogger.logTx(LogFormatter.formatWait(transactionId, options.desiredStates(), options.failState(),
                options.maxPolls(), options.pollInterval().toMillis()));

        final CompletableFuture<Optional<TransactionRecord>> result = new CompletableFuture<>();
        poll(transactionId, options, 1, result);
        return result;
    }

    private void poll(
            final String id,
            final PollOptions options,
            final int attempt,
            final CompletableFuture<Optional<TransactionRecord>> result) {
        if (result.isDone()) {
            return;
        }
        CompletableFuture<List<TransactionRecord>> history;
        try {
            history = lookup.getTransaction(id);
        } catch (RuntimeException e) {
            history = CompletableFuture.failedFuture(e);
        }
        history.whenComplete((records, error) -> {
            if (result.isDone()) {
                return;
            }
            if (error != null) {
                result.completeExceptionally(withContext(id, Futures.unwrap(error)));
                return;
            }
            final Optional<TransactionRecord> current = records == null || records.isEmpty()
                    ? Optional.empty()
                    : Optional.of(records.get(0));
            final String state = current.map(TransactionRecord::state).orElse("");
            DebugLogger.logTx(LogFormatter.formatPoll(id, attempt, options.maxPolls(), state));

            if (current.isPresent() && current.get().inState(options.desiredStates())) {
                finish(id, current.get(), true);
                result.complete(current);
            } else if (current.isPresent() && state.equals(options.failState())) {
                finish(id, current.get(), false);
                result.complete(Optional.empty());
            } else if (attempt >= options.maxPolls()) {
                DebugLogger.logTx(LogFormatter.formatFinal(id, state, null, false));
                result.complete(Optional.empty());
            } else {
                final Executor delayed = CompletableFuture.delayedExecutor(
                        options.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
                delayed.execute(() -> poll(id, options, attempt + 1, result));
            }
        });
    }

    private static void finish(final String id, final TransactionRecord record, final boolean reached) {
        DebugLogger.logTx(LogFormatter.formatFinal(id, record.state(), record.transactionHash(), reached));
    }

    private static Throwable withContext(final String id, final Throwable error) {
        if (error instanceof RelayTransportException transport) {
            return transport.withContext("Failed to poll relay transaction " + id);
        }
        if (error instanceof RelayException) {
            return error;
        }
        return new RelayTransportException("Failed to poll relay transaction " + id, error);
    }
}
