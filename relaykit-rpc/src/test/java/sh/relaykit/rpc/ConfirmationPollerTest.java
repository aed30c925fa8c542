// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import sh.relaykit.core.error.RelayTransportException;
import sh.relaykit.core.model.TransactionRecord;
import sh.relaykit.core.model.TransactionStates;

class ConfirmationPollerTest {

    private static final PollOptions FAST = PollOptions.defaults().withPollInterval(Duration.ZERO);

    /** Serves scripted states; the last one repeats. An empty state means an empty history. */
    private static final class ScriptedLookup implements TransactionLookup {
        private final Deque<String> states;
        final AtomicInteger calls = new AtomicInteger();

        ScriptedLookup(final String... states) {
            this.states = new ArrayDeque<>(List.of(states));
        }

        @Override
        public synchronized CompletableFuture<List<TransactionRecord>> getTransaction(final String id) {
            calls.incrementAndGet();
            final String state = states.size() > 1 ? states.poll() : states.peek();
            if (state.isEmpty()) {
                return CompletableFuture.completedFuture(List.of());
            }
            final String hash = TransactionStates.CONFIRMED.equals(state) ? "0xabc" : null;
            return CompletableFuture.completedFuture(List.of(new TransactionRecord(id, state, null, hash)));
        }
    }

    @Test
    void returnsImmediatelyWhenAlreadyConfirmed() {
        ScriptedLookup lookup = new ScriptedLookup(TransactionStates.CONFIRMED);

        Optional<TransactionRecord> result = new ConfirmationPoller(lookup).await("tx-1", FAST).join();

        assertEquals(TransactionStates.CONFIRMED, result.orElseThrow().state());
        assertEquals("0xabc", result.get().transactionHash());
        assertEquals(1, lookup.calls.get());
    }

    @Test
    void failStateEndsWaitWithoutResult() {
        ScriptedLookup lookup = new ScriptedLookup(TransactionStates.FAILED);

        Optional<TransactionRecord> result = new ConfirmationPoller(lookup).await("tx-1", FAST).join();

        assertTrue(result.isEmpty());
        assertEquals(1, lookup.calls.get());
    }

    @Test
    void progressesThroughStates() {
        ScriptedLookup lookup = new ScriptedLookup(
                TransactionStates.NEW, TransactionStates.MINED, TransactionStates.CONFIRMED);

        Optional<TransactionRecord> result = new ConfirmationPoller(lookup).await("tx-1", FAST).join();

        assertEquals(TransactionStates.CONFIRMED, result.orElseThrow().state());
        assertEquals(3, lookup.calls.get());
    }

    @Test
    void stopsAfterMaxPolls() {
        ScriptedLookup lookup = new ScriptedLookup(TransactionStates.NEW);

        Optional<TransactionRecord> result =
                new ConfirmationPoller(lookup).await("tx-1", FAST.withMaxPolls(3)).join();

        assertTrue(result.isEmpty());
        assertEquals(3, lookup.calls.get());
    }

    @Test
    void singlePollDoesNotWait() {
        ScriptedLookup lookup = new ScriptedLookup(TransactionStates.NEW);
        PollOptions options = PollOptions.defaults().withMaxPolls(1).withPollInterval(Duration.ofHours(1));

        Optional<TransactionRecord> result =
                new ConfirmationPoller(lookup).await("tx-1", options).orTimeout(5, TimeUnit.SECONDS).join();

        assertTrue(result.isEmpty());
        assertEquals(1, lookup.calls.get());
    }

    @Test
    void emptyHistoryIsNotTerminal() {
        ScriptedLookup lookup = new ScriptedLookup("");

        Optional<TransactionRecord> result =
                new ConfirmationPoller(lookup).await("tx-1", FAST.withMaxPolls(2)).join();

        assertTrue(result.isEmpty());
        assertEquals(2, lookup.calls.get());
    }

    @Test
    void customDesiredAndFailStates() {
        ScriptedLookup mined = new ScriptedLookup(TransactionStates.NEW, TransactionStates.MINED);
        ScriptedLookup invalid = new ScriptedLookup(TransactionStates.INVALID);
        PollOptions options = FAST
                .withDesiredStates(TransactionStates.MINED, TransactionStates.CONFIRMED)
                .withFailState(TransactionStates.INVALID);

        assertEquals(TransactionStates.MINED,
                new ConfirmationPoller(mined).await("tx-1", options).join().orElseThrow().state());
        assertTrue(new ConfirmationPoller(invalid).await("tx-2", options).join().isEmpty());
    }

    @Test
    void waitsBetweenPolls() {
        ScriptedLookup lookup = new ScriptedLookup(TransactionStates.NEW, TransactionStates.CONFIRMED);
        PollOptions options = PollOptions.defaults().withPollInterval(Duration.ofMillis(200));

        long start = System.nanoTime();
        new ConfirmationPoller(lookup).await("tx-1", options).join();
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000L;

        assertTrue(elapsedMillis >= 200, "elapsed " + elapsedMillis);
        assertEquals(2, lookup.calls.get());
    }

    @Test
    void cancellationStopsPolling() throws Exception {
        CountDownLatch firstPoll = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        TransactionLookup lookup = id -> {
            calls.incrementAndGet();
            firstPoll.countDown();
            return CompletableFuture.completedFuture(List.of(new TransactionRecord(id, TransactionStates.NEW, null, null)));
        };
        PollOptions options = PollOptions.defaults().withPollInterval(Duration.ofMillis(300));

        CompletableFuture<Optional<TransactionRecord>> wait = new ConfirmationPoller(lookup).await("tx-1", options);
        assertTrue(firstPoll.await(5, TimeUnit.SECONDS));
        wait.cancel(true);
        Thread.sleep(900);

        assertThrows(CancellationException.class, wait::join);
        assertEquals(1, calls.get());
    }

    @Test
    void lookupFailurePropagatesWithId() {
        TransactionLookup lookup = id -> CompletableFuture.failedFuture(
                new RelayTransportException(500, "HTTP 500", "/transaction", "", null));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> new ConfirmationPoller(lookup).await("tx-7", FAST).join());

        RelayTransportException error = assertInstanceOf(RelayTransportException.class, ex.getCause());
        assertTrue(error.getMessage().contains("tx-7"));
        assertEquals(500, error.status());
    }

    @Test
    void lookupThrowingSynchronouslyFailsWait() {
        TransactionLookup lookup = id -> {
            throw new IllegalStateException("executor shut down");
        };

        CompletionException ex = assertThrows(CompletionException.class,
                () -> new ConfirmationPoller(lookup).await("tx-8", FAST).join());

        assertInstanceOf(RelayTransportException.class, ex.getCause());
    }
}
