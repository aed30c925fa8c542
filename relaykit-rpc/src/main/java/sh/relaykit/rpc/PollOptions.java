// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

import sh.relaykit.core.model.TransactionStates;

/**
 * Parameters of a confirmation wait.
 *
 * <p>
 * The wait issues at most {@code maxPolls} lookups, sleeping
 * {@code pollInterval} between consecutive ones, so the worst-case duration is
 * {@code (maxPolls - 1) * pollInterval} plus the lookups themselves.
 *
 * @param desiredStates states that end the wait successfully
 * @param failState     state that ends the wait unsuccessfully
 * @param maxPolls      lookup budget, at least 1
 * @param pollInterval  spacing between lookups, not negative
 */
public record PollOptions(Set<String> desiredStates, String failState, int maxPolls, Duration pollInterval) {

    public static final int DEFAULT_MAX_POLLS = 60;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(2000);

    private static final PollOptions DEFAULTS = new PollOptions(
            Set.of(TransactionStates.CONFIRMED), TransactionStates.FAILED, DEFAULT_MAX_POLLS, DEFAULT_POLL_INTERVAL);

    public PollOptions {
        Objects.requireNonNull(desiredStates, "desiredStates");
        Objects.requireNonNull(failState, "failState");
        Objects.requireNonNull(pollInterval, "pollInterval");
        desiredStates = Set.copyOf(desiredStates);
        if (desiredStates.isEmpty()) {
            throw new IllegalArgumentException("At least one desired state is required");
        }
        if (maxPolls < 1) {
            throw new IllegalArgumentException("maxPolls must be at least 1: " + maxPolls);
        }
        if (pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval cannot be negative: " + pollInterval);
        }
    }

    /**
     * Waits for {@code STATE_CONFIRMED}, fails on {@code STATE_FAILED}, 60
     * polls two seconds apart.
     */
    public static PollOptions defaults() {
        return DEFAULTS;
    }

    public PollOptions withDesiredStates(final Set<String> states) {
        return new PollOptions(states, failState, maxPolls, pollInterval);
    }

    public PollOptions withDesiredStates(final String... states) {
        return withDesiredStates(Set.of(states));
    }

    public PollOptions withFailState(final String state) {
        return new PollOptions(desiredStates, state, maxPolls, pollInterval);
    }

    public PollOptions withMaxPolls(final int polls) {
        return new PollOptions(desiredStates, failState, polls, pollInterval);
    }

    public PollOptions withPollInterval(final Duration interval) {
        return new PollOptions(desiredStates, failState, maxPolls, interval);
    }
}
