// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.model;

import java.util.Set;

/**
 * State names reported by the relay.
 *
 * <p>
 * The poller treats states as opaque strings, so unknown names from newer
 * relay versions pass through untouched. Typical progression:
 * {@code STATE_NEW → STATE_EXECUTED → STATE_MINED → STATE_CONFIRMED}, with
 * {@code STATE_FAILED} or {@code STATE_INVALID} as dead ends.
 */
public final class TransactionStates {

    /** Accepted by the relay, not yet sent. */
    public static final String NEW = "STATE_NEW";
    /** Sent to the chain. */
    public static final String EXECUTED = "STATE_EXECUTED";
    /** Included in a block. */
    public static final String MINED = "STATE_MINED";
    /** Rejected by the relay after acceptance. */
    public static final String INVALID = "STATE_INVALID";
    public static final String CONFIRMED = "STATE_CONFIRMED";
    public static final String FAILED = "STATE_FAILED";

    public static final Set<String> KNOWN = Set.of(NEW, EXECUTED, MINED, INVALID, CONFIRMED, FAILED);

    private static final Set<String> TERMINAL = Set.of(CONFIRMED, FAILED, INVALID);

    private TransactionStates() {
    }

    public static boolean isKnown(final String state) {
        return state != null && KNOWN.contains(state);
    }

    public static boolean isTerminal(final String state) {
        return state != null && TERMINAL.contains(state);
    }
}
