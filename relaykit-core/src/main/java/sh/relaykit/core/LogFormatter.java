// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core;

import static sh.relaykit.core.AnsiColors.*;

import java.util.Collection;

/**
 * Formats one-line debug entries for relay traffic and transaction tracking.
 *
 * <p>
 * Every entry uses a bracketed {@code [OPERATION]} tag; status symbols
 * (✓ ✗ ○) mark success, failure and pending. Long hex values are shortened to
 * {@code 0x1234...5678}.
 *
 * <pre>{@code
 * DebugLogger.logTransport(LogFormatter.formatRequest("POST", "/submit", 1500));
 * // [RELAY] POST /submit duration=1.50ms
 *
 * DebugLogger.logTx(LogFormatter.formatSubmit("PROXY", from, "7", 2));
 * // [TX-SUBMIT] type=PROXY from=0xf39f...2266 nonce=7 calls=2
 * }</pre>
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;
    private static final int HASH_SUFFIX_LENGTH = 4;
    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: [RELAY] GET /nonce duration=1.06ms
     */
    public static String formatRequest(String method, String path, long durationMicros) {
        return String.format(
                "%s[RELAY]%s %s %s %s",
                INDIGO, RESET,
                method,
                path,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [RELAY-ERROR] POST /submit status=400 message=bad call data duration=1.5ms
     */
    public static String formatRequestError(String method, String path, Object status, String message,
            long durationMicros) {
        return String.format(
                "%s✗%s %s[RELAY-ERROR]%s %s %s status=%s message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                method,
                path,
                status,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    /**
     * Format: [TX-SUBMIT] type=SAFE from=0x1234...5678 nonce=3 calls=2
     */
    public static String formatSubmit(String type, String from, String nonce, int calls) {
        return String.format(
                "%s[TX-SUBMIT]%s type=%s from=%s nonce=%s calls=%d",
                LAVENDER, RESET,
                type,
                shortenHash(from),
                nonce,
                calls);
    }

    /**
     * Format: ✓ [TX-ACCEPTED] id=0190b... state=STATE_NEW
     */
    public static String formatAccepted(String id, String state) {
        return String.format(
                "%s✓%s %s[TX-ACCEPTED]%s id=%s state=%s",
                TEAL, RESET,
                TEAL, RESET,
                id,
                state);
    }

    /**
     * Format: ○ [TX-WAIT] id=0190b... desired=[STATE_CONFIRMED] fail=STATE_FAILED maxPolls=60 interval=2.0s
     */
    public static String formatWait(String id, Collection<String> desired, String failState, int maxPolls,
            long intervalMillis) {
        return String.format(
                "%s○%s %s[TX-WAIT]%s id=%s desired=%s fail=%s maxPolls=%d interval=%s",
                SLATE, RESET,
                SLATE, RESET,
                id,
                desired,
                failState,
                maxPolls,
                millis(intervalMillis));
    }

    /**
     * Format: ○ [TX-POLL] id=0190b... poll=2/60 state=STATE_MINED
     */
    public static String formatPoll(String id, int poll, int maxPolls, String state) {
        return String.format(
                "%s○%s %s[TX-POLL]%s id=%s poll=%d/%d state=%s",
                SLATE, RESET,
                SLATE, RESET,
                id,
                poll,
                maxPolls,
                state);
    }

    /**
     * Format: ✓ [TX-FINAL] id=0190b... state=STATE_CONFIRMED hash=0x1234...5678
     * or: ✗ [TX-FINAL] id=0190b... state=STATE_FAILED hash=null
     */
    public static String formatFinal(String id, String state, String txHash, boolean reached) {
        String emoji = reached ? "✓" : "✗";
        String color = reached ? TEAL : CORAL;
        return String.format(
                "%s%s%s %s[TX-FINAL]%s id=%s state=%s%s%s hash=%s",
                color, emoji, RESET,
                color, RESET,
                id,
                color, state, RESET,
                shortenHash(txHash));
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }

    private static String millis(long millis) {
        return millis < 1000 ? millis + "ms" : String.format("%.1fs", millis / 1000.0);
    }

    private static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
