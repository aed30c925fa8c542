// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger gated by {@link RelayDebug}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.relaykit.debug");

    private DebugLogger() {
    }

    public static void logTransport(final String message, final Object... args) {
        if (!RelayDebug.isTransportLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logTx(final String message, final Object... args) {
        if (!RelayDebug.isTxLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!RelayDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Writes to stdout on a TTY so colors survive, otherwise to SLF4J.
     * Always sanitized first.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        final String sanitized = LogSanitizer.sanitize(formatted);

        if (AnsiColors.IS_TTY) {
            System.out.println(sanitized);
        } else {
            LOG.info(sanitized);
        }
    }
}
