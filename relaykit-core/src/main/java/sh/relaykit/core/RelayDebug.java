// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core;

/**
 * Global toggles for verbose debug logging.
 * <p>
 * Transport logging covers every HTTP exchange with the relay; transaction
 * logging covers submissions, nonce lookups and confirmation polling.
 */
public final class RelayDebug {

    private static volatile boolean transportLogging = false;
    private static volatile boolean txLogging = false;

    private RelayDebug() {
    }

    public static boolean isEnabled() {
        return transportLogging || txLogging;
    }

    public static void setEnabled(final boolean enabled) {
        transportLogging = enabled;
        txLogging = enabled;
    }

    public static void setTransportLogging(final boolean enabled) {
        transportLogging = enabled;
    }

    public static boolean isTransportLoggingEnabled() {
        return transportLogging;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }
}
