// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.error;

/**
 * A blocking confirmation wait was cancelled or interrupted by the caller
 * before the transaction reached a terminal state or the poll budget ran out.
 * Cancelled asynchronous waits complete with the JDK's
 * {@link java.util.concurrent.CancellationException} instead.
 */
public final class RelayCancelledException extends RelayException {

    private final String transactionId;

    public RelayCancelledException(final String transactionId, final Throwable cause) {
        super("Cancelled while waiting for relay transaction " + transactionId, cause);
        this.transactionId = transactionId;
    }

    public String transactionId() {
        return transactionId;
    }
}
