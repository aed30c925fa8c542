// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.error;

import org.jspecify.annotations.Nullable;

/**
 * The relay declined a submission: validation failure, unsponsored funds,
 * malformed call data or a transport error while submitting.
 *
 * <p>
 * Not retried automatically. {@link #relayMessage()} carries the relay's own
 * wording when one was returned.
 */
public final class RelayRejectedException extends RelayException {

    private final String operation;
    private final String relayMessage;

    public RelayRejectedException(
            final String operation, final String relayMessage, final @Nullable Throwable cause) {
        super("Failed to " + operation + ": " + relayMessage, cause);
        this.operation = operation;
        this.relayMessage = relayMessage;
    }

    /**
     * Returns the submission that was rejected, e.g. {@code "execute proxy transactions"}.
     */
    public String operation() {
        return operation;
    }

    public String relayMessage() {
        return relayMessage;
    }
}
