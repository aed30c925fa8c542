// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.error;

import org.jspecify.annotations.Nullable;

/**
 * A request to the relay failed below the business level: connection error,
 * non-2xx status or an unparseable body.
 *
 * <p>
 * {@link #status()} is the HTTP status, or {@link #NO_STATUS} when no response
 * was received. {@link #body()} holds the raw response body when there was one.
 */
public final class RelayTransportException extends RelayException {

    /** Status used when the request never produced an HTTP response. */
    public static final int NO_STATUS = -1;

    private final int status;
    private final String reason;
    private final @Nullable String path;
    private final @Nullable String body;

    public RelayTransportException(
            final int status,
            final String message,
            final @Nullable String path,
            final @Nullable String body,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, path), cause);
        this.status = status;
        this.reason = message;
        this.path = path;
        this.body = body;
    }

    public RelayTransportException(final String message, final Throwable cause) {
        this(NO_STATUS, message, null, null, cause);
    }

    public int status() {
        return status;
    }

    /**
     * Returns the failure description without the path prefix; for error
     * responses this is the relay's own {@code error} or {@code message} text.
     */
    public String reason() {
        return reason;
    }

    public @Nullable String path() {
        return path;
    }

    public @Nullable String body() {
        return body;
    }

    /**
     * Returns whether the relay answered at all; a {@code false} result means
     * the failure happened on the network or while serializing.
     */
    public boolean hasStatus() {
        return status != NO_STATUS;
    }

    /**
     * Returns a copy whose message is prefixed with {@code context}, keeping
     * status, path and body. This exception becomes the cause.
     */
    public RelayTransportException withContext(final String context) {
        return new RelayTransportException(status, context + ": " + reason, path, body, this);
    }

    @Override
    public String toString() {
        return "RelayTransportException{"
                + "status="
                + status
                + ", message="
                + getMessage()
                + ", body="
                + body
                + "}";
    }

    private static String augmentMessage(final String message, final @Nullable String path) {
        if (path == null || message == null || message.isBlank()) {
            return message;
        }
        return "[" + path + "] " + message;
    }
}
