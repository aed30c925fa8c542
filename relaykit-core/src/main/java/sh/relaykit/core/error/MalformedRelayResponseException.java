// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.error;

import org.jspecify.annotations.Nullable;

/**
 * A relay response violated its contract, most notably by omitting the
 * transaction identifier.
 */
public final class MalformedRelayResponseException extends RelayException {

    private final @Nullable String responseBody;

    public MalformedRelayResponseException(final String message, final @Nullable String responseBody) {
        super(message);
        this.responseBody = responseBody;
    }

    public @Nullable String responseBody() {
        return responseBody;
    }
}
