// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import sh.relaykit.core.error.RelayTransportException;

/**
 * Low-level access to the relay's HTTP API.
 *
 * <p>
 * Implementations turn a path plus query or body into a parsed JSON reply
 * and raise {@link RelayTransportException} for anything that is not a 2xx
 * JSON response. They carry no business rules: normalization and error
 * wrapping happen in the layers above.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * @see HttpRelayProvider
 */
public interface RelayProvider extends AutoCloseable {

    /**
     * Issues a GET. Query entries with {@code null} values are omitted.
     */
    JsonNode get(String path, Map<String, String> query) throws RelayTransportException;

    /**
     * Issues a POST with {@code body} serialized as JSON.
     */
    JsonNode post(String path, Object body) throws RelayTransportException;

    @Override
    default void close() {
        // no resources by default
    }
}
