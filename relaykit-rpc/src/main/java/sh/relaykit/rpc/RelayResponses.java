// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import org.jspecify.annotations.Nullable;

import sh.relaykit.core.error.MalformedRelayResponseException;
import sh.relaykit.core.model.TransactionRecord;
import sh.relaykit.core.types.Address;
import sh.relaykit.rpc.internal.RelayJson;

/**
 * Maps relay replies onto canonical types.
 *
 * <p>
 * Relay versions disagree on field names, so each value is read from the
 * first alias present:
 * <ul>
 * <li>id: {@code transactionID}, {@code transactionId}, {@code id}</li>
 * <li>state: {@code state}, {@code status}</li>
 * <li>relay hash: {@code hash}, {@code relayHash}</li>
 * <li>chain hash: {@code transactionHash}, {@code txHash}</li>
 * </ul>
 */
public final class RelayResponses {

    private static final String[] ID_FIELDS = {"transactionID", "transactionId", "id"};
    private static final String[] STATE_FIELDS = {"state", "status"};
    private static final String[] RELAY_HASH_FIELDS = {"hash", "relayHash"};
    private static final String[] TX_HASH_FIELDS = {"transactionHash", "txHash"};

    private RelayResponses() {
    }

    public static TransactionRecord normalize(final @Nullable JsonNode node) {
        return normalize(node, "relay");
    }

    /**
     * @param source operation the reply belongs to, used in error messages
     * @throws MalformedRelayResponseException if the reply carries no transaction id
     */
    public static TransactionRecord normalize(final @Nullable JsonNode node, final String source) {
        final String id = RelayJson.text(node, ID_FIELDS);
        if (id == null || id.isBlank()) {
            throw new MalformedRelayResponseException(
                    "Relay " + source + " response is missing transactionID", bodyOf(node));
        }
        return new TransactionRecord(
                id,
                RelayJson.text(node, STATE_FIELDS),
                RelayJson.text(node, RELAY_HASH_FIELDS),
                RelayJson.text(node, TX_HASH_FIELDS));
    }

    /**
     * Normalizes a history reply: an array, an object wrapping a
     * {@code transactions} array, or a single record. {@code null} yields an
     * empty list.
     */
    public static List<TransactionRecord> normalizeList(final @Nullable JsonNode node, final String source) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        JsonNode entries = node;
        if (node.isObject() && node.has("transactions")) {
            entries = node.get("transactions");
        }
        if (!entries.isArray()) {
            return List.of(normalize(entries, source));
        }
        final List<TransactionRecord> out = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            out.add(normalize(entry, source));
        }
        return List.copyOf(out);
    }

    /**
     * Reads the opaque nonce from {@code {"nonce": ...}} or a bare scalar.
     */
    public static String nonce(final @Nullable JsonNode node) {
        String nonce = RelayJson.text(node, "nonce");
        if (nonce == null && node != null && node.isValueNode() && !node.isNull()) {
            nonce = node.asText();
        }
        if (nonce == null || nonce.isBlank()) {
            throw new MalformedRelayResponseException("Relay nonce response is missing nonce", bodyOf(node));
        }
        return nonce;
    }

    public static Address relayAddress(final @Nullable JsonNode node) {
        String value = RelayJson.text(node, "address", "relayAddress");
        if (value == null && node != null && node.isTextual()) {
            value = node.asText();
        }
        if (value == null || !Address.isValid(value)) {
            throw new MalformedRelayResponseException(
                    "Relay address response has no valid address", bodyOf(node));
        }
        return new Address(value);
    }

    private static @Nullable String bodyOf(final @Nullable JsonNode node) {
        return node == null ? null : node.toString();
    }
}
