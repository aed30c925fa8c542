// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.jspecify.annotations.Nullable;

import sh.relaykit.core.crypto.Keccak256;

/**
 * Shared JSON helpers for the relay layer.
 *
 * <p>
 * <strong>Internal Use Only.</strong>
 */
public final class RelayJson {

    /**
     * Shared, thread-safe mapper. Null fields are left out of request bodies.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private RelayJson() {
    }

    /**
     * Returns the first field among {@code names} holding a non-empty scalar,
     * as text.
     */
    public static @Nullable String text(final @Nullable JsonNode node, final String... names) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String name : names) {
            final JsonNode value = node.get(name);
            if (value != null && value.isValueNode() && !value.isNull()) {
                final String text = value.asText();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    /**
     * Encodes {@code value} as JSON with object keys sorted recursively, array
     * order preserved and no whitespace. Fields named in {@code exclude} are
     * dropped from the top-level object.
     */
    public static byte[] canonicalBytes(final Object value, final String... exclude) {
        final JsonNode tree = value instanceof JsonNode node ? node.deepCopy() : MAPPER.valueToTree(value);
        if (tree instanceof ObjectNode object) {
            for (String field : exclude) {
                object.remove(field);
            }
        }
        try {
            return MAPPER.writeValueAsBytes(sorted(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode canonical JSON", e);
        }
    }

    /**
     * Keccak-256 of {@link #canonicalBytes(Object, String...)}.
     */
    public static byte[] digest(final Object value, final String... exclude) {
        return Keccak256.hash(canonicalBytes(value, exclude));
    }

    private static JsonNode sorted(final JsonNode node) {
        if (node.isObject()) {
            final List<String> names = new ArrayList<>();
            final Iterator<String> it = node.fieldNames();
            while (it.hasNext()) {
                names.add(it.next());
            }
            Collections.sort(names);
            final ObjectNode out = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                out.set(name, sorted(node.get(name)));
            }
            return out;
        }
        if (node.isArray()) {
            final ArrayNode out = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                out.add(sorted(element));
            }
            return out;
        }
        return node;
    }
}
