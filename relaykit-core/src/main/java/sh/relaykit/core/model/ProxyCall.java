// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import sh.relaykit.core.types.Address;

/**
 * One call in a proxy (externally-owned-account) batch.
 *
 * <pre>{@code
 * ProxyCall call = new ProxyCall(exchange, ProxyCall.CALL, "0xa9059cbb...", "0");
 * }</pre>
 *
 * @param to       destination contract
 * @param typeCode call-type discriminator understood by the relay's proxy
 *                 ({@code "1"} is a plain call); passed through unchanged
 * @param data     0x-prefixed call data ({@code "0x"} for none)
 * @param value    native-currency amount as a decimal integer string
 * @since 0.1.0
 */
@JsonPropertyOrder({"to", "typeCode", "data", "value"})
public record ProxyCall(Address to, String typeCode, String data, String value) {

    /** Type code of a plain call. */
    public static final String CALL = "1";

    public ProxyCall {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(typeCode, "typeCode");
        if (typeCode.isBlank()) {
            throw new IllegalArgumentException("typeCode cannot be blank");
        }
        CallValidation.requireCallData(data);
        CallValidation.requireDecimalValue(value);
    }

    /**
     * Creates a plain call carrying no native value.
     */
    public static ProxyCall call(final Address to, final String data) {
        return new ProxyCall(to, CALL, data, "0");
    }
}
