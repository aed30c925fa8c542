// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import sh.relaykit.core.types.Address;

/**
 * One call executed through a multi-signature (Safe) wallet.
 *
 * <p>
 * The {@code operation} code is forwarded exactly as given; only its presence
 * is checked. The wallet contract defines {@link #CALL} and
 * {@link #DELEGATE_CALL}.
 *
 * @param to        destination contract
 * @param operation wallet operation code
 * @param data      0x-prefixed call data
 * @param value     native-currency amount as a decimal integer string
 * @since 0.1.0
 */
@JsonPropertyOrder({"to", "operation", "data", "value"})
public record SafeCall(Address to, Integer operation, String data, String value) {

    public static final int CALL = 0;
    public static final int DELEGATE_CALL = 1;

    public SafeCall {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(operation, "operation");
        CallValidation.requireCallData(data);
        CallValidation.requireDecimalValue(value);
    }

    public static SafeCall call(final Address to, final String data) {
        return new SafeCall(to, CALL, data, "0");
    }
}
