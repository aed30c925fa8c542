// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.error;

/**
 * Base runtime exception for all relaykit failures.
 *
 * <p>
 * Callers get one stable error surface regardless of how the underlying relay
 * formats its errors.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * RelayException
 * ├── {@link ConfigurationException} - missing or ambiguous signing mode
 * ├── {@link InvalidPrivateKeyException} - malformed backend key
 * ├── {@link NoAddressAvailableException} - signer address not resolved yet
 * ├── {@link RelayRejectedException} - relay declined a submission
 * ├── {@link MalformedRelayResponseException} - relay response lacks the transaction id
 * ├── {@link RelayCancelledException} - blocking confirmation wait aborted by the caller
 * └── {@link RelayTransportException} - HTTP or decoding failure talking to the relay
 * </pre>
 *
 * <p>
 * A transaction that ends in the fail state, or never reaches a desired state
 * within the poll budget, is not an exception: the poller reports it as an
 * empty result.
 *
 * <pre>{@code
 * try {
 *     relayer.submitProxyBatch(calls).join();
 * } catch (CompletionException e) {
 *     if (e.getCause() instanceof RelayRejectedException rejected) {
 *         log(rejected.relayMessage());
 *     }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class RelayException extends RuntimeException
        permits ConfigurationException,
        InvalidPrivateKeyException,
        NoAddressAvailableException,
        RelayRejectedException,
        MalformedRelayResponseException,
        RelayCancelledException,
        RelayTransportException {

    public RelayException(final String message) {
        super(message);
    }

    public RelayException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
