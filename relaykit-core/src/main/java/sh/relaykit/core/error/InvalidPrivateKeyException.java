// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.error;

/**
 * The backend secret key is not a valid secp256k1 private key.
 * The key itself is never part of the message.
 */
public final class InvalidPrivateKeyException extends RelayException {

    public InvalidPrivateKeyException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
