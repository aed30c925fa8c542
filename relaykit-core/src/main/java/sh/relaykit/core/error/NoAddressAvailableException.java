// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.error;

/**
 * An operation needed the signer's address but none was supplied and the
 * signer has not resolved one yet.
 *
 * <p>
 * Recoverable: wait for the signer's address to resolve or pass an explicit
 * address.
 */
public final class NoAddressAvailableException extends RelayException {

    public NoAddressAvailableException(final String message) {
        super(message);
    }
}
