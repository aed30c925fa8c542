// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.error;

/**
 * Raised at construction when the relayer configuration is unusable, e.g. no
 * signing mode or both signing modes. Never retried.
 */
public final class ConfigurationException extends RelayException {

    public ConfigurationException(final String message) {
        super(message);
    }
}
