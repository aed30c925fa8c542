// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.Objects;

/**
 * How the relayer obtains signatures: from a private key it holds, or from an
 * interactive signer it is handed.
 */
public sealed interface SigningMode permits SigningMode.Backend, SigningMode.Frontend {

    /**
     * Signs locally with a hex-encoded secp256k1 private key.
     */
    record Backend(String privateKey) implements SigningMode {

        public Backend {
            Objects.requireNonNull(privateKey, "privateKey");
        }

        @Override
        public String toString() {
            return "Backend[privateKey=***]";
        }
    }

    /**
     * Delegates to an externally supplied signer.
     */
    record Frontend(InteractiveSigner signer) implements SigningMode {

        public Frontend {
            Objects.requireNonNull(signer, "signer");
        }
    }
}
