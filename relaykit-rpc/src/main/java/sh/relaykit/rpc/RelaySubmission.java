// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import org.jspecify.annotations.Nullable;

import sh.relaykit.core.types.Address;
import sh.relaykit.rpc.internal.RelayJson;

/**
 * Body of a {@code POST /submit} request.
 *
 * <p>
 * The signature commits to every other field: it is an EIP-191 personal
 * signature over {@link #digest()}, the Keccak-256 of the canonical JSON
 * encoding with {@code signature} removed.
 *
 * @param type      {@code PROXY}, {@code SAFE} or {@code SAFE-CREATE}
 * @param from      signer address
 * @param chainId   target chain
 * @param nonce     relay nonce, as reported by the relay
 * @param calls     ordered calls; empty for deployments
 * @param metadata  optional free-form label
 * @param signature 65-byte hex signature, {@code null} before signing
 */
@JsonPropertyOrder({"type", "from", "chainId", "nonce", "calls", "metadata", "signature"})
public record RelaySubmission(
        String type,
        Address from,
        long chainId,
        String nonce,
        List<?> calls,
        @Nullable String metadata,
        @Nullable String signature) {

    public RelaySubmission {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(nonce, "nonce");
        calls = calls == null ? List.of() : List.copyOf(calls);
    }

    public static RelaySubmission unsigned(
            final String type,
            final Address from,
            final long chainId,
            final String nonce,
            final List<?> calls,
            final @Nullable String metadata) {
        return new RelaySubmission(type, from, chainId, nonce, calls, metadata, null);
    }

    public byte[] digest() {
        return RelayJson.digest(this, "signature");
    }

    public RelaySubmission withSignature(final String signatureHex) {
        return new RelaySubmission(type, from, chainId, nonce, calls, metadata,
                Objects.requireNonNull(signatureHex, "signatureHex"));
    }
}
