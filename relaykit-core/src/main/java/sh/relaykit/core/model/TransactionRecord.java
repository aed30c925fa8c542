// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.model;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * Canonical view of a relayed transaction, whatever endpoint produced it.
 *
 * <p>
 * Records are snapshots: the relay owns the transaction and moves it through
 * its states; clients only observe. {@code transactionHash} stays
 * {@code null} until the relay has broadcast to the chain.
 *
 * @param id              relay-assigned transaction identifier, never blank
 * @param state           relay state name (see {@link TransactionStates}), {@code ""} if not reported
 * @param relayHash       the relay's own hash for the request, if reported
 * @param transactionHash on-chain transaction hash, once broadcast
 * @since 0.1.0
 */
public record TransactionRecord(
        String id,
        String state,
        @Nullable String relayHash,
        @Nullable String transactionHash) {

    public TransactionRecord {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        state = state == null ? "" : state;
    }

    public Optional<String> relayHashValue() {
        return Optional.ofNullable(relayHash);
    }

    public Optional<String> transactionHashValue() {
        return Optional.ofNullable(transactionHash);
    }

    public boolean isBroadcast() {
        return transactionHash != null;
    }

    public boolean inState(final Collection<String> states) {
        return states.contains(state);
    }
}
