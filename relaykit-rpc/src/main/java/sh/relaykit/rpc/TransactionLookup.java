// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import sh.relaykit.core.model.TransactionRecord;

/**
 * Fetches the state history of a relayed transaction, newest first.
 */
@FunctionalInterface
public interface TransactionLookup {

    CompletableFuture<List<TransactionRecord>> getTransaction(String transactionId);
}
