// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.examples;

import java.util.List;
import java.util.Optional;

import sh.relaykit.core.RelayDebug;
import sh.relaykit.core.error.RelayException;
import sh.relaykit.core.model.ProxyCall;
import sh.relaykit.core.model.TransactionRecord;
import sh.relaykit.core.model.TransactionStates;
import sh.relaykit.core.types.Address;
import sh.relaykit.rpc.PollOptions;
import sh.relaykit.rpc.Relayer;
import sh.relaykit.rpc.RelayerConfig;

/**
 * Walks through the relayer: identity, nonce, history and, optionally, a
 * gasless proxy call.
 *
 * <p>
 * Usage:
 *
 * <pre>
 * export PRIVATE_KEY=0x...
 * mvn -pl relaykit-examples exec:java -Dexec.mainClass=sh.relaykit.examples.RelayerExample \
 *   -Drelaykit.examples.to=0x... -Drelaykit.examples.data=0x...
 * </pre>
 *
 * Without {@code relaykit.examples.to} the submission step is skipped.
 */
public final class RelayerExample {

    private RelayerExample() {
    }

    public static void main(String[] args) {
        final String privateKey = System.getenv("PRIVATE_KEY");
        if (privateKey == null || privateKey.isBlank()) {
            System.err.println("ERROR: set the PRIVATE_KEY environment variable, e.g. export PRIVATE_KEY=0x...");
            System.exit(1);
            return;
        }

        RelayDebug.setEnabled(true);

        final RelayerConfig config = RelayerConfig.builder()
                .relayUrl(System.getProperty("relaykit.examples.relay", RelayerConfig.DEFAULT_RELAY_URL))
                .chainId(RelayerConfig.DEFAULT_CHAIN_ID)
                .backend(privateKey)
                .build();

        try (Relayer relayer = Relayer.create(config)) {
            System.out.println("Wallet address: " + relayer.walletAddress().orElse(null));

            System.out.println("\n=== Relayer Address ===");
            try {
                System.out.println("Relayer address: " + relayer.getRelayerAddress().join());
            } catch (RuntimeException e) {
                System.out.println("Error getting relayer address: " + e.getMessage());
            }

            System.out.println("\n=== Current Nonce ===");
            try {
                System.out.println("Current nonce: " + relayer.getNonce().join());
            } catch (RuntimeException e) {
                System.out.println("Error getting nonce: " + e.getMessage());
            }

            System.out.println("\n=== Your Transactions ===");
            try {
                final List<TransactionRecord> transactions = relayer.getTransactions().join();
                System.out.println("You have " + transactions.size() + " relayer transaction(s)");
                transactions.stream().limit(3).forEach(tx -> System.out.println(
                        "  " + tx.id() + " " + tx.state() + " " + tx.transactionHashValue().orElse("pending")));
            } catch (RuntimeException e) {
                System.out.println("Error getting transactions: " + e.getMessage());
            }

            final String to = System.getProperty("relaykit.examples.to");
            if (to != null) {
                submitAndWait(relayer, new Address(to), System.getProperty("relaykit.examples.data", "0x"));
            }
        }
    }

    private static void submitAndWait(final Relayer relayer, final Address to, final String data) {
        System.out.println("\n=== Gasless Transaction ===");
        try {
            final TransactionRecord submitted = relayer
                    .submitProxyBatch(List.of(ProxyCall.call(to, data)), "relaykit-example")
                    .join();
            System.out.println("Submitted " + submitted.id() + " state=" + submitted.state());

            final Optional<TransactionRecord> result = relayer.waitForTransaction(
                    submitted.id(),
                    PollOptions.defaults().withDesiredStates(TransactionStates.CONFIRMED));
            if (result.isPresent()) {
                System.out.println("Confirmed: " + result.get().transactionHashValue().orElse("?"));
            } else {
                System.out.println("Transaction failed or was not confirmed in time");
            }
        } catch (RelayException e) {
            System.out.println("Relay error: " + e.getMessage());
        } catch (RuntimeException e) {
            System.out.println("Error executing transaction: " + e.getMessage());
        }
    }
}
