// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.examples;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import sh.relaykit.core.crypto.PrivateKeySigner;
import sh.relaykit.core.crypto.Signature;
import sh.relaykit.core.error.NoAddressAvailableException;
import sh.relaykit.core.types.Address;
import sh.relaykit.rpc.InteractiveSigner;
import sh.relaykit.rpc.Relayer;
import sh.relaykit.rpc.RelayerConfig;

/**
 * Frontend mode: the wallet address arrives later, the way a browser wallet
 * answers a connection request.
 *
 * <p>
 * The "wallet" here is a local key that answers after a delay. Nothing is
 * sent to the relay until the final nonce lookup.
 */
public final class FrontendSignerExample {

    private FrontendSignerExample() {
    }

    /** Simulated wallet that takes a moment to approve the connection. */
    static final class SlowWallet implements InteractiveSigner {
        private final PrivateKeySigner key;

        SlowWallet(final String privateKey) {
            this.key = new PrivateKeySigner(privateKey);
        }

        @Override
        public CompletableFuture<Address> requestAddress() {
            System.out.println("[wallet] connection requested");
            return CompletableFuture.supplyAsync(key::address,
                    CompletableFuture.delayedExecutor(500, TimeUnit.MILLISECONDS));
        }

        @Override
        public CompletableFuture<Signature> signMessage(final byte[] message) {
            System.out.println("[wallet] signature requested for " + message.length + " bytes");
            return CompletableFuture.completedFuture(key.signMessage(message));
        }
    }

    public static void main(String[] args) {
        // Anvil account #0; never holds real funds
        final String demoKey = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";

        final RelayerConfig config = RelayerConfig.builder()
                .relayUrl(System.getProperty("relaykit.examples.relay", RelayerConfig.DEFAULT_RELAY_URL))
                .frontend(new SlowWallet(demoKey))
                .build();

        try (Relayer relayer = Relayer.create(config)) {
            System.out.println("Address right after creation: " + relayer.walletAddress());
            try {
                relayer.getNonce().join();
            } catch (RuntimeException e) {
                if (e.getCause() instanceof NoAddressAvailableException) {
                    System.out.println("Nonce before connection: " + e.getCause().getMessage());
                } else {
                    throw e;
                }
            }

            final Address address = relayer.addressReady().join();
            System.out.println("Connected wallet: " + address);

            try {
                System.out.println("Nonce: " + relayer.getNonce().join());
            } catch (RuntimeException e) {
                System.out.println("Error getting nonce: " + e.getMessage());
            }
        }
    }
}
