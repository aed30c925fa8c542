// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import sh.relaykit.core.crypto.PrivateKeySigner;
import sh.relaykit.core.error.ConfigurationException;

class RelayerConfigTest {

    private static final String KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";

    @Test
    void backendConfigUsesDefaults() {
        RelayerConfig config = RelayerConfig.builder().backend(KEY).build();

        assertEquals("https://relayer.polymarket.com", config.relayUrl());
        assertEquals(137L, config.chainId());
        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(Duration.ofSeconds(30), config.readTimeout());
        assertInstanceOf(SigningMode.Backend.class, config.signingMode());
        assertTrue(config.isBackend());
    }

    @Test
    void frontendConfig() {
        InteractiveSigner signer = InteractiveSigner.of(new PrivateKeySigner(KEY));
        RelayerConfig config = RelayerConfig.builder()
                .relayUrl("http://localhost:8080/")
                .chainId(80002L)
                .frontend(signer)
                .build();

        assertEquals("http://localhost:8080", config.relayUrl());
        assertEquals(80002L, config.chainId());
        assertFalse(config.isBackend());
        assertEquals(signer, ((SigningMode.Frontend) config.signingMode()).signer());
    }

    @Test
    void missingSigningModeIsRejected() {
        ConfigurationException ex = assertThrows(
                ConfigurationException.class, () -> RelayerConfig.builder().build());
        assertTrue(ex.getMessage().contains("must be provided"));
    }

    @Test
    void bothSigningModesAreRejected() {
        RelayerConfig.Builder builder = RelayerConfig.builder()
                .backend(KEY)
                .frontend(InteractiveSigner.of(new PrivateKeySigner(KEY)));

        assertThrows(ConfigurationException.class, builder::build);
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(ConfigurationException.class,
                () -> RelayerConfig.builder().backend(KEY).chainId(0).build());
        assertThrows(ConfigurationException.class,
                () -> RelayerConfig.builder().backend(KEY).relayUrl("ftp://relay").build());
        assertThrows(ConfigurationException.class,
                () -> RelayerConfig.builder().backend(KEY).readTimeout(Duration.ZERO).build());
    }

    @Test
    void malformedCredentialsAreRejectedAtBuild() {
        RelayerConfig.Builder builder = RelayerConfig.builder().backend(KEY);

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> builder.credentials("key-1", "%%%not-base64%%%"));
        assertFalse(ex.getMessage().contains("%%%not-base64%%%"));
        assertThrows(ConfigurationException.class, () -> builder.credentials(" ", "c2VjcmV0"));
    }

    @Test
    void secretsNeverAppearInToString() {
        RelayerConfig config = RelayerConfig.builder()
                .backend(KEY)
                .credentials("key-1", "c2VjcmV0")
                .build();

        String text = config.toString();
        assertFalse(text.contains(KEY.substring(2)));
        assertFalse(text.contains("c2VjcmV0"));
        assertTrue(text.contains("key-1"));
    }

    @Test
    void credentialSignatureDependsOnEveryPart() {
        RelayCredentials credentials = new RelayCredentials("key-1", "c2VjcmV0LXNlY3JldA==");

        String base = credentials.sign("1700000000", "POST", "/submit", "{}");

        assertEquals(base, credentials.sign("1700000000", "POST", "/submit", "{}"));
        assertNotEquals(base, credentials.sign("1700000001", "POST", "/submit", "{}"));
        assertNotEquals(base, credentials.sign("1700000000", "GET", "/submit", "{}"));
        assertNotEquals(base, credentials.sign("1700000000", "POST", "/submit", "{\"a\":1}"));
    }
}
