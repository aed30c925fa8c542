// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.relaykit.core.types.Address;

class PrivateKeySignerTest {

    private static final String KEY_0 = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    private static final String KEY_1 = "0x59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d";

    @Test
    void derivesKnownAddresses() {
        assertEquals("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266", new PrivateKeySigner(KEY_0).address().value());
        assertEquals("0x70997970c51812dc3a010c7d01b50e0d17dc79c8", new PrivateKeySigner(KEY_1).address().value());
    }

    @Test
    void derivationIsDeterministicAndPrefixInsensitive() {
        Address withPrefix = new PrivateKeySigner(KEY_0).address();
        Address withoutPrefix = new PrivateKeySigner(KEY_0.substring(2)).address();
        assertEquals(withPrefix, withoutPrefix);
        assertEquals(PrivateKey.fromHex(KEY_0).toAddress(), withPrefix);
    }

    @Test
    void signMessageProducesPersonalSignV() {
        PrivateKeySigner signer = new PrivateKeySigner(KEY_0);

        Signature sig = signer.signMessage("Hello World".getBytes(StandardCharsets.UTF_8));

        assertTrue(sig.v() == 27 || sig.v() == 28, "v should be 27 or 28, but was " + sig.v());
    }

    @Test
    void signatureRecoversToSignerAddress() {
        PrivateKeySigner signer = new PrivateKeySigner(KEY_1);
        byte[] message = "relay payload".getBytes(StandardCharsets.UTF_8);

        Signature sig = signer.signMessage(message);

        assertEquals(signer.address(), PrivateKey.recoverAddress(PrivateKeySigner.personalMessageHash(message), sig));
    }

    @Test
    void signingIsDeterministic() {
        PrivateKeySigner signer = new PrivateKeySigner(KEY_0);
        byte[] message = new byte[] {1, 2, 3};

        assertEquals(signer.signMessage(message), signer.signMessage(message));
        assertNotEquals(signer.signMessage(message), signer.signMessage(new byte[] {1, 2, 4}));
    }

    @Test
    void signMessageThrowsOnNullMessage() {
        PrivateKeySigner signer = new PrivateKeySigner(KEY_0);

        NullPointerException ex = assertThrows(NullPointerException.class, () -> signer.signMessage(null));
        assertTrue(ex.getMessage().contains("message"));
    }

    @Test
    void invalidKeysThrow() {
        assertThrows(IllegalArgumentException.class, () -> new PrivateKeySigner("not-a-key"));
        assertThrows(IllegalArgumentException.class, () -> new PrivateKeySigner("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> new PrivateKeySigner("0x" + "0".repeat(64)));
        assertThrows(IllegalArgumentException.class, () -> new PrivateKeySigner("0x" + "f".repeat(64)));
    }

    @Test
    void destroyDisablesSigning() {
        PrivateKeySigner signer = new PrivateKeySigner(KEY_0);
        assertFalse(signer.isDestroyed());

        signer.destroy();

        assertTrue(signer.isDestroyed());
        assertThrows(IllegalStateException.class, () -> signer.signMessage(new byte[] {1}));
        assertEquals("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266", signer.address().value());
    }

    @Test
    void toStringNeverLeaksKey() {
        PrivateKey key = PrivateKey.fromHex(KEY_0);
        assertFalse(key.toString().contains(KEY_0.substring(2)));
        assertFalse(new PrivateKeySigner(key).toString().contains(KEY_0.substring(2)));
    }
}
