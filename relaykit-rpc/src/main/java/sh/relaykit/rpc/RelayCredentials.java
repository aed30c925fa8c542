// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import sh.relaykit.core.error.ConfigurationException;

/**
 * API credentials for relays that authenticate requests.
 *
 * <p>
 * Each request carries an HMAC-SHA256 over
 * {@code timestamp + method + path + body}, keyed with the base64-decoded
 * secret and encoded as URL-safe base64.
 *
 * @param apiKey    key identifier sent in the clear
 * @param apiSecret base64 secret, standard or URL-safe; never logged
 * @throws ConfigurationException if {@code apiSecret} does not decode
 */
public record RelayCredentials(String apiKey, String apiSecret) {

    public RelayCredentials {
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(apiSecret, "apiSecret");
        if (apiKey.isBlank()) {
            throw new ConfigurationException("apiKey cannot be blank");
        }
        try {
            decodeSecret(apiSecret);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("apiSecret is not valid base64");
        }
    }

    public String sign(final String timestamp, final String method, final String path, final String body) {
        final byte[] key = decodeSecret(apiSecret);
        final byte[] message = (timestamp + method + path + body).getBytes(StandardCharsets.UTF_8);

        final HMac mac = new HMac(new SHA256Digest());
        mac.init(new KeyParameter(key));
        mac.update(message, 0, message.length);
        final byte[] out = new byte[mac.getMacSize()];
        mac.doFinal(out, 0);
        return Base64.getUrlEncoder().encodeToString(out);
    }

    private static byte[] decodeSecret(final String secret) {
        try {
            return Base64.getUrlDecoder().decode(secret);
        } catch (IllegalArgumentException e) {
            return Base64.getDecoder().decode(secret);
        }
    }

    @Override
    public String toString() {
        return "RelayCredentials[apiKey=" + apiKey + ", apiSecret=***]";
    }
}
