// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.net.URI;
import java.time.Duration;

import org.jspecify.annotations.Nullable;

import sh.relaykit.core.error.ConfigurationException;

/**
 * Immutable relayer configuration.
 *
 * <p>
 * Exactly one signing mode is required. Use {@link #builder()}:
 *
 * <pre>{@code
 * RelayerConfig config = RelayerConfig.builder()
 *         .backend(System.getenv("PRIVATE_KEY"))
 *         .build();
 * }</pre>
 *
 * @param relayUrl       base URL of the relay service
 * @param chainId        target chain
 * @param signingMode    backend key or interactive signer
 * @param credentials    optional API credentials
 * @param connectTimeout HTTP connect timeout
 * @param readTimeout    per-request timeout
 * @since 0.1.0
 */
public record RelayerConfig(
        String relayUrl,
        long chainId,
        SigningMode signingMode,
        @Nullable RelayCredentials credentials,
        Duration connectTimeout,
        Duration readTimeout) {

    public static final String DEFAULT_RELAY_URL = "https://relayer.polymarket.com";
    /** Polygon mainnet. */
    public static final long DEFAULT_CHAIN_ID = 137L;

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public RelayerConfig {
        if (signingMode == null) {
            throw new ConfigurationException("Either a backend private key or a frontend signer must be provided");
        }
        relayUrl = requireUrl(relayUrl);
        if (chainId <= 0) {
            throw new ConfigurationException("chainId must be positive: " + chainId);
        }
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        if (connectTimeout.isNegative() || connectTimeout.isZero()
                || readTimeout.isNegative() || readTimeout.isZero()) {
            throw new ConfigurationException("Timeouts must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isBackend() {
        return signingMode instanceof SigningMode.Backend;
    }

    private static String requireUrl(final String url) {
        if (url == null || url.isBlank()) {
            return DEFAULT_RELAY_URL;
        }
        final URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid relay URL: " + url);
        }
        if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) {
            throw new ConfigurationException("Relay URL must be http or https: " + url);
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static final class Builder {
        private String relayUrl = DEFAULT_RELAY_URL;
        private long chainId = DEFAULT_CHAIN_ID;
        private @Nullable String privateKey;
        private @Nullable InteractiveSigner signer;
        private @Nullable RelayCredentials credentials;
        private Duration connectTimeout = DEFAULT_CONNECT;
        private Duration readTimeout = DEFAULT_READ;

        private Builder() {
        }

        public Builder relayUrl(final String relayUrl) {
            this.relayUrl = relayUrl;
            return this;
        }

        public Builder chainId(final long chainId) {
            this.chainId = chainId;
            return this;
        }

        /**
         * Selects backend mode. The key is validated when the relayer is created.
         */
        public Builder backend(final String privateKey) {
            this.privateKey = privateKey;
            return this;
        }

        public Builder frontend(final InteractiveSigner signer) {
            this.signer = signer;
            return this;
        }

        public Builder credentials(final RelayCredentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder credentials(final String apiKey, final String apiSecret) {
            return credentials(new RelayCredentials(apiKey, apiSecret));
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        /**
         * @throws ConfigurationException if neither or both signing modes are set
         */
        public RelayerConfig build() {
            if (privateKey != null && signer != null) {
                throw new ConfigurationException(
                        "Both a backend private key and a frontend signer were provided; choose one");
            }
            final SigningMode mode;
            if (privateKey != null) {
                mode = new SigningMode.Backend(privateKey);
            } else if (signer != null) {
                mode = new SigningMode.Frontend(signer);
            } else {
                mode = null;
            }
            return new RelayerConfig(relayUrl, chainId, mode, credentials, connectTimeout, readTimeout);
        }
    }

    @Override
    public String toString() {
        return "RelayerConfig[relayUrl=" + relayUrl
                + ", chainId=" + chainId
                + ", signingMode=" + signingMode
                + ", credentials=" + credentials + "]";
    }
}
