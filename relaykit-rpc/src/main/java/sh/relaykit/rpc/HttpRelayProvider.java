// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import org.jspecify.annotations.Nullable;

import sh.relaykit.core.DebugLogger;
import sh.relaykit.core.LogFormatter;
import sh.relaykit.core.error.RelayTransportException;
import sh.relaykit.rpc.internal.RelayJson;

/**
 * {@link RelayProvider} over {@link java.net.http.HttpClient}.
 *
 * <pre>{@code
 * RelayProvider provider = HttpRelayProvider.builder("https://relayer.polymarket.com")
 *         .readTimeout(Duration.ofSeconds(15))
 *         .build();
 * }</pre>
 *
 * <p>
 * When {@link RelayCredentials} are configured every request carries the
 * {@code RELAYER_API_KEY}, {@code RELAYER_TIMESTAMP} and
 * {@code RELAYER_SIGNATURE} headers.
 */
public final class HttpRelayProvider implements RelayProvider {

    private final String baseUrl;
    private final Duration readTimeout;
    private final Map<String, String> headers;
    private final @Nullable RelayCredentials credentials;
    private final HttpClient httpClient;

    private HttpRelayProvider(final Builder builder) {
        this.baseUrl = stripTrailingSlash(builder.url);
        this.readTimeout = builder.readTimeout;
        this.headers = Map.copyOf(builder.headers);
        this.credentials = builder.credentials;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    /**
     * Creates a provider from a relayer configuration.
     */
    public static HttpRelayProvider from(final RelayerConfig config) {
        final Builder builder = builder(config.relayUrl())
                .connectTimeout(config.connectTimeout())
                .readTimeout(config.readTimeout());
        if (config.credentials() != null) {
            builder.credentials(config.credentials());
        }
        return builder.build();
    }

    @Override
    public JsonNode get(final String path, final Map<String, String> query) throws RelayTransportException {
        final String target = path + encodeQuery(query);
        final HttpRequest.Builder request = newRequest(target, "GET", "").GET();
        return exchange("GET", path, request.build());
    }

    @Override
    public JsonNode post(final String path, final Object body) throws RelayTransportException {
        final String payload = serialize(path, body);
        final HttpRequest.Builder request = newRequest(path, "POST", payload)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload));
        return exchange("POST", path, request.build());
    }

    private HttpRequest.Builder newRequest(final String target, final String method, final String body) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + target))
                .header("Accept", "application/json")
                .timeout(readTimeout);
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }
        if (credentials != null) {
            final String timestamp = Long.toString(System.currentTimeMillis() / 1000L);
            builder.header(RelayEndpoints.HEADER_API_KEY, credentials.apiKey())
                    .header(RelayEndpoints.HEADER_TIMESTAMP, timestamp)
                    .header(RelayEndpoints.HEADER_SIGNATURE, credentials.sign(timestamp, method, target, body));
        }
        return builder;
    }

    private JsonNode exchange(final String method, final String path, final HttpRequest request) {
        final long start = System.nanoTime();
        final HttpResponse<String> response = execute(method, path, request, start);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        final int status = response.statusCode();
        final String body = response.body();
        if (status < 200 || status >= 300) {
            final String reason = errorReason(status, body);
            DebugLogger.logTransport(LogFormatter.formatRequestError(method, path, status, reason, durationMicros));
            throw new RelayTransportException(status, reason, path, body, null);
        }

        final JsonNode parsed = parse(status, path, body);
        DebugLogger.logTransport(LogFormatter.formatRequest(method, path, durationMicros));
        return parsed;
    }

    private HttpResponse<String> execute(
            final String method, final String path, final HttpRequest request, final long start) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logNetworkError(method, path, e, start);
            throw new RelayTransportException(
                    RelayTransportException.NO_STATUS, "Interrupted during relay request", path, null, e);
        } catch (IOException e) {
            logNetworkError(method, path, e, start);
            throw new RelayTransportException(
                    RelayTransportException.NO_STATUS, "Network error during relay request", path, null, e);
        }
    }

    private static void logNetworkError(final String method, final String path, final Exception e, final long start) {
        DebugLogger.logTransport(LogFormatter.formatRequestError(
                method, path, "network", String.valueOf(e.getMessage()), (System.nanoTime() - start) / 1_000L));
    }

    private static String serialize(final String path, final Object body) {
        try {
            return RelayJson.MAPPER.writeValueAsString(Objects.requireNonNull(body, "body"));
        } catch (JsonProcessingException e) {
            throw new RelayTransportException(
                    RelayTransportException.NO_STATUS, "Unable to serialize relay request", path, null, e);
        }
    }

    private static JsonNode parse(final int status, final String path, final @Nullable String body) {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return RelayJson.MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RelayTransportException(status, "Unable to parse relay response", path, body, e);
        }
    }

    /**
     * Prefers the relay's {@code error} or {@code message} field, falling back
     * to the bare status.
     */
    private static String errorReason(final int status, final @Nullable String body) {
        if (body != null && !body.isBlank()) {
            try {
                final String relayError = RelayJson.text(RelayJson.MAPPER.readTree(body), "error", "message");
                if (relayError != null) {
                    return relayError;
                }
            } catch (JsonProcessingException e) {
                DebugLogger.logTransport("Non-JSON error body for HTTP %s", status);
            }
        }
        return "HTTP " + status;
    }

    private static String encodeQuery(final @Nullable Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        final StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : query.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            sb.append(sb.length() == 0 ? '?' : '&')
                    .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    private static String stripTrailingSlash(final String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();
        private @Nullable RelayCredentials credentials;

        private Builder(final String url) {
            this.url = Objects.requireNonNull(url, "url");
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

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public Builder credentials(final RelayCredentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public HttpRelayProvider build() {
            return new HttpRelayProvider(this);
        }
    }
}
