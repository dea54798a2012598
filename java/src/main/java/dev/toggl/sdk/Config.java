package dev.toggl.sdk;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link TogglClient} instances.
 */
public final class Config {

    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT = "toggl-java/0.1";
    public static final String CONTENT_TYPE_JSON = "application/json";

    private final String apiToken;
    private final String apiSecret;
    private final HttpClient httpClient;
    private final Duration httpTimeout;

    private Config(Builder builder) {
        this.apiToken = builder.apiToken;
        this.apiSecret = builder.apiSecret;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalArgumentException("ApiToken is required");
        }

        String secret = apiSecret == null || apiSecret.isBlank() ? ApiCredential.API_TOKEN_SECRET : apiSecret;

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .apiToken(apiToken)
            .apiSecret(secret)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .buildInternal();
    }

    public ApiCredential credential() {
        return new ApiCredential(apiToken, apiSecret);
    }

    public String getApiToken() {
        return apiToken;
    }

    public String getApiSecret() {
        return apiSecret;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public String getUserAgent() {
        return DEFAULT_USER_AGENT;
    }

    public static final class Builder {
        private String apiToken;
        private String apiSecret;
        private HttpClient httpClient;
        private Duration httpTimeout;

        public Builder apiToken(String apiToken) {
            this.apiToken = apiToken;
            return this;
        }

        public Builder apiSecret(String apiSecret) {
            this.apiSecret = apiSecret;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
