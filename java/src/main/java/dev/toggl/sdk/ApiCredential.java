package dev.toggl.sdk;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Token pair sent as HTTP Basic credentials on every request.
 *
 * <p>
 * Toggl accepts the personal API token as the username together with the literal password {@value #API_TOKEN_SECRET};
 * {@link #ofToken(String)} builds that form.
 * </p>
 */
public record ApiCredential(String token, String secret) {

    public static final String API_TOKEN_SECRET = "api_token";

    public ApiCredential {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("API token is required");
        }
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("API secret is required");
        }
    }

    public static ApiCredential ofToken(String token) {
        return new ApiCredential(token, API_TOKEN_SECRET);
    }

    /**
     * @return value for the {@code Authorization} header.
     */
    public String basicAuthorization() {
        String pair = token + ":" + secret;
        return "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "ApiCredential[token=***, secret=***]";
    }
}
