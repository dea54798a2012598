package dev.toggl.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.toggl.sdk.ApiError;
import dev.toggl.sdk.TogglApiException;

import java.io.IOException;
import java.util.Optional;

/**
 * Utility for decoding error payloads from the Toggl API.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    /**
     * Maps a failed response to an exception. Bodies following {@code {"error": {"code": int, "message": string}}}
     * are reported as-is; anything else falls back to the status code and status line.
     */
    public static TogglApiException decode(int statusCode, byte[] body) {
        ApiError error = parseEnvelope(body)
            .orElseGet(() -> new ApiError(statusCode, HttpStatusText.statusLine(statusCode)));
        return new TogglApiException(statusCode, error);
    }

    static Optional<ApiError> parseEnvelope(byte[] body) {
        if (body == null || body.length == 0) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException ex) {
            // not JSON (HTML error page, proxy text, truncated body)
            return Optional.empty();
        }
        if (root == null) {
            return Optional.empty();
        }

        JsonNode error = root.path("error");
        if (!error.isObject()) {
            return Optional.empty();
        }
        JsonNode code = error.path("code");
        if (!code.isIntegralNumber() || !code.canConvertToInt()) {
            return Optional.empty();
        }
        JsonNode message = error.path("message");
        if (!message.isMissingNode() && !message.isNull() && !message.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(new ApiError(code.intValue(), message.isTextual() ? message.asText() : ""));
    }
}
