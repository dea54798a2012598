package dev.toggl.sdk.internal;

import dev.toggl.sdk.ApiError;
import dev.toggl.sdk.TogglApiException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorDecoderTest {

    @Test
    void readsErrorEnvelope() {
        TogglApiException ex = ApiErrorDecoder.decode(403, bytes("{\"error\":{\"code\":403,\"message\":\"Forbidden\"}}"));

        assertEquals(403, ex.getStatusCode());
        assertEquals(403, ex.getCode());
        assertEquals("Forbidden", ex.getMessage());
        assertEquals(new ApiError(403, "Forbidden"), ex.getError());
    }

    @Test
    void envelopeCodeMayDifferFromStatus() {
        TogglApiException ex = ApiErrorDecoder.decode(400, bytes("{\"error\":{\"code\":1001,\"message\":\"bad project\"}}"));

        assertEquals(400, ex.getStatusCode());
        assertEquals(1001, ex.getCode());
        assertEquals("bad project", ex.getError().message());
    }

    @Test
    void fallsBackToStatusLineForHtml() {
        TogglApiException ex = ApiErrorDecoder.decode(502, bytes("<html><body>Bad Gateway</body></html>"));

        assertEquals(new ApiError(502, "502 Bad Gateway"), ex.getError());
    }

    @Test
    void fallsBackWhenEnvelopeIsMalformed() {
        assertEquals(new ApiError(500, "500 Internal Server Error"),
            ApiErrorDecoder.decode(500, bytes("{\"message\":\"no envelope\"}")).getError());
        assertEquals(new ApiError(401, "401 Unauthorized"),
            ApiErrorDecoder.decode(401, bytes("{\"error\":{\"code\":\"401\",\"message\":\"x\"}}")).getError());
        assertEquals(new ApiError(404, "404 Not Found"),
            ApiErrorDecoder.decode(404, bytes("{\"error\":\"missing\"}")).getError());
        assertEquals(new ApiError(429, "429 Too Many Requests"),
            ApiErrorDecoder.decode(429, new byte[0]).getError());
        assertEquals(new ApiError(599, "599"), ApiErrorDecoder.decode(599, null).getError());
    }

    @Test
    void fallbackCoversGatewayAndProxyStatuses() {
        assertEquals(new ApiError(408, "408 Request Timeout"),
            ApiErrorDecoder.decode(408, bytes("<html/>")).getError());
        assertEquals(new ApiError(507, "507 Insufficient Storage"),
            ApiErrorDecoder.decode(507, bytes("<html/>")).getError());
        assertEquals(new ApiError(505, "505 HTTP Version Not Supported"),
            ApiErrorDecoder.decode(505, bytes("<html/>")).getError());
        assertEquals(new ApiError(511, "511 Network Authentication Required"),
            ApiErrorDecoder.decode(511, bytes("")).getError());
        assertEquals("407 Proxy Authentication Required", HttpStatusText.statusLine(407));
        assertEquals("451 Unavailable For Legal Reasons", HttpStatusText.statusLine(451));
    }

    @Test
    void missingMessageKeepsStructuredCode() {
        TogglApiException ex = ApiErrorDecoder.decode(409, bytes("{\"error\":{\"code\":42}}"));

        assertEquals(new ApiError(42, ""), ex.getError());
        assertTrue(ex.getMessage().contains("409"));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
