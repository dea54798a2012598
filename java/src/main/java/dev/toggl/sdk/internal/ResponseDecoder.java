package dev.toggl.sdk.internal;

import dev.toggl.sdk.DecodeException;
import dev.toggl.sdk.ResponseType;
import dev.toggl.sdk.TogglException;
import dev.toggl.sdk.TransportException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Maps a completed HTTP response to either a decoded value or a {@link dev.toggl.sdk.TogglApiException}.
 */
public final class ResponseDecoder {

    static final int STATUS_OK = 200;

    private ResponseDecoder() {
    }

    /**
     * Only status {@code 200} counts as success. When {@code type} is {@link ResponseType#none()} the body of a
     * successful response is not read and {@code null} is returned.
     *
     * @throws dev.toggl.sdk.TogglApiException for any other status.
     * @throws DecodeException when a successful body does not match {@code type}.
     * @throws TransportException when the body cannot be read.
     */
    public static <T> T decode(int statusCode, InputStream body, ResponseType<T> type) throws TogglException {
        if (statusCode != STATUS_OK) {
            throw ApiErrorDecoder.decode(statusCode, readBody(body));
        }
        if (!type.expectsPayload()) {
            return null;
        }

        byte[] bytes = readBody(body);
        try {
            return Json.decode(bytes, type.javaType());
        } catch (IOException ex) {
            throw new DecodeException("decode response body: " + ex.getMessage(), ex);
        }
    }

    private static byte[] readBody(InputStream body) throws TransportException {
        if (body == null) {
            return new byte[0];
        }
        try {
            return body.readAllBytes();
        } catch (IOException ex) {
            throw new TransportException("read response body: " + ex.getMessage(), ex);
        }
    }
}
