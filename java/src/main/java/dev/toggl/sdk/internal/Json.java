package dev.toggl.sdk.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Shared JSON codec for request bodies and response payloads.
 *
 * <p>
 * Time entries and reports carry ISO-8601 timestamps, so {@code java.time} values are written as strings rather
 * than epoch numbers. Fields the caller's type does not declare are ignored, and {@code null} fields are left out of
 * request bodies so partial updates only send what was set.
 * </p>
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    static byte[] encode(Object payload) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(payload);
    }

    static <T> T decode(byte[] body, JavaType type) throws IOException {
        return MAPPER.readValue(body, type);
    }

    public static JavaType type(Class<?> type) {
        return MAPPER.getTypeFactory().constructType(type);
    }

    public static JavaType type(TypeReference<?> type) {
        return MAPPER.getTypeFactory().constructType(type);
    }
}
