package dev.toggl.sdk;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import dev.toggl.sdk.internal.Json;

import java.util.Objects;

/**
 * Destination for a response body. Use {@link #none()} when the call carries no payload worth reading; the body
 * is then never decoded.
 *
 * @param <T> decoded type
 */
public final class ResponseType<T> {

    private static final ResponseType<Void> NONE = new ResponseType<>(null);

    private final JavaType javaType;

    private ResponseType(JavaType javaType) {
        this.javaType = javaType;
    }

    public static ResponseType<Void> none() {
        return NONE;
    }

    public static <T> ResponseType<T> of(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return new ResponseType<>(Json.type(type));
    }

    public static <T> ResponseType<T> of(TypeReference<T> type) {
        Objects.requireNonNull(type, "type");
        return new ResponseType<>(Json.type(type));
    }

    public boolean expectsPayload() {
        return javaType != null;
    }

    public JavaType javaType() {
        return javaType;
    }

    @Override
    public String toString() {
        return javaType == null ? "ResponseType[none]" : "ResponseType[" + javaType.toCanonical() + "]";
    }
}
