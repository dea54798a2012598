package dev.toggl.sdk;

/**
 * Raised when a successful response body cannot be decoded into the requested type.
 */
public final class DecodeException extends TogglException {

    private static final long serialVersionUID = 1L;

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
