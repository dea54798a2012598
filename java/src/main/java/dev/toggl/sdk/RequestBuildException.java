package dev.toggl.sdk;

/**
 * Raised when an HTTP request cannot be assembled, for example because the method is not a valid token,
 * the resolved URL is rejected by the HTTP client, or the body cannot be encoded as JSON.
 */
public final class RequestBuildException extends TogglException {

    private static final long serialVersionUID = 1L;

    public RequestBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
