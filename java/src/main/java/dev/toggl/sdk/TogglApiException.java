package dev.toggl.sdk;

import java.util.Objects;

/**
 * Exception representing an error returned by the Toggl API. Thrown for every response whose status is not
 * {@code 200}, so callers can tell service-level failures apart from transport or decoding problems.
 */
public final class TogglApiException extends TogglException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final ApiError error;

    public TogglApiException(int statusCode, ApiError error) {
        super(defaultMessage(statusCode, Objects.requireNonNull(error, "error")));
        this.statusCode = statusCode;
        this.error = error;
    }

    /**
     * @return HTTP status code of the response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return error code reported by the service, or the HTTP status when the body carried no envelope.
     */
    public int getCode() {
        return error.code();
    }

    public ApiError getError() {
        return error;
    }

    private static String defaultMessage(int status, ApiError error) {
        if (error.message() == null || error.message().isBlank()) {
            return "Toggl request failed with status " + status + " (" + error.code() + ")";
        }
        return error.message();
    }
}
