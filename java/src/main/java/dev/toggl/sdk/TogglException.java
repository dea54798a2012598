package dev.toggl.sdk;

/**
 * Base exception thrown by the Toggl Java SDK.
 */
public class TogglException extends Exception {

    private static final long serialVersionUID = 1L;

    public TogglException(String message) {
        super(message);
    }

    public TogglException(String message, Throwable cause) {
        super(message, cause);
    }
}
