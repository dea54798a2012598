package dev.toggl.sdk;

/**
 * Raised when the HTTP exchange itself fails (connection refused, DNS failure, timeout, interruption).
 * No response body has been inspected when this is thrown.
 */
public final class TransportException extends TogglException {

    private static final long serialVersionUID = 1L;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
