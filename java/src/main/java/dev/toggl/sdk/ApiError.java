package dev.toggl.sdk;

/**
 * Error reported by the Toggl API, either parsed from the {@code {"error": {...}}} envelope or synthesized
 * from the HTTP status line when the body does not follow that shape.
 */
public record ApiError(int code, String message) {
}
