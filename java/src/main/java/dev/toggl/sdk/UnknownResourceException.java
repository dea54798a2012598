package dev.toggl.sdk;

/**
 * Raised when a request names a resource that was never registered.
 */
public final class UnknownResourceException extends TogglException {

    private static final long serialVersionUID = 1L;

    private final String resourceName;

    public UnknownResourceException(String resourceName) {
        super(resourceName + " is not registered as a resource");
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
