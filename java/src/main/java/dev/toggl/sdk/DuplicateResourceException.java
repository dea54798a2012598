package dev.toggl.sdk;

/**
 * Raised when a resource name is registered twice in the same
 * {@link dev.toggl.sdk.endpoint.EndpointRegistry}. Registrations are never overwritten.
 */
public final class DuplicateResourceException extends TogglException {

    private static final long serialVersionUID = 1L;

    private final String resourceName;

    public DuplicateResourceException(String resourceName) {
        super(resourceName + " is already used");
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
