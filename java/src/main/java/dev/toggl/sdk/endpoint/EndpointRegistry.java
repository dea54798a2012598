package dev.toggl.sdk.endpoint;

import dev.toggl.sdk.DuplicateResourceException;
import dev.toggl.sdk.UnknownResourceException;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Maps logical resource names to endpoints.
 *
 * <p>
 * Entries are only ever added: a name that is already taken is rejected rather than overwritten, and lookups never
 * create entries. Register everything before handing the registry to a {@link dev.toggl.sdk.TogglClient}.
 * </p>
 */
public final class EndpointRegistry {

    private static final Logger LOGGER = Logger.getLogger(EndpointRegistry.class.getName());

    private final Map<String, Endpoint> endpoints = new ConcurrentHashMap<>();

    /**
     * @return a registry holding every {@link TogglEndpoint} under its default resource name.
     */
    public static EndpointRegistry withDefaults() {
        EndpointRegistry registry = new EndpointRegistry();
        for (TogglEndpoint endpoint : TogglEndpoint.values()) {
            registry.endpoints.put(endpoint.resourceName(), endpoint);
        }
        return registry;
    }

    public void addEndpoint(String name, Endpoint endpoint) throws DuplicateResourceException {
        Objects.requireNonNull(endpoint, "endpoint");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("resource name must be non-empty");
        }
        if (endpoints.putIfAbsent(name, endpoint) != null) {
            throw new DuplicateResourceException(name);
        }
        LOGGER.fine(() -> "[toggl-sdk] registered resource " + name + " -> " + endpoint.urlString());
    }

    public URI getUrl(String name) throws UnknownResourceException {
        Endpoint endpoint = name == null ? null : endpoints.get(name);
        if (endpoint == null) {
            throw new UnknownResourceException(name);
        }
        return endpoint.uri();
    }

    public boolean contains(String name) {
        return name != null && endpoints.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(endpoints.keySet());
    }
}
