package dev.toggl.sdk.endpoint;

import java.net.URI;

/**
 * A REST endpoint bound to a resource name in an {@link EndpointRegistry}.
 */
public interface Endpoint {

    URI uri();

    default String urlString() {
        return uri().toString();
    }
}
