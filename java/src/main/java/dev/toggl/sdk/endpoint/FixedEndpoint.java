package dev.toggl.sdk.endpoint;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * Endpoint bound to a caller-supplied absolute URL, e.g. a staging host.
 */
public record FixedEndpoint(URI uri) implements Endpoint {

    public FixedEndpoint {
        Objects.requireNonNull(uri, "uri");
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("URL must use http or https: " + uri);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("URL must include a host: " + uri);
        }
    }

    public static FixedEndpoint of(String url) {
        String trimmed = Objects.requireNonNull(url, "url").trim();
        try {
            return new FixedEndpoint(new URI(trimmed));
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
    }
}
