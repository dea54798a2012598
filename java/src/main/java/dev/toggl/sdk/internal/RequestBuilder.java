package dev.toggl.sdk.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.toggl.sdk.ApiCredential;
import dev.toggl.sdk.Config;
import dev.toggl.sdk.RequestBuildException;
import dev.toggl.sdk.UnknownResourceException;
import dev.toggl.sdk.endpoint.EndpointRegistry;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Objects;

/**
 * Turns a method, resource name and optional payload into an authenticated JSON request.
 */
public final class RequestBuilder {

    private final EndpointRegistry registry;
    private final ApiCredential credential;
    private final String userAgent;
    private final Duration timeout;

    public RequestBuilder(EndpointRegistry registry, ApiCredential credential, String userAgent, Duration timeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.credential = Objects.requireNonNull(credential, "credential");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.timeout = timeout;
    }

    /**
     * Resolves {@code resource} and builds the request. A {@code null} payload sends no body; anything else is
     * encoded with {@link Json#mapper()}.
     *
     * @throws UnknownResourceException when the resource was never registered.
     * @throws RequestBuildException when the method, URL or payload is rejected.
     */
    public HttpRequest build(String method, String resource, Object payload)
        throws UnknownResourceException, RequestBuildException {
        URI url = registry.getUrl(resource);
        return build(method, url, payload);
    }

    public HttpRequest build(String method, URI url, Object payload) throws RequestBuildException {
        HttpRequest.BodyPublisher body;
        if (payload == null) {
            body = HttpRequest.BodyPublishers.noBody();
        } else {
            try {
                body = HttpRequest.BodyPublishers.ofByteArray(Json.encode(payload));
            } catch (JsonProcessingException ex) {
                throw new RequestBuildException("encode request body: " + ex.getOriginalMessage(), ex);
            }
        }

        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(url)
                .method(method, body)
                .header("Authorization", credential.basicAuthorization())
                .header("User-Agent", userAgent)
                .header("Content-Type", Config.CONTENT_TYPE_JSON)
                .header("Accept", Config.CONTENT_TYPE_JSON);
            if (timeout != null) {
                builder.timeout(timeout);
            }
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new RequestBuildException("build " + method + " " + url + ": " + ex.getMessage(), ex);
        }
    }
}
