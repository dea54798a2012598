package dev.toggl.sdk;

import dev.toggl.sdk.endpoint.EndpointRegistry;
import dev.toggl.sdk.internal.RequestBuilder;
import dev.toggl.sdk.internal.ResponseDecoder;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Entry point for calling the Toggl REST API. A client resolves logical resource names through an
 * {@link EndpointRegistry}, authenticates with HTTP Basic credentials and maps JSON responses into typed values.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Every call is one synchronous request/response cycle. Nothing is retried, cached or paginated.</li>
 *   <li>The registry is shared with the caller, who keeps ownership of it. Finish registering endpoints before
 *       issuing requests.</li>
 *   <li>Failures surface as the first {@link TogglException} raised along the pipeline: resource lookup
 *       ({@link UnknownResourceException}), request assembly ({@link RequestBuildException}), the exchange itself
 *       ({@link TransportException}), then the response ({@link TogglApiException} or {@link DecodeException}).</li>
 * </ul>
 *
 * <p>
 * The client holds no per-request state and may be shared across threads.
 * </p>
 */
public final class TogglClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(TogglClient.class.getName());

    private final Config config;
    private final HttpClient httpClient;
    private final EndpointRegistry registry;
    private final RequestBuilder requestBuilder;

    /**
     * @param config   caller-supplied configuration; only the API token is mandatory.
     * @param registry endpoints this client may call. The reference is kept, not copied.
     */
    public TogglClient(Config config, EndpointRegistry registry) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.registry = Objects.requireNonNull(registry, "registry");
        this.httpClient = this.config.getHttpClient();
        this.requestBuilder = new RequestBuilder(
            registry,
            this.config.credential(),
            this.config.getUserAgent(),
            this.config.getHttpTimeout()
        );
    }

    public TogglClient(ApiCredential credential, EndpointRegistry registry) {
        this(Config.builder()
            .apiToken(Objects.requireNonNull(credential, "credential").token())
            .apiSecret(credential.secret())
            .build(), registry);
    }

    public EndpointRegistry registry() {
        return registry;
    }

    /**
     * Sends a GET to {@code resource} and discards the body of a successful response.
     *
     * @throws TogglException when any stage of the call fails.
     */
    public void get(String resource) throws TogglException {
        request("GET", resource, null, ResponseType.none());
    }

    public <T> T get(String resource, Class<T> type) throws TogglException {
        return request("GET", resource, null, ResponseType.of(type));
    }

    public <T> T get(String resource, ResponseType<T> type) throws TogglException {
        return request("GET", resource, null, type);
    }

    public <T> T post(String resource, Object body, Class<T> type) throws TogglException {
        return request("POST", resource, body, ResponseType.of(type));
    }

    public <T> T post(String resource, Object body, ResponseType<T> type) throws TogglException {
        return request("POST", resource, body, type);
    }

    public <T> T put(String resource, Object body, Class<T> type) throws TogglException {
        return request("PUT", resource, body, ResponseType.of(type));
    }

    public <T> T put(String resource, Object body, ResponseType<T> type) throws TogglException {
        return request("PUT", resource, body, type);
    }

    public void delete(String resource) throws TogglException {
        request("DELETE", resource, null, ResponseType.none());
    }

    /**
     * Performs a single authenticated exchange against a registered resource.
     *
     * @param method   HTTP method, e.g. {@code "GET"}.
     * @param resource name the target endpoint was registered under.
     * @param body     payload encoded as JSON, or {@code null} for no body.
     * @param type     destination for a {@code 200} body; {@link ResponseType#none()} skips decoding.
     * @return the decoded body, or {@code null} when {@code type} is {@link ResponseType#none()}.
     * @throws TogglException the first failure encountered; see the class documentation for the order.
     */
    public <T> T request(String method, String resource, Object body, ResponseType<T> type) throws TogglException {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(type, "type");

        HttpRequest request = requestBuilder.build(method, resource, body);
        LOGGER.fine(() -> "[toggl-sdk] " + method + " " + resource + " -> " + request.uri());

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException | InterruptedException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new TransportException(method + " " + resource + " interrupted", ex);
            }
            throw new TransportException(method + " " + resource + " request: " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        LOGGER.fine(() -> "[toggl-sdk] " + method + " " + resource + " returned " + status);
        try (InputStream bodyStream = response.body()) {
            return ResponseDecoder.decode(status, bodyStream, type);
        } catch (IOException ex) {
            throw new TransportException("close " + resource + " response: " + ex.getMessage(), ex);
        }
    }

    /**
     * Closes the client. A no-op: the {@link HttpClient} is supplied through {@link Config} and is not owned here.
     */
    @Override
    public void close() {
    }
}
