package org.healthdata.reporting.search.http;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Adds the common headers to every request and hands it to an {@link HttpClientAdapter}.
 */
public abstract class AbstractRestClient {
    @Getter
    protected final ConnectionContext connectionContext;
    protected final HttpClientAdapter httpClientAdapter;

    private static final String USER_AGENT_HEADER_NAME = "User-Agent";
    private static final String CONTENT_TYPE_HEADER_NAME = "Content-Type";
    private static final String HOST_HEADER_NAME = "Host";
    private static final String AUTHORIZATION_HEADER_NAME = "Authorization";

    private static final String USER_AGENT = "HealthReporting-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";

    protected AbstractRestClient(ConnectionContext connectionContext, HttpClientAdapter httpClientAdapter) {
        this.connectionContext = connectionContext;
        this.httpClientAdapter = httpClientAdapter;
    }

    /**
     * The host header omits the port when it is the protocol default.
     */
    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        String host = connectionContext.getUri().getHost();
        int port = connectionContext.getUri().getPort();
        int defaultPort = connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS ? 443 : 80;
        if (port == -1 || port == defaultPort) {
            return host;
        }
        return host + ":" + port;
    }

    /**
     * Fails with {@link java.util.concurrent.TimeoutException} when no response arrives within the connection's
     * request timeout.
     */
    public Mono<HttpResponse> asyncRequest(String method, String path, String body,
                                           Map<String, List<String>> additionalHeaders) {
        return httpClientAdapter.request(method, path, body, prepareHeaders(body, additionalHeaders))
            .timeout(connectionContext.getRequestTimeout());
    }

    protected Map<String, List<String>> prepareHeaders(String body, Map<String, List<String>> additionalHeaders) {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put(USER_AGENT_HEADER_NAME, List.of(USER_AGENT));
        headers.put(HOST_HEADER_NAME, List.of(getHostHeaderValue(connectionContext)));
        if (body != null) {
            headers.put(CONTENT_TYPE_HEADER_NAME, List.of(JSON_CONTENT_TYPE));
        }
        if (connectionContext.hasCredentials()) {
            headers.put(AUTHORIZATION_HEADER_NAME, List.of(connectionContext.basicAuthorization()));
        }
        if (additionalHeaders != null) {
            headers.putAll(additionalHeaders);
        }
        return headers;
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest("GET", path, null, null);
    }

    public Mono<HttpResponse> postAsync(String path, String body) {
        return asyncRequest("POST", path, body, null);
    }
}
