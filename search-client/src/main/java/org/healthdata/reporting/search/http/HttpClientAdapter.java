package org.healthdata.reporting.search.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Transport seam under {@link AbstractRestClient}; tests substitute a canned implementation.
 */
@FunctionalInterface
public interface HttpClientAdapter {
    /**
     * Performs an HTTP request.
     *
     * @param method The HTTP method (GET, POST, ...)
     * @param path The request path, without a leading slash
     * @param body The request body, or null if no body
     * @param headers The request headers
     * @return A Mono that emits the HTTP response, whatever its status code
     */
    Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers);
}
