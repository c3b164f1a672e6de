package org.healthdata.reporting.search;

import java.util.concurrent.TimeoutException;

import org.healthdata.reporting.common.IndexAccessDeniedException;
import org.healthdata.reporting.common.IndexAllowList;
import org.healthdata.reporting.common.ReportingException;
import org.healthdata.reporting.search.http.AbstractRestClient;
import org.healthdata.reporting.search.http.HttpResponse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * {@link SearchExecutionClient} issuing {@code POST /<indices>/_search} through an {@link AbstractRestClient}.
 */
@Slf4j
public class RestSearchExecutionClient implements SearchExecutionClient {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final int FORBIDDEN = 403;

    private final AbstractRestClient restClient;
    private final IndexAllowList allowList;

    public RestSearchExecutionClient(AbstractRestClient restClient, IndexAllowList allowList) {
        this.restClient = restClient;
        this.allowList = allowList;
    }

    @Override
    public Mono<SearchResponse> search(SearchRequest request) {
        return Mono.defer(() -> {
            allowList.checkAccess(request.indices());
            if (request.indices().isEmpty()) {
                log.debug("No indices to search, returning an empty response");
                return Mono.just(SearchResponse.empty());
            }
            String path = String.join(",", request.indices()) + "/_search";
            String body = request.toBody().toString();
            log.atDebug().setMessage("POST {} {}").addArgument(path).addArgument(body).log();
            return restClient.postAsync(path, body)
                .onErrorMap(TimeoutException.class, e -> new SearchExecutionException("Search request to " + path
                    + " timed out after " + restClient.getConnectionContext().getRequestTimeout(), e))
                .onErrorMap(e -> !(e instanceof ReportingException),
                    e -> new SearchExecutionException("Search request to " + path + " failed", e))
                .map(response -> toSearchResponse(request, response));
        });
    }

    private static SearchResponse toSearchResponse(SearchRequest request, HttpResponse response) {
        if (response.statusCode() == FORBIDDEN) {
            throw new IndexAccessDeniedException(String.join(",", request.indices()));
        }
        if (!response.isSuccessful()) {
            log.warn("Search over {} failed: {}", request.indices(), response);
            throw new SearchExecutionException(
                "Search failed with status " + response.statusCode() + ": " + response.body(), response.statusCode());
        }
        try {
            return SearchResponse.fromJson(OBJECT_MAPPER.readTree(response.body()));
        } catch (JsonProcessingException e) {
            throw new SearchExecutionException("Unreadable search response", e);
        }
    }
}
