package org.healthdata.reporting.search;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.healthdata.reporting.common.IndexAccessDeniedException;
import org.healthdata.reporting.common.IndexAllowList;
import org.healthdata.reporting.jql.QueryCompiler;
import org.healthdata.reporting.search.http.AbstractRestClient;
import org.healthdata.reporting.search.http.ConnectionContext;
import org.healthdata.reporting.search.http.HttpClientAdapter;
import org.healthdata.reporting.search.http.HttpResponse;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class RestSearchExecutionClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ConnectionContext CONTEXT = ConnectionContext.builder().host("http://localhost:9200").build();

    private final AtomicReference<String> lastPath = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();

    private RestSearchExecutionClient clientReturning(int status, String body) {
        HttpClientAdapter adapter = (method, path, requestBody, headers) -> {
            lastPath.set(path);
            lastBody.set(requestBody);
            return Mono.just(new HttpResponse(status, "status", Map.of(), body));
        };
        return new RestSearchExecutionClient(new AbstractRestClient(CONTEXT, adapter) {}, IndexAllowList.of("visits", "labs-*"));
    }

    private static SearchRequest request(String... indices) {
        return SearchRequest.builder().indices(List.of(indices)).size(10).build();
    }

    @Test
    void postsToJoinedIndexPathAndParsesHits() {
        var client = clientReturning(200, "{\"hits\":{\"total\":{\"value\":2,\"relation\":\"eq\"},\"hits\":["
            + "{\"_index\":\"visits\",\"_id\":\"1\",\"_source\":{\"patient\":\"p1\"}},"
            + "{\"_index\":\"labs-2024\",\"_id\":\"2\",\"_source\":{\"patient\":\"p2\"}}]},"
            + "\"aggregations\":{\"by_ward\":{\"buckets\":[]}}}");

        StepVerifier.create(client.search(request("visits", "labs-2024")))
            .assertNext(response -> {
                assertEquals(2, response.total());
                assertEquals(2, response.hits().size());
                assertEquals("labs-2024", response.hits().get(1).index());
                assertEquals("p1", response.sources().get(0).path("patient").asText());
                assertTrue(response.aggregations().has("by_ward"));
            })
            .verifyComplete();

        assertEquals("visits,labs-2024/_search", lastPath.get());
    }

    @Test
    void sendsQueryPagingAndSortInTheBody() throws Exception {
        var client = clientReturning(200, "{\"hits\":{\"total\":0,\"hits\":[]}}");
        var sort = MAPPER.createArrayNode();
        sort.addObject().putObject("admitted.keyword").put("order", "desc");

        client.search(SearchRequest.builder()
            .indices(List.of("visits"))
            .query(QueryCompiler.matchAll())
            .from(20)
            .size(5)
            .sort(sort)
            .sourceFields(List.of("patient"))
            .build()).block();

        assertEquals(
            MAPPER.readTree("{\"query\":{\"match_all\":{}},\"from\":20,\"size\":5,"
                + "\"sort\":[{\"admitted.keyword\":{\"order\":\"desc\"}}],\"_source\":[\"patient\"]}"),
            MAPPER.readTree(lastBody.get()));
    }

    @Test
    void acceptsNumericTotal() {
        var client = clientReturning(200, "{\"hits\":{\"total\":7,\"hits\":[]}}");

        StepVerifier.create(client.search(request("visits")))
            .assertNext(response -> assertEquals(7, response.total()))
            .verifyComplete();
    }

    @Test
    void indexOutsideAllowListIsDeniedBeforeAnyRequest() {
        var client = clientReturning(200, "{}");

        StepVerifier.create(client.search(request("visits", "billing")))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(IndexAccessDeniedException.class, e);
                assertEquals("Access denied to index: billing", e.getMessage());
            })
            .verify();

        assertNull(lastPath.get());
    }

    @Test
    void forbiddenStatusIsAccessDenied() {
        var client = clientReturning(403, "{\"error\":\"forbidden\"}");

        StepVerifier.create(client.search(request("visits")))
            .expectError(IndexAccessDeniedException.class)
            .verify();
    }

    @Test
    void serverErrorIsSearchExecutionError() {
        var client = clientReturning(500, "{\"error\":\"boom\"}");

        StepVerifier.create(client.search(request("visits")))
            .expectErrorSatisfies(e -> {
                var error = assertInstanceOf(SearchExecutionException.class, e);
                assertEquals(500, error.getStatusCode());
            })
            .verify();
    }

    @Test
    void transportFailureIsWrapped() {
        HttpClientAdapter adapter = (method, path, body, headers) -> Mono.error(new IllegalStateException("reset"));
        var client = new RestSearchExecutionClient(new AbstractRestClient(CONTEXT, adapter) {}, IndexAllowList.of("*"));

        StepVerifier.create(client.search(request("visits")))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(SearchExecutionException.class, e);
                assertInstanceOf(IllegalStateException.class, e.getCause());
            })
            .verify();
    }

    @Test
    void noIndicesYieldsAnEmptyResponseWithoutRequest() {
        var client = clientReturning(200, "{}");

        StepVerifier.create(client.search(request()))
            .assertNext(response -> {
                assertEquals(0, response.total());
                assertTrue(response.hits().isEmpty());
            })
            .verifyComplete();

        assertNull(lastPath.get());
    }

    @Test
    void stalledClusterFailsAfterTheRequestTimeout() {
        var context = ConnectionContext.builder().host("http://localhost:9200").requestTimeout(Duration.ofSeconds(5)).build();
        HttpClientAdapter stalled = (method, path, body, headers) -> Mono.never();
        var client = new RestSearchExecutionClient(new AbstractRestClient(context, stalled) {}, IndexAllowList.of("*"));

        StepVerifier.withVirtualTime(() -> client.search(request("visits")))
            .expectSubscription()
            .thenAwait(Duration.ofSeconds(5))
            .expectErrorSatisfies(e -> {
                var error = assertInstanceOf(SearchExecutionException.class, e);
                assertInstanceOf(TimeoutException.class, error.getCause());
                assertEquals(-1, error.getStatusCode());
                assertTrue(error.getMessage().contains("timed out"));
            })
            .verify();
    }
}
