package org.healthdata.reporting.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.healthdata.reporting.common.IndexAllowList;

import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * A {@link SearchExecutionClient} over documents held in memory, for exercising callers without a cluster.
 *
 * It does not evaluate query documents: every search returns the documents of the requested indices in
 * insertion order, sliced by {@code from}/{@code size}. Every request is recorded for later assertions.
 * Indices registered with {@link #failIndex} fail their searches with {@link SearchExecutionException}.
 */
public class InMemorySearchClient implements SearchExecutionClient {

    private final IndexAllowList allowList;
    private final Map<String, List<ObjectNode>> documentsByIndex = new LinkedHashMap<>();
    private final Map<String, String> failingIndices = new LinkedHashMap<>();
    private final List<SearchRequest> requests = new CopyOnWriteArrayList<>();

    public InMemorySearchClient() {
        this(IndexAllowList.of("*"));
    }

    public InMemorySearchClient(IndexAllowList allowList) {
        this.allowList = allowList;
    }

    public synchronized InMemorySearchClient addDocuments(String index, List<ObjectNode> documents) {
        documentsByIndex.computeIfAbsent(index, i -> new ArrayList<>()).addAll(documents);
        return this;
    }

    public synchronized InMemorySearchClient failIndex(String index, String message) {
        failingIndices.put(index, message);
        return this;
    }

    @Override
    public Mono<SearchResponse> search(SearchRequest request) {
        return Mono.fromCallable(() -> {
            requests.add(request);
            allowList.checkAccess(request.indices());
            return respond(request);
        });
    }

    private synchronized SearchResponse respond(SearchRequest request) {
        List<SearchHit> all = new ArrayList<>();
        for (String index : request.indices()) {
            if (failingIndices.containsKey(index)) {
                throw new SearchExecutionException(failingIndices.get(index), 500);
            }
            List<ObjectNode> documents = documentsByIndex.getOrDefault(index, List.of());
            for (int i = 0; i < documents.size(); i++) {
                all.add(new SearchHit(index, index + "-" + i, documents.get(i).deepCopy()));
            }
        }
        int start = Math.min(request.from(), all.size());
        int end = Math.min(start + request.size(), all.size());
        return new SearchResponse(all.size(), all.subList(start, end), null);
    }

    public List<SearchRequest> getRequests() {
        return Collections.unmodifiableList(requests);
    }
}
