package org.healthdata.reporting.join.source;

import java.util.List;

import org.healthdata.reporting.common.ReportingException;
import org.healthdata.reporting.jql.QueryCompiler;
import org.healthdata.reporting.join.SourceFetchException;
import org.healthdata.reporting.join.ir.JoinSource;
import org.healthdata.reporting.search.SearchExecutionClient;
import org.healthdata.reporting.search.SearchRequest;
import org.healthdata.reporting.search.SearchResponse;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * {@link SourceFetcher} backed by a {@link SearchExecutionClient}. Errors that already carry an error code
 * (access denied, engine failures) pass through; anything else becomes a {@link SourceFetchException}.
 */
@Slf4j
@RequiredArgsConstructor
public class SearchClientSourceFetcher implements SourceFetcher {
    private final SearchExecutionClient searchClient;

    @Override
    public Mono<List<ObjectNode>> fetch(JoinSource source, int limit) {
        return Mono.defer(() -> {
            ObjectNode query = source.isSavedQuery() ? source.query() : QueryCompiler.matchAll();
            if (source.isSavedQuery()) {
                log.info("Executing saved query '{}' against {}", source.label(), source.targetIndex());
            }
            var request = SearchRequest.builder()
                .indices(List.of(source.searchIndex()))
                .query(query)
                .size(limit)
                .build();
            return searchClient.search(request);
        })
            .map(SearchResponse::sources)
            .onErrorMap(e -> !(e instanceof ReportingException),
                e -> new SourceFetchException("Failed to fetch " + source.describe(), e));
    }
}
