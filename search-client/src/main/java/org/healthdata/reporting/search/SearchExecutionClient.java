package org.healthdata.reporting.search;

import reactor.core.publisher.Mono;

/**
 * Runs a query document against the search engine and returns the raw hits.
 *
 * Implementations reject indices outside their allow-list with
 * {@link org.healthdata.reporting.common.IndexAccessDeniedException} before doing any I/O, and report
 * engine failures as {@link SearchExecutionException}. Errors are signalled through the returned Mono.
 */
public interface SearchExecutionClient {
    Mono<SearchResponse> search(SearchRequest request);
}
