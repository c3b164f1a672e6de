package org.healthdata.reporting.service;

import java.util.UUID;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.common.ReportingException;
import org.healthdata.reporting.jql.IndexResolver;
import org.healthdata.reporting.jql.JqlTranslator;
import org.healthdata.reporting.jql.ValidationResult;
import org.healthdata.reporting.jql.ir.CompiledQuery;
import org.healthdata.reporting.join.HashJoinEngine;
import org.healthdata.reporting.join.MultiSourceJoinPipeline;
import org.healthdata.reporting.join.ir.JoinResult;
import org.healthdata.reporting.join.ir.JoinSource;
import org.healthdata.reporting.join.ir.JoinSpec;
import org.healthdata.reporting.join.ir.JoinType;
import org.healthdata.reporting.join.source.SearchClientSourceFetcher;
import org.healthdata.reporting.search.RestSearchExecutionClient;
import org.healthdata.reporting.search.SearchExecutionClient;
import org.healthdata.reporting.search.SearchRequest;
import org.healthdata.reporting.search.SearchResponse;
import org.healthdata.reporting.search.http.ConnectionContext;
import org.healthdata.reporting.search.http.ReactorNettyRestClient;
import org.healthdata.reporting.service.config.ReportingConfig;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Entry point for callers: JQL translation, validation and search, saved queries, joins and join previews.
 *
 * Every operation is scoped to the configured allow-list. Join and search failures are reported through the
 * returned Mono; failures without an error code are reported as {@link ErrorCode#JOIN_EXECUTION_ERROR}
 * or {@link ErrorCode#SEARCH_EXECUTION_ERROR}.
 */
@Slf4j
public class ReportingQueryService {
    @Getter
    private final ReportingConfig config;
    private final JqlTranslator translator;
    private final SearchExecutionClient searchClient;
    private final SavedQueryStore savedQueries;
    private final MultiSourceJoinPipeline pipeline;
    private final JoinRequestParser requestParser;

    public ReportingQueryService(ReportingConfig config, SearchExecutionClient searchClient,
                                 SavedQueryStore savedQueries) {
        this.config = config;
        this.translator = new JqlTranslator(new IndexResolver(config.getProjectIndexMapping()));
        this.searchClient = searchClient;
        this.savedQueries = savedQueries;
        this.pipeline = new MultiSourceJoinPipeline(new SearchClientSourceFetcher(searchClient),
            new HashJoinEngine(config.getMaxPairsPerKey()), config.getDefaultSourceLimit());
        this.requestParser = new JoinRequestParser(savedQueries, config.getDefaultPageSize(), config.getMaxPageSize());
    }

    /** Wires the service to the configured search cluster over HTTP. */
    public static ReportingQueryService create(ReportingConfig config, SavedQueryStore savedQueries) {
        var connection = ConnectionContext.builder()
            .host(config.getSearchHost())
            .username(config.getSearchUsername())
            .password(config.getSearchPassword())
            .insecure(config.isSearchInsecure())
            .caCert(config.getSearchCaCertPath())
            .requestTimeout(config.getSearchRequestTimeout())
            .build();
        log.info("Connecting to {}", connection);
        var restClient = new ReactorNettyRestClient(connection, config.getMaxConnections());
        return new ReportingQueryService(config,
            new RestSearchExecutionClient(restClient, config.getAllowedIndexes()), savedQueries);
    }

    public CompiledQuery translate(String jql) {
        return translator.translate(jql, config.getAllowedPatterns());
    }

    public ValidationResult validate(String jql) {
        return translator.validate(jql, config.getAllowedPatterns());
    }

    /**
     * Translates {@code jql} and runs it. A {@code limit} in the JQL replaces {@code size}; a null size uses the
     * configured default.
     */
    public Mono<SearchResponse> search(String jql, int from, Integer size) {
        return Mono.fromCallable(() -> translate(jql))
            .flatMap(compiled -> searchClient.search(SearchRequest.forCompiledQuery(compiled, from,
                size != null ? size : config.getDefaultSearchSize())))
            .onErrorMap(e -> !(e instanceof ReportingException),
                e -> new ReportingException(ErrorCode.SEARCH_EXECUTION_ERROR, "Failed to execute search", e));
    }

    /**
     * Compiles {@code jql} and stores it; the target index is the first index the query resolves to.
     */
    public SavedQuery saveJqlQuery(String id, String name, String jql) {
        CompiledQuery compiled = translate(jql);
        if (compiled.indexes().isEmpty()) {
            throw new ReportingException(ErrorCode.INVALID_SAVED_QUERY_SOURCE,
                "Saved query '" + name + "' does not resolve to any allowed index");
        }
        var saved = new SavedQuery(id != null ? id : UUID.randomUUID().toString(), name,
            compiled.indexes().get(0), compiled.document(), jql);
        log.info("Saving query '{}' ({}) against {}", saved.name(), saved.id(), saved.targetIndex());
        return savedQueries.save(saved);
    }

    /** Parses and runs a join request body. */
    public Mono<JoinResult> executeJoin(JsonNode requestBody) {
        return Mono.fromCallable(() -> requestParser.parse(requestBody))
            .flatMap(request -> executeJoin(request.spec(), request.from(), request.size()));
    }

    public Mono<JoinResult> executeJoin(JoinSpec spec, int from, int size) {
        return pipeline.execute(spec, from, size)
            .onErrorMap(e -> !(e instanceof ReportingException),
                e -> new ReportingException(ErrorCode.JOIN_EXECUTION_ERROR, "Failed to execute multi-index join", e));
    }

    /**
     * Inner-joins a handful of records from two indices and shows the first few. All four arguments are required.
     */
    public Mono<JoinPreview> previewJoin(String leftIndex, String rightIndex, String leftField, String rightField) {
        if (isBlank(leftIndex) || isBlank(rightIndex) || isBlank(leftField) || isBlank(rightField)) {
            return Mono.error(new ReportingException(ErrorCode.MISSING_PREVIEW_PARAMS,
                "leftIndex, rightIndex, leftField, and rightField are required for join preview"));
        }
        var spec = JoinSpec.builder()
            .left(JoinSource.index(leftIndex))
            .right(JoinSource.index(rightIndex))
            .leftField(leftField)
            .rightField(rightField)
            .joinType(JoinType.INNER)
            .limit(JoinPreview.SOURCE_LIMIT)
            .build();
        return executeJoin(spec, 0, JoinPreview.PAGE_SIZE)
            .map(result -> new JoinPreview(
                result.results().subList(0, Math.min(JoinPreview.SHOWN_RECORDS, result.results().size())),
                result.joinSummary(),
                result.totalResults(),
                result.aggregations().joinFieldDistribution().distribution()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** Maps a failed join to the error envelope. */
    public static ErrorResponse joinError(Throwable failure) {
        return ErrorResponse.from(failure, ErrorCode.JOIN_EXECUTION_ERROR, "Failed to execute multi-index join");
    }
}
