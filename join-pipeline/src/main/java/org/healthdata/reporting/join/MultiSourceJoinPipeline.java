package org.healthdata.reporting.join;

import java.util.List;
import java.util.UUID;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.join.ir.JoinKeyDistribution;
import org.healthdata.reporting.join.ir.JoinResult;
import org.healthdata.reporting.join.ir.JoinSource;
import org.healthdata.reporting.join.ir.JoinSpec;
import org.healthdata.reporting.join.ir.JoinSummary;
import org.healthdata.reporting.join.source.SourceFetcher;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Runs one join request: validate, fetch left, fetch right, join, summarize, paginate.
 *
 * The spec is validated before anything is fetched. The two fetches run one after the other and any fetch
 * failure fails the whole request; nothing is retried and no partial result is produced. The full join is
 * materialized before the page is cut.
 */
@Slf4j
public class MultiSourceJoinPipeline {
    public static final int DEFAULT_SOURCE_LIMIT = 1000;

    private final SourceFetcher fetcher;
    private final HashJoinEngine engine;
    private final int defaultSourceLimit;

    public MultiSourceJoinPipeline(SourceFetcher fetcher) {
        this(fetcher, new HashJoinEngine(), DEFAULT_SOURCE_LIMIT);
    }

    public MultiSourceJoinPipeline(SourceFetcher fetcher, HashJoinEngine engine, int defaultSourceLimit) {
        this.fetcher = fetcher;
        this.engine = engine;
        this.defaultSourceLimit = defaultSourceLimit;
    }

    public Mono<JoinResult> execute(JoinSpec spec, int from, int size) {
        return Mono.defer(() -> {
            String operationId = newOperationId();
            long startNanos = System.nanoTime();
            spec.validate();
            if (from < 0) {
                throw new JoinConfigurationException(ErrorCode.INVALID_FROM, "from must not be negative: " + from);
            }
            if (size < 1) {
                throw new JoinConfigurationException(ErrorCode.INVALID_SIZE, "size must be at least 1: " + size);
            }
            int limit = spec.limit() != null ? spec.limit() : defaultSourceLimit;
            log.info("[JOIN-{}] Executing {} join of {}.{} with {}.{} (limit {}, from {}, size {})", operationId,
                spec.joinType().getWireName(), spec.left().describe(), spec.leftField(),
                spec.right().describe(), spec.rightField(), limit, from, size);

            return timedFetch(operationId, "Left", spec.left(), limit)
                .flatMap(left -> timedFetch(operationId, "Right", spec.right(), limit)
                    .map(right -> joinAndPage(operationId, spec, left, right, from, size, startNanos)))
                .doOnError(e -> log.error("[JOIN-{}] Join failed after {}ms: {}",
                    operationId, elapsedMillis(startNanos), e.getMessage()));
        });
    }

    private Mono<List<ObjectNode>> timedFetch(String operationId, String side, JoinSource source, int limit) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return fetcher.fetch(source, limit)
                .doOnNext(records -> log.info("[JOIN-{}] {} source {} returned {} record(s) in {}ms",
                    operationId, side, source.describe(), records.size(), elapsedMillis(start)));
        });
    }

    private JoinResult joinAndPage(String operationId, JoinSpec spec, List<ObjectNode> left,
                                   List<ObjectNode> right, int from, int size, long startNanos) {
        long joinStart = System.nanoTime();
        var consolidator = new RecordConsolidator(spec.left().label(), spec.right().label(),
            spec.leftField(), spec.rightField());
        HashJoinEngine.Output output = engine.join(left, right, spec.joinType(), consolidator);
        var records = output.records();

        var summary = JoinSummary.of(left.size(), right.size(), records,
            output.leftExcludedNullKey(), output.rightExcludedNullKey());
        log.info("[JOIN-{}] Join computed in {}ms: {}", operationId, elapsedMillis(joinStart), summary);

        var aggregations = new JoinResult.Aggregations(
            JoinKeyDistribution.of(records), JoinResult.IndexDistribution.of(summary));
        var page = Pagination.page(records, from, size);
        long took = elapsedMillis(startNanos);
        log.info("[JOIN-{}] Completed in {}ms, returning {} of {} record(s)",
            operationId, took, page.size(), records.size());
        return new JoinResult(took, records.size(), summary, page, aggregations);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static String newOperationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
