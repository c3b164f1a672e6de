package org.healthdata.reporting.join.ir;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one join request: the requested page plus statistics computed over the full result.
 */
public record JoinResult(
    @JsonProperty("took") long took,
    @JsonProperty("totalResults") int totalResults,
    @JsonProperty("joinSummary") JoinSummary joinSummary,
    @JsonProperty("results") List<JoinedRecord> results,
    @JsonProperty("aggregations") Aggregations aggregations
) {
    public JoinResult {
        results = List.copyOf(results);
    }

    public record Aggregations(
        @JsonProperty("joinFieldDistribution") JoinKeyDistribution joinFieldDistribution,
        @JsonProperty("indexDistribution") IndexDistribution indexDistribution
    ) {}

    public record IndexDistribution(
        @JsonProperty("leftIndex") int leftIndex,
        @JsonProperty("rightIndex") int rightIndex,
        @JsonProperty("joined") int joined
    ) {
        public static IndexDistribution of(JoinSummary summary) {
            return new IndexDistribution(summary.leftTotal(), summary.rightTotal(), summary.matched());
        }
    }
}
