package org.healthdata.reporting.join.ir;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters for one join. {@code matched + leftOnly + rightOnly} equals the number of emitted records; the
 * excluded-null-key counters are outside that total.
 */
public record JoinSummary(
    @JsonProperty("leftIndexTotal") int leftTotal,
    @JsonProperty("rightIndexTotal") int rightTotal,
    @JsonProperty("joinedRecords") int matched,
    @JsonProperty("leftOnlyRecords") int leftOnly,
    @JsonProperty("rightOnlyRecords") int rightOnly,
    @JsonProperty("leftExcludedNullKey") int leftExcludedNullKey,
    @JsonProperty("rightExcludedNullKey") int rightExcludedNullKey
) {
    public static JoinSummary of(int leftTotal, int rightTotal, List<JoinedRecord> records,
                                 int leftExcludedNullKey, int rightExcludedNullKey) {
        int matched = 0;
        int leftOnly = 0;
        int rightOnly = 0;
        for (JoinedRecord record : records) {
            switch (record.matchKind()) {
                case MATCHED -> matched++;
                case LEFT_ONLY -> leftOnly++;
                case RIGHT_ONLY -> rightOnly++;
            }
        }
        return new JoinSummary(leftTotal, rightTotal, matched, leftOnly, rightOnly,
            leftExcludedNullKey, rightExcludedNullKey);
    }

    public int emitted() {
        return matched + leftOnly + rightOnly;
    }
}
