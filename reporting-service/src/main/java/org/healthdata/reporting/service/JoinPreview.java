package org.healthdata.reporting.service;

import java.util.List;
import java.util.Map;

import org.healthdata.reporting.join.ir.JoinSummary;
import org.healthdata.reporting.join.ir.JoinedRecord;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A small inner join that shows whether two indices line up on the chosen fields.
 */
public record JoinPreview(
    @JsonProperty("preview") List<JoinedRecord> preview,
    @JsonProperty("joinSummary") JoinSummary joinSummary,
    @JsonProperty("possibleMatches") int possibleMatches,
    @JsonProperty("sampleJoinKeys") Map<String, Integer> sampleJoinKeys
) {
    public static final int SOURCE_LIMIT = 10;
    public static final int PAGE_SIZE = 5;
    public static final int SHOWN_RECORDS = 3;

    public JoinPreview {
        preview = List.copyOf(preview);
    }
}
