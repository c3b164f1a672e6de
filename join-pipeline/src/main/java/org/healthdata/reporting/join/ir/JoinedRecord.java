package org.healthdata.reporting.join.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One emitted row. {@code leftRecord}/{@code rightRecord} are absent for the side with no counterpart.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JoinedRecord(
    @JsonProperty("joinKey") String joinKey,
    @JsonProperty("leftRecord") ObjectNode leftRecord,
    @JsonProperty("rightRecord") ObjectNode rightRecord,
    @JsonProperty("consolidatedRecord") ObjectNode consolidatedRecord,
    @JsonProperty("matchKind") MatchKind matchKind
) {}
