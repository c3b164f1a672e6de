package org.healthdata.reporting.search;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** A raw engine hit; {@code source} is the stored document. */
public record SearchHit(
    @JsonProperty("_index") String index,
    @JsonProperty("_id") String id,
    @JsonProperty("_source") ObjectNode source
) {}
