package org.healthdata.reporting.service;

import org.healthdata.reporting.join.ir.JoinSource;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A stored, already compiled query. {@code jql} keeps the text it was compiled from, when there was one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SavedQuery(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("targetIndex") String targetIndex,
    @JsonProperty("query") ObjectNode query,
    @JsonProperty("jql") String jql
) {
    public JoinSource toJoinSource() {
        return JoinSource.savedQuery(id, name, targetIndex, query);
    }
}
