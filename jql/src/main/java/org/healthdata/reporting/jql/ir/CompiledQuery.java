package org.healthdata.reporting.jql.ir;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Output of the translation path: the engine query document, the resolved indexes and an optional sort.
 * {@code document} is always a {@code bool} clause or {@code match_all}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompiledQuery(
    @JsonProperty("query") ObjectNode document,
    @JsonProperty("indexes") List<String> indexes,
    @JsonProperty("sort") ArrayNode sort,
    @JsonProperty("limit") Integer limit
) {
    public CompiledQuery {
        indexes = indexes == null ? List.of() : List.copyOf(indexes);
    }

    public Optional<ArrayNode> sortClause() {
        return Optional.ofNullable(sort);
    }

    public Optional<Integer> resultLimit() {
        return Optional.ofNullable(limit);
    }
}
