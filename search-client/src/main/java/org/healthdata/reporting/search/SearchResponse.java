package org.healthdata.reporting.search;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The parts of an engine search response the reporting core consumes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResponse(
    @JsonProperty("total") long total,
    @JsonProperty("hits") List<SearchHit> hits,
    @JsonProperty("aggregations") ObjectNode aggregations
) {
    public SearchResponse {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public static SearchResponse empty() {
        return new SearchResponse(0, List.of(), null);
    }

    /** Stored documents of every hit, in hit order. */
    public List<ObjectNode> sources() {
        List<ObjectNode> sources = new ArrayList<>(hits.size());
        for (SearchHit hit : hits) {
            sources.add(hit.source());
        }
        return sources;
    }

    /**
     * Reads an engine response body. {@code hits.total} is accepted both as a bare number and as
     * {@code {value, relation}}; a hit without {@code _source} gets an empty document.
     */
    public static SearchResponse fromJson(JsonNode root) {
        JsonNode hitsNode = root.path("hits");
        JsonNode totalNode = hitsNode.path("total");
        long total = totalNode.isObject() ? totalNode.path("value").asLong() : totalNode.asLong();

        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode hit : hitsNode.path("hits")) {
            JsonNode source = hit.path("_source");
            hits.add(new SearchHit(
                hit.path("_index").asText(null),
                hit.path("_id").asText(null),
                source.isObject() ? (ObjectNode) source : JsonNodeFactory.instance.objectNode()
            ));
        }

        JsonNode aggregations = root.get("aggregations");
        return new SearchResponse(total, hits,
            aggregations != null && aggregations.isObject() ? (ObjectNode) aggregations : null);
    }
}
