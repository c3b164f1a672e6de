package org.healthdata.reporting.search;

import java.util.List;

import org.healthdata.reporting.jql.QueryCompiler;
import org.healthdata.reporting.jql.ir.CompiledQuery;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;

/**
 * One search call: target indices, the query document, paging, and optional sort and source filtering.
 */
@Builder(toBuilder = true)
public record SearchRequest(
    List<String> indices,
    ObjectNode query,
    int from,
    int size,
    ArrayNode sort,
    List<String> sourceFields
) {
    public static final int DEFAULT_SIZE = 50;

    public SearchRequest {
        indices = indices == null ? List.of() : List.copyOf(indices);
        query = query == null ? QueryCompiler.matchAll() : query;
        sourceFields = sourceFields == null ? null : List.copyOf(sourceFields);
        if (from < 0) {
            throw new IllegalArgumentException("from must not be negative: " + from);
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
    }

    /** Runs a translated query; the JQL {@code limit} wins over {@code size} when present. */
    public static SearchRequest forCompiledQuery(CompiledQuery compiled, int from, int size) {
        return SearchRequest.builder()
            .indices(compiled.indexes())
            .query(compiled.document())
            .from(from)
            .size(compiled.resultLimit().orElse(size))
            .sort(compiled.sort())
            .build();
    }

    /** The wire body for {@code _search}: {@code {query, from, size, sort?, _source?}}. */
    public ObjectNode toBody() {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.set("query", query);
        body.put("from", from);
        body.put("size", size);
        if (sort != null) {
            body.set("sort", sort);
        }
        if (sourceFields != null) {
            ArrayNode source = body.putArray("_source");
            sourceFields.forEach(source::add);
        }
        return body;
    }
}
