package org.healthdata.reporting.jql;

import java.util.Optional;

import org.healthdata.reporting.jql.ir.FilterCondition;
import org.healthdata.reporting.jql.ir.OrderBy;
import org.healthdata.reporting.jql.ir.ParsedQuery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates a {@link ParsedQuery} into a search engine query document and sort clause.
 *
 * Positive clauses go to {@code bool.must}, negated ones to {@code bool.must_not}. Exact matches and sorting
 * target the untokenized {@value #EXACT_MATCH_SUFFIX} sub-field; {@code contains}, ranges and existence checks
 * target the raw field.
 */
@Slf4j
public class QueryCompiler {

    public static final String EXACT_MATCH_SUFFIX = ".keyword";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public ObjectNode compile(ParsedQuery parsedQuery) {
        if (parsedQuery.conditions().isEmpty()) {
            return matchAll();
        }

        ArrayNode must = NODES.arrayNode();
        ArrayNode mustNot = NODES.arrayNode();
        for (FilterCondition condition : parsedQuery.conditions()) {
            ObjectNode clause = toClause(condition);
            if (clause == null) {
                log.debug("Skipping condition on '{}' that compiles to no clause", condition.field());
                continue;
            }
            (condition.operator().isNegated() ? mustNot : must).add(clause);
        }

        if (must.isEmpty() && mustNot.isEmpty()) {
            return matchAll();
        }
        ObjectNode bool = NODES.objectNode();
        if (!must.isEmpty()) {
            bool.set("must", must);
        }
        if (!mustNot.isEmpty()) {
            bool.set("must_not", mustNot);
        }
        ObjectNode document = NODES.objectNode();
        document.set("bool", bool);
        return document;
    }

    /** One descriptor per {@code order by} entry, or empty when the query has none. */
    public Optional<ArrayNode> compileSort(ParsedQuery parsedQuery) {
        if (parsedQuery.orderBy().isEmpty()) {
            return Optional.empty();
        }
        ArrayNode sort = NODES.arrayNode();
        for (OrderBy orderBy : parsedQuery.orderBy()) {
            ObjectNode descriptor = NODES.objectNode();
            descriptor.putObject(exactMatchField(orderBy.field()))
                .put("order", orderBy.direction().getWireName());
            sort.add(descriptor);
        }
        return Optional.of(sort);
    }

    public static ObjectNode matchAll() {
        ObjectNode document = NODES.objectNode();
        document.putObject("match_all");
        return document;
    }

    static String exactMatchField(String field) {
        return field.endsWith(EXACT_MATCH_SUFFIX) ? field : field + EXACT_MATCH_SUFFIX;
    }

    /** Returns null when the condition yields no clause (a value list with no values). */
    private ObjectNode toClause(FilterCondition condition) {
        String field = condition.field();
        switch (condition.operator()) {
            case EQUALS:
            case NOT_EQUALS:
                return leaf("term", exactMatchField(field), NODES.textNode(condition.value()));
            case CONTAINS:
            case NOT_CONTAINS:
                return leaf("match", field, NODES.textNode(condition.value()));
            case IN:
            case NOT_IN:
                if (condition.values().isEmpty()) {
                    return null;
                }
                ArrayNode values = NODES.arrayNode();
                condition.values().forEach(values::add);
                return leaf("terms", exactMatchField(field), values);
            case GREATER_THAN:
                return range(field, "gt", condition.value());
            case LESS_THAN:
                return range(field, "lt", condition.value());
            case IS_NULL:
            case IS_NOT_NULL:
                ObjectNode exists = NODES.objectNode();
                exists.putObject("exists").put("field", field);
                return exists;
            default:
                throw new IllegalStateException("Unhandled operator: " + condition.operator());
        }
    }

    private static ObjectNode leaf(String clauseType, String field, JsonNode value) {
        ObjectNode clause = NODES.objectNode();
        clause.putObject(clauseType).set(field, value);
        return clause;
    }

    private static ObjectNode range(String field, String bound, String value) {
        ObjectNode clause = NODES.objectNode();
        clause.putObject("range").putObject(field).put(bound, value);
        return clause;
    }
}
