package org.healthdata.reporting.service;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.join.JoinConfigurationException;
import org.healthdata.reporting.join.ir.JoinSource;
import org.healthdata.reporting.join.ir.JoinSpec;
import org.healthdata.reporting.join.ir.JoinType;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;

/**
 * Reads a join request body into a {@link JoinSpec} plus paging.
 *
 * <p>Each join accepts two shapes. The current one names its sides with {@code leftSource}/{@code rightSource}
 * objects and its fields with {@code leftField}/{@code rightField}; the legacy one uses
 * {@code leftIndex}/{@code rightIndex} and {@code joinField: {left, right}}. A saved-query side given only by id
 * is completed from the {@link SavedQueryStore}.
 */
@RequiredArgsConstructor
public class JoinRequestParser {
    public record ParsedJoinRequest(JoinSpec spec, int from, int size) {}

    private final SavedQueryStore savedQueries;
    private final int defaultPageSize;
    private final int maxPageSize;

    public ParsedJoinRequest parse(JsonNode body) {
        JsonNode joins = body == null ? null : body.get("joins");
        if (joins == null || !joins.isArray() || joins.isEmpty()) {
            throw fail(ErrorCode.MISSING_JOINS, "At least one join configuration is required");
        }
        if (joins.size() > 1) {
            throw fail(ErrorCode.UNSUPPORTED_MULTI_JOIN, "Currently only single join operations are supported");
        }

        JsonNode join = joins.get(0);
        JoinSpec spec = join.has("leftSource") || join.has("rightSource") ? parseCurrent(join) : parseLegacy(join);
        spec.validate();

        var invalidFrom = fail(ErrorCode.INVALID_FROM, "Invalid from parameter. Must be a non-negative number.");
        int from = intParam(body.get("from"), 0, invalidFrom);
        if (from < 0) {
            throw invalidFrom;
        }
        var invalidSize = fail(ErrorCode.INVALID_SIZE,
            "Invalid size parameter. Must be between 1 and " + maxPageSize + ".");
        int size = intParam(body.get("size"), defaultPageSize, invalidSize);
        if (size < 1 || size > maxPageSize) {
            throw invalidSize;
        }
        return new ParsedJoinRequest(spec, from, size);
    }

    private JoinSpec parseCurrent(JsonNode join) {
        return JoinSpec.builder()
            .left(parseSource(join.get("leftSource"), ErrorCode.INVALID_LEFT_SOURCE, "leftSource"))
            .right(parseSource(join.get("rightSource"), ErrorCode.INVALID_RIGHT_SOURCE, "rightSource"))
            .leftField(text(join.get("leftField")))
            .rightField(text(join.get("rightField")))
            .joinType(joinType(join))
            .limit(limit(join))
            .build();
    }

    private JoinSpec parseLegacy(JsonNode join) {
        String leftIndex = text(join.get("leftIndex"));
        if (leftIndex == null) {
            throw fail(ErrorCode.INVALID_LEFT_SOURCE, "Join 0: leftIndex is required and must be a string");
        }
        String rightIndex = text(join.get("rightIndex"));
        if (rightIndex == null) {
            throw fail(ErrorCode.INVALID_RIGHT_SOURCE, "Join 0: rightIndex is required and must be a string");
        }
        JsonNode joinField = join.path("joinField");
        String left = text(joinField.get("left"));
        String right = text(joinField.get("right"));
        if (left == null || right == null) {
            throw fail(ErrorCode.INVALID_JOIN_FIELD, "Join 0: joinField with left and right properties is required");
        }
        return JoinSpec.builder()
            .left(JoinSource.index(leftIndex))
            .right(JoinSource.index(rightIndex))
            .leftField(left)
            .rightField(right)
            .joinType(joinType(join))
            .limit(limit(join))
            .build();
    }

    private JoinSource parseSource(JsonNode node, ErrorCode invalidCode, String name) {
        if (node == null || !node.isObject()) {
            throw fail(invalidCode, "Join 0: " + name + " is required and must be an object");
        }
        String type = text(node.get("type"));
        String id = text(node.get("id"));
        if ("index".equals(type)) {
            if (id == null) {
                throw fail(invalidCode, "Join 0: " + name + " of type index needs an id");
            }
            return JoinSource.index(id);
        }
        if (!"savedQuery".equals(type)) {
            throw fail(invalidCode, "Join 0: " + name + ".type must be one of: index, savedQuery");
        }

        JsonNode query = node.get("query");
        String targetIndex = text(node.get("targetIndex"));
        if ((query == null || !query.isObject()) && targetIndex == null && id != null) {
            return savedQueries.findById(id)
                .map(SavedQuery::toJoinSource)
                .orElseThrow(() -> fail(ErrorCode.SAVED_QUERY_NOT_FOUND, "Saved query not found: " + id));
        }
        return JoinSource.savedQuery(id, text(node.get("name")), targetIndex,
            query != null && query.isObject() ? (ObjectNode) query : null);
    }

    private static JoinType joinType(JsonNode join) {
        return JoinType.fromString(text(join.get("joinType")));
    }

    private static Integer limit(JsonNode join) {
        JsonNode limit = join.get("limit");
        if (limit == null || limit.isNull()) {
            return null;
        }
        if (!limit.canConvertToInt() || !limit.isIntegralNumber()) {
            throw fail(ErrorCode.INVALID_SIZE, "Join 0: limit must be a positive integer");
        }
        return limit.intValue();
    }

    // Numbers and numeric strings are both accepted, as query-string parameters arrive as text.
    private static int intParam(JsonNode value, int fallback, JoinConfigurationException invalid) {
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isTextual() && value.asText().trim().matches("-?\\d{1,9}")) {
            return Integer.parseInt(value.asText().trim());
        }
        throw invalid;
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }

    private static JoinConfigurationException fail(ErrorCode code, String message) {
        return new JoinConfigurationException(code, message);
    }
}
