package org.healthdata.reporting.join;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Dotted-path lookup into a JSON document, e.g. {@code patient.id}.
 */
public final class FieldPath {
    private FieldPath() {}

    /** The value at {@code path}, or empty when any segment is absent or the value is JSON null. */
    public static Optional<JsonNode> resolve(JsonNode document, String path) {
        if (document == null || path == null) {
            return Optional.empty();
        }
        JsonNode current = document;
        for (String segment : path.split("\\.", -1)) {
            if (!current.isObject() || !current.has(segment)) {
                return Optional.empty();
            }
            current = current.get(segment);
        }
        return current.isNull() ? Optional.empty() : Optional.of(current);
    }

    /**
     * String form used to group records: text as-is, everything else in its JSON rendering. Finite floating-point
     * numbers drop trailing zeros, so {@code 42.0} and {@code 42} share a key.
     */
    public static String keyOf(JsonNode value) {
        if (value.isFloatingPointNumber() && Double.isFinite(value.doubleValue())) {
            return value.decimalValue().stripTrailingZeros().toPlainString();
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
