package org.healthdata.reporting.join.ir;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.join.JoinConfigurationException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One side of a join: either a whole index, or a saved query that carries its own compiled query and
 * target index.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JoinSource(
    @JsonProperty("type") Type type,
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("targetIndex") String targetIndex,
    @JsonProperty("query") ObjectNode query
) {
    public enum Type {
        INDEX("index"),
        SAVED_QUERY("savedQuery");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }
    }

    public static JoinSource index(String indexName) {
        return new JoinSource(Type.INDEX, indexName, indexName, null, null);
    }

    public static JoinSource savedQuery(String id, String name, String targetIndex, ObjectNode query) {
        return new JoinSource(Type.SAVED_QUERY, id, name, targetIndex, query);
    }

    public boolean isSavedQuery() {
        return type == Type.SAVED_QUERY;
    }

    /** The index actually searched for this side. */
    public String searchIndex() {
        return isSavedQuery() ? targetIndex : id;
    }

    /** Human-facing name of the side, used for consolidated field prefixes and logs. */
    public String label() {
        if (isSavedQuery()) {
            return name != null && !name.isBlank() ? name : id;
        }
        return id;
    }

    /** Log form: the index name, or {@code savedQuery:<name>}. */
    public String describe() {
        return isSavedQuery() ? "savedQuery:" + label() : id;
    }

    /**
     * @param missingSourceCode code reported when this side is absent or names nothing
     */
    public static void validate(JoinSource source, ErrorCode missingSourceCode, String side) {
        if (source == null || source.type() == null) {
            throw new JoinConfigurationException(missingSourceCode, side + " source is required");
        }
        if (source.isSavedQuery()) {
            if (source.query() == null || isBlank(source.targetIndex())) {
                throw new JoinConfigurationException(ErrorCode.INVALID_SAVED_QUERY_SOURCE,
                    "Invalid saved query source: missing query or targetIndex for " + source.label());
            }
            if (isBlank(source.label())) {
                throw new JoinConfigurationException(missingSourceCode, side + " saved query needs an id or name");
            }
        } else if (isBlank(source.id())) {
            throw new JoinConfigurationException(missingSourceCode, side + " source index is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
