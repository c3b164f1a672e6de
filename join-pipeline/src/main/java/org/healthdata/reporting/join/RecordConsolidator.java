package org.healthdata.reporting.join;

import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;

/**
 * Flattens a left/right pair into one record. Each side's top-level fields are copied under that side's
 * prefix and the raw join value is stored under {@value #JOIN_KEY_FIELD}.
 *
 * The prefix is the side's label followed by {@code _}. When one prefix starts with the other (equal labels,
 * or labels such as {@code visits} and {@code visits_archive}) they become {@code left_<label>_} and
 * {@code right_<label>_}, so no key can belong to both sides.
 */
@Getter
public class RecordConsolidator {
    public static final String JOIN_KEY_FIELD = "_joinKey";

    private final String leftPrefix;
    private final String rightPrefix;
    private final String leftField;
    private final String rightField;

    public RecordConsolidator(String leftLabel, String rightLabel, String leftField, String rightField) {
        String left = leftLabel + "_";
        String right = rightLabel + "_";
        if (left.startsWith(right) || right.startsWith(left)) {
            this.leftPrefix = "left_" + left;
            this.rightPrefix = "right_" + right;
        } else {
            this.leftPrefix = left;
            this.rightPrefix = right;
        }
        this.leftField = leftField;
        this.rightField = rightField;
    }

    /** Either side may be null, but not both. */
    public ObjectNode consolidate(ObjectNode left, ObjectNode right) {
        ObjectNode consolidated = JsonNodeFactory.instance.objectNode();
        copyWithPrefix(left, leftPrefix, consolidated);
        copyWithPrefix(right, rightPrefix, consolidated);
        JsonNode joinValue = FieldPath.resolve(left, leftField)
            .or(() -> FieldPath.resolve(right, rightField))
            .orElse(JsonNodeFactory.instance.nullNode());
        consolidated.set(JOIN_KEY_FIELD, joinValue.deepCopy());
        return consolidated;
    }

    /** Recovers the left record's fields from a consolidated record. */
    public ObjectNode readLeft(ObjectNode consolidated) {
        return readBack(consolidated, leftPrefix);
    }

    /** Recovers the right record's fields from a consolidated record. */
    public ObjectNode readRight(ObjectNode consolidated) {
        return readBack(consolidated, rightPrefix);
    }

    private static void copyWithPrefix(ObjectNode source, String prefix, ObjectNode target) {
        if (source == null) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            target.set(prefix + field.getKey(), field.getValue().deepCopy());
        }
    }

    private static ObjectNode readBack(ObjectNode consolidated, String prefix) {
        ObjectNode side = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = consolidated.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (!key.startsWith(prefix)) {
                continue;
            }
            side.set(key.substring(prefix.length()), field.getValue().deepCopy());
        }
        return side;
    }
}
