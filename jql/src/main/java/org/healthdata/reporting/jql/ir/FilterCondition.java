package org.healthdata.reporting.jql.ir;

import java.util.List;
import java.util.Objects;

/**
 * One field condition. Single-valued operators carry {@code value}; {@code in}/{@code not_in} carry
 * {@code values}. An empty {@code values} list is representable so that validation can report it.
 */
public record FilterCondition(
    String field,
    Operator operator,
    String value,
    List<String> values
) {
    public FilterCondition {
        Objects.requireNonNull(operator, "operator");
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static FilterCondition of(String field, Operator operator, String value) {
        if (operator.isMultiValued()) {
            return new FilterCondition(field, operator, null, value == null ? List.of() : List.of(value));
        }
        return new FilterCondition(field, operator, value, List.of());
    }

    public static FilterCondition ofValues(String field, Operator operator, List<String> values) {
        if (!operator.isMultiValued()) {
            throw new IllegalArgumentException(operator.getWireName() + " does not take a value list");
        }
        return new FilterCondition(field, operator, null, values);
    }

    public static FilterCondition ofPresence(String field, Operator operator) {
        if (operator.takesValue()) {
            throw new IllegalArgumentException(operator.getWireName() + " requires a value");
        }
        return new FilterCondition(field, operator, null, List.of());
    }

    public boolean hasField() {
        return field != null && !field.isBlank();
    }
}
