package org.healthdata.reporting.jql.ir;

/**
 * Condition operators understood by the compiler. The parser emits a subset of these; the rest are
 * reachable by building a {@link ParsedQuery} directly.
 */
public enum Operator {
    EQUALS("equals", false, false),
    NOT_EQUALS("not_equals", true, false),
    CONTAINS("contains", false, false),
    NOT_CONTAINS("not_contains", true, false),
    IN("in", false, true),
    NOT_IN("not_in", true, true),
    GREATER_THAN("greater_than", false, false),
    LESS_THAN("less_than", false, false),
    IS_NULL("is_null", true, false),
    IS_NOT_NULL("is_not_null", false, false);

    private final String wireName;
    private final boolean negated;
    private final boolean multiValued;

    Operator(String wireName, boolean negated, boolean multiValued) {
        this.wireName = wireName;
        this.negated = negated;
        this.multiValued = multiValued;
    }

    public String getWireName() {
        return wireName;
    }

    /** True when the compiled clause belongs in the {@code must_not} branch. */
    public boolean isNegated() {
        return negated;
    }

    public boolean isMultiValued() {
        return multiValued;
    }

    public boolean takesValue() {
        return this != IS_NULL && this != IS_NOT_NULL;
    }
}
