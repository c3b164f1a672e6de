package org.healthdata.reporting.jql.ir;

import java.util.List;

import lombok.Builder;
import lombok.Singular;

/**
 * Intermediate representation produced by the parser and consumed by the compiler and index resolver.
 * Immutable once built.
 */
@Builder
public record ParsedQuery(
    @Singular List<String> projects,
    @Singular List<FilterCondition> conditions,
    List<OrderBy> orderBy,
    Integer limit
) {
    public ParsedQuery {
        projects = projects == null ? List.of() : List.copyOf(projects);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }

    public static ParsedQuery empty() {
        return new ParsedQuery(List.of(), List.of(), List.of(), null);
    }
}
