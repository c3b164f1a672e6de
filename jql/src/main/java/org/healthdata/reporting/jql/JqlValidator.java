package org.healthdata.reporting.jql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.healthdata.reporting.jql.ir.FilterCondition;
import org.healthdata.reporting.jql.ir.ParsedQuery;

import lombok.RequiredArgsConstructor;

/**
 * Runs the parser and index resolver speculatively and reports problems without compiling or executing anything.
 */
@RequiredArgsConstructor
public class JqlValidator {
    static final String EMPTY_QUERY = "JQL query cannot be empty";
    static final String FIELD_REQUIRED = "Field name is required";
    static final String VALUES_REQUIRED = "%s operator requires at least one value";
    static final String NO_INDEXES = "No valid indexes found for the specified projects";

    private final JqlParser parser;
    private final IndexResolver indexResolver;

    public ValidationResult validate(String jql, List<String> allowed) {
        if (jql == null || jql.isBlank()) {
            return new ValidationResult(false, List.of(new ValidationResult.FieldError("jql", EMPTY_QUERY)), List.of());
        }

        return validate(parser.parse(jql), allowed);
    }

    /** Validates a query built programmatically rather than parsed from text. */
    public ValidationResult validate(ParsedQuery parsed, List<String> allowed) {
        List<ValidationResult.FieldError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (indexResolver.resolve(parsed.projects(), allowed).isEmpty()) {
            warnings.add(NO_INDEXES);
        }

        for (FilterCondition condition : parsed.conditions()) {
            if (!condition.hasField()) {
                errors.add(new ValidationResult.FieldError("condition", FIELD_REQUIRED));
            }
            if (condition.operator().isMultiValued() && condition.values().isEmpty()) {
                errors.add(new ValidationResult.FieldError("condition",
                    String.format(VALUES_REQUIRED, condition.operator().getWireName().toUpperCase(Locale.ROOT).replace('_', ' '))));
            }
        }

        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }
}
