package org.healthdata.reporting.jql;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a dry-run validation. Warnings never affect {@code isValid}.
 */
public record ValidationResult(
    @JsonProperty("isValid") boolean isValid,
    @JsonProperty("errors") List<FieldError> errors,
    @JsonProperty("warnings") List<String> warnings
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public record FieldError(
        @JsonProperty("field") String field,
        @JsonProperty("message") String message
    ) {}
}
