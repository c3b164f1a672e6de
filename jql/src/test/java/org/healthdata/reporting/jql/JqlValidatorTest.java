package org.healthdata.reporting.jql;

import java.util.List;
import java.util.Map;

import org.healthdata.reporting.jql.ir.FilterCondition;
import org.healthdata.reporting.jql.ir.Operator;
import org.healthdata.reporting.jql.ir.ParsedQuery;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class JqlValidatorTest {

    private static final List<String> ALLOWED = List.of("visits", "labs-*");

    private final JqlValidator validator =
        new JqlValidator(new JqlParser(), new IndexResolver(Map.of("lab", "labs-2024")));

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "   "})
    void emptyInputIsAnImmediateError(String jql) {
        ValidationResult result = validator.validate(jql, ALLOWED);

        assertFalse(result.isValid());
        assertEquals(List.of(new ValidationResult.FieldError("jql", JqlValidator.EMPTY_QUERY)), result.errors());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void wellFormedQueryIsValid() {
        ValidationResult result = validator.validate("project = lab AND status = final", ALLOWED);

        assertTrue(result.isValid());
        assertTrue(result.errors().isEmpty());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void emptyInListIsAnError() {
        ValidationResult result = validator.validate("ward in ( )", ALLOWED);

        assertFalse(result.isValid());
        assertEquals("IN operator requires at least one value", result.errors().get(0).message());
    }

    @Test
    void emptyNotInListIsAnError() {
        ValidationResult result = validator.validate("ward not in ()", ALLOWED);

        assertFalse(result.isValid());
        assertEquals("NOT IN operator requires at least one value", result.errors().get(0).message());
    }

    @Test
    void unresolvableProjectIsAWarningNotAnError() {
        ValidationResult result = validator.validate("project = billing AND status = open", ALLOWED);

        assertTrue(result.isValid());
        assertEquals(List.of(JqlValidator.NO_INDEXES), result.warnings());
    }

    @Test
    void missingFieldNameIsAnError() {
        ParsedQuery parsed = ParsedQuery.builder()
            .condition(FilterCondition.of("", Operator.EQUALS, "x"))
            .condition(FilterCondition.of("status", Operator.EQUALS, "open"))
            .build();

        ValidationResult result = validator.validate(parsed, ALLOWED);

        assertFalse(result.isValid());
        assertEquals(List.of(new ValidationResult.FieldError("condition", JqlValidator.FIELD_REQUIRED)),
            result.errors());
    }

    @Test
    void emptyAllowListWarnsEvenWithoutProjects() {
        ValidationResult result = validator.validate("status = open", List.of());

        assertTrue(result.isValid());
        assertEquals(List.of(JqlValidator.NO_INDEXES), result.warnings());
    }
}
