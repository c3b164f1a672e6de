package org.healthdata.reporting.jql;

import java.util.List;

import org.healthdata.reporting.jql.ir.FilterCondition;
import org.healthdata.reporting.jql.ir.Operator;
import org.healthdata.reporting.jql.ir.OrderBy;
import org.healthdata.reporting.jql.ir.ParsedQuery;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class JqlParserTest {

    private final JqlParser parser = new JqlParser();

    @Test
    void projectClauseSetsProjectsAndIsNotACondition() {
        ParsedQuery parsed = parser.parse("project = foo AND status = open");

        assertEquals(List.of("foo"), parsed.projects());
        assertEquals(List.of(FilterCondition.of("status", Operator.EQUALS, "open")), parsed.conditions());
        assertTrue(parsed.conditions().stream().noneMatch(c -> c.field().equalsIgnoreCase("project")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"PROJECT = foo", "project=foo", "Project = 'foo'", "project = \"foo\""})
    void projectClauseIsCaseInsensitiveAndUnquoted(String jql) {
        ParsedQuery parsed = parser.parse(jql);

        assertEquals(List.of("foo"), parsed.projects());
        assertTrue(parsed.conditions().isEmpty());
    }

    @Test
    void onlyFirstProjectClauseCounts() {
        ParsedQuery parsed = parser.parse("project = first AND project = second");

        assertEquals(List.of("first"), parsed.projects());
        assertTrue(parsed.conditions().isEmpty());
    }

    @Test
    void projectWithOtherOperatorIsAnOrdinaryCondition() {
        ParsedQuery parsed = parser.parse("project != legacy");

        assertTrue(parsed.projects().isEmpty());
        assertEquals(List.of(FilterCondition.of("project", Operator.NOT_EQUALS, "legacy")), parsed.conditions());
    }

    @Test
    void notEqualsIsNotAlsoReadAsEquals() {
        ParsedQuery parsed = parser.parse("status != closed");

        assertEquals(List.of(FilterCondition.of("status", Operator.NOT_EQUALS, "closed")), parsed.conditions());
    }

    @Test
    void parsesEveryComparisonOperator() {
        ParsedQuery parsed = parser.parse(
            "a = 1 AND b != 2 AND c ~ fever AND d !~ cough AND e > 10 AND f < 2024-01-01");

        assertEquals(List.of(
            FilterCondition.of("a", Operator.EQUALS, "1"),
            FilterCondition.of("b", Operator.NOT_EQUALS, "2"),
            FilterCondition.of("c", Operator.CONTAINS, "fever"),
            FilterCondition.of("d", Operator.NOT_CONTAINS, "cough"),
            FilterCondition.of("e", Operator.GREATER_THAN, "10"),
            FilterCondition.of("f", Operator.LESS_THAN, "2024-01-01")
        ), parsed.conditions());
    }

    @Test
    void inListValuesAreTrimmedAndUnquoted() {
        ParsedQuery parsed = parser.parse("region in ( 'north' , \"south\",east )");

        FilterCondition condition = parsed.conditions().get(0);
        assertEquals(Operator.IN, condition.operator());
        assertEquals("region", condition.field());
        assertEquals(List.of("north", "south", "east"), condition.values());
    }

    @Test
    void inKeywordIsCaseInsensitive() {
        ParsedQuery parsed = parser.parse("ward IN (a, b)");

        assertEquals(List.of(FilterCondition.ofValues("ward", Operator.IN, List.of("a", "b"))), parsed.conditions());
    }

    @Test
    void inListElementsKeepInnerSpaces() {
        ParsedQuery parsed = parser.parse("city in (New York, Boston)");

        assertEquals(List.of("New York", "Boston"), parsed.conditions().get(0).values());
    }

    @Test
    void emptyInListIsKeptSoValidationCanReportIt() {
        ParsedQuery parsed = parser.parse("region in ( )");

        assertEquals(1, parsed.conditions().size());
        assertTrue(parsed.conditions().get(0).values().isEmpty());
    }

    @Test
    void parsesNotIn() {
        ParsedQuery parsed = parser.parse("status not in (closed, archived)");

        assertEquals(List.of(FilterCondition.ofValues("status", Operator.NOT_IN, List.of("closed", "archived"))),
            parsed.conditions());
    }

    @Test
    void parsesNullChecks() {
        ParsedQuery parsed = parser.parse("discharged is null AND admitted IS NOT NULL");

        assertEquals(List.of(
            FilterCondition.ofPresence("discharged", Operator.IS_NULL),
            FilterCondition.ofPresence("admitted", Operator.IS_NOT_NULL)
        ), parsed.conditions());
    }

    @Test
    void orderByDefaultsToAscendingAndAcceptsSeveralKeys() {
        ParsedQuery parsed = parser.parse("status = open ORDER BY created desc, name, priority ASC");

        assertEquals(List.of(OrderBy.desc("created"), OrderBy.asc("name"), OrderBy.asc("priority")), parsed.orderBy());
    }

    @Test
    void orderByIsRepeatable() {
        ParsedQuery parsed = parser.parse("order by a desc order by b");

        assertEquals(List.of(OrderBy.desc("a"), OrderBy.asc("b")), parsed.orderBy());
    }

    @Test
    void parsesLimit() {
        ParsedQuery parsed = parser.parse("status = open order by created desc limit 25");

        assertEquals(25, parsed.limit());
        assertEquals(List.of(OrderBy.desc("created")), parsed.orderBy());
    }

    @Test
    void nonNumericOrOversizedLimitIsDropped() {
        assertNull(parser.parse("limit ten").limit());
        assertNull(parser.parse("limit 99999999999").limit());
    }

    @Test
    void fieldNamedLikeKeywordStillComparesWhenFollowedByOperator() {
        ParsedQuery parsed = parser.parse("limit = 5 AND order = 3");

        assertNull(parsed.limit());
        assertEquals(List.of(
            FilterCondition.of("limit", Operator.EQUALS, "5"),
            FilterCondition.of("order", Operator.EQUALS, "3")
        ), parsed.conditions());
    }

    @Test
    void malformedFragmentsAreSilentlyDropped() {
        ParsedQuery parsed = parser.parse("= dangling AND status = open AND broken ! AND ward in");

        assertEquals(List.of(FilterCondition.of("status", Operator.EQUALS, "open")), parsed.conditions());
    }

    @Test
    void blankOrNullInputYieldsEmptyQuery() {
        assertEquals(ParsedQuery.empty(), parser.parse("   "));
        assertEquals(ParsedQuery.empty(), parser.parse(null));
    }

    @Test
    void parsedQueryIsImmutable() {
        ParsedQuery parsed = parser.parse("a = 1");

        assertThrows(UnsupportedOperationException.class,
            () -> parsed.conditions().add(FilterCondition.of("b", Operator.EQUALS, "2")));
    }
}
