package org.healthdata.reporting.join;

import java.util.List;
import java.util.stream.Collectors;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.join.ir.JoinSummary;
import org.healthdata.reporting.join.ir.JoinType;
import org.healthdata.reporting.join.ir.JoinedRecord;
import org.healthdata.reporting.join.ir.MatchKind;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.healthdata.reporting.join.Records.doc;
import static org.healthdata.reporting.join.Records.docs;
import static org.junit.jupiter.api.Assertions.*;

class HashJoinEngineTest {

    private static final RecordConsolidator BY_K = new RecordConsolidator("visits", "labs", "k", "k");

    private final HashJoinEngine engine = new HashJoinEngine();

    // left keys 1, 1, 2, 4; right keys 1, 3, 4
    private static final List<ObjectNode> LEFT = docs(
        "{'k':1,'a':'x'}", "{'k':1,'a':'y'}", "{'k':2,'a':'z'}", "{'k':4,'a':'w'}");
    private static final List<ObjectNode> RIGHT = docs(
        "{'k':1,'b':'p'}", "{'k':3,'b':'q'}", "{'k':4,'b':'r'}");

    private static List<MatchKind> kinds(List<JoinedRecord> records) {
        return records.stream().map(JoinedRecord::matchKind).collect(Collectors.toList());
    }

    private static List<String> keys(List<JoinedRecord> records) {
        return records.stream().map(JoinedRecord::joinKey).collect(Collectors.toList());
    }

    @Test
    void innerJoinEmitsTheCrossProductPerKey() {
        var output = engine.join(
            docs("{'k':1,'a':'x'}", "{'k':1,'a':'y'}"), docs("{'k':1,'b':'p'}"), JoinType.INNER, BY_K);

        assertEquals(List.of(MatchKind.MATCHED, MatchKind.MATCHED), kinds(output.records()));
        assertEquals("x", output.records().get(0).leftRecord().path("a").asText());
        assertEquals("y", output.records().get(1).leftRecord().path("a").asText());
        assertEquals("p", output.records().get(1).rightRecord().path("b").asText());
    }

    @Test
    void crossProductMultipliesDuplicatesOnBothSides() {
        var output = engine.join(
            docs("{'k':'a'}", "{'k':'a'}", "{'k':'a'}"), docs("{'k':'a'}", "{'k':'a'}"), JoinType.INNER, BY_K);

        assertEquals(6, output.records().size());
    }

    @Test
    void innerJoinKeepsOnlySharedKeys() {
        var output = engine.join(LEFT, RIGHT, JoinType.INNER, BY_K);

        assertEquals(List.of("1", "1", "4"), keys(output.records()));
        assertTrue(output.records().stream().allMatch(r -> r.matchKind() == MatchKind.MATCHED));
    }

    @Test
    void leftJoinEmitsUnmatchedLeftRecordsExactlyOnce() {
        var output = engine.join(LEFT, RIGHT, JoinType.LEFT, BY_K);

        assertEquals(List.of("1", "1", "2", "4"), keys(output.records()));
        assertEquals(List.of(MatchKind.MATCHED, MatchKind.MATCHED, MatchKind.LEFT_ONLY, MatchKind.MATCHED),
            kinds(output.records()));
        JoinedRecord leftOnly = output.records().get(2);
        assertNull(leftOnly.rightRecord());
        assertEquals("z", leftOnly.leftRecord().path("a").asText());
    }

    @Test
    void rightJoinMirrorsLeftJoin() {
        var output = engine.join(LEFT, RIGHT, JoinType.RIGHT, BY_K);

        assertEquals(List.of("1", "1", "3", "4"), keys(output.records()));
        assertEquals(MatchKind.RIGHT_ONLY, output.records().get(2).matchKind());
        assertNull(output.records().get(2).leftRecord());
    }

    @Test
    void fullJoinCoversBothSidesLeftKeysFirst() {
        var output = engine.join(LEFT, RIGHT, JoinType.FULL, BY_K);

        assertEquals(List.of("1", "1", "2", "4", "3"), keys(output.records()));
        assertEquals(List.of(MatchKind.MATCHED, MatchKind.MATCHED, MatchKind.LEFT_ONLY, MatchKind.MATCHED,
            MatchKind.RIGHT_ONLY), kinds(output.records()));
    }

    @ParameterizedTest
    @EnumSource(JoinType.class)
    void summaryCountsAddUpToEmittedRecords(JoinType joinType) {
        var output = engine.join(LEFT, RIGHT, joinType, BY_K);

        var summary = JoinSummary.of(LEFT.size(), RIGHT.size(), output.records(), 0, 0);

        assertEquals(output.records().size(), summary.matched() + summary.leftOnly() + summary.rightOnly());
        assertEquals(output.records().size(), summary.emitted());
    }

    @Test
    void nullAndMissingKeysAreExcludedButCounted() {
        var output = engine.join(
            docs("{'k':1}", "{'k':null}", "{'other':2}"),
            docs("{'k':1}", "{}"),
            JoinType.FULL, BY_K);

        assertEquals(1, output.records().size());
        assertEquals(2, output.leftExcludedNullKey());
        assertEquals(1, output.rightExcludedNullKey());
    }

    @Test
    void joinsOnNestedDottedPaths() {
        var consolidator = new RecordConsolidator("visits", "labs", "patient.id", "subject.patient.id");

        var output = engine.join(
            docs("{'patient':{'id':'p1'}}", "{'patient':{'id':'p2'}}"),
            docs("{'subject':{'patient':{'id':'p2'}}}"),
            JoinType.INNER, consolidator);

        assertEquals(List.of("p2"), keys(output.records()));
    }

    @Test
    void numericAndTextualKeysWithTheSameTextMatch() {
        var output = engine.join(docs("{'k':7}"), docs("{'k':'7'}"), JoinType.INNER, BY_K);

        assertEquals(1, output.records().size());
    }

    @Test
    void pairCapFailsInsteadOfTruncating() {
        var capped = new HashJoinEngine(5);

        var error = assertThrows(JoinLimitExceededException.class, () -> capped.join(
            docs("{'k':'a'}", "{'k':'a'}", "{'k':'a'}"), docs("{'k':'a'}", "{'k':'a'}"), JoinType.INNER, BY_K));

        assertEquals(ErrorCode.JOIN_PAIR_LIMIT_EXCEEDED, error.getCode());
        assertEquals("a", error.getJoinKey());
        assertEquals(6, error.getPairCount());
    }

    @Test
    void pairCapAllowsProductsUpToTheLimit() {
        var capped = new HashJoinEngine(6);

        var output = capped.join(
            docs("{'k':'a'}", "{'k':'a'}", "{'k':'a'}"), docs("{'k':'a'}", "{'k':'a'}"), JoinType.INNER, BY_K);

        assertEquals(6, output.records().size());
    }

    @Test
    void consolidatedRecordCarriesBothSides() {
        var output = engine.join(docs("{'k':1,'a':'x'}"), docs("{'k':1,'b':'p'}"), JoinType.INNER, BY_K);

        assertEquals(doc("{'visits_k':1,'visits_a':'x','labs_k':1,'labs_b':'p','_joinKey':1}"),
            output.records().get(0).consolidatedRecord());
    }

    @Test
    void emptyInputsProduceNothing() {
        var output = engine.join(List.of(), List.of(), JoinType.FULL, BY_K);

        assertTrue(output.records().isEmpty());
        assertEquals(0, output.leftExcludedNullKey());
    }
}
