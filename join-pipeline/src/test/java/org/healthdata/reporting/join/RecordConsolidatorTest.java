package org.healthdata.reporting.join;

import org.junit.jupiter.api.Test;

import static org.healthdata.reporting.join.Records.doc;
import static org.junit.jupiter.api.Assertions.*;

class RecordConsolidatorTest {

    @Test
    void prefixesEachSideWithItsLabel() {
        var consolidator = new RecordConsolidator("visits", "labs", "patient", "patientId");

        var consolidated = consolidator.consolidate(
            doc("{'patient':'p1','ward':'A'}"), doc("{'patientId':'p1','result':4.2}"));

        assertEquals(doc("{'visits_patient':'p1','visits_ward':'A','labs_patientId':'p1','labs_result':4.2,"
            + "'_joinKey':'p1'}"), consolidated);
    }

    @Test
    void readingBackRecoversBothOriginalRecords() {
        var consolidator = new RecordConsolidator("visits", "labs", "patient.id", "patient.id");
        var left = doc("{'patient':{'id':'p1','age':40},'codes':['a','b'],'discharged':null}");
        var right = doc("{'patient':{'id':'p1'},'value':12}");

        var consolidated = consolidator.consolidate(left, right);

        assertEquals(left, consolidator.readLeft(consolidated));
        assertEquals(right, consolidator.readRight(consolidated));
        assertEquals("p1", consolidated.path(RecordConsolidator.JOIN_KEY_FIELD).asText());
    }

    @Test
    void labelThatExtendsTheOtherLabelKeepsBothSides() {
        var consolidator = new RecordConsolidator("visits", "visits_archive", "k", "k");
        var left = doc("{'k':1,'archive_id':'L'}");
        var right = doc("{'k':1,'id':'R'}");

        var consolidated = consolidator.consolidate(left, right);

        assertEquals("L", consolidated.path("left_visits_archive_id").asText());
        assertEquals("R", consolidated.path("right_visits_archive_id").asText());
        assertEquals(5, consolidated.size());
        assertEquals(left, consolidator.readLeft(consolidated));
        assertEquals(right, consolidator.readRight(consolidated));
    }

    @Test
    void rightLabelExtendingTheLeftIsQualifiedToo() {
        var consolidator = new RecordConsolidator("labs_2024", "labs", "k", "k");

        assertEquals("left_labs_2024_", consolidator.getLeftPrefix());
        assertEquals("right_labs_", consolidator.getRightPrefix());
    }

    @Test
    void selfJoinUsesSideQualifiedPrefixes() {
        var consolidator = new RecordConsolidator("visits", "visits", "k", "k");

        var consolidated = consolidator.consolidate(doc("{'k':1,'v':'l'}"), doc("{'k':1,'v':'r'}"));

        assertEquals("l", consolidated.path("left_visits_v").asText());
        assertEquals("r", consolidated.path("right_visits_v").asText());
        assertEquals(5, consolidated.size());
    }

    @Test
    void joinKeyFallsBackToTheRightRecord() {
        var consolidator = new RecordConsolidator("visits", "labs", "k", "ref");

        var consolidated = consolidator.consolidate(null, doc("{'ref':42}"));

        assertEquals(42, consolidated.path("_joinKey").asInt());
        assertEquals(doc("{}"), consolidator.readLeft(consolidated));
    }

    @Test
    void consolidationDoesNotAliasTheSourceRecords() {
        var consolidator = new RecordConsolidator("visits", "labs", "k", "k");
        var left = doc("{'k':1,'nested':{'n':1}}");

        var consolidated = consolidator.consolidate(left, null);
        ((com.fasterxml.jackson.databind.node.ObjectNode) consolidated.get("visits_nested")).put("n", 2);

        assertEquals(1, left.path("nested").path("n").asInt());
    }
}
