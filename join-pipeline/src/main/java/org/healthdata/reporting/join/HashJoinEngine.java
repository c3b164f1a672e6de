package org.healthdata.reporting.join;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.healthdata.reporting.join.ir.JoinType;
import org.healthdata.reporting.join.ir.JoinedRecord;
import org.healthdata.reporting.join.ir.MatchKind;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory hash join of two fetched record sets.
 *
 * <p>Records are grouped by the string form of their join value. Records whose join path is absent or null
 * never enter a lookup: they are neither matched nor emitted as unmatched, only counted. A key present on
 * both sides emits the full cross product of its left and right records, in left-major order. Keys are
 * visited in first-appearance order, left lookup first.
 */
@Slf4j
public class HashJoinEngine {

    /** Emitted records plus the per-side count of records dropped for a missing join key. */
    public record Output(List<JoinedRecord> records, int leftExcludedNullKey, int rightExcludedNullKey) {}

    private final int maxPairsPerKey;

    public HashJoinEngine() {
        this(0);
    }

    /**
     * @param maxPairsPerKey largest cross product allowed for a single key; 0 for no limit
     */
    public HashJoinEngine(int maxPairsPerKey) {
        if (maxPairsPerKey < 0) {
            throw new IllegalArgumentException("maxPairsPerKey must not be negative: " + maxPairsPerKey);
        }
        this.maxPairsPerKey = maxPairsPerKey;
    }

    /**
     * @throws JoinLimitExceededException when one key's cross product exceeds the configured limit
     */
    public Output join(List<ObjectNode> left, List<ObjectNode> right, JoinType joinType,
                       RecordConsolidator consolidator) {
        var leftLookup = new Lookup(left, consolidator.getLeftField());
        var rightLookup = new Lookup(right, consolidator.getRightField());

        Set<String> keys = new LinkedHashSet<>();
        switch (joinType) {
            case INNER -> leftLookup.groups.keySet().stream()
                .filter(rightLookup.groups::containsKey)
                .forEach(keys::add);
            case LEFT -> keys.addAll(leftLookup.groups.keySet());
            case RIGHT -> keys.addAll(rightLookup.groups.keySet());
            case FULL -> {
                keys.addAll(leftLookup.groups.keySet());
                keys.addAll(rightLookup.groups.keySet());
            }
        }

        List<JoinedRecord> records = new ArrayList<>();
        for (String key : keys) {
            emit(key, leftLookup.get(key), rightLookup.get(key), consolidator, records);
        }
        log.atDebug().setMessage("{} join over {} left and {} right key(s) emitted {} record(s)")
            .addArgument(joinType::getWireName)
            .addArgument(leftLookup.groups::size)
            .addArgument(rightLookup.groups::size)
            .addArgument(records::size)
            .log();
        return new Output(records, leftLookup.excluded, rightLookup.excluded);
    }

    private void emit(String key, List<ObjectNode> lefts, List<ObjectNode> rights,
                      RecordConsolidator consolidator, List<JoinedRecord> out) {
        if (rights.isEmpty()) {
            for (ObjectNode l : lefts) {
                out.add(new JoinedRecord(key, l, null, consolidator.consolidate(l, null), MatchKind.LEFT_ONLY));
            }
        } else if (lefts.isEmpty()) {
            for (ObjectNode r : rights) {
                out.add(new JoinedRecord(key, null, r, consolidator.consolidate(null, r), MatchKind.RIGHT_ONLY));
            }
        } else {
            long pairs = (long) lefts.size() * rights.size();
            if (maxPairsPerKey > 0 && pairs > maxPairsPerKey) {
                throw new JoinLimitExceededException(key, pairs, maxPairsPerKey);
            }
            for (ObjectNode l : lefts) {
                for (ObjectNode r : rights) {
                    out.add(new JoinedRecord(key, l, r, consolidator.consolidate(l, r), MatchKind.MATCHED));
                }
            }
        }
    }

    private static class Lookup {
        final Map<String, List<ObjectNode>> groups = new LinkedHashMap<>();
        int excluded;

        Lookup(List<ObjectNode> records, String fieldPath) {
            for (ObjectNode record : records) {
                Optional<JsonNode> value = FieldPath.resolve(record, fieldPath);
                if (value.isEmpty()) {
                    excluded++;
                    continue;
                }
                groups.computeIfAbsent(FieldPath.keyOf(value.get()), k -> new ArrayList<>()).add(record);
            }
        }

        List<ObjectNode> get(String key) {
            return groups.getOrDefault(key, List.of());
        }
    }
}
