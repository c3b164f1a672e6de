package org.healthdata.reporting.join.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How many emitted records carry each join key, keeping only the most frequent keys.
 * Equal counts keep first-appearance order.
 */
public record JoinKeyDistribution(
    @JsonProperty("totalUniqueKeys") int totalUniqueKeys,
    @JsonProperty("distribution") Map<String, Integer> distribution
) {
    public static final int TOP_KEYS = 10;

    public JoinKeyDistribution {
        distribution = Collections.unmodifiableMap(new LinkedHashMap<>(distribution));
    }

    public static JoinKeyDistribution of(List<JoinedRecord> records) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (JoinedRecord record : records) {
            counts.merge(record.joinKey(), 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        // List.sort is stable
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

        Map<String, Integer> top = new LinkedHashMap<>();
        entries.stream().limit(TOP_KEYS).forEach(e -> top.put(e.getKey(), e.getValue()));
        return new JoinKeyDistribution(counts.size(), top);
    }
}
