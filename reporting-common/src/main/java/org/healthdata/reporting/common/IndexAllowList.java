package org.healthdata.reporting.common;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The set of index name patterns a caller may query. An entry ending in {@value #WILDCARD} matches by prefix,
 * every other entry requires exact equality.
 */
public final class IndexAllowList {
    public static final String WILDCARD = "*";

    private final List<String> patterns;

    private IndexAllowList(List<String> patterns) {
        this.patterns = patterns;
    }

    public static IndexAllowList of(Collection<String> patterns) {
        return new IndexAllowList(patterns.stream()
            .map(String::trim)
            .filter(p -> !p.isEmpty())
            .collect(Collectors.toUnmodifiableList()));
    }

    public static IndexAllowList of(String... patterns) {
        return of(List.of(patterns));
    }

    /** Parses a comma-separated pattern list such as {@code "metrics-*, audit"}. */
    public static IndexAllowList parse(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return of(List.of());
        }
        return of(List.of(commaSeparated.split(",")));
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    public boolean isAllowed(String indexName) {
        return isAllowed(indexName, patterns);
    }

    /**
     * @throws IndexAccessDeniedException for the first index that no pattern admits
     */
    public void checkAccess(Collection<String> indexNames) {
        for (String indexName : indexNames) {
            if (!isAllowed(indexName)) {
                throw new IndexAccessDeniedException(indexName);
            }
        }
    }

    public static boolean isAllowed(String indexName, Collection<String> allowedPatterns) {
        if (indexName == null) {
            return false;
        }
        return allowedPatterns.stream().anyMatch(pattern -> matches(indexName, pattern));
    }

    static boolean matches(String indexName, String pattern) {
        if (pattern.endsWith(WILDCARD)) {
            return indexName.startsWith(pattern.substring(0, pattern.length() - WILDCARD.length()));
        }
        return indexName.equals(pattern);
    }

    @Override
    public String toString() {
        return "IndexAllowList" + patterns;
    }
}
