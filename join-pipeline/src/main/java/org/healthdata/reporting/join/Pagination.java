package org.healthdata.reporting.join;

import java.util.List;

public final class Pagination {
    private Pagination() {}

    /**
     * Copy of {@code results[from, from + size)}, clamped to the list bounds. {@code results} is not modified.
     */
    public static <T> List<T> page(List<T> results, int from, int size) {
        if (from < 0 || size < 0) {
            throw new IllegalArgumentException("from and size must not be negative");
        }
        int start = Math.min(from, results.size());
        int end = (int) Math.min((long) start + size, results.size());
        return List.copyOf(results.subList(start, end));
    }
}
