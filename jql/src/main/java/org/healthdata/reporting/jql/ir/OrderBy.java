package org.healthdata.reporting.jql.ir;

/**
 * One {@code order by} entry.
 */
public record OrderBy(String field, Direction direction) {

    public enum Direction {
        ASC,
        DESC;

        public String getWireName() {
            return name().toLowerCase();
        }

        /** Anything other than {@code desc} (case-insensitive) sorts ascending. */
        public static Direction parse(String text) {
            return "desc".equalsIgnoreCase(text) ? DESC : ASC;
        }
    }

    public static OrderBy asc(String field) {
        return new OrderBy(field, Direction.ASC);
    }

    public static OrderBy desc(String field) {
        return new OrderBy(field, Direction.DESC);
    }
}
