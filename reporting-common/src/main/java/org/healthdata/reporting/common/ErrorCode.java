package org.healthdata.reporting.common;

/**
 * Stable error codes surfaced to callers in the {@code {code, message}} error envelope.
 */
public enum ErrorCode {
    // Syntax / validation
    INVALID_JQL(Category.VALIDATION),
    MISSING_JOINS(Category.VALIDATION),
    UNSUPPORTED_MULTI_JOIN(Category.CONFIGURATION),
    INVALID_FROM(Category.VALIDATION),
    INVALID_SIZE(Category.VALIDATION),
    MISSING_PREVIEW_PARAMS(Category.VALIDATION),

    // Authorization
    ACCESS_DENIED(Category.AUTHORIZATION),

    // Configuration
    INVALID_LEFT_SOURCE(Category.CONFIGURATION),
    INVALID_RIGHT_SOURCE(Category.CONFIGURATION),
    INVALID_JOIN_FIELD(Category.CONFIGURATION),
    INVALID_JOIN_TYPE(Category.CONFIGURATION),
    INVALID_SAVED_QUERY_SOURCE(Category.CONFIGURATION),
    SAVED_QUERY_NOT_FOUND(Category.CONFIGURATION),
    JOIN_PAIR_LIMIT_EXCEEDED(Category.CONFIGURATION),

    // Upstream
    SEARCH_EXECUTION_ERROR(Category.UPSTREAM),
    SOURCE_FETCH_ERROR(Category.UPSTREAM),
    JOIN_EXECUTION_ERROR(Category.UPSTREAM);

    public enum Category {
        VALIDATION,
        AUTHORIZATION,
        CONFIGURATION,
        UPSTREAM
    }

    private final Category category;

    ErrorCode(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }
}
