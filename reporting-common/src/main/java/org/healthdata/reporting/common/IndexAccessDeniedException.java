package org.healthdata.reporting.common;

import lombok.Getter;

/**
 * Raised when a requested index does not match any entry of the allow-list. Never retried.
 */
@Getter
public class IndexAccessDeniedException extends ReportingException {
    private final String indexName;

    public IndexAccessDeniedException(String indexName) {
        super(ErrorCode.ACCESS_DENIED, "Access denied to index: " + indexName);
        this.indexName = indexName;
    }
}
