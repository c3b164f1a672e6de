package org.healthdata.reporting.search;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.common.ReportingException;

import lombok.Getter;

public class SearchExecutionException extends ReportingException {
    /** HTTP status of the failed call, or -1 when no response was received. */
    @Getter
    private final int statusCode;

    public SearchExecutionException(String message, int statusCode) {
        super(ErrorCode.SEARCH_EXECUTION_ERROR, message);
        this.statusCode = statusCode;
    }

    public SearchExecutionException(String message, Throwable cause) {
        super(ErrorCode.SEARCH_EXECUTION_ERROR, message, cause);
        this.statusCode = -1;
    }
}
