package org.healthdata.reporting.join;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.common.ReportingException;

public class SourceFetchException extends ReportingException {
    public SourceFetchException(String message, Throwable cause) {
        super(ErrorCode.SOURCE_FETCH_ERROR, message, cause);
    }
}
