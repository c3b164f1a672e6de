package org.healthdata.reporting.jql;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.common.ReportingException;

public class JqlTranslationException extends ReportingException {
    public JqlTranslationException(String message) {
        super(ErrorCode.INVALID_JQL, "Invalid JQL query: " + message);
    }

    public JqlTranslationException(String message, Throwable cause) {
        super(ErrorCode.INVALID_JQL, "Invalid JQL query: " + message, cause);
    }
}
