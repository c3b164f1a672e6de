package org.healthdata.reporting.common;

import lombok.Getter;

/**
 * Root of the reporting error hierarchy. Every failure that reaches a caller carries an {@link ErrorCode}.
 */
@Getter
public class ReportingException extends RuntimeException {
    private final ErrorCode code;

    public ReportingException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ReportingException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorDetail toErrorDetail() {
        return new ErrorDetail(code.name(), getMessage());
    }
}
