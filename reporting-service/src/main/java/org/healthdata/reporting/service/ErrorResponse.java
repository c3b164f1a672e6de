package org.healthdata.reporting.service;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.common.ReportingException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The failure envelope: {@code {success: false, error: {code, message, details?}}}.
 */
public record ErrorResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("error") ErrorBody error
) {
    static final String ACCESS_DENIED_MESSAGE = "Access denied to one or more requested indices";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorBody(
        @JsonProperty("code") String code,
        @JsonProperty("message") String message,
        @JsonProperty("details") String details
    ) {}

    public static ErrorResponse of(ErrorCode code, String message, String details) {
        return new ErrorResponse(false, new ErrorBody(code.name(), message, details));
    }

    /**
     * Renders any failure. Coded failures keep their code and message, access denials get a generic message
     * with the denied index in {@code details}, and anything else is reported under {@code fallback}.
     */
    public static ErrorResponse from(Throwable failure, ErrorCode fallback, String fallbackMessage) {
        if (failure instanceof ReportingException) {
            var reporting = (ReportingException) failure;
            if (reporting.getCode() == ErrorCode.ACCESS_DENIED) {
                return of(ErrorCode.ACCESS_DENIED, ACCESS_DENIED_MESSAGE, reporting.getMessage());
            }
            return of(reporting.getCode(), reporting.getMessage(), null);
        }
        return of(fallback, fallbackMessage, String.valueOf(failure.getMessage()));
    }
}
