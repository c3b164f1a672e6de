package org.healthdata.reporting.common;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured {@code {code, message}} pair returned for validation messages and failures.
 */
public record ErrorDetail(
    @JsonProperty("code") String code,
    @JsonProperty("message") String message
) {}
