package org.healthdata.reporting.search.http;

import java.util.Map;

public record HttpResponse(int statusCode, String statusText, Map<String, String> headers, String body) {
    public HttpResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return "HttpResponse{status=" + statusCode + " " + statusText + ", body=" + body + "}";
    }
}
