package com.scandrift.core.http;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Status, body and headers of an HTTP response.
 *
 * @param statusCode HTTP status code
 * @param body response body, empty string if none
 * @param headers response headers
 */
public record HttpResponseData(
    int statusCode,
    String body,
    Map<String, List<String>> headers
) {
    /**
     * Compact constructor with validation.
     */
    public HttpResponseData {
        if (body == null) {
            body = "";
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * Creates a response without headers.
     *
     * @param statusCode status code
     * @param body body
     * @return response
     */
    public static HttpResponseData of(int statusCode, String body) {
        return new HttpResponseData(statusCode, body, Map.of());
    }

    /**
     * Returns the first value of a header, matching the name case-insensitively.
     *
     * @param name header name
     * @return header value if present
     */
    public Optional<String> header(String name) {
        return headers.entrySet().stream()
            .filter(entry -> entry.getKey() != null && entry.getKey().equalsIgnoreCase(name))
            .flatMap(entry -> entry.getValue().stream())
            .findFirst();
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isUnauthorized() {
        return statusCode == 401 || statusCode == 403;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
