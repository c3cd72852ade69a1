package com.scandrift.core.http;

import java.io.IOException;
import java.util.Map;

/**
 * Minimal HTTP capability the API clients are built on.
 *
 * <p>Implementations return every response, whatever its status, and throw {@link IOException} only for
 * transport-level faults (connection reset, timeout, truncated body). Status handling, retries and
 * pagination live above this interface in {@link com.scandrift.core.fetch.PaginatedFetcher}.
 */
public interface HttpTransport {

    /**
     * Issues a GET request.
     *
     * @param url absolute URL, may already carry a query string
     * @param params query parameters appended in iteration order
     * @param headers request headers
     * @return response
     * @throws IOException on transport faults
     * @throws IllegalArgumentException if the URL and parameters do not form a valid URI
     */
    HttpResponseData get(String url, Map<String, String> params, Map<String, String> headers) throws IOException;
}
