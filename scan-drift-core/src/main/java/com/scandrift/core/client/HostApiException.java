package com.scandrift.core.client;

/**
 * Thrown when the hosting platform answers a repository query with an unexpected status.
 *
 * <p>A 404 is never reported this way; callers treat it as "does not exist".
 */
public class HostApiException extends RuntimeException {

    private final int statusCode;

    public HostApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public HostApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /**
     * HTTP status that caused the failure, 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
