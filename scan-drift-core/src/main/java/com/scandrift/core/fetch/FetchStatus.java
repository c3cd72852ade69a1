package com.scandrift.core.fetch;

/**
 * Outcome of a collection fetch.
 */
public enum FetchStatus {
    /** Every page was fetched. */
    COMPLETE,
    /** Transient retries ran out mid-listing; items hold what was gathered before. */
    PARTIAL,
    /** Every API version answered not-found or not-authorized. */
    UNAVAILABLE,
    /** Unexpected status or malformed response body. */
    FAILED
}
