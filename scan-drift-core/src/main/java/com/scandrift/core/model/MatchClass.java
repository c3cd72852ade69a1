package com.scandrift.core.model;

/**
 * Classification of a canonical key after joining both catalogs.
 */
public enum MatchClass {
    /** Present in both the target catalog and the host catalog. */
    MATCHED,
    /** Present only in the target catalog: tracked, but the repository was not found on the host. */
    LEFT_ONLY,
    /** Present only in the host catalog: the repository exists but nothing tracks it. */
    RIGHT_ONLY
}
