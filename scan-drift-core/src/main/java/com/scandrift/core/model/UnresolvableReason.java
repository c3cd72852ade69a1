package com.scandrift.core.model;

/**
 * Why a target landed in the unresolvable bucket.
 */
public enum UnresolvableReason {
    /** The target carries no source URL (typical for CLI-style targets). */
    NO_URL,
    /** The source URL matched no known repository URL shape. */
    UNPARSEABLE_URL,
    /** The source URL is a local filesystem path, which no host catalog can contain. */
    LOCAL_PATH
}
