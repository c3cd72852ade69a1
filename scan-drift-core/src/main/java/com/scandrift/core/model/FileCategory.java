package com.scandrift.core.model;

/**
 * Top-level grouping of the supported-file taxonomy.
 */
public enum FileCategory {
    DEPENDENCY_MANIFEST,
    CONTAINER,
    INFRASTRUCTURE_AS_CODE,
    OTHER
}
