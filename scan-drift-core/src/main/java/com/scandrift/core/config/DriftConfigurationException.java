package com.scandrift.core.config;

/**
 * Unrecoverable configuration problem: unknown region, missing credentials, or no organizations to reconcile.
 */
public class DriftConfigurationException extends RuntimeException {

    public DriftConfigurationException(String message) {
        super(message);
    }

    public DriftConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
