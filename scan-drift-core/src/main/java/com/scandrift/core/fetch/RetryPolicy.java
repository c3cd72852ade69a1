package com.scandrift.core.fetch;

import java.time.Duration;
import java.util.Optional;

/**
 * Retry limits for transient faults and rate limiting.
 *
 * <p>Transient faults (I/O errors and 5xx responses) back off exponentially from {@code baseDelay} and give up
 * after {@code maxRetries} retries. Rate-limited responses wait for the server's {@code Retry-After} value, or
 * {@code rateLimitFallback} when it is missing or unparseable, and never consume the transient budget.
 *
 * @param maxRetries retries allowed per page after the first attempt
 * @param baseDelay delay before the first retry, doubled on each further retry
 * @param rateLimitFallback wait used when a 429 carries no usable Retry-After
 */
public record RetryPolicy(
    int maxRetries,
    Duration baseDelay,
    Duration rateLimitFallback
) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_RATE_LIMIT_FALLBACK = Duration.ofSeconds(30);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            baseDelay = DEFAULT_BASE_DELAY;
        }
        if (rateLimitFallback == null || rateLimitFallback.isNegative()) {
            rateLimitFallback = DEFAULT_RATE_LIMIT_FALLBACK;
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_RATE_LIMIT_FALLBACK);
    }

    /**
     * Delay before retry number {@code attempt} (zero-based).
     */
    public Duration backoff(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(attempt, 20));
    }

    /**
     * Delay demanded by a rate-limited response.
     *
     * @param retryAfterHeader raw Retry-After value, in seconds
     * @return delay to wait
     */
    public Duration rateLimitDelay(Optional<String> retryAfterHeader) {
        return retryAfterHeader
            .map(String::trim)
            .flatMap(RetryPolicy::parseSeconds)
            .orElse(rateLimitFallback);
    }

    private static Optional<Duration> parseSeconds(String value) {
        try {
            long seconds = Long.parseLong(value);
            return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
