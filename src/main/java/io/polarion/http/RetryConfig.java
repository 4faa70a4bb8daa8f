package io.polarion.http;

import io.polarion.error.ApiErrors;

import java.time.Duration;
import java.util.function.Predicate;

public record RetryConfig(
        int maxRetries,
        Duration minWait,
        Duration maxWait,
        Predicate<Throwable> retryIf
) {
    public static final int DEFAULT_MAX_RETRIES = 1;
    public static final Duration DEFAULT_MIN_WAIT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(15);

    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("max retries must be non-negative, got " + maxRetries);
        }
        if (minWait == null || minWait.isNegative()) {
            throw new IllegalArgumentException("min wait must be non-negative, got " + minWait);
        }
        if (maxWait == null || maxWait.compareTo(minWait) < 0) {
            throw new IllegalArgumentException("max wait (" + maxWait + ") must be >= min wait (" + minWait + ")");
        }
    }

    public static RetryConfig defaults() {
        return new RetryConfig(DEFAULT_MAX_RETRIES, DEFAULT_MIN_WAIT, DEFAULT_MAX_WAIT, ApiErrors::isRetryable);
    }

    public static RetryConfig disabled() {
        return new RetryConfig(0, Duration.ZERO, Duration.ZERO, ApiErrors::isRetryable);
    }

    public RetryConfig withMaxRetries(int value) {
        return new RetryConfig(value, minWait, maxWait, retryIf);
    }

    public RetryConfig withWaits(Duration min, Duration max) {
        return new RetryConfig(maxRetries, min, max, retryIf);
    }

    public RetryConfig withRetryIf(Predicate<Throwable> predicate) {
        return new RetryConfig(maxRetries, minWait, maxWait, predicate);
    }

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(minWait, maxWait);
    }
}
