package com.boomerang.shared.config;

/** Bounds for outbound retries. {@code maxAttempts} counts the first attempt. */
public record RetryConfig(int maxAttempts, long baseDelayMs, long maxDelayMs) {

    public RetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "Invalid backoff bounds: base=" + baseDelayMs + "ms cap=" + maxDelayMs + "ms");
        }
    }

    public static RetryConfig defaults() {
        return new RetryConfig(3, 500, 10_000);
    }
}
