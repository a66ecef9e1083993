package com.boomerang.send;

import com.boomerang.shared.config.RetryConfig;
import com.boomerang.shared.model.FailureClass;

import java.util.concurrent.ThreadLocalRandom;

/** Exponential backoff with jitter, bounded by a maximum number of attempts. */
public class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;

    public RetryPolicy(RetryConfig config) {
        this.maxAttempts = config.maxAttempts();
        this.baseDelayMs = config.baseDelayMs();
        this.maxDelayMs = config.maxDelayMs();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean shouldRetry(FailureClass failureClass, int attemptsSoFar) {
        return failureClass == FailureClass.RETRYABLE && attemptsSoFar < maxAttempts;
    }

    /** Delay before the attempt following attempt number {@code attempt} (1-based). */
    public long backoffMillis(int attempt) {
        long exponential = attempt - 1 >= 31
                ? maxDelayMs
                : Math.min(maxDelayMs, baseDelayMs * (1L << (attempt - 1)));
        long jitter = exponential > 1 ? ThreadLocalRandom.current().nextLong(exponential / 2 + 1) : 0;
        return Math.min(maxDelayMs, exponential + jitter);
    }
}
