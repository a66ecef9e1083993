package com.boomerang.send;

import com.boomerang.shared.config.RetryConfig;
import com.boomerang.shared.model.FailureClass;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void retriesOnlyRetryableWithinBudget() {
        var policy = new RetryPolicy(new RetryConfig(3, 100, 1000));

        assertTrue(policy.shouldRetry(FailureClass.RETRYABLE, 1));
        assertTrue(policy.shouldRetry(FailureClass.RETRYABLE, 2));
        assertFalse(policy.shouldRetry(FailureClass.RETRYABLE, 3));
        assertFalse(policy.shouldRetry(FailureClass.FATAL, 1));
    }

    @Test
    void backoffGrowsExponentiallyWithBoundedJitter() {
        var policy = new RetryPolicy(new RetryConfig(10, 100, 100_000));

        for (int i = 0; i < 50; i++) {
            long first = policy.backoffMillis(1);
            long third = policy.backoffMillis(3);
            assertTrue(first >= 100 && first <= 150, "first=" + first);
            assertTrue(third >= 400 && third <= 600, "third=" + third);
        }
    }

    @Test
    void backoffIsCapped() {
        var policy = new RetryPolicy(new RetryConfig(100, 500, 2000));

        assertEquals(2000, policy.backoffMillis(5));
        assertEquals(2000, policy.backoffMillis(64));
    }

    @Test
    void zeroBaseMeansNoDelay() {
        var policy = new RetryPolicy(new RetryConfig(3, 0, 0));

        assertEquals(0, policy.backoffMillis(1));
        assertEquals(0, policy.backoffMillis(2));
    }

    @Test
    void invalidBoundsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig(0, 1, 2));
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig(3, 10, 5));
    }
}
