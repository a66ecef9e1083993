package com.boomerang.send;

import com.boomerang.shared.model.FailureClass;

import java.time.Instant;

/** Progress of one outbound call's retry loop. Touched by one stage at a time. */
final class RetryState {

    private int attempts;
    private FailureClass lastFailure;
    private Instant nextEligibleAt = Instant.EPOCH;

    int begin() {
        return ++attempts;
    }

    int attempts() {
        return attempts;
    }

    FailureClass lastFailure() {
        return lastFailure;
    }

    Instant nextEligibleAt() {
        return nextEligibleAt;
    }

    void failed(FailureClass failureClass, long backoffMs) {
        this.lastFailure = failureClass;
        this.nextEligibleAt = Instant.now().plusMillis(backoffMs);
    }
}
