package com.boomerang.shared.model;

public enum FailureClass {
    /** Timeouts, connection failures, 5xx and rate limiting. */
    RETRYABLE,
    /** Rejected by the platform: bad token, unknown recipient, malformed payload. */
    FATAL
}
