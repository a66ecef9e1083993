package com.boomerang.attachments;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

public record CacheEntry(
    String token,
    Path path,
    Instant createdAt,
    State state
) {
    public enum State { UNCONSUMED, SERVED }

    CacheEntry served() {
        return state == State.SERVED ? this : new CacheEntry(token, path, createdAt, State.SERVED);
    }

    boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
