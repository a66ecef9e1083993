package com.boomerang.attachments;

import java.util.Locale;

public enum ConsumptionPolicy {
    /** Evict on the first successful fetch. */
    SERVE_ONCE,
    /** Serve any number of times until the TTL expires; tolerates platform re-fetches. */
    UNTIL_EXPIRY;

    public String configName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static ConsumptionPolicy fromName(String name) {
        var normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown attachment policy: " + name, e);
        }
    }
}
