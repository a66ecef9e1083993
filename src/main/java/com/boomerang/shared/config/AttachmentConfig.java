package com.boomerang.shared.config;

import com.boomerang.attachments.ConsumptionPolicy;

/**
 * @param baseUrl public URL under which this server is reachable, e.g. {@code https://bot.example.com}
 */
public record AttachmentConfig(
    String baseUrl,
    long ttlSeconds,
    long sweepIntervalSeconds,
    ConsumptionPolicy policy
) {
    public static AttachmentConfig defaults() {
        return new AttachmentConfig("", 600, 60, ConsumptionPolicy.SERVE_ONCE);
    }
}
