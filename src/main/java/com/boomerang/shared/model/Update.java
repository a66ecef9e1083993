package com.boomerang.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One inbound conversational event parsed from a webhook delivery.
 *
 * <p>Every variant carries the sender that owns the conversation, the page it was addressed to,
 * the platform timestamp (epoch millis) and the raw messaging event for fields that are not
 * modeled here.
 */
public sealed interface Update permits MessageReceived, MessageEchoed, DeliveryConfirmed,
        ReadConfirmed, PostbackReceived, OptinReceived, ReferralReceived, AccountLinkingReceived {

    String senderId();

    String recipientId();

    long timestamp();

    JsonNode raw();

    UpdateType type();

    static String requireSender(String senderId) {
        if (senderId == null || senderId.isBlank()) {
            throw new IllegalArgumentException("Update requires a non-empty sender id");
        }
        return senderId;
    }
}
