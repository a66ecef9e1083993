package com.boomerang.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

public record PostbackReceived(
    String senderId,
    String recipientId,
    long timestamp,
    JsonNode raw,
    String title,
    String payload,
    Referral referral
) implements Update {

    public PostbackReceived {
        Update.requireSender(senderId);
    }

    @Override
    public UpdateType type() {
        return UpdateType.POSTBACK_RECEIVED;
    }
}
