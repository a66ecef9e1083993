package com.boomerang.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ReferralReceived(
    String senderId,
    String recipientId,
    long timestamp,
    JsonNode raw,
    Referral referral
) implements Update {

    public ReferralReceived {
        Update.requireSender(senderId);
    }

    @Override
    public UpdateType type() {
        return UpdateType.REFERRAL_RECEIVED;
    }
}
