package com.boomerang.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

/** {@code authorizationCode} is only present when {@code status} is "linked". */
public record AccountLinkingReceived(
    String senderId,
    String recipientId,
    long timestamp,
    JsonNode raw,
    String status,
    String authorizationCode
) implements Update {

    public AccountLinkingReceived {
        Update.requireSender(senderId);
    }

    @Override
    public UpdateType type() {
        return UpdateType.ACCOUNT_LINKING_RECEIVED;
    }

    public boolean linked() {
        return "linked".equals(status);
    }
}
