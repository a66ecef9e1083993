package com.boomerang.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

/** Sent when a user passes through the "Send to Messenger" plugin; {@code ref} is the data-ref. */
public record OptinReceived(
    String senderId,
    String recipientId,
    long timestamp,
    JsonNode raw,
    String ref
) implements Update {

    public OptinReceived {
        Update.requireSender(senderId);
    }

    @Override
    public UpdateType type() {
        return UpdateType.OPTIN_RECEIVED;
    }
}
