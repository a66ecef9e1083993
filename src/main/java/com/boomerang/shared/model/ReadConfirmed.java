package com.boomerang.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

/** Every message sent before {@code watermark} has been read. */
public record ReadConfirmed(
    String senderId,
    String recipientId,
    long timestamp,
    JsonNode raw,
    long watermark,
    Long sequence
) implements Update {

    public ReadConfirmed {
        Update.requireSender(senderId);
    }

    @Override
    public UpdateType type() {
        return UpdateType.READ_CONFIRMED;
    }
}
