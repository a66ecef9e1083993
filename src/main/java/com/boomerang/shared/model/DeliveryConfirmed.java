package com.boomerang.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** Every message sent before {@code watermark} has been delivered. */
public record DeliveryConfirmed(
    String senderId,
    String recipientId,
    long timestamp,
    JsonNode raw,
    long watermark,
    List<String> messageIds,
    Long sequence
) implements Update {

    public DeliveryConfirmed {
        Update.requireSender(senderId);
        messageIds = messageIds != null ? List.copyOf(messageIds) : List.of();
    }

    @Override
    public UpdateType type() {
        return UpdateType.DELIVERY_CONFIRMED;
    }
}
