package com.boomerang.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record MessageReceived(
    String senderId,
    String recipientId,
    long timestamp,
    JsonNode raw,
    String messageId,
    Long sequence,
    String text,
    List<InboundAttachment> attachments,
    String quickReplyPayload
) implements Update {

    public MessageReceived {
        Update.requireSender(senderId);
        text = text != null ? text : "";
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
    }

    @Override
    public UpdateType type() {
        return UpdateType.MESSAGE_RECEIVED;
    }

    public boolean hasText() {
        return !text.isEmpty();
    }
}
