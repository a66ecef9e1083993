package com.boomerang.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** A message the page itself sent, reflected back by the platform. */
public record MessageEchoed(
    String senderId,
    String recipientId,
    long timestamp,
    JsonNode raw,
    String messageId,
    String appId,
    String metadata,
    String text,
    List<InboundAttachment> attachments
) implements Update {

    public MessageEchoed {
        Update.requireSender(senderId);
        text = text != null ? text : "";
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
    }

    @Override
    public UpdateType type() {
        return UpdateType.MESSAGE_ECHOED;
    }
}
