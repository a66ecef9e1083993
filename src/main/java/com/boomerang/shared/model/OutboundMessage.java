package com.boomerang.shared.model;

import com.boomerang.shared.BoomerangException;

import java.util.List;

/**
 * A message for the Send API. Either {@code text} or {@code attachment} must be present.
 *
 * @param metadata developer string echoed back in the message_echoes webhook
 */
public record OutboundMessage(
    String text,
    OutboundAttachment attachment,
    List<QuickReply> quickReplies,
    String metadata
) {

    public OutboundMessage {
        if (text == null && attachment == null) {
            throw new BoomerangException("Message objects require either text or an attachment");
        }
        quickReplies = quickReplies != null ? List.copyOf(quickReplies) : List.of();
    }

    public static OutboundMessage text(String text) {
        return new OutboundMessage(text, null, List.of(), null);
    }

    public static OutboundMessage attachment(OutboundAttachment attachment) {
        return new OutboundMessage(null, attachment, List.of(), null);
    }

    public OutboundMessage withQuickReplies(List<QuickReply> replies) {
        return new OutboundMessage(text, attachment, replies, metadata);
    }

    public OutboundMessage withMetadata(String value) {
        return new OutboundMessage(text, attachment, quickReplies, value);
    }
}
