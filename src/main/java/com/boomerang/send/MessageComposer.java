package com.boomerang.send;

import com.boomerang.shared.model.MediaType;
import com.boomerang.shared.model.OutboundAttachment;
import com.boomerang.shared.model.OutboundMessage;
import com.boomerang.shared.model.SenderAction;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Builds Send API request bodies. */
class MessageComposer {

    private final ObjectMapper mapper;

    MessageComposer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    ObjectNode message(String recipientId, OutboundMessage message) {
        var body = mapper.createObjectNode();
        body.put("messaging_type", "RESPONSE");
        body.putObject("recipient").put("id", recipientId);
        var node = body.putObject("message");
        if (message.text() != null) node.put("text", message.text());
        if (message.attachment() != null) node.set("attachment", attachment(message.attachment()));
        if (!message.quickReplies().isEmpty()) {
            var replies = node.putArray("quick_replies");
            for (var reply : message.quickReplies()) {
                var r = replies.addObject().put("content_type", reply.contentType());
                if (reply.title() != null) r.put("title", reply.title());
                if (reply.payload() != null) r.put("payload", reply.payload());
                if (reply.imageUrl() != null) r.put("image_url", reply.imageUrl());
            }
        }
        if (message.metadata() != null) node.put("metadata", message.metadata());
        return body;
    }

    ObjectNode action(String recipientId, SenderAction action) {
        var body = mapper.createObjectNode();
        body.putObject("recipient").put("id", recipientId);
        body.put("sender_action", action.wireName());
        return body;
    }

    ObjectNode upload(MediaType type, String url) {
        var body = mapper.createObjectNode();
        body.putObject("message").set("attachment",
                attachment(new OutboundAttachment.Media(type, url, true)));
        return body;
    }

    private ObjectNode attachment(OutboundAttachment attachment) {
        var node = mapper.createObjectNode();
        if (attachment instanceof OutboundAttachment.Media media) {
            node.put("type", media.type().wireName());
            var payload = node.putObject("payload").put("url", media.url());
            if (media.reusable()) payload.put("is_reusable", true);
        } else if (attachment instanceof OutboundAttachment.Saved saved) {
            node.put("type", saved.type().wireName());
            node.putObject("payload").put("attachment_id", saved.attachmentId());
        } else if (attachment instanceof OutboundAttachment.Template template) {
            node.put("type", "template");
            node.set("payload", mapper.valueToTree(template.payload()));
        }
        return node;
    }
}
