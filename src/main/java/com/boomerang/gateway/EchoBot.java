package com.boomerang.gateway;

import com.boomerang.dispatch.MessengerBot;
import com.boomerang.dispatch.Reply;
import com.boomerang.shared.model.MessageReceived;
import com.boomerang.shared.model.OutboundMessage;
import com.boomerang.shared.model.PostbackReceived;

import java.util.Optional;

/** Default bot: acknowledges every message and sends its text back. */
public class EchoBot extends MessengerBot {

    @Override
    protected Optional<OutboundMessage> onMessage(MessageReceived message, Reply reply) {
        reply.acknowledge();
        if (!message.hasText()) {
            return Optional.of(OutboundMessage.text("Received " + message.attachments().size() + " attachment(s)"));
        }
        return Optional.of(OutboundMessage.text(message.text()));
    }

    @Override
    protected Optional<OutboundMessage> onPostback(PostbackReceived postback, Reply reply) {
        return Optional.of(OutboundMessage.text("Postback: " + postback.payload()));
    }
}
