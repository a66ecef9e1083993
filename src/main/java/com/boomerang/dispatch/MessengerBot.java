package com.boomerang.dispatch;

import com.boomerang.shared.model.AccountLinkingReceived;
import com.boomerang.shared.model.DeliveryConfirmed;
import com.boomerang.shared.model.MessageEchoed;
import com.boomerang.shared.model.MessageReceived;
import com.boomerang.shared.model.OptinReceived;
import com.boomerang.shared.model.OutboundMessage;
import com.boomerang.shared.model.PostbackReceived;
import com.boomerang.shared.model.ReadConfirmed;
import com.boomerang.shared.model.ReferralReceived;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Base class for bots written by overriding one method per update variant. The overrides are
 * bound into a {@link HandlerRegistry} like any other handler; unhandled variants are logged and
 * ignored.
 */
public abstract class MessengerBot {

    private static final Logger log = LoggerFactory.getLogger(MessengerBot.class);

    public final void bindTo(HandlerRegistry registry) {
        registry.on(MessageReceived.class, this::onMessage)
                .on(MessageEchoed.class, this::onEcho)
                .on(DeliveryConfirmed.class, this::onDelivery)
                .on(ReadConfirmed.class, this::onRead)
                .on(PostbackReceived.class, this::onPostback)
                .on(OptinReceived.class, this::onOptin)
                .on(ReferralReceived.class, this::onReferral)
                .on(AccountLinkingReceived.class, this::onAccountLinking);
    }

    protected Optional<OutboundMessage> onMessage(MessageReceived message, Reply reply) throws Exception {
        log.debug("Unhandled message from {}", message.senderId());
        return Optional.empty();
    }

    protected Optional<OutboundMessage> onEcho(MessageEchoed echo, Reply reply) throws Exception {
        return Optional.empty();
    }

    protected Optional<OutboundMessage> onDelivery(DeliveryConfirmed delivery, Reply reply) throws Exception {
        return Optional.empty();
    }

    protected Optional<OutboundMessage> onRead(ReadConfirmed read, Reply reply) throws Exception {
        return Optional.empty();
    }

    protected Optional<OutboundMessage> onPostback(PostbackReceived postback, Reply reply) throws Exception {
        log.debug("Unhandled postback '{}' from {}", postback.payload(), postback.senderId());
        return Optional.empty();
    }

    protected Optional<OutboundMessage> onOptin(OptinReceived optin, Reply reply) throws Exception {
        log.debug("Unhandled opt-in from {}", optin.senderId());
        return Optional.empty();
    }

    protected Optional<OutboundMessage> onReferral(ReferralReceived referral, Reply reply) throws Exception {
        log.debug("Unhandled referral from {}", referral.senderId());
        return Optional.empty();
    }

    protected Optional<OutboundMessage> onAccountLinking(AccountLinkingReceived linking, Reply reply)
            throws Exception {
        log.debug("Unhandled account linking ({}) from {}", linking.status(), linking.senderId());
        return Optional.empty();
    }
}
