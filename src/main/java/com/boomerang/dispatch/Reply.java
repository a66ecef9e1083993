package com.boomerang.dispatch;

import com.boomerang.shared.model.OutboundMessage;
import com.boomerang.shared.model.SenderAction;
import com.boomerang.shared.model.SendResult;

import java.util.concurrent.CompletableFuture;

/**
 * Reply capability bound to the sender of the update being handled. Calls are sequenced:
 * anything sent after {@link #acknowledge()} goes out once both acknowledge actions finished.
 */
public interface Reply {

    String senderId();

    /** Fires "mark seen" then "typing on"; best effort. */
    CompletableFuture<Void> acknowledge();

    CompletableFuture<SendResult> respond(OutboundMessage message);

    default CompletableFuture<SendResult> respond(String text) {
        return respond(OutboundMessage.text(text));
    }

    CompletableFuture<SendResult> sendAction(SenderAction action);
}
