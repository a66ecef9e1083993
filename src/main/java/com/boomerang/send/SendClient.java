package com.boomerang.send;

import com.boomerang.shared.model.MediaType;
import com.boomerang.shared.model.OutboundMessage;
import com.boomerang.shared.model.SenderAction;
import com.boomerang.shared.model.SendResult;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound calls to the Send API. Returned futures always complete normally; failures are
 * reported as {@link SendResult.Failed}.
 */
public interface SendClient extends AutoCloseable {

    CompletableFuture<SendResult> send(String recipientId, OutboundMessage message);

    CompletableFuture<SendResult> sendAction(String recipientId, SenderAction action);

    /** Uploads media the platform fetches from {@code url}; success carries the attachment id. */
    CompletableFuture<SendResult> uploadAttachment(MediaType type, String url);

    /**
     * Marks the conversation as seen and switches the typing indicator on, in that order.
     * Best effort: completes normally whatever the outcome of either action.
     */
    CompletableFuture<Void> acknowledge(String recipientId);

    /** Stops scheduling retries. Calls already in flight complete with their current outcome. */
    @Override
    void close();
}
