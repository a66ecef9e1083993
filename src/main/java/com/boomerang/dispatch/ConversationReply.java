package com.boomerang.dispatch;

import com.boomerang.send.SendClient;
import com.boomerang.shared.model.OutboundMessage;
import com.boomerang.shared.model.SenderAction;
import com.boomerang.shared.model.SendResult;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

class ConversationReply implements Reply {

    private final String senderId;
    private final SendClient client;
    private final List<CompletableFuture<?>> outstanding = new ArrayList<>();
    // tail of everything sent so far; each new call waits for it, success or not
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    ConversationReply(String senderId, SendClient client) {
        this.senderId = senderId;
        this.client = client;
    }

    @Override
    public String senderId() {
        return senderId;
    }

    @Override
    public CompletableFuture<Void> acknowledge() {
        return enqueue(() -> client.acknowledge(senderId));
    }

    @Override
    public CompletableFuture<SendResult> respond(OutboundMessage message) {
        return enqueue(() -> client.send(senderId, message));
    }

    @Override
    public CompletableFuture<SendResult> sendAction(SenderAction action) {
        return enqueue(() -> client.sendAction(senderId, action));
    }

    /** Completes when every call made through this reply has finished. */
    synchronized CompletableFuture<Void> settled() {
        return CompletableFuture.allOf(outstanding.toArray(new CompletableFuture<?>[0]))
                .handle((v, e) -> null);
    }

    private synchronized <T> CompletableFuture<T> enqueue(Supplier<CompletableFuture<T>> call) {
        var next = tail.thenCompose(ignored -> call.get());
        tail = next.handle((v, e) -> null);
        outstanding.add(next);
        return next;
    }
}
