package com.boomerang.dispatch;

import com.boomerang.observability.GatewayMetrics;
import com.boomerang.send.SendClient;
import com.boomerang.shared.model.SendResult;
import com.boomerang.shared.model.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Routes updates to their handlers, one conversation (sender) at a time.
 *
 * <p>An update is finished when all of its handlers have returned and every reply they caused
 * (returned or sent through {@link Reply}) has completed; only then does the sender's next update
 * start. Handler failures are logged and counted and affect nothing else.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final HandlerRegistry registry;
    private final SendClient sendClient;
    private final ConversationSequencer sequencer;
    private final GatewayMetrics metrics;
    private volatile boolean accepting = true;

    public Dispatcher(HandlerRegistry registry, SendClient sendClient, Executor workers, GatewayMetrics metrics) {
        this.registry = registry;
        this.sendClient = sendClient;
        this.sequencer = new ConversationSequencer(workers);
        this.metrics = metrics;
    }

    /**
     * Queues every update behind earlier ones from the same sender. Returns the number queued.
     *
     * @throws RejectedExecutionException once shutdown has begun
     */
    public int dispatch(Iterable<Update> updates) {
        if (!accepting) {
            throw new RejectedExecutionException("Dispatcher is shutting down");
        }
        int queued = 0;
        for (var update : updates) {
            sequencer.submit(update.senderId(), () -> process(update));
            queued++;
        }
        return queued;
    }

    public ConversationState state(String senderId) {
        return sequencer.state(senderId);
    }

    public boolean awaitIdle(Duration timeout) {
        return sequencer.awaitIdle(timeout);
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Stops accepting updates and waits up to {@code grace} for running conversations. Whatever is
     * left afterwards is cancelled. Returns true if everything finished in time.
     */
    public boolean shutdown(Duration grace) {
        accepting = false;
        if (sequencer.awaitIdle(grace)) {
            return true;
        }
        int cancelled = sequencer.cancelAll();
        log.warn("Shutdown grace of {} elapsed; cancelled {} pending conversation task(s)", grace, cancelled);
        return false;
    }

    CompletableFuture<Void> process(Update update) {
        var handlers = registry.handlersFor(update.type());
        if (handlers.isEmpty()) {
            log.debug("No handler for {} from {}", update.type(), update.senderId());
            return CompletableFuture.completedFuture(null);
        }
        var reply = new ConversationReply(update.senderId(), sendClient);
        for (var registration : handlers) {
            long start = System.nanoTime();
            try {
                var outbound = registration.invoke(update, reply);
                outbound.ifPresent(message -> reply.respond(message).thenAccept(result -> {
                    if (result instanceof SendResult.Failed failed) {
                        log.warn("Reply to {} failed: {} {}", update.senderId(),
                                failed.failureClass(), failed.message());
                    }
                }));
            } catch (Exception e) {
                metrics.handlerFailures().increment();
                log.error("{} failed for sender={} type={} timestamp={}", registration.describe(),
                        update.senderId(), update.type(), update.timestamp(), e);
            } finally {
                metrics.handlerLatency().record(Duration.ofNanos(System.nanoTime() - start));
            }
        }
        return reply.settled();
    }
}
