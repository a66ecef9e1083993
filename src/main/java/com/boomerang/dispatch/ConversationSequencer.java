package com.boomerang.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs tasks one at a time per key and concurrently across keys.
 *
 * <p>A key with a task running or queued is {@link ConversationState#PROCESSING}; its tail future
 * is the last task submitted. A new task chains behind the tail inside {@code compute}, so two
 * submitters can never both see the key as idle.
 */
public class ConversationSequencer {

    private static final Logger log = LoggerFactory.getLogger(ConversationSequencer.class);

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private final Object idle = new Object();
    private final Executor executor;

    public ConversationSequencer(Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(String key, Supplier<CompletableFuture<Void>> task) {
        @SuppressWarnings("unchecked")
        CompletableFuture<Void>[] created = new CompletableFuture[1];
        tails.compute(key, (k, previous) -> {
            var ready = previous == null
                    ? CompletableFuture.<Void>completedFuture(null)
                    : previous.handle((v, e) -> (Void) null);
            created[0] = ready.thenComposeAsync(ignored -> runSafely(key, task), executor);
            return created[0];
        });
        var next = created[0];
        inFlight.add(next);
        next.whenComplete((v, e) -> {
            inFlight.remove(next);
            if (tails.remove(key, next)) signalIfIdle();
        });
        return next;
    }

    public ConversationState state(String key) {
        return tails.containsKey(key) ? ConversationState.PROCESSING : ConversationState.IDLE;
    }

    public int activeConversations() {
        return tails.size();
    }

    /** Waits until no conversation is processing. Returns false on timeout or interrupt. */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idle) {
            while (!tails.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) return false;
                try {
                    TimeUnit.NANOSECONDS.timedWait(idle, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return true;
    }

    /** Cancels every queued or running conversation chain. Returns the number cancelled. */
    public int cancelAll() {
        int cancelled = 0;
        for (var task : inFlight.toArray(new CompletableFuture<?>[0])) {
            if (task.cancel(true)) cancelled++;
        }
        inFlight.clear();
        tails.clear();
        signalIfIdle();
        return cancelled;
    }

    private void signalIfIdle() {
        synchronized (idle) {
            if (tails.isEmpty()) idle.notifyAll();
        }
    }

    private static CompletableFuture<Void> runSafely(String key, Supplier<CompletableFuture<Void>> task) {
        try {
            var stage = task.get();
            return stage != null ? stage : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            log.error("Conversation task for {} failed", key, e);
            return CompletableFuture.failedFuture(e);
        }
    }
}
