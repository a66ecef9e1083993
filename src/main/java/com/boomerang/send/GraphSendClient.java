package com.boomerang.send;

import com.boomerang.observability.GatewayMetrics;
import com.boomerang.shared.model.FailureClass;
import com.boomerang.shared.model.MediaType;
import com.boomerang.shared.model.OutboundMessage;
import com.boomerang.shared.model.SenderAction;
import com.boomerang.shared.model.SendResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Send API client. Each call is a chain of asynchronous attempts: a retryable failure schedules
 * the next attempt after a backoff delay instead of blocking a thread, a fatal failure ends the
 * chain at once, and running out of attempts ends it with the last retryable failure.
 */
public class GraphSendClient implements SendClient {

    private static final Logger log = LoggerFactory.getLogger(GraphSendClient.class);

    static final String MESSAGES_PATH = "/me/messages";
    static final String ATTACHMENTS_PATH = "/me/message_attachments";

    private final SendTransport transport;
    private final RetryPolicy retryPolicy;
    private final Executor executor;
    private final GatewayMetrics metrics;
    private final ObjectMapper mapper;
    private final MessageComposer composer;
    private final OutcomeClassifier classifier;
    private volatile boolean closed;

    public GraphSendClient(SendTransport transport, RetryPolicy retryPolicy, Executor executor,
                           ObjectMapper mapper, GatewayMetrics metrics) {
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
        this.metrics = metrics;
        this.mapper = mapper;
        this.composer = new MessageComposer(mapper);
        this.classifier = new OutcomeClassifier(mapper);
    }

    @Override
    public CompletableFuture<SendResult> send(String recipientId, OutboundMessage message) {
        return execute(MESSAGES_PATH, composer.message(recipientId, message), "message to " + recipientId);
    }

    @Override
    public CompletableFuture<SendResult> sendAction(String recipientId, SenderAction action) {
        return execute(MESSAGES_PATH, composer.action(recipientId, action),
                action.wireName() + " to " + recipientId);
    }

    @Override
    public CompletableFuture<SendResult> uploadAttachment(MediaType type, String url) {
        return execute(ATTACHMENTS_PATH, composer.upload(type, url), type.wireName() + " upload");
    }

    @Override
    public CompletableFuture<Void> acknowledge(String recipientId) {
        return sendAction(recipientId, SenderAction.MARK_SEEN)
                .thenCompose(seen -> {
                    logIfFailed(seen, "mark_seen", recipientId);
                    return sendAction(recipientId, SenderAction.TYPING_ON);
                })
                .thenAccept(typing -> logIfFailed(typing, "typing_on", recipientId));
    }

    @Override
    public void close() {
        closed = true;
    }

    private CompletableFuture<SendResult> execute(String path, ObjectNode body, String description) {
        var result = new CompletableFuture<SendResult>();
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            result.complete(new SendResult.Failed(FailureClass.FATAL, 0, 0, e.getOriginalMessage(), 0));
            return result;
        }
        attempt(path, json, description, new RetryState(), result);
        return result;
    }

    private void attempt(String path, String json, String description, RetryState state,
                         CompletableFuture<SendResult> result) {
        if (closed) {
            result.complete(failed(Outcome.failure(FailureClass.RETRYABLE, 0, 0, "send client closed"), state));
            return;
        }
        int attempt = state.begin();
        metrics.sendAttempts().increment();

        CompletableFuture<TransportResponse> call;
        try {
            call = transport.post(path, json);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.whenComplete((response, error) -> {
            try {
                var outcome = error != null ? classifier.classify(error) : classifier.classify(response);
                if (outcome.success()) {
                    result.complete(new SendResult.Delivered(
                            outcome.body().path("message_id").asText(null),
                            outcome.body().path("recipient_id").asText(null),
                            outcome.body().path("attachment_id").asText(null),
                            attempt));
                    return;
                }
                if (!retryPolicy.shouldRetry(outcome.failureClass(), attempt) || closed) {
                    log.warn("Send of {} failed after {} attempt(s): {} {} (code {})", description, attempt,
                            outcome.failureClass(), outcome.message(), outcome.errorCode());
                    result.complete(failed(outcome, state));
                    return;
                }
                long delay = retryPolicy.backoffMillis(attempt);
                state.failed(outcome.failureClass(), delay);
                log.debug("Send of {} attempt {} failed ({}: {}), next attempt at {}",
                        description, attempt, state.lastFailure(), outcome.message(), state.nextEligibleAt());
                Executor next = task -> {
                    try {
                        executor.execute(task);
                    } catch (RejectedExecutionException e) {
                        result.complete(failed(Outcome.failure(FailureClass.RETRYABLE, 0, 0,
                                "retry rejected during shutdown"), state));
                    }
                };
                CompletableFuture.runAsync(() -> attempt(path, json, description, state, result),
                        CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS, next));
            } catch (RuntimeException e) {
                log.error("Unexpected failure while sending {}", description, e);
                result.complete(new SendResult.Failed(FailureClass.FATAL, 0, 0,
                        String.valueOf(e.getMessage()), attempt));
            }
        });
    }

    private SendResult.Failed failed(Outcome outcome, RetryState state) {
        metrics.sendFailures(outcome.failureClass()).increment();
        return new SendResult.Failed(outcome.failureClass(), outcome.statusCode(), outcome.errorCode(),
                outcome.message(), state.attempts());
    }

    private static void logIfFailed(SendResult result, String action, String recipientId) {
        if (result instanceof SendResult.Failed failed) {
            log.info("Best-effort {} to {} failed: {}", action, recipientId, failed.message());
        }
    }
}
