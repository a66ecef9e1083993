package com.boomerang.gateway;

import com.boomerang.attachments.AttachmentCache;
import com.boomerang.dispatch.ConversationState;
import com.boomerang.dispatch.Dispatcher;
import com.boomerang.dispatch.HandlerRegistry;
import com.boomerang.dispatch.MessengerBot;
import com.boomerang.dispatch.UpdateHandler;
import com.boomerang.events.EventParser;
import com.boomerang.observability.GatewayMetrics;
import com.boomerang.security.SignatureValidator;
import com.boomerang.send.GraphSendClient;
import com.boomerang.send.HttpSendTransport;
import com.boomerang.send.RetryPolicy;
import com.boomerang.send.SendClient;
import com.boomerang.send.SendTransport;
import com.boomerang.shared.config.BoomerangConfig;
import com.boomerang.shared.model.MediaType;
import com.boomerang.shared.model.OutboundAttachment;
import com.boomerang.shared.model.Update;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One Messenger integration: the handler table plus the parser, dispatcher, send client and
 * attachment cache it needs. Instances share nothing, so several can run side by side.
 */
public class MessengerGateway {

    private static final Logger log = LoggerFactory.getLogger(MessengerGateway.class);
    private static final AtomicInteger INSTANCES = new AtomicInteger();

    public enum Status { ACCEPTED, REJECTED_SIGNATURE, UNAVAILABLE }

    public record IngestResult(Status status, int dispatched, int malformed) {
        static IngestResult of(Status status) {
            return new IngestResult(status, 0, 0);
        }
    }

    private final BoomerangConfig config;
    private final HandlerRegistry registry;
    private final SignatureValidator validator;
    private final EventParser parser;
    private final AttachmentCache attachments;
    private final SendClient sendClient;
    private final Dispatcher dispatcher;
    private final ExecutorService workers;
    private final GatewayMetrics metrics;
    private volatile boolean running;
    private volatile boolean stopped;

    private MessengerGateway(Builder builder) {
        this.config = builder.config;
        this.registry = builder.registry;
        this.metrics = builder.metrics != null ? builder.metrics : new GatewayMetrics();
        var mapper = builder.mapper != null ? builder.mapper : new ObjectMapper();
        var messenger = config.messenger();

        var instance = INSTANCES.incrementAndGet();
        var threadIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.dispatch().workerThreads()), r -> {
            var t = new Thread(r, "boomerang-" + instance + "-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        if (messenger.appSecret() == null || messenger.appSecret().isBlank()) {
            log.warn("messenger.app-secret is not configured; every webhook delivery will be rejected");
            this.validator = null;
        } else {
            this.validator = new SignatureValidator(messenger.appSecret(), messenger.signatureAlgorithm());
        }
        if (messenger.verifyToken() == null || messenger.verifyToken().isBlank()) {
            log.warn("messenger.verify-token is not configured; subscription handshakes will be refused");
        }

        this.parser = new EventParser(mapper, metrics);
        this.attachments = new AttachmentCache(config.attachments(), builder.clock, metrics);
        if (builder.sendClient != null) {
            this.sendClient = builder.sendClient;
        } else {
            var transport = builder.transport != null ? builder.transport
                    : new HttpSendTransport(messenger.graphBaseUrl(), messenger.pageAccessToken(),
                            Duration.ofSeconds(messenger.requestTimeoutSeconds()));
            this.sendClient = new GraphSendClient(transport, new RetryPolicy(config.retry()), workers, mapper, metrics);
        }
        this.dispatcher = new Dispatcher(registry, sendClient, workers, metrics);
    }

    public static Builder builder(BoomerangConfig config) {
        return new Builder(config);
    }

    public synchronized void start() {
        if (stopped) throw new IllegalStateException("Gateway has been stopped");
        if (running) return;
        registry.freeze();
        attachments.start();
        running = true;
        log.info("Messenger gateway started with {} handler(s)", registry.size());
    }

    /** Drains in-flight conversations for the configured grace period, then releases everything. */
    public synchronized void stop() {
        if (stopped) return;
        stopped = true;
        running = false;
        var grace = Duration.ofSeconds(config.dispatch().shutdownGraceSeconds());
        if (!dispatcher.shutdown(grace)) {
            log.warn("Conversations still running after {}; they were cancelled", grace);
        }
        sendClient.close();
        attachments.stop();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Messenger gateway stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /** Subscription handshake: mode must be {@code subscribe} and the token must match. */
    public boolean verifySubscription(String mode, String token) {
        var expected = config.messenger().verifyToken();
        if (!"subscribe".equals(mode) || token == null || expected == null || expected.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                token.getBytes(StandardCharsets.UTF_8));
    }

    public String signatureHeaderName() {
        return config.messenger().signatureAlgorithm().headerName();
    }

    /**
     * Authenticates, parses and dispatches one webhook delivery. Returns once every update of the
     * batch has been queued; handlers run afterwards.
     */
    public IngestResult ingest(byte[] body, String signatureHeader) {
        if (!running || !dispatcher.isAccepting()) {
            return IngestResult.of(Status.UNAVAILABLE);
        }
        if (validator == null) {
            metrics.webhookRejected().increment();
            log.warn("Rejected webhook delivery: no app secret configured to check {}", signatureHeaderName());
            return IngestResult.of(Status.REJECTED_SIGNATURE);
        }
        if (!validator.isValid(body, signatureHeader)) {
            metrics.webhookRejected().increment();
            log.warn("Rejected webhook delivery with invalid {} header", signatureHeaderName());
            return IngestResult.of(Status.REJECTED_SIGNATURE);
        }
        var batch = parser.parse(body);
        try {
            int dispatched = dispatcher.dispatch(batch);
            return new IngestResult(Status.ACCEPTED, dispatched, batch.malformedCount());
        } catch (RejectedExecutionException e) {
            log.warn("Webhook delivery arrived during shutdown: {}", e.getMessage());
            return new IngestResult(Status.UNAVAILABLE, batch.parsedCount(), batch.malformedCount());
        }
    }

    /** Hosts a local file and returns an attachment pointing at it. */
    public OutboundAttachment.Media hostAttachment(MediaType type, Path file) {
        return new OutboundAttachment.Media(type, attachments.host(file).url());
    }

    public SendClient sendClient() {
        return sendClient;
    }

    public AttachmentCache attachments() {
        return attachments;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public ConversationState conversationState(String senderId) {
        return dispatcher.state(senderId);
    }

    public boolean awaitIdle(Duration timeout) {
        return dispatcher.awaitIdle(timeout);
    }

    public static class Builder {
        private final BoomerangConfig config;
        private final HandlerRegistry registry = new HandlerRegistry();
        private SendTransport transport;
        private SendClient sendClient;
        private Clock clock = Clock.systemUTC();
        private GatewayMetrics metrics;
        private ObjectMapper mapper;

        private Builder(BoomerangConfig config) {
            this.config = config;
        }

        public <U extends Update> Builder on(Class<U> variant, UpdateHandler<? super U> handler) {
            registry.on(variant, handler);
            return this;
        }

        public Builder bot(MessengerBot bot) {
            bot.bindTo(registry);
            return this;
        }

        /** Replaces the HTTP transport of the default send client. */
        public Builder transport(SendTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder sendClient(SendClient sendClient) {
            this.sendClient = sendClient;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(GatewayMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public MessengerGateway build() {
            return new MessengerGateway(this);
        }
    }
}
