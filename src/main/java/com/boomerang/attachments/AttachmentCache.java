package com.boomerang.attachments;

import com.boomerang.observability.GatewayMetrics;
import com.boomerang.shared.BoomerangException;
import com.boomerang.shared.config.AttachmentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serves local files through unguessable, short-lived URLs so they can be sent as attachments.
 *
 * <p>Each {@link #host(Path)} call allocates a new token, even for a file that is already hosted.
 * Entries leave the cache when their TTL expires and, under {@link ConsumptionPolicy#SERVE_ONCE},
 * as soon as they are claimed. A background sweep removes expired entries.
 */
public class AttachmentCache {

    private static final Logger log = LoggerFactory.getLogger(AttachmentCache.class);
    public static final String PATH_PREFIX = "/attachments/";

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final TokenGenerator tokens = new TokenGenerator();
    private final String baseUrl;
    private final Duration ttl;
    private final Duration sweepInterval;
    private final ConsumptionPolicy policy;
    private final Clock clock;
    private final GatewayMetrics metrics;
    private ScheduledExecutorService sweeper;

    public AttachmentCache(AttachmentConfig config, Clock clock, GatewayMetrics metrics) {
        this.baseUrl = config.baseUrl() == null ? "" : config.baseUrl().replaceAll("/+$", "");
        this.ttl = Duration.ofSeconds(config.ttlSeconds());
        this.sweepInterval = Duration.ofSeconds(Math.max(1, config.sweepIntervalSeconds()));
        this.policy = config.policy();
        this.clock = clock;
        this.metrics = metrics;
        if (baseUrl.isBlank()) {
            log.warn("attachments.base-url is not configured; hosted attachment URLs will be relative");
        }
    }

    public ConsumptionPolicy policy() {
        return policy;
    }

    public HostedAttachment host(Path localPath) {
        if (!Files.isRegularFile(localPath) || !Files.isReadable(localPath)) {
            throw new BoomerangException("Attachment is not a readable file: " + localPath);
        }
        var path = localPath.toAbsolutePath();
        var now = clock.instant();
        String token;
        do {
            token = tokens.next();
        } while (entries.putIfAbsent(token,
                new CacheEntry(token, path, now, CacheEntry.State.UNCONSUMED)) != null);
        log.debug("Hosting {} as {}", path, token);
        return new HostedAttachment(token, baseUrl + PATH_PREFIX + token);
    }

    /** Looks a token up without consuming it. */
    public Optional<Path> resolve(String token) {
        var entry = token == null ? null : entries.get(token);
        if (entry == null || entry.isExpired(clock.instant(), ttl)) return Optional.empty();
        if (policy == ConsumptionPolicy.SERVE_ONCE && entry.state() == CacheEntry.State.SERVED) {
            return Optional.empty();
        }
        return Optional.of(entry.path());
    }

    /**
     * Claims a token for serving. The returned entry carries the path to stream; callers must not
     * consult the cache again while transferring.
     */
    public Optional<CacheEntry> claim(String token) {
        if (token == null) return Optional.empty();
        var claimed = new AtomicReference<CacheEntry>();
        var expired = new AtomicInteger();
        var now = clock.instant();
        entries.computeIfPresent(token, (k, entry) -> {
            if (entry.isExpired(now, ttl)) {
                expired.incrementAndGet();
                return null;
            }
            if (policy == ConsumptionPolicy.SERVE_ONCE) {
                if (entry.state() == CacheEntry.State.UNCONSUMED) claimed.set(entry.served());
                return null;
            }
            var served = entry.served();
            claimed.set(served);
            return served;
        });
        if (expired.get() > 0) metrics.attachmentsEvicted().increment();
        if (claimed.get() != null) metrics.attachmentsServed().increment();
        return Optional.ofNullable(claimed.get());
    }

    /** Evicts expired entries. Returns the number removed. */
    public int sweep() {
        var now = clock.instant();
        var removed = new AtomicInteger();
        entries.values().removeIf(entry -> {
            boolean stale = entry.isExpired(now, ttl)
                    || (policy == ConsumptionPolicy.SERVE_ONCE && entry.state() == CacheEntry.State.SERVED);
            if (stale) removed.incrementAndGet();
            return stale;
        });
        int evicted = removed.get();
        if (evicted > 0) {
            metrics.attachmentsEvicted().increment(evicted);
            log.debug("Evicted {} attachment(s)", evicted);
        }
        return evicted;
    }

    public int size() {
        return entries.size();
    }

    public synchronized void start() {
        if (sweeper != null) return;
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "attachment-sweeper");
            t.setDaemon(true);
            return t;
        });
        long interval = sweepInterval.toMillis();
        sweeper.scheduleAtFixedRate(this::sweepQuietly, interval, interval, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
    }

    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Attachment sweep failed", e);
        }
    }
}
