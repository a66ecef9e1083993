package com.boomerang.observability;

import com.boomerang.shared.model.FailureClass;
import com.boomerang.shared.model.UpdateType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;

public class GatewayMetrics {

    private final MeterRegistry registry;

    public GatewayMetrics() {
        this(new SimpleMeterRegistry());
    }

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter webhookRejected() {
        return Counter.builder("boomerang.webhook.rejected").register(registry);
    }

    public Counter updatesParsed(UpdateType type) {
        return Counter.builder("boomerang.updates.parsed")
                .tag("type", type.name().toLowerCase(Locale.ROOT))
                .register(registry);
    }

    public Counter malformedEvents() {
        return Counter.builder("boomerang.updates.malformed").register(registry);
    }

    public Counter handlerFailures() {
        return Counter.builder("boomerang.handler.failures").register(registry);
    }

    public Timer handlerLatency() {
        return Timer.builder("boomerang.handler.latency").register(registry);
    }

    public Counter sendAttempts() {
        return Counter.builder("boomerang.send.attempts").register(registry);
    }

    public Counter sendFailures(FailureClass failureClass) {
        return Counter.builder("boomerang.send.failures")
                .tag("class", failureClass.name().toLowerCase(Locale.ROOT))
                .register(registry);
    }

    public Counter attachmentsServed() {
        return Counter.builder("boomerang.attachments.served").register(registry);
    }

    public Counter attachmentsEvicted() {
        return Counter.builder("boomerang.attachments.evicted").register(registry);
    }
}
