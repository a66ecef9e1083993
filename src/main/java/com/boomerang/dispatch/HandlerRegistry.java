package com.boomerang.dispatch;

import com.boomerang.shared.model.OutboundMessage;
import com.boomerang.shared.model.Update;
import com.boomerang.shared.model.UpdateType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatch table from update variant to handlers, in registration order. Filled before the
 * gateway starts; frozen afterwards.
 */
public class HandlerRegistry {

    private final Map<UpdateType, List<Registration<?>>> handlers = new EnumMap<>(UpdateType.class);
    private volatile boolean frozen;

    public synchronized <U extends Update> HandlerRegistry on(Class<U> variant, UpdateHandler<? super U> handler) {
        if (frozen) {
            throw new IllegalStateException("Handlers must be registered before the gateway starts");
        }
        var type = UpdateType.of(variant);
        handlers.computeIfAbsent(type, k -> new ArrayList<>())
                .add(new Registration<>(variant, handler));
        return this;
    }

    public synchronized List<Registration<?>> handlersFor(UpdateType type) {
        return List.copyOf(handlers.getOrDefault(type, List.of()));
    }

    public synchronized int size() {
        return handlers.values().stream().mapToInt(List::size).sum();
    }

    public void freeze() {
        frozen = true;
    }

    public record Registration<U extends Update>(Class<U> variant, UpdateHandler<? super U> handler) {

        Optional<OutboundMessage> invoke(Update update, Reply reply) throws Exception {
            var result = handler.handle(variant.cast(update), reply);
            return result != null ? result : Optional.empty();
        }

        String describe() {
            return variant.getSimpleName() + " handler " + handler.getClass().getName();
        }
    }
}
