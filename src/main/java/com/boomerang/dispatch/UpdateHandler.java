package com.boomerang.dispatch;

import com.boomerang.shared.model.OutboundMessage;
import com.boomerang.shared.model.Update;

import java.util.Optional;

/**
 * Application callback for one update variant. A returned message is sent to the update's
 * sender automatically; handlers may instead talk through {@link Reply}, but should not do both.
 */
@FunctionalInterface
public interface UpdateHandler<U extends Update> {
    Optional<OutboundMessage> handle(U update, Reply reply) throws Exception;
}
