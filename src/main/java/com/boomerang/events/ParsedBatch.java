package com.boomerang.events;

import com.boomerang.shared.model.Update;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Updates of one webhook delivery, produced lazily in the order the platform listed them.
 * Can be iterated once.
 */
public class ParsedBatch implements Iterable<Update> {

    private final EventParser parser;
    private final JsonNode payload;
    private final AtomicBoolean consumed = new AtomicBoolean();
    private final AtomicInteger malformed;
    private final AtomicInteger parsed = new AtomicInteger();

    ParsedBatch(EventParser parser, JsonNode payload, int initialMalformed) {
        this.parser = parser;
        this.payload = payload;
        this.malformed = new AtomicInteger(initialMalformed);
    }

    /** Events skipped so far; final once iteration is exhausted. */
    public int malformedCount() {
        return malformed.get();
    }

    public int parsedCount() {
        return parsed.get();
    }

    @Override
    public Iterator<Update> iterator() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Parsed batch can only be consumed once");
        }
        return new UpdateIterator();
    }

    private class UpdateIterator implements Iterator<Update> {

        private final Iterator<JsonNode> entries = payload.path("entry").elements();
        private String entryId = "";
        private Iterator<JsonNode> events = Collections.emptyIterator();
        private Update next;

        @Override
        public boolean hasNext() {
            while (next == null) {
                while (!events.hasNext()) {
                    if (!entries.hasNext()) return false;
                    var entry = entries.next();
                    entryId = entry.path("id").asText("");
                    events = entry.path("messaging").elements();
                }
                var event = events.next();
                try {
                    next = parser.toUpdate(event);
                    parsed.incrementAndGet();
                } catch (MalformedEventException e) {
                    malformed.incrementAndGet();
                    parser.skipped(entryId, e.getMessage());
                }
            }
            return true;
        }

        @Override
        public Update next() {
            if (!hasNext()) throw new NoSuchElementException();
            var out = next;
            next = null;
            return out;
        }
    }
}
