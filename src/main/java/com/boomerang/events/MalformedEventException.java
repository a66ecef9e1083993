package com.boomerang.events;

/** A messaging event that cannot be mapped to an update. Skipped, never propagated. */
class MalformedEventException extends Exception {

    MalformedEventException(String message) {
        super(message);
    }
}
