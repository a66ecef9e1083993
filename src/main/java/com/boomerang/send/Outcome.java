package com.boomerang.send;

import com.boomerang.shared.model.FailureClass;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/** Classified result of a single attempt. */
record Outcome(
    boolean success,
    FailureClass failureClass,
    int statusCode,
    int errorCode,
    String message,
    JsonNode body
) {
    static Outcome success(int statusCode, JsonNode body) {
        return new Outcome(true, null, statusCode, 0, null, body);
    }

    static Outcome failure(FailureClass failureClass, int statusCode, int errorCode, String message) {
        return new Outcome(false, failureClass, statusCode, errorCode, message, MissingNode.getInstance());
    }
}
