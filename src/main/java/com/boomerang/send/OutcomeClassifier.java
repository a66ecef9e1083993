package com.boomerang.send;

import com.boomerang.shared.model.FailureClass;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Sorts attempt outcomes into success, retryable and fatal.
 *
 * <p>Retryable: network failures, 408, 429, 5xx, and Graph throttling or transient errors
 * (which the platform may report with a 400 status). Every other 4xx is fatal.
 */
class OutcomeClassifier {

    // application, user, page and custom rate limits
    static final Set<Integer> THROTTLING_CODES = Set.of(4, 17, 32, 613);

    private final ObjectMapper mapper;

    OutcomeClassifier(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    Outcome classify(TransportResponse response) {
        int status = response.statusCode();
        var body = readBody(response.body());
        if (status >= 200 && status < 300) {
            return Outcome.success(status, body);
        }
        var error = body.path("error");
        int code = error.path("code").asInt(0);
        var message = error.path("message").asText("HTTP " + status);
        boolean retryable = status == 408 || status == 429 || status >= 500
                || THROTTLING_CODES.contains(code)
                || error.path("is_transient").asBoolean(false);
        return Outcome.failure(retryable ? FailureClass.RETRYABLE : FailureClass.FATAL, status, code, message);
    }

    Outcome classify(Throwable error) {
        var cause = unwrap(error);
        var message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (cause instanceof IOException || cause instanceof TimeoutException) {
            return Outcome.failure(FailureClass.RETRYABLE, 0, 0, message);
        }
        return Outcome.failure(FailureClass.FATAL, 0, 0, message);
    }

    private JsonNode readBody(String body) {
        if (body == null || body.isBlank()) return MissingNode.getInstance();
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            return MissingNode.getInstance();
        }
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
