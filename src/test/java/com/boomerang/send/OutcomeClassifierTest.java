package com.boomerang.send;

import com.boomerang.shared.model.FailureClass;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;

class OutcomeClassifierTest {

    private final OutcomeClassifier classifier = new OutcomeClassifier(new ObjectMapper());

    @Test
    void twoHundredIsSuccess() {
        var outcome = classifier.classify(new TransportResponse(200, "{\"message_id\":\"mid.1\"}"));

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.body().path("message_id").asText()).isEqualTo("mid.1");
    }

    @Test
    void serverErrorsAndRateLimitsAreRetryable() {
        assertThat(classOf(500, "")).isEqualTo(FailureClass.RETRYABLE);
        assertThat(classOf(503, "<html>")).isEqualTo(FailureClass.RETRYABLE);
        assertThat(classOf(429, "{}")).isEqualTo(FailureClass.RETRYABLE);
        assertThat(classOf(408, "{}")).isEqualTo(FailureClass.RETRYABLE);
    }

    @Test
    void throttlingCodesInA400AreRetryable() {
        var outcome = classifier.classify(new TransportResponse(400,
                "{\"error\":{\"message\":\"(#613) Calls to this api have exceeded the rate limit.\",\"code\":613}}"));

        assertThat(outcome.failureClass()).isEqualTo(FailureClass.RETRYABLE);
        assertThat(outcome.errorCode()).isEqualTo(613);
        assertThat(outcome.message()).contains("rate limit");
        assertThat(classOf(400, "{\"error\":{\"code\":2,\"is_transient\":true}}")).isEqualTo(FailureClass.RETRYABLE);
    }

    @Test
    void otherClientErrorsAreFatal() {
        var outcome = classifier.classify(new TransportResponse(400,
                "{\"error\":{\"message\":\"(#100) No matching user found\",\"code\":100,\"error_subcode\":2018001}}"));

        assertThat(outcome.failureClass()).isEqualTo(FailureClass.FATAL);
        assertThat(outcome.statusCode()).isEqualTo(400);
        assertThat(outcome.errorCode()).isEqualTo(100);
        assertThat(classOf(403, "")).isEqualTo(FailureClass.FATAL);
        assertThat(classOf(404, "not json")).isEqualTo(FailureClass.FATAL);
    }

    @Test
    void transportExceptions() {
        assertThat(classifier.classify(new IOException("Connection reset")).failureClass())
                .isEqualTo(FailureClass.RETRYABLE);
        assertThat(classifier.classify(new CompletionException(new HttpTimeoutException("request timed out")))
                .failureClass()).isEqualTo(FailureClass.RETRYABLE);
        assertThat(classifier.classify(new IllegalStateException("bug")).failureClass())
                .isEqualTo(FailureClass.FATAL);
    }

    private FailureClass classOf(int status, String body) {
        return classifier.classify(new TransportResponse(status, body)).failureClass();
    }
}
