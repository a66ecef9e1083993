package com.boomerang.shared.model;

/** Outcome of one outbound call, after any retries. */
public sealed interface SendResult permits SendResult.Delivered, SendResult.Failed {

    int attempts();

    default boolean isSuccess() {
        return this instanceof Delivered;
    }

    /** {@code messageId} is set for messages, {@code attachmentId} for uploads. */
    record Delivered(String messageId, String recipientId, String attachmentId, int attempts)
            implements SendResult {}

    /**
     * @param statusCode HTTP status, 0 when no response was received
     * @param errorCode platform error code from the response body, 0 when absent
     */
    record Failed(FailureClass failureClass, int statusCode, int errorCode, String message, int attempts)
            implements SendResult {}
}
