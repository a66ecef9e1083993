package com.boomerang.shared.config;

import com.boomerang.security.SignatureAlgorithm;

public record BoomerangConfig(
    String serverHost,
    int serverPort,
    MessengerConfig messenger,
    DispatchConfig dispatch,
    RetryConfig retry,
    AttachmentConfig attachments
) {
    /**
     * Credentials and endpoints of the Messenger Platform.
     *
     * @param appSecret shared secret for webhook signatures; blank disables signature checks
     */
    public record MessengerConfig(String verifyToken, String pageAccessToken, String appSecret,
                                  SignatureAlgorithm signatureAlgorithm, String graphBaseUrl,
                                  int requestTimeoutSeconds) {
        public static MessengerConfig defaults() {
            return new MessengerConfig("", "", "", SignatureAlgorithm.SHA1,
                    "https://graph.facebook.com/v2.6", 30);
        }
    }

    public record DispatchConfig(int workerThreads, long shutdownGraceSeconds) {
        public static DispatchConfig defaults() {
            return new DispatchConfig(4, 10);
        }
    }

    public static BoomerangConfig defaults() {
        return new BoomerangConfig(
            "127.0.0.1",
            8000,
            MessengerConfig.defaults(),
            DispatchConfig.defaults(),
            RetryConfig.defaults(),
            AttachmentConfig.defaults()
        );
    }

    public BoomerangConfig withMessenger(MessengerConfig value) {
        return new BoomerangConfig(serverHost, serverPort, value, dispatch, retry, attachments);
    }

    public BoomerangConfig withRetry(RetryConfig value) {
        return new BoomerangConfig(serverHost, serverPort, messenger, dispatch, value, attachments);
    }

    public BoomerangConfig withAttachments(AttachmentConfig value) {
        return new BoomerangConfig(serverHost, serverPort, messenger, dispatch, retry, value);
    }
}
