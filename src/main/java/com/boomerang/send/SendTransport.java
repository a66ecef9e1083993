package com.boomerang.send;

import java.util.concurrent.CompletableFuture;

/** Posts a JSON body to a Graph API path. Network failures complete the future exceptionally. */
@FunctionalInterface
public interface SendTransport {
    CompletableFuture<TransportResponse> post(String path, String jsonBody);
}
