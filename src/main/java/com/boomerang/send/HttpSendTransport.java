package com.boomerang.send;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/** {@link SendTransport} over the JDK HTTP client, authenticated with the page access token. */
public class HttpSendTransport implements SendTransport {

    private final String baseUrl;
    private final String accessToken;
    private final Duration timeout;
    private final HttpClient httpClient;

    public HttpSendTransport(String graphBaseUrl, String pageAccessToken, Duration timeout) {
        this.baseUrl = graphBaseUrl.replaceAll("/+$", "");
        this.accessToken = URLEncoder.encode(pageAccessToken, StandardCharsets.UTF_8);
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public CompletableFuture<TransportResponse> post(String path, String jsonBody) {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path + "?access_token=" + accessToken))
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(resp -> new TransportResponse(resp.statusCode(), resp.body()));
    }
}
