package com.boomerang.send;

public record TransportResponse(
    int statusCode,
    String body
) {}
