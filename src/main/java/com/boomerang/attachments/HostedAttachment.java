package com.boomerang.attachments;

public record HostedAttachment(
    String token,
    String url
) {}
