package com.boomerang.shared.model;

public record Referral(
    String ref,
    String source,
    String type
) {}
