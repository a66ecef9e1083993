package com.boomerang.shared.model;

public record QuickReply(
    String contentType,
    String title,
    String payload,
    String imageUrl
) {

    public static QuickReply text(String title, String payload) {
        return new QuickReply("text", title, payload, null);
    }

    public static QuickReply text(String title, String payload, String imageUrl) {
        return new QuickReply("text", title, payload, imageUrl);
    }

    public static QuickReply location() {
        return new QuickReply("location", null, null, null);
    }
}
