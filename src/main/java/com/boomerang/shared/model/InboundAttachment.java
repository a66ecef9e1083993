package com.boomerang.shared.model;

/** Attachment carried by a received or echoed message. */
public sealed interface InboundAttachment permits InboundAttachment.Media, InboundAttachment.Location {

    String type();

    /** Image, audio, video, file or fallback content. {@code url} may be null for fallbacks. */
    record Media(String type, String url) implements InboundAttachment {}

    record Location(double latitude, double longitude) implements InboundAttachment {
        @Override
        public String type() {
            return "location";
        }
    }
}
