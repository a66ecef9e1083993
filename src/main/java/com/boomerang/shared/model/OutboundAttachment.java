package com.boomerang.shared.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public sealed interface OutboundAttachment
        permits OutboundAttachment.Media, OutboundAttachment.Saved, OutboundAttachment.Template {

    /** Media fetched by the platform from {@code url}; {@code reusable} asks it to keep a copy. */
    record Media(MediaType type, String url, boolean reusable) implements OutboundAttachment {
        public Media(MediaType type, String url) {
            this(type, url, false);
        }
    }

    /** Media previously uploaded with {@code uploadAttachment}. */
    record Saved(MediaType type, String attachmentId) implements OutboundAttachment {}

    /**
     * Structured template. The payload is passed through to the Send API as-is, so any template
     * type the platform supports can be expressed.
     */
    record Template(Map<String, Object> payload) implements OutboundAttachment {

        public Template {
            payload = Map.copyOf(payload);
        }

        /** A horizontally scrollable list of cards. */
        public static Template generic(List<TemplateElement> elements) {
            var rendered = new ArrayList<Map<String, Object>>();
            for (var element : elements) rendered.add(element.toPayload());
            var payload = new LinkedHashMap<String, Object>();
            payload.put("template_type", "generic");
            payload.put("elements", rendered);
            return new Template(payload);
        }

        public static Template buttons(String text, List<Button> buttons) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("template_type", "button");
            payload.put("text", text);
            payload.put("buttons", Button.toPayload(buttons));
            return new Template(payload);
        }
    }
}
