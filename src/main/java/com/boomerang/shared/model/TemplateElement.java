package com.boomerang.shared.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** One card of a generic template. Only {@code title} is required. */
public record TemplateElement(
    String title,
    String subtitle,
    String imageUrl,
    String defaultActionUrl,
    List<Button> buttons
) {

    public TemplateElement {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Template element requires a title");
        }
        buttons = buttons != null ? List.copyOf(buttons) : List.of();
    }

    Map<String, Object> toPayload() {
        var out = new LinkedHashMap<String, Object>();
        out.put("title", title);
        if (subtitle != null) out.put("subtitle", subtitle);
        if (imageUrl != null) out.put("image_url", imageUrl);
        if (defaultActionUrl != null) {
            out.put("default_action", Map.of("type", "web_url", "url", defaultActionUrl));
        }
        if (!buttons.isEmpty()) out.put("buttons", Button.toPayload(buttons));
        return out;
    }
}
