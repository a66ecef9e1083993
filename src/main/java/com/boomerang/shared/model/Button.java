package com.boomerang.shared.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public sealed interface Button permits Button.Url, Button.Postback {

    Map<String, Object> toPayload();

    record Url(String title, String url) implements Button {
        @Override
        public Map<String, Object> toPayload() {
            return Map.of("type", "web_url", "title", title, "url", url);
        }
    }

    record Postback(String title, String payload) implements Button {
        @Override
        public Map<String, Object> toPayload() {
            return Map.of("type", "postback", "title", title, "payload", payload);
        }
    }

    static List<Map<String, Object>> toPayload(List<Button> buttons) {
        var out = new ArrayList<Map<String, Object>>();
        if (buttons != null) {
            for (var button : buttons) out.add(button.toPayload());
        }
        return out;
    }
}
