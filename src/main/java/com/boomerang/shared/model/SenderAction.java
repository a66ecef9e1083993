package com.boomerang.shared.model;

import java.util.Locale;

public enum SenderAction {
    MARK_SEEN, TYPING_ON, TYPING_OFF;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
