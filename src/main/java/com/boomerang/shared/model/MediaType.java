package com.boomerang.shared.model;

import java.util.Locale;

public enum MediaType {
    IMAGE, AUDIO, VIDEO, FILE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
