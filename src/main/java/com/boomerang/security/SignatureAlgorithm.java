package com.boomerang.security;

import java.util.Locale;

public enum SignatureAlgorithm {
    SHA1("sha1", "HmacSHA1", "X-Hub-Signature"),
    SHA256("sha256", "HmacSHA256", "X-Hub-Signature-256");

    private final String prefix;
    private final String macName;
    private final String headerName;

    SignatureAlgorithm(String prefix, String macName, String headerName) {
        this.prefix = prefix;
        this.macName = macName;
        this.headerName = headerName;
    }

    /** Prefix of the header value, as in {@code sha1=<hex>}. */
    public String prefix() { return prefix; }

    public String macName() { return macName; }

    public String headerName() { return headerName; }

    public static SignatureAlgorithm fromName(String name) {
        var normalized = name.trim().toLowerCase(Locale.ROOT).replace("-", "");
        for (var alg : values()) {
            if (alg.prefix.equals(normalized)) return alg;
        }
        throw new IllegalArgumentException("Unsupported signature algorithm: " + name);
    }
}
