package com.boomerang.attachments;

import java.security.SecureRandom;
import java.util.Base64;

/** 256-bit URL-safe tokens; never derived from file content or time. */
class TokenGenerator {

    private final SecureRandom random = new SecureRandom();

    String next() {
        var bytes = new byte[32];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
