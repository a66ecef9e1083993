package com.boomerang.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Verifies the {@code X-Hub-Signature} family of headers: an HMAC of the raw request body keyed
 * with the app secret. Must run on the bytes as received, before any JSON parsing.
 *
 * <p>Fails closed: a missing header, unknown prefix, bad hex or mismatch all yield {@code false}.
 */
public class SignatureValidator {

    private static final Logger log = LoggerFactory.getLogger(SignatureValidator.class);

    private final SecretKeySpec key;
    private final SignatureAlgorithm algorithm;

    public SignatureValidator(String appSecret, SignatureAlgorithm algorithm) {
        if (appSecret == null || appSecret.isEmpty()) {
            throw new IllegalArgumentException("App secret must not be empty");
        }
        this.algorithm = algorithm;
        this.key = new SecretKeySpec(appSecret.getBytes(StandardCharsets.UTF_8), algorithm.macName());
    }

    public SignatureAlgorithm algorithm() {
        return algorithm;
    }

    public boolean isValid(byte[] rawBody, String signatureHeader) {
        if (rawBody == null || signatureHeader == null) return false;
        var prefix = algorithm.prefix() + "=";
        var header = signatureHeader.trim();
        if (!header.startsWith(prefix)) return false;

        byte[] claimed;
        try {
            claimed = HexFormat.of().parseHex(header.substring(prefix.length()));
        } catch (IllegalArgumentException e) {
            return false;
        }
        var expected = digest(rawBody);
        return expected != null && MessageDigest.isEqual(expected, claimed);
    }

    /** Header value the platform would send for {@code rawBody}. */
    public String sign(byte[] rawBody) {
        var digest = digest(rawBody);
        if (digest == null) {
            throw new IllegalStateException(algorithm.macName() + " is not available");
        }
        return algorithm.prefix() + "=" + HexFormat.of().formatHex(digest);
    }

    private byte[] digest(byte[] rawBody) {
        try {
            var mac = Mac.getInstance(algorithm.macName());
            mac.init(key);
            return mac.doFinal(rawBody);
        } catch (GeneralSecurityException e) {
            log.error("Cannot compute {} for webhook signature", algorithm.macName(), e);
            return null;
        }
    }
}
