package com.boomerang.gateway;

import com.boomerang.attachments.ConsumptionPolicy;
import com.boomerang.security.SignatureAlgorithm;
import com.boomerang.shared.config.AttachmentConfig;
import com.boomerang.shared.config.BoomerangConfig;
import com.boomerang.shared.config.RetryConfig;

public final class GatewayFixtures {

    public static final String VERIFY_TOKEN = "verify-me";
    public static final String APP_SECRET = "app-secret";

    private GatewayFixtures() {
    }

    public static BoomerangConfig config() {
        return BoomerangConfig.defaults()
                .withMessenger(new BoomerangConfig.MessengerConfig(VERIFY_TOKEN, "page-token", APP_SECRET,
                        SignatureAlgorithm.SHA256, "https://graph.test/v2.6", 5))
                .withRetry(new RetryConfig(3, 1, 5))
                .withAttachments(new AttachmentConfig("https://bot.example.com", 60, 30, ConsumptionPolicy.SERVE_ONCE));
    }

    public static String textEvent(String sender, String text) {
        return "{\"object\":\"page\",\"entry\":[{\"id\":\"PAGE\",\"time\":1,\"messaging\":["
                + "{\"sender\":{\"id\":\"" + sender + "\"},\"recipient\":{\"id\":\"PAGE\"},\"timestamp\":1,"
                + "\"message\":{\"mid\":\"mid.1\",\"text\":\"" + text + "\"}}]}]}";
    }
}
