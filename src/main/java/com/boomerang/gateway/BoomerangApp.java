package com.boomerang.gateway;

import com.boomerang.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.boomerang.gateway")
public class BoomerangApp {

    private static final Logger log = LoggerFactory.getLogger(BoomerangApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        if (config.messenger().pageAccessToken().isBlank()) {
            log.warn("Page access token not configured. Set messenger.page-access-token in ~/.boomerang/config.yaml");
        }
        if (config.messenger().appSecret().isBlank()) {
            log.warn("App secret not configured, every webhook delivery will be rejected. Set messenger.app-secret in ~/.boomerang/config.yaml");
        }
        if (config.messenger().verifyToken().isBlank()) {
            log.warn("Verify token not configured, subscription handshakes will fail. Set messenger.verify-token in ~/.boomerang/config.yaml");
        }

        var app = new SpringApplication(BoomerangApp.class);
        app.setDefaultProperties(Map.of(
                "server.address", config.serverHost(),
                "server.port", String.valueOf(config.serverPort())));
        ApplicationContextInitializer<ConfigurableApplicationContext> registerConfig =
                ctx -> ctx.getBeanFactory().registerSingleton("boomerangConfig", config);
        app.addInitializers(registerConfig);
        app.run(args);
        log.info("Listening on {}:{}", config.serverHost(), config.serverPort());
    }
}
