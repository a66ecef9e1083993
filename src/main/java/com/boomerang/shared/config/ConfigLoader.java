package com.boomerang.shared.config;

import com.boomerang.attachments.ConsumptionPolicy;
import com.boomerang.security.SignatureAlgorithm;
import com.boomerang.shared.BoomerangException;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".boomerang", "config.yaml"
    );

    public static BoomerangConfig load() {
        return load(DEFAULT_PATH);
    }

    public static BoomerangConfig load(Path path) {
        return load(path, System::getenv);
    }

    public static BoomerangConfig load(Path path, Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new BoomerangException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = section(raw, "server");
        var messenger = section(raw, "messenger");
        var dispatch = section(raw, "dispatch");
        var retry = section(raw, "retry");
        var attachments = section(raw, "attachments");

        var defaults = BoomerangConfig.defaults();
        return new BoomerangConfig(
            envOrDefault(env, "BOOMERANG_HOST",
                stringValue(server, "host", defaults.serverHost())),
            Integer.parseInt(envOrDefault(env, "BOOMERANG_PORT",
                stringValue(server, "port", String.valueOf(defaults.serverPort())))),
            parseMessengerConfig(messenger, env),
            parseDispatchConfig(dispatch),
            parseRetryConfig(retry),
            parseAttachmentConfig(attachments, env)
        );
    }

    private static BoomerangConfig.MessengerConfig parseMessengerConfig(
            Map<String, Object> messenger, Function<String, String> env) {
        var defaults = BoomerangConfig.MessengerConfig.defaults();
        return new BoomerangConfig.MessengerConfig(
            envOrDefault(env, "BOOMERANG_VERIFY_TOKEN",
                stringValue(messenger, "verify-token", defaults.verifyToken())),
            envOrDefault(env, "BOOMERANG_PAGE_TOKEN",
                stringValue(messenger, "page-access-token", defaults.pageAccessToken())),
            envOrDefault(env, "BOOMERANG_APP_SECRET",
                stringValue(messenger, "app-secret", defaults.appSecret())),
            SignatureAlgorithm.fromName(
                stringValue(messenger, "signature-algorithm", defaults.signatureAlgorithm().prefix())),
            stringValue(messenger, "graph-base-url", defaults.graphBaseUrl()),
            intValue(messenger, "request-timeout", defaults.requestTimeoutSeconds())
        );
    }

    private static BoomerangConfig.DispatchConfig parseDispatchConfig(Map<String, Object> dispatch) {
        var defaults = BoomerangConfig.DispatchConfig.defaults();
        return new BoomerangConfig.DispatchConfig(
            intValue(dispatch, "worker-threads", defaults.workerThreads()),
            longValue(dispatch, "shutdown-grace", defaults.shutdownGraceSeconds())
        );
    }

    private static RetryConfig parseRetryConfig(Map<String, Object> retry) {
        var defaults = RetryConfig.defaults();
        return new RetryConfig(
            intValue(retry, "max-attempts", defaults.maxAttempts()),
            longValue(retry, "base-delay-ms", defaults.baseDelayMs()),
            longValue(retry, "max-delay-ms", defaults.maxDelayMs())
        );
    }

    private static AttachmentConfig parseAttachmentConfig(
            Map<String, Object> attachments, Function<String, String> env) {
        var defaults = AttachmentConfig.defaults();
        return new AttachmentConfig(
            envOrDefault(env, "BOOMERANG_BASE_URL",
                stringValue(attachments, "base-url", defaults.baseUrl())),
            longValue(attachments, "ttl", defaults.ttlSeconds()),
            longValue(attachments, "sweep-interval", defaults.sweepIntervalSeconds()),
            ConsumptionPolicy.fromName(
                stringValue(attachments, "policy", defaults.policy().configName()))
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> raw, String name) {
        var value = raw.get(name);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    // an empty YAML value ("key:") loads as null and falls back like a missing key
    private static String stringValue(Map<String, Object> section, String key, String fallback) {
        var value = section.get(key);
        return value != null ? String.valueOf(value) : fallback;
    }

    private static int intValue(Map<String, Object> section, String key, int fallback) {
        return Integer.parseInt(stringValue(section, key, String.valueOf(fallback)));
    }

    private static long longValue(Map<String, Object> section, String key, long fallback) {
        return Long.parseLong(stringValue(section, key, String.valueOf(fallback)));
    }

    private static String envOrDefault(Function<String, String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null ? val : fallback;
    }
}
