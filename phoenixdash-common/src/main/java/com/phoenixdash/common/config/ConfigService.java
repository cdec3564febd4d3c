package com.phoenixdash.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the dashboard configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, PhoenixDashConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public PhoenixDashConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public PhoenixDashConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private PhoenixDashConfig doLoadConfig() {
        try {
            if (!Files.exists(configPath)) {
                log.warn("Config file not found: {}, using defaults", configPath);
                return applyDefaults(new PhoenixDashConfig());
            }
            String raw = Files.readString(configPath);
            raw = substituteEnvVars(raw);

            PhoenixDashConfig config = applyDefaults(objectMapper.readValue(raw, PhoenixDashConfig.class));
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new PhoenixDashConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config sections. The default phoenixd
     * endpoint honours PHOENIXD_URL / PHOENIXD_PASSWORD.
     */
    PhoenixDashConfig applyDefaults(PhoenixDashConfig config) {
        if (config.getPhoenixd() == null) {
            config.setPhoenixd(new PhoenixDashConfig.PhoenixdConfig());
        }
        if (config.getRecurring() == null) {
            config.setRecurring(new PhoenixDashConfig.RecurringConfig());
        }
        if (config.getLnurl() == null) {
            config.setLnurl(new PhoenixDashConfig.LnurlConfig());
        }

        PhoenixDashConfig.PhoenixdConfig phoenixd = config.getPhoenixd();
        String envUrl = env.apply("PHOENIXD_URL");
        if (envUrl != null && !envUrl.isBlank()) {
            phoenixd.setDefaultUrl(envUrl);
        }
        String envPassword = env.apply("PHOENIXD_PASSWORD");
        if (envPassword != null) {
            phoenixd.setDefaultPassword(envPassword);
        }
        if (phoenixd.getConnections() == null) {
            phoenixd.setConnections(new java.util.ArrayList<>());
        }
        return config;
    }

    /** Environment lookup backed by a fixed map, for tests and embedding. */
    public static Function<String, String> envFrom(Map<String, String> values) {
        return values::get;
    }
}
