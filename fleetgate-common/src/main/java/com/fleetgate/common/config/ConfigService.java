package com.fleetgate.common.config;

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
 * Loads and caches FleetGate configuration.
 * <p>
 * The file is JSON with {@code ${VAR}} / {@code ${VAR:-default}} substitution. A missing
 * file yields defaults. Crash guard thresholds can additionally be overridden from the
 * environment.
 */
@Slf4j
public class ConfigService {

    public static final String ENV_CRASH_THRESHOLD = "FLEETGATE_PLUGIN_CRASH_THRESHOLD";
    public static final String ENV_CRASH_WINDOW_MS = "FLEETGATE_PLUGIN_CRASH_WINDOW_MS";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, FleetConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    /** Constructor for testing – allows injecting the environment lookup. */
    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = expandHome(configPath);
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
    public FleetConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public FleetConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private FleetConfig doLoadConfig() {
        FleetConfig config;
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            config = new FleetConfig();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, FleetConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                log.error("Failed to load config from: {}", configPath, e);
                config = new FleetConfig();
            }
        }
        return applyEnvOverrides(applyDefaults(config));
    }

    /**
     * Replace {@code ${VAR}} and {@code ${VAR:-default}} placeholders.
     * Unresolved placeholders without a default become empty strings.
     */
    String substituteEnvVars(String raw) {
        Matcher m = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = env.apply(m.group(1));
            if (value == null || value.isEmpty()) {
                value = m.group(2) != null ? m.group(2) : "";
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private FleetConfig applyDefaults(FleetConfig config) {
        if (config.getStore() == null) config.setStore(new FleetConfig.StoreConfig());
        if (config.getQueue() == null) config.setQueue(new FleetConfig.QueueConfig());
        if (config.getScheduler() == null) config.setScheduler(new FleetConfig.SchedulerConfig());
        if (config.getCrashGuard() == null) config.setCrashGuard(new FleetConfig.CrashGuardConfig());
        if (config.getCredentials() == null) config.setCredentials(new FleetConfig.CredentialsConfig());
        if (config.getTasks() == null) config.setTasks(new FleetConfig.TasksConfig());
        if (config.getAgentRunner() == null) config.setAgentRunner(new FleetConfig.AgentRunnerConfig());
        return config;
    }

    private FleetConfig applyEnvOverrides(FleetConfig config) {
        for (Map.Entry<String, String> e : Map.of(
                ENV_CRASH_THRESHOLD, "threshold",
                ENV_CRASH_WINDOW_MS, "windowMs").entrySet()) {
            String raw = env.apply(e.getKey());
            if (raw == null || raw.isBlank()) {
                continue;
            }
            try {
                long parsed = Long.parseLong(raw.trim());
                if (parsed <= 0) {
                    log.warn("Ignoring non-positive {}={}", e.getKey(), raw);
                } else if ("threshold".equals(e.getValue())) {
                    config.getCrashGuard().setThreshold((int) parsed);
                } else {
                    config.getCrashGuard().setWindowMs(parsed);
                }
            } catch (NumberFormatException ex) {
                log.warn("Ignoring invalid {}={}", e.getKey(), raw);
            }
        }
        return config;
    }

    /**
     * Expand a leading {@code ~} to the user home directory.
     */
    public static Path expandHome(Path path) {
        String pathStr = path.toString();
        if (pathStr.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        return path;
    }
}
