package com.aviax.common.config;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the pipeline configuration from a JSON file.
 * The short cache TTL lets runtime toggles (such as direct-link mode) take
 * effect without restarting the host process.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, AviaxConfig> cache;
    private final Path configPath;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
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
    public AviaxConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public AviaxConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Persist the config to disk and drop the cached copy.
     */
    public void saveConfig(AviaxConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(config);
        Files.writeString(configPath, json);
        cache.invalidateAll();
        log.info("Config saved to: {}", configPath);
    }

    /**
     * Flip the direct-link flag and persist it.
     */
    public void setDirectLinkEnabled(boolean enabled) throws IOException {
        AviaxConfig config = reloadConfig();
        config.getDownload().setDirectLinkEnabled(enabled);
        saveConfig(config);
    }

    /**
     * Get the config file path.
     */
    public Path getConfigPath() {
        return configPath;
    }

    private AviaxConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new AviaxConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            AviaxConfig config = applyDefaults(objectMapper.readValue(raw, AviaxConfig.class));
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new AviaxConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Map<String, String> env = System.getenv();
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config sections.
     */
    static AviaxConfig applyDefaults(AviaxConfig config) {
        if (config.getPacer() == null) {
            config.setPacer(new AviaxConfig.PacerConfig());
        }
        if (config.getExtraction() == null) {
            config.setExtraction(new AviaxConfig.ExtractionConfig());
        }
        if (config.getSearch() == null) {
            config.setSearch(new AviaxConfig.SearchConfig());
        }
        if (config.getDownload() == null) {
            config.setDownload(new AviaxConfig.DownloadConfig());
        }
        AviaxConfig.PacerConfig pacer = config.getPacer();
        if (pacer.getMaxDelayMs() < pacer.getMinDelayMs()) {
            pacer.setMaxDelayMs(pacer.getMinDelayMs());
        }
        AviaxConfig.ExtractionConfig extraction = config.getExtraction();
        if (extraction.getAttempts() < 1) {
            extraction.setAttempts(1);
        }
        if (extraction.getMaxSleepIntervalSeconds() < extraction.getMinSleepIntervalSeconds()) {
            extraction.setMaxSleepIntervalSeconds(extraction.getMinSleepIntervalSeconds());
        }
        if (extraction.getWorkerThreads() < 1) {
            extraction.setWorkerThreads(1);
        }
        if (config.getDownload().getWorkerThreads() < 1) {
            config.getDownload().setWorkerThreads(1);
        }
        return config;
    }

    /**
     * Defaults without touching the filesystem.
     */
    public static AviaxConfig defaults() {
        return applyDefaults(new AviaxConfig());
    }
}
