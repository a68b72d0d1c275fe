package com.aviax.media.backend;

import com.aviax.common.config.AviaxConfig;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Produces the shared anti-detection option set. Each call draws a new user
 * agent and sleep interval so consecutive attempts do not look identical.
 */
public class AntiDetectionProfile {

    private final AviaxConfig.ExtractionConfig config;

    public AntiDetectionProfile(AviaxConfig.ExtractionConfig config) {
        if (config.getUserAgents() == null || config.getUserAgents().isEmpty()) {
            throw new IllegalArgumentException("at least one user agent is required");
        }
        this.config = config;
    }

    /**
     * A builder pre-filled with the anti-detection settings; callers add the
     * format and output options.
     */
    public ExtractionOptions.ExtractionOptionsBuilder newOptions() {
        return ExtractionOptions.builder()
                .quiet(true)
                .noWarnings(true)
                .retries(config.getBackendRetries())
                .geoBypass(true)
                .forceIpv4(true)
                .socketTimeout(Duration.ofSeconds(config.getSocketTimeoutSeconds()))
                .skipStreams(nullToEmpty(config.getSkipStreams()))
                .playerClients(nullToEmpty(config.getPlayerClients()))
                .userAgent(pickUserAgent())
                .referer(config.getReferer())
                .throttledRate(config.getThrottledRate())
                .sleepIntervalSeconds(pickSleepInterval());
    }

    String pickUserAgent() {
        List<String> agents = config.getUserAgents();
        return agents.get(ThreadLocalRandom.current().nextInt(agents.size()));
    }

    int pickSleepInterval() {
        int min = Math.max(0, config.getMinSleepIntervalSeconds());
        int max = Math.max(min, config.getMaxSleepIntervalSeconds());
        return ThreadLocalRandom.current().nextInt(min, max + 1);
    }

    private static List<String> nullToEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }
}
