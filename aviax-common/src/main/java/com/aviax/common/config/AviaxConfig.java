package com.aviax.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for the media pipeline.
 * Every tuning constant lives here with its default so deployments can
 * override it from the JSON config file.
 */
@Data
public class AviaxConfig {

    /** Request pacing between calls to the extraction backend. */
    private PacerConfig pacer;

    /** Primary extraction backend settings. */
    private ExtractionConfig extraction;

    /** Secondary search provider settings. */
    private SearchConfig search;

    /** Download and direct-link settings. */
    private DownloadConfig download;

    // --- Nested config types ---

    @Data
    public static class PacerConfig {
        private long minDelayMs = 1_500;
        private long maxDelayMs = 3_000;
    }

    @Data
    public static class ExtractionConfig {
        /** yt-dlp executable name or absolute path. */
        private String executable = "yt-dlp";
        private int attempts = 3;
        private int socketTimeoutSeconds = 30;
        /** Hard cap on a single backend subprocess run. */
        private int processTimeoutSeconds = 600;
        private long backoffSeedMs = 1_000;
        private long backoffJitterMs = 500;
        /** Threads running metadata, playlist and format lookups. */
        private int workerThreads = 4;
        /** Retries the backend performs internally per call. */
        private int backendRetries = 3;
        private String referer = "https://www.youtube.com/";
        private String throttledRate = "1M";
        private int minSleepIntervalSeconds = 1;
        private int maxSleepIntervalSeconds = 3;
        private List<String> playerClients = new ArrayList<>(List.of("android", "web"));
        private List<String> skipStreams = new ArrayList<>(List.of("dash", "hls"));
        private List<String> userAgents = new ArrayList<>(List.of(
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
                        + "Chrome/91.0.4472.124 Safari/537.36",
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) "
                        + "Version/14.0.3 Safari/605.1.15",
                "Mozilla/5.0 (iPhone; CPU iPhone OS 14_6 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) "
                        + "Version/14.0 Mobile/15E148 Safari/604.1"));
    }

    @Data
    public static class SearchConfig {
        private String endpoint = "https://www.youtube.com/youtubei/v1/search";
        private String clientVersion = "2.20240101.00.00";
        private String language = "en";
        private String region = "US";
        private int timeoutSeconds = 15;
    }

    @Data
    public static class DownloadConfig {
        private String directory = "downloads";
        /** Canonical extension for audio results, without the dot. */
        private String audioExtension = "mp3";
        private String audioQuality = "192";
        /** Return a remote stream URL for 720p video instead of downloading. */
        private boolean directLinkEnabled = false;
        private int directLinkTimeoutSeconds = 20;
        private int workerThreads = 4;
        private int playlistLimit = 25;
    }
}
