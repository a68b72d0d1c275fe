package com.aviax.media.backend;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Every option the extraction backend recognizes, with explicit defaults.
 * Built fresh per attempt; immutable once built.
 */
@Value
@Builder(toBuilder = true)
public class ExtractionOptions {

    /** Backend format selector, e.g. {@code bestaudio[ext=m4a]/bestaudio}. */
    String format;

    @Builder.Default
    boolean quiet = true;

    @Builder.Default
    boolean noWarnings = true;

    /** Retries performed inside the backend itself. */
    @Builder.Default
    int retries = 3;

    @Builder.Default
    boolean geoBypass = true;

    @Builder.Default
    boolean forceIpv4 = true;

    @Builder.Default
    Duration socketTimeout = Duration.ofSeconds(30);

    /** Stream variants the extractor should skip (dash, hls). */
    @Singular("skipStream")
    List<String> skipStreams;

    @Singular
    List<String> playerClients;

    String userAgent;

    String referer;

    /** Minimum download rate below which the backend assumes throttling, e.g. {@code 1M}. */
    String throttledRate;

    /** Seconds to sleep before each download. */
    @Builder.Default
    int sleepIntervalSeconds = 0;

    /** Output template in backend syntax. Only meaningful when downloading. */
    String outputTemplate;

    /** Container to merge separate video and audio into. */
    String mergeOutputFormat;

    /** Audio codec to transcode to after download; {@code null} for none. */
    String extractAudioFormat;

    String audioQuality;

    @Builder.Default
    boolean noPlaylist = false;

    @Builder.Default
    boolean flatPlaylist = false;

    /** Last playlist index to enumerate; 0 for no limit. */
    @Builder.Default
    int playlistEnd = 0;

    /**
     * Render as yt-dlp command-line arguments (without executable or query).
     */
    public List<String> toArguments() {
        List<String> args = new ArrayList<>();
        if (format != null && !format.isBlank()) {
            args.add("-f");
            args.add(format);
        }
        if (quiet) {
            args.add("--quiet");
        }
        if (noWarnings) {
            args.add("--no-warnings");
        }
        args.add("--retries");
        args.add(String.valueOf(Math.max(0, retries)));
        if (geoBypass) {
            args.add("--geo-bypass");
        }
        if (forceIpv4) {
            args.add("--force-ipv4");
        }
        if (socketTimeout != null) {
            args.add("--socket-timeout");
            args.add(String.valueOf(Math.max(1, socketTimeout.toSeconds())));
        }
        String extractorArgs = extractorArgs();
        if (!extractorArgs.isEmpty()) {
            args.add("--extractor-args");
            args.add(extractorArgs);
        }
        if (userAgent != null && !userAgent.isBlank()) {
            args.add("--add-header");
            args.add("User-Agent:" + userAgent);
        }
        if (referer != null && !referer.isBlank()) {
            args.add("--add-header");
            args.add("Referer:" + referer);
        }
        if (throttledRate != null && !throttledRate.isBlank()) {
            args.add("--throttled-rate");
            args.add(throttledRate);
        }
        if (sleepIntervalSeconds > 0) {
            args.add("--sleep-interval");
            args.add(String.valueOf(sleepIntervalSeconds));
        }
        if (outputTemplate != null && !outputTemplate.isBlank()) {
            args.add("-o");
            args.add(outputTemplate);
        }
        if (mergeOutputFormat != null && !mergeOutputFormat.isBlank()) {
            args.add("--merge-output-format");
            args.add(mergeOutputFormat);
        }
        if (extractAudioFormat != null && !extractAudioFormat.isBlank()) {
            args.add("-x");
            args.add("--audio-format");
            args.add(extractAudioFormat);
            if (audioQuality != null && !audioQuality.isBlank()) {
                args.add("--audio-quality");
                args.add(audioQuality);
            }
        }
        if (noPlaylist) {
            args.add("--no-playlist");
        }
        if (flatPlaylist) {
            args.add("--flat-playlist");
        }
        if (playlistEnd > 0) {
            args.add("--playlist-end");
            args.add(String.valueOf(playlistEnd));
        }
        return args;
    }

    private String extractorArgs() {
        List<String> parts = new ArrayList<>();
        if (!skipStreams.isEmpty()) {
            parts.add("skip=" + String.join(",", skipStreams));
        }
        if (!playerClients.isEmpty()) {
            parts.add("player_client=" + String.join(",", playerClients));
        }
        return parts.isEmpty() ? "" : "youtube:" + String.join(";", parts);
    }
}
