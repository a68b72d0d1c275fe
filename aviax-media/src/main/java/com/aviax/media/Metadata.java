package com.aviax.media;

import com.aviax.common.infra.DurationFormat;

/**
 * Normalized media metadata. All fields are non-null; a total resolution
 * failure yields {@link #SENTINEL} instead of absent values.
 *
 * @param title           display title
 * @param durationSeconds non-negative duration
 * @param videoId         platform video id, empty for the sentinel
 * @param thumbnailUrl    thumbnail URL without query string, possibly empty
 */
public record Metadata(String title, long durationSeconds, String videoId, String thumbnailUrl) {

    public static final String UNKNOWN_TITLE = "Unknown Title";

    /** Placeholder returned when every resolution strategy failed. */
    public static final Metadata SENTINEL = new Metadata(UNKNOWN_TITLE, 0, "", "");

    public Metadata {
        title = title == null || title.isBlank() ? UNKNOWN_TITLE : title;
        durationSeconds = Math.max(0, durationSeconds);
        videoId = videoId == null ? "" : videoId;
        thumbnailUrl = thumbnailUrl == null ? "" : thumbnailUrl;
    }

    /**
     * Duration as {@code M:SS}, always derived from {@link #durationSeconds()}.
     */
    public String durationDisplay() {
        return DurationFormat.formatSeconds(durationSeconds);
    }

    public boolean isSentinel() {
        return videoId.isEmpty() && UNKNOWN_TITLE.equals(title);
    }

    /**
     * Watch page link, or empty for the sentinel.
     */
    public String link() {
        return videoId.isEmpty() ? "" : References.WATCH_URL + videoId;
    }
}
