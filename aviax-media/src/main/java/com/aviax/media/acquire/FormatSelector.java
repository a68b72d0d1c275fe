package com.aviax.media.acquire;

import com.aviax.media.AcquisitionMode;

/**
 * Maps an {@link AcquisitionMode} to backend format and output naming.
 * Pure and deterministic.
 */
public final class FormatSelector {

    private FormatSelector() {
    }

    static final String AUDIO_FORMAT = "bestaudio[ext=m4a]/bestaudio";
    static final String VIDEO_FORMAT = "bestvideo[height<=?720][width<=?1280][ext=mp4]+bestaudio[ext=m4a]"
            + "/bestvideo[height<=?720]+bestaudio"
            + "/best[height<=?720]";
    /** Single progressive stream, used when no merge is possible (direct links). */
    public static final String PROGRESSIVE_VIDEO_FORMAT = "best[height<=?720][width<=?1280]";
    static final String MERGE_CONTAINER = "mp4";

    public static FormatSelection select(AcquisitionMode mode) {
        return switch (mode.kind()) {
            case AUDIO_ONLY -> new FormatSelection(
                    AUDIO_FORMAT, FormatSelection.VIDEO_ID + "." + FormatSelection.EXT, null, null, false);
            case VIDEO_UP_TO_720 -> new FormatSelection(
                    VIDEO_FORMAT, FormatSelection.VIDEO_ID + "." + FormatSelection.EXT, null, MERGE_CONTAINER, false);
            case NAMED_SONG_AUDIO -> new FormatSelection(
                    mode.formatId(), FormatSelection.TITLE + "." + FormatSelection.EXT, mode.title(), null, true);
            case NAMED_SONG_VIDEO -> new FormatSelection(
                    mode.formatId() + "+bestaudio[ext=m4a]/" + mode.formatId() + "+bestaudio",
                    FormatSelection.TITLE + "." + MERGE_CONTAINER, mode.title(), MERGE_CONTAINER, false);
        };
    }
}
