package com.aviax.media;

import java.util.Objects;

/**
 * What to acquire. The named-song modes carry the exact format id chosen from
 * the format catalog and the title used for the output file name.
 */
public record AcquisitionMode(Kind kind, String formatId, String title) {

    public enum Kind {
        AUDIO_ONLY,
        VIDEO_UP_TO_720,
        NAMED_SONG_AUDIO,
        NAMED_SONG_VIDEO
    }

    private static final AcquisitionMode AUDIO = new AcquisitionMode(Kind.AUDIO_ONLY, null, null);
    private static final AcquisitionMode VIDEO = new AcquisitionMode(Kind.VIDEO_UP_TO_720, null, null);

    public AcquisitionMode {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.NAMED_SONG_AUDIO || kind == Kind.NAMED_SONG_VIDEO) {
            if (formatId == null || formatId.isBlank()) {
                throw new IllegalArgumentException("formatId is required for " + kind);
            }
            if (title == null || title.isBlank()) {
                throw new IllegalArgumentException("title is required for " + kind);
            }
        }
    }

    public static AcquisitionMode audioOnly() {
        return AUDIO;
    }

    public static AcquisitionMode videoUpTo720() {
        return VIDEO;
    }

    public static AcquisitionMode namedSongAudio(String formatId, String title) {
        return new AcquisitionMode(Kind.NAMED_SONG_AUDIO, formatId, title);
    }

    public static AcquisitionMode namedSongVideo(String formatId, String title) {
        return new AcquisitionMode(Kind.NAMED_SONG_VIDEO, formatId, title);
    }

    /** True when the produced file is audio and should carry the canonical audio extension. */
    public boolean producesAudio() {
        return kind == Kind.AUDIO_ONLY || kind == Kind.NAMED_SONG_AUDIO;
    }
}
