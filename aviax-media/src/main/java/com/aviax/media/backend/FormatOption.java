package com.aviax.media.backend;

/**
 * One downloadable encoding of a media item.
 *
 * @param formatId   backend format id, usable in a named-song acquisition mode
 * @param ext        container extension
 * @param note       human-readable quality note, e.g. "720p" or "medium"
 * @param height     video height in pixels, 0 for audio-only
 * @param filesize   size in bytes, 0 if unknown
 * @param audioCodec audio codec or "none"
 * @param videoCodec video codec or "none"
 */
public record FormatOption(
        String formatId,
        String ext,
        String note,
        int height,
        long filesize,
        String audioCodec,
        String videoCodec) {

    public boolean isAudioOnly() {
        return "none".equals(videoCodec) && !"none".equals(audioCodec);
    }
}
