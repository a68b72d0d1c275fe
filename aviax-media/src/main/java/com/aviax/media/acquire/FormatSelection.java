package com.aviax.media.acquire;

import java.nio.file.Path;

/**
 * Backend format selector plus output naming for one acquisition mode.
 *
 * @param format            backend format selector string
 * @param fileNamePattern   output file name with {@code {videoID}}, {@code {title}}
 *                          and {@code {ext}} placeholders
 * @param title             value for {@code {title}}; {@code null} when unused
 * @param mergeOutputFormat container to merge into, or {@code null}
 * @param extractAudio      ask the backend to transcode to the canonical audio format
 */
public record FormatSelection(
        String format,
        String fileNamePattern,
        String title,
        String mergeOutputFormat,
        boolean extractAudio) {

    static final String VIDEO_ID = "{videoID}";
    static final String TITLE = "{title}";
    static final String EXT = "{ext}";

    /**
     * Render the file name the backend will produce.
     */
    public String fileName(String videoId, String ext) {
        return fileNamePattern
                .replace(VIDEO_ID, videoId == null ? "" : videoId)
                .replace(TITLE, FileNames.sanitize(title))
                .replace(EXT, ext == null ? "" : ext);
    }

    /**
     * Output template in yt-dlp syntax, rooted at {@code directory}.
     */
    public String backendTemplate(Path directory) {
        String name = fileNamePattern
                .replace(TITLE, FileNames.sanitize(title).replace("%", "%%"))
                .replace(VIDEO_ID, "%(id)s")
                .replace(EXT, "%(ext)s");
        return directory.resolve(name).toString();
    }
}
