package com.aviax.media.acquire;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * File name normalization for downloaded assets.
 */
final class FileNames {

    private FileNames() {
    }

    private static final Pattern ILLEGAL = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");
    private static final int MAX_LENGTH = 150;

    /**
     * Make a title safe to use as a file name stem.
     */
    static String sanitize(String title) {
        if (title == null) {
            return "";
        }
        String cleaned = ILLEGAL.matcher(title).replaceAll("_").trim();
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1);
        }
        if (cleaned.length() > MAX_LENGTH) {
            cleaned = cleaned.substring(0, MAX_LENGTH).trim();
        }
        return cleaned.isEmpty() ? "untitled" : cleaned;
    }

    /**
     * Extension of a path without the dot, or empty.
     */
    static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1) : "";
    }

    /**
     * The same path with its extension replaced.
     */
    static Path withExtension(Path path, String ext) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return path.resolveSibling(stem + "." + ext);
    }
}
