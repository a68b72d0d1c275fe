package com.aviax.media;

import java.util.regex.Pattern;

/**
 * Classification of raw strings into {@link Reference}s and normalization of
 * references into backend query strings.
 */
public final class References {

    private References() {
    }

    public static final String WATCH_URL = "https://www.youtube.com/watch?v=";
    public static final String SEARCH_PREFIX = "ytsearch:";

    private static final Pattern PLATFORM_HOST = Pattern.compile(
            "(?:youtube\\.com|youtu\\.be)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PLAYLIST_PATH = Pattern.compile(
            "youtube\\.com/playlist\\?(?:.*&)?list=", Pattern.CASE_INSENSITIVE);

    /**
     * Check whether the text points at the target video platform.
     */
    public static boolean isPlatformLink(String text) {
        return text != null && PLATFORM_HOST.matcher(text).find();
    }

    /**
     * Classify a bare string. Platform links become {@code DIRECT_URL} (or
     * {@code PLAYLIST_URL} for playlist pages); everything else is search text.
     */
    public static Reference classify(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        String trimmed = raw.trim();
        if (isPlatformLink(trimmed)) {
            return PLAYLIST_PATH.matcher(trimmed).find()
                    ? Reference.playlistUrl(trimmed)
                    : Reference.directUrl(trimmed);
        }
        return Reference.searchQuery(trimmed);
    }

    /**
     * Reference for a link already known to be a URL, such as a link entity in a
     * chat message. Playlist pages become {@code PLAYLIST_URL}, anything else
     * {@code DIRECT_URL}; the host is not checked.
     */
    public static Reference link(String url) {
        String trimmed = url == null ? "" : url.trim();
        return PLAYLIST_PATH.matcher(trimmed).find()
                ? Reference.playlistUrl(trimmed)
                : Reference.directUrl(trimmed);
    }

    /**
     * Build the query string the extraction backend understands.
     * Links lose everything after the first {@code &}; bare ids become watch
     * URLs; search text gets the search scheme prefix.
     */
    public static String toBackendQuery(Reference ref) {
        return switch (ref.kind()) {
            case DIRECT_URL -> stripTracking(ref.value());
            case VIDEO_ID -> WATCH_URL + stripTracking(ref.value());
            case PLAYLIST_URL -> ref.value();
            case SEARCH_QUERY -> ref.value().startsWith(SEARCH_PREFIX)
                    ? ref.value()
                    : SEARCH_PREFIX + ref.value();
        };
    }

    /**
     * The plain text handed to the secondary search provider.
     */
    public static String toSearchText(Reference ref) {
        String value = ref.value();
        if (value.startsWith(SEARCH_PREFIX)) {
            return value.substring(SEARCH_PREFIX.length()).trim();
        }
        return ref.kind() == Reference.Kind.SEARCH_QUERY ? value : stripTracking(value);
    }

    static String stripTracking(String value) {
        int amp = value.indexOf('&');
        return amp >= 0 ? value.substring(0, amp) : value;
    }
}
