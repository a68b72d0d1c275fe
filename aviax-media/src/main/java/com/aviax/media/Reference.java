package com.aviax.media;

import java.util.Objects;

/**
 * A user-supplied identifier of a media item. Exactly one kind is active.
 *
 * @param kind  which variant this reference is
 * @param value the URL, bare video id, or search text
 */
public record Reference(Kind kind, String value) {

    public enum Kind {
        DIRECT_URL,
        VIDEO_ID,
        SEARCH_QUERY,
        PLAYLIST_URL
    }

    public Reference {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        value = value.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("reference value must not be blank");
        }
    }

    public static Reference directUrl(String url) {
        return new Reference(Kind.DIRECT_URL, url);
    }

    public static Reference videoId(String id) {
        return new Reference(Kind.VIDEO_ID, id);
    }

    public static Reference searchQuery(String text) {
        return new Reference(Kind.SEARCH_QUERY, text);
    }

    public static Reference playlistUrl(String url) {
        return new Reference(Kind.PLAYLIST_URL, url);
    }
}
