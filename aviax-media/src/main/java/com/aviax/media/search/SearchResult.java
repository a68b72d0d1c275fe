package com.aviax.media.search;

import java.util.List;

/**
 * One hit from the secondary search provider.
 *
 * @param id         video id
 * @param title      video title
 * @param duration   duration as shown by the provider, usually {@code M:SS}
 * @param thumbnails thumbnail URLs, best first
 */
public record SearchResult(String id, String title, String duration, List<String> thumbnails) {

    public SearchResult {
        thumbnails = thumbnails == null ? List.of() : List.copyOf(thumbnails);
    }
}
