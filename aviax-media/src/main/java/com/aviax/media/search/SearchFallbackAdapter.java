package com.aviax.media.search;

import com.aviax.common.infra.DurationFormat;
import com.aviax.media.Metadata;

/**
 * Maps the search provider's result shape onto {@link Metadata}.
 */
public final class SearchFallbackAdapter {

    private SearchFallbackAdapter() {
    }

    public static Metadata toMetadata(SearchResult result) {
        String thumbnail = result.thumbnails().isEmpty() ? "" : stripQuery(result.thumbnails().get(0));
        return new Metadata(
                result.title(),
                DurationFormat.parseSeconds(result.duration()),
                result.id(),
                thumbnail);
    }

    static String stripQuery(String url) {
        if (url == null) {
            return "";
        }
        int q = url.indexOf('?');
        return q >= 0 ? url.substring(0, q) : url;
    }
}
