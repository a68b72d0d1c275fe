package com.aviax.media.search;

import com.aviax.media.MediaException;

import java.util.List;

/**
 * Secondary search provider consulted when the extraction backend fails.
 */
public interface SearchProvider {

    /**
     * Search by free text.
     *
     * @param text  query text, without any backend search prefix
     * @param limit maximum number of results
     * @return results in relevance order; may be empty
     * @throws MediaException       if the provider is unreachable or answers garbage
     * @throws InterruptedException if interrupted
     */
    List<SearchResult> search(String text, int limit) throws MediaException, InterruptedException;
}
