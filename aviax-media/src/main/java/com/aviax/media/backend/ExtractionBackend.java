package com.aviax.media.backend;

import com.aviax.common.infra.CancellationToken;
import com.aviax.media.MediaException;

/**
 * The primary extraction backend. Blocking; callers pace and offload it.
 */
public interface ExtractionBackend {

    /**
     * Extract metadata for a query (URL, bare watch URL, or search-prefixed text).
     *
     * @param query    backend query string
     * @param options  option set for this call
     * @param download also write the asset to the templated output path
     * @param token    cancellation token; cancelling aborts the call
     * @return extracted info; never {@code null}
     * @throws MediaException.TransientExtractionException on network errors, timeouts or throttling
     * @throws MediaException.NoResultsException           if the backend returned nothing
     * @throws InterruptedException                        if cancelled or interrupted
     */
    ExtractedInfo extract(String query, ExtractionOptions options, boolean download, CancellationToken token)
            throws MediaException, InterruptedException;
}
