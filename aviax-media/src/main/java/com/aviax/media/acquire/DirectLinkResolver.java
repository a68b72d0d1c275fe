package com.aviax.media.acquire;

import com.aviax.common.infra.CancellationToken;
import com.aviax.media.MediaException;

/**
 * Resolves a streamable URL for a link without downloading anything.
 */
public interface DirectLinkResolver {

    /**
     * @param link  watch URL of the item
     * @param token cancellation token
     * @return a non-empty remote URL
     * @throws MediaException.DirectResolutionException if no usable URL came back
     * @throws InterruptedException                     if cancelled or interrupted
     */
    String resolve(String link, CancellationToken token)
            throws MediaException.DirectResolutionException, InterruptedException;
}
