package com.aviax.media.pacer;

import com.aviax.common.infra.CancellationToken;

/**
 * Gate in front of the extraction backend. Every code path that reaches the
 * backend acquires exactly one slot first, retries included.
 */
public interface RequestPacer {

    /** A pacer that never waits, for tests and offline tooling. */
    RequestPacer NOOP = token -> {
    };

    /**
     * Block the calling task until the next request may go out.
     *
     * @param token cancellation token observed while waiting
     * @throws InterruptedException if interrupted or cancelled while waiting
     */
    void acquireSlot(CancellationToken token) throws InterruptedException;

    default void acquireSlot() throws InterruptedException {
        acquireSlot(CancellationToken.NONE);
    }
}
