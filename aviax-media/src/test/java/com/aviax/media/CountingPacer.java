package com.aviax.media;

import com.aviax.common.infra.CancellationToken;
import com.aviax.media.pacer.RequestPacer;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * No-wait pacer that counts acquired slots.
 */
public class CountingPacer implements RequestPacer {

    public final AtomicInteger slots = new AtomicInteger();

    @Override
    public void acquireSlot(CancellationToken token) {
        slots.incrementAndGet();
    }
}
