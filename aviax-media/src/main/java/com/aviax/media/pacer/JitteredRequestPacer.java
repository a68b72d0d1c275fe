package com.aviax.media.pacer;

import com.aviax.common.config.AviaxConfig;
import com.aviax.common.infra.Backoff;
import com.aviax.common.infra.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces a jittered minimum gap between outbound extraction calls.
 * <p>
 * The lock guards only the read-modify-write of the timestamp/delay pair;
 * waiting happens outside it. After waking, the gap is re-checked under the
 * lock, so a task that lost the race to a concurrent caller waits again
 * rather than stamping early. The lock is fair, giving FIFO contention.
 */
@Slf4j
public class JitteredRequestPacer implements RequestPacer {

    private final long minDelayNanos;
    private final long maxDelayNanos;
    private final ReentrantLock lock = new ReentrantLock(true);

    // guarded by lock
    private long lastRequestNanos;
    private long currentDelayNanos;
    private boolean first = true;

    public JitteredRequestPacer(long minDelayMs, long maxDelayMs) {
        if (minDelayMs < 0 || maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException(
                    "invalid delay range [" + minDelayMs + ", " + maxDelayMs + "]");
        }
        this.minDelayNanos = TimeUnit.MILLISECONDS.toNanos(minDelayMs);
        this.maxDelayNanos = TimeUnit.MILLISECONDS.toNanos(maxDelayMs);
        this.currentDelayNanos = drawDelay();
    }

    public JitteredRequestPacer(AviaxConfig.PacerConfig config) {
        this(config.getMinDelayMs(), config.getMaxDelayMs());
    }

    @Override
    public void acquireSlot(CancellationToken token) throws InterruptedException {
        while (true) {
            long waitNanos;
            lock.lock();
            try {
                long now = System.nanoTime();
                waitNanos = first ? 0 : lastRequestNanos + currentDelayNanos - now;
                if (waitNanos <= 0) {
                    lastRequestNanos = now;
                    currentDelayNanos = drawDelay();
                    first = false;
                    return;
                }
            } finally {
                lock.unlock();
            }
            log.debug("Pacing extraction call, waiting {}ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            // Round up so the re-check does not spin on sub-millisecond remainders
            Backoff.sleep(TimeUnit.NANOSECONDS.toMillis(waitNanos) + 1, token);
        }
    }

    /**
     * Delay currently required after the last stamped request, in milliseconds.
     */
    public long currentDelayMs() {
        lock.lock();
        try {
            return TimeUnit.NANOSECONDS.toMillis(currentDelayNanos);
        } finally {
            lock.unlock();
        }
    }

    private long drawDelay() {
        if (maxDelayNanos == minDelayNanos) {
            return minDelayNanos;
        }
        return ThreadLocalRandom.current().nextLong(minDelayNanos, maxDelayNanos + 1);
    }
}
