package com.aviax.common.infra;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry backoff computation and cancellable sleep.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Backoff policy: the delay after attempt {@code n} is
     * {@code seedMs + n * stepMs} plus up to {@code jitterMs} of random jitter.
     *
     * @param seedMs   base delay in milliseconds
     * @param stepMs   added per completed attempt
     * @param jitterMs upper bound of the random jitter
     */
    public record Policy(long seedMs, long stepMs, long jitterMs) {

        /** 1s seed, 1s per attempt, up to 0.5s jitter. */
        public static final Policy DEFAULT = new Policy(1_000, 1_000, 500);
    }

    /**
     * Compute the backoff delay after a failed attempt.
     *
     * @param policy  backoff policy
     * @param attempt 1-based number of the attempt that just failed
     * @return delay in milliseconds, never negative
     */
    public static long compute(Policy policy, int attempt) {
        long base = policy.seedMs() + policy.stepMs() * Math.max(attempt - 1, 0);
        long jitter = policy.jitterMs() > 0
                ? ThreadLocalRandom.current().nextLong(policy.jitterMs() + 1)
                : 0;
        return Math.max(0, base + jitter);
    }

    /**
     * Sleep for the specified duration, aborting early if the token is cancelled.
     *
     * @param ms    milliseconds to sleep; if {@code <= 0} returns immediately
     * @param token cancellation token; may be {@code null}
     * @throws InterruptedException if interrupted or cancelled
     */
    public static void sleep(long ms, CancellationToken token) throws InterruptedException {
        if (ms <= 0) {
            return;
        }
        long deadline = System.currentTimeMillis() + ms;
        long remaining = ms;
        while (remaining > 0) {
            if (token != null && token.isCancelled()) {
                throw new InterruptedException("cancelled");
            }
            Thread.sleep(Math.min(remaining, 100));
            remaining = deadline - System.currentTimeMillis();
        }
    }
}
