package com.aviax.media.worker;

import com.aviax.common.infra.CancellationToken;
import com.aviax.common.infra.ErrorUtils;
import com.aviax.media.MediaException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of named daemon threads for blocking backend subprocesses.
 * The pipeline keeps one pool for metadata extraction and another for
 * downloads so a slow download cannot starve lookups.
 */
@Slf4j
public class MediaWorkerPool implements AutoCloseable {

    private final ExecutorService executor;

    /**
     * A blocking backend call that fails with the pipeline's own exceptions.
     */
    @FunctionalInterface
    public interface MediaTask<T> {
        T call() throws MediaException, InterruptedException;
    }

    public MediaWorkerPool(int threads) {
        this("media-worker", threads);
    }

    public MediaWorkerPool(String namePrefix, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, namePrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newFixedThreadPool(threads, factory);
    }

    /**
     * Run a blocking task on a worker and wait for its result. Cancelling the
     * token (or interrupting the caller) interrupts the worker task.
     *
     * @throws ExecutionException   if the task threw; the cause is the original error
     * @throws InterruptedException if the caller was interrupted or the token cancelled
     */
    public <T> T run(Callable<T> task, CancellationToken token) throws ExecutionException, InterruptedException {
        token.throwIfCancelled();
        Future<T> future = executor.submit(task);
        Runnable unregister = token.onCancel(() -> future.cancel(true));
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (CancellationException e) {
            throw new InterruptedException("cancelled");
        } finally {
            unregister.run();
        }
    }

    /**
     * Like {@link #run}, but rethrows the task's own failure instead of an
     * {@link ExecutionException}.
     */
    public <T> T call(MediaTask<T> task, CancellationToken token) throws MediaException, InterruptedException {
        try {
            return run(task::call, token);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MediaException media) {
                throw media;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            if (cause instanceof InterruptedException) {
                throw new InterruptedException("worker interrupted");
            }
            throw new MediaException.TransientExtractionException(ErrorUtils.formatErrorMessage(cause), cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Media workers did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
