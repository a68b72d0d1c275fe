package com.aviax.media.resolve;

import com.aviax.common.config.AviaxConfig;
import com.aviax.common.infra.Backoff;
import com.aviax.common.infra.CancellationToken;
import com.aviax.common.infra.ErrorUtils;
import com.aviax.media.MediaException;
import com.aviax.media.Metadata;
import com.aviax.media.Reference;
import com.aviax.media.References;
import com.aviax.media.backend.AntiDetectionProfile;
import com.aviax.media.backend.ExtractedInfo;
import com.aviax.media.backend.ExtractionBackend;
import com.aviax.media.backend.ExtractionOptions;
import com.aviax.media.pacer.RequestPacer;
import com.aviax.media.search.SearchFallbackAdapter;
import com.aviax.media.search.SearchProvider;
import com.aviax.media.search.SearchResult;
import com.aviax.media.worker.MediaWorkerPool;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Resolves a {@link Reference} into {@link Metadata}.
 * <p>
 * Up to {@code attempts} paced calls to the primary backend, sequential, with
 * growing backoff and freshly drawn anti-detection options per attempt. Then
 * one query to the secondary search provider. Then the sentinel. Never throws.
 * Backend subprocesses run on the metadata worker pool; retries stay
 * sequential.
 */
@Slf4j
public class MetadataResolver {

    private final RequestPacer pacer;
    private final ExtractionBackend backend;
    private final SearchProvider searchProvider;
    private final AntiDetectionProfile profile;
    private final int attempts;
    private final Backoff.Policy backoff;
    private final MediaWorkerPool workers;

    public MetadataResolver(RequestPacer pacer,
            ExtractionBackend backend,
            SearchProvider searchProvider,
            AntiDetectionProfile profile,
            int attempts,
            Backoff.Policy backoff,
            MediaWorkerPool workers) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1");
        }
        this.pacer = pacer;
        this.backend = backend;
        this.searchProvider = searchProvider;
        this.profile = profile;
        this.attempts = attempts;
        this.backoff = backoff;
        this.workers = workers;
    }

    public MetadataResolver(AviaxConfig.ExtractionConfig config,
            RequestPacer pacer,
            ExtractionBackend backend,
            SearchProvider searchProvider,
            MediaWorkerPool workers) {
        this(pacer, backend, searchProvider, new AntiDetectionProfile(config), config.getAttempts(),
                new Backoff.Policy(config.getBackoffSeedMs(), 1_000, config.getBackoffJitterMs()), workers);
    }

    public Metadata resolve(Reference ref) {
        return resolve(ref, CancellationToken.NONE);
    }

    /**
     * Resolve metadata. On total failure returns {@link Metadata#SENTINEL}.
     */
    public Metadata resolve(Reference ref, CancellationToken token) {
        String query = References.toBackendQuery(ref);
        ResolutionStep step = attempt(ref, query, 1, token);
        boolean fallbackUsed = false;

        while (true) {
            if (step instanceof ResolutionStep.Success success) {
                return success.metadata();
            }
            if (step instanceof ResolutionStep.Retry retry) {
                step = retryAfterBackoff(ref, query, retry, token);
            } else if (step instanceof ResolutionStep.Fallback fallback && !fallbackUsed) {
                fallbackUsed = true;
                step = fallback(ref, fallback.cause());
            } else {
                Throwable cause = step instanceof ResolutionStep.SentinelFailure failure
                        ? failure.cause()
                        : ((ResolutionStep.Fallback) step).cause();
                log.error("Metadata resolution failed for '{}': {}", ref.value(), ErrorUtils.formatCauseChain(cause));
                return Metadata.SENTINEL;
            }
        }
    }

    private ResolutionStep attempt(Reference ref, String query, int attempt, CancellationToken token) {
        try {
            pacer.acquireSlot(token);
            ExtractionOptions options = options(ref);
            ExtractedInfo info = workers.call(() -> backend.extract(query, options, false, token), token);
            return new ResolutionStep.Success(toMetadata(firstItem(info, query)));
        } catch (MediaException.NoResultsException e) {
            log.warn("No results from backend for '{}', falling back to search", query);
            return new ResolutionStep.Fallback(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ResolutionStep.SentinelFailure(e);
        } catch (MediaException | RuntimeException e) {
            log.warn("Attempt {}/{} failed for '{}': {}", attempt, attempts, query, ErrorUtils.formatErrorMessage(e));
            return attempt < attempts
                    ? new ResolutionStep.Retry(attempt + 1, e)
                    : new ResolutionStep.Fallback(e);
        }
    }

    private ResolutionStep retryAfterBackoff(Reference ref, String query, ResolutionStep.Retry retry,
            CancellationToken token) {
        long delay = Backoff.compute(backoff, retry.nextAttempt() - 1);
        try {
            Backoff.sleep(delay, token);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ResolutionStep.SentinelFailure(e);
        }
        return attempt(ref, query, retry.nextAttempt(), token);
    }

    // Fresh per attempt; a playlist page only needs its first member
    private ExtractionOptions options(Reference ref) {
        ExtractionOptions.ExtractionOptionsBuilder builder = profile.newOptions();
        if (ref.kind() == Reference.Kind.PLAYLIST_URL) {
            builder.playlistEnd(1);
        }
        return builder.build();
    }

    private ResolutionStep fallback(Reference ref, Throwable primaryCause) {
        String text = References.toSearchText(ref);
        try {
            List<SearchResult> results = searchProvider.search(text, 1);
            if (results.isEmpty()) {
                throw new MediaException.NoResultsException("search found nothing for " + text);
            }
            log.info("Resolved '{}' via search fallback", text);
            return new ResolutionStep.Success(SearchFallbackAdapter.toMetadata(results.get(0)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ResolutionStep.SentinelFailure(e);
        } catch (MediaException | RuntimeException e) {
            MediaException exhausted = new MediaException.FallbackExhaustedException(
                    "primary failed (" + ErrorUtils.formatErrorMessage(primaryCause) + ") and search failed", e);
            return new ResolutionStep.SentinelFailure(exhausted);
        }
    }

    private static ExtractedInfo firstItem(ExtractedInfo info, String query) throws MediaException {
        if (!info.resultSet()) {
            return info;
        }
        if (info.entries().isEmpty()) {
            throw new MediaException.NoResultsException("empty result set for " + query);
        }
        return info.entries().get(0);
    }

    static Metadata toMetadata(ExtractedInfo info) {
        return new Metadata(info.title(), info.durationSeconds(), info.id(), info.thumbnail());
    }
}
