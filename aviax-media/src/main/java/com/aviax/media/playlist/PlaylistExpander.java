package com.aviax.media.playlist;

import com.aviax.common.infra.CancellationToken;
import com.aviax.common.infra.ErrorUtils;
import com.aviax.media.MediaException;
import com.aviax.media.Reference;
import com.aviax.media.backend.AntiDetectionProfile;
import com.aviax.media.backend.ExtractedInfo;
import com.aviax.media.backend.ExtractionBackend;
import com.aviax.media.backend.ExtractionOptions;
import com.aviax.media.pacer.RequestPacer;
import com.aviax.media.worker.MediaWorkerPool;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Enumerates member video ids of a playlist using flat extraction only.
 */
@Slf4j
public class PlaylistExpander {

    private final RequestPacer pacer;
    private final ExtractionBackend backend;
    private final AntiDetectionProfile profile;
    private final MediaWorkerPool workers;

    public PlaylistExpander(RequestPacer pacer, ExtractionBackend backend, AntiDetectionProfile profile,
            MediaWorkerPool workers) {
        this.pacer = pacer;
        this.backend = backend;
        this.profile = profile;
        this.workers = workers;
    }

    public Stream<String> expand(Reference playlist, int limit) {
        return expand(playlist, limit, CancellationToken.NONE);
    }

    /**
     * Lazily enumerate up to {@code limit} video ids. The backend is not called
     * until the stream is consumed; the stream can be consumed once. Backend
     * failure yields an empty stream.
     */
    public Stream<String> expand(Reference playlist, int limit, CancellationToken token) {
        if (playlist.kind() != Reference.Kind.PLAYLIST_URL && playlist.kind() != Reference.Kind.DIRECT_URL) {
            throw new IllegalArgumentException("not a playlist reference: " + playlist.kind());
        }
        if (limit <= 0) {
            return Stream.empty();
        }
        Supplier<List<String>> enumeration = () -> enumerate(playlist, limit, token);
        return Stream.of(enumeration)
                .flatMap(supplier -> supplier.get().stream())
                .limit(limit);
    }

    private List<String> enumerate(Reference playlist, int limit, CancellationToken token) {
        // Playlist links keep their query string; list= lives there
        String query = playlist.value();
        try {
            pacer.acquireSlot(token);
            ExtractionOptions options = profile.newOptions().flatPlaylist(true).playlistEnd(limit).build();
            ExtractedInfo info = workers.call(() -> backend.extract(query, options, false, token), token);
            List<String> ids = info.entries().stream()
                    .map(ExtractedInfo::id)
                    .filter(Objects::nonNull)
                    .limit(limit)
                    .collect(Collectors.toList());
            log.debug("Playlist '{}' yielded {} id(s)", query, ids.size());
            return ids;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (MediaException | RuntimeException e) {
            log.warn("Playlist enumeration failed for '{}': {}", query, ErrorUtils.formatErrorMessage(e));
            return List.of();
        }
    }
}
