package com.aviax.media.resolve;

import com.aviax.common.infra.CancellationToken;
import com.aviax.common.infra.ErrorUtils;
import com.aviax.media.MediaException;
import com.aviax.media.Reference;
import com.aviax.media.References;
import com.aviax.media.backend.AntiDetectionProfile;
import com.aviax.media.backend.ExtractedInfo;
import com.aviax.media.backend.ExtractionBackend;
import com.aviax.media.backend.ExtractionOptions;
import com.aviax.media.backend.FormatOption;
import com.aviax.media.pacer.RequestPacer;
import com.aviax.media.worker.MediaWorkerPool;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Lists the formats a media item is available in, for picking a named-song
 * acquisition mode. One paced backend call, no retries.
 */
@Slf4j
public class FormatCatalog {

    private final RequestPacer pacer;
    private final ExtractionBackend backend;
    private final AntiDetectionProfile profile;
    private final MediaWorkerPool workers;

    public FormatCatalog(RequestPacer pacer, ExtractionBackend backend, AntiDetectionProfile profile,
            MediaWorkerPool workers) {
        this.pacer = pacer;
        this.backend = backend;
        this.profile = profile;
        this.workers = workers;
    }

    /**
     * @return usable formats, or an empty list if the backend failed
     */
    public List<FormatOption> formats(Reference ref, CancellationToken token) {
        String query = References.toBackendQuery(ref);
        try {
            pacer.acquireSlot(token);
            ExtractionOptions options = profile.newOptions().noPlaylist(true).playlistEnd(1).build();
            ExtractedInfo info = workers.call(() -> backend.extract(query, options, false, token), token);
            if (info.resultSet()) {
                if (info.entries().isEmpty()) {
                    return List.of();
                }
                info = info.entries().get(0);
            }
            return info.formats().stream()
                    .filter(f -> f.formatId() != null && !f.formatId().isBlank())
                    .filter(f -> !"mhtml".equals(f.ext()))
                    .collect(Collectors.toList());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (MediaException | RuntimeException e) {
            log.warn("Format listing failed for '{}': {}", query, ErrorUtils.formatErrorMessage(e));
            return List.of();
        }
    }
}
