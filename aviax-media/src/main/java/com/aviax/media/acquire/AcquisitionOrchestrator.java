package com.aviax.media.acquire;

import com.aviax.common.config.AviaxConfig;
import com.aviax.common.infra.CancellationToken;
import com.aviax.common.infra.ErrorUtils;
import com.aviax.media.AcquisitionMode;
import com.aviax.media.AcquisitionResult;
import com.aviax.media.MediaException;
import com.aviax.media.Reference;
import com.aviax.media.References;
import com.aviax.media.backend.AntiDetectionProfile;
import com.aviax.media.backend.ExtractedInfo;
import com.aviax.media.backend.ExtractionBackend;
import com.aviax.media.backend.ExtractionOptions;
import com.aviax.media.pacer.RequestPacer;
import com.aviax.media.worker.MediaWorkerPool;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Acquires the asset behind a reference: a local download, or a remote stream
 * URL when direct-link mode is on for 720p video. Downloads and subprocesses
 * run on the worker pool. Never throws; failures come back as
 * {@link AcquisitionResult#failed()}.
 */
@Slf4j
public class AcquisitionOrchestrator {

    private final RequestPacer pacer;
    private final ExtractionBackend backend;
    private final AntiDetectionProfile profile;
    private final DirectLinkResolver directLinks;
    private final DirectLinkSwitch directLinkSwitch;
    private final MediaWorkerPool workers;
    private final Path downloadDir;
    private final String audioExtension;
    private final String audioQuality;

    public AcquisitionOrchestrator(RequestPacer pacer,
            ExtractionBackend backend,
            AntiDetectionProfile profile,
            DirectLinkResolver directLinks,
            DirectLinkSwitch directLinkSwitch,
            MediaWorkerPool workers,
            Path downloadDir,
            String audioExtension,
            String audioQuality) {
        this.pacer = pacer;
        this.backend = backend;
        this.profile = profile;
        this.directLinks = directLinks;
        this.directLinkSwitch = directLinkSwitch;
        this.workers = workers;
        this.downloadDir = downloadDir;
        this.audioExtension = audioExtension;
        this.audioQuality = audioQuality;
    }

    public AcquisitionOrchestrator(AviaxConfig config,
            RequestPacer pacer,
            ExtractionBackend backend,
            DirectLinkResolver directLinks,
            DirectLinkSwitch directLinkSwitch,
            MediaWorkerPool workers) {
        this(pacer, backend, new AntiDetectionProfile(config.getExtraction()), directLinks, directLinkSwitch,
                workers, Path.of(config.getDownload().getDirectory()),
                config.getDownload().getAudioExtension(), config.getDownload().getAudioQuality());
    }

    public AcquisitionResult acquire(Reference ref, AcquisitionMode mode) {
        return acquire(ref, mode, CancellationToken.NONE);
    }

    public AcquisitionResult acquire(Reference ref, AcquisitionMode mode, CancellationToken token) {
        String query = References.toBackendQuery(ref);
        try {
            pacer.acquireSlot(token);
            FormatSelection selection = FormatSelector.select(mode);

            if (mode.kind() == AcquisitionMode.Kind.VIDEO_UP_TO_720 && directLinkSwitch.isEnabled()) {
                Optional<String> direct = tryDirectLink(query, token);
                if (direct.isPresent()) {
                    log.info("Direct link resolved for '{}'", query);
                    return AcquisitionResult.directLink(direct.get());
                }
            }

            boolean playlist = ref.kind() == Reference.Kind.PLAYLIST_URL;
            Path file = workers.run(() -> download(query, playlist, mode, selection, token), token);
            log.info("Downloaded '{}' to {}", query, file);
            return AcquisitionResult.downloaded(file.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Acquisition of '{}' cancelled", query);
            return AcquisitionResult.failed();
        } catch (ExecutionException e) {
            log.error("Download failed for '{}': {}", query, ErrorUtils.formatCauseChain(e.getCause()));
            return AcquisitionResult.failed();
        } catch (RuntimeException e) {
            log.error("Download failed for '{}'", query, e);
            return AcquisitionResult.failed();
        }
    }

    /**
     * Look up the backend's direct media URL without downloading.
     *
     * @return the URL, or empty if the backend failed or returned none
     */
    public Optional<String> streamUrl(Reference ref, boolean audioOnly, CancellationToken token) {
        String query = References.toBackendQuery(ref);
        String format = audioOnly ? FormatSelector.AUDIO_FORMAT : FormatSelector.PROGRESSIVE_VIDEO_FORMAT;
        try {
            pacer.acquireSlot(token);
            ExtractionOptions options = profile.newOptions().format(format).noPlaylist(true).playlistEnd(1).build();
            ExtractedInfo info = workers.run(() -> firstItem(backend.extract(query, options, false, token)), token);
            return Optional.ofNullable(info.url());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
            log.error("Failed to get stream URL for '{}': {}", query, ErrorUtils.formatErrorMessage(cause));
            return Optional.empty();
        }
    }

    private Optional<String> tryDirectLink(String link, CancellationToken token) throws InterruptedException {
        try {
            Optional<String> url = Optional.ofNullable(workers.run(() -> directLinks.resolve(link, token), token))
                    .map(String::trim)
                    .filter(u -> !u.isEmpty());
            if (url.isEmpty()) {
                log.info("Direct link resolver returned nothing for '{}', downloading instead", link);
            }
            return url;
        } catch (ExecutionException e) {
            log.info("Direct link unavailable for '{}', downloading instead: {}",
                    link, ErrorUtils.formatErrorMessage(e.getCause()));
            return Optional.empty();
        }
    }

    // --no-playlist has no effect on a playlist page, so those are capped at their first member
    private Path download(String query, boolean playlist, AcquisitionMode mode, FormatSelection selection,
            CancellationToken token) throws MediaException, InterruptedException {
        ExtractionOptions options = profile.newOptions()
                .format(selection.format())
                .outputTemplate(selection.backendTemplate(downloadDir))
                .mergeOutputFormat(selection.mergeOutputFormat())
                .extractAudioFormat(selection.extractAudio() ? audioExtension : null)
                .audioQuality(selection.extractAudio() ? audioQuality : null)
                .noPlaylist(true)
                .playlistEnd(playlist ? 1 : 0)
                .build();
        try {
            Files.createDirectories(downloadDir);
        } catch (IOException e) {
            throw new MediaException.DownloadException("cannot create " + downloadDir, e);
        }

        ExtractedInfo info = firstItem(backend.extract(query, options, true, token));
        Path file = info.filepath() != null
                ? Path.of(info.filepath())
                : downloadDir.resolve(selection.fileName(info.id(), info.ext()));
        if (!Files.isRegularFile(file)) {
            throw new MediaException.DownloadException("expected output missing: " + file);
        }
        return mode.producesAudio() ? normalizeAudioExtension(file) : file;
    }

    /**
     * Rename to the canonical audio extension. No re-encode happens here.
     */
    Path normalizeAudioExtension(Path file) throws MediaException.DownloadException {
        if (FileNames.extension(file).equalsIgnoreCase(audioExtension)) {
            return file;
        }
        Path target = FileNames.withExtension(file, audioExtension);
        try {
            return Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new MediaException.DownloadException("rename to " + target + " failed", e);
        }
    }

    private static ExtractedInfo firstItem(ExtractedInfo info) throws MediaException.NoResultsException {
        if (!info.resultSet()) {
            return info;
        }
        if (info.entries().isEmpty()) {
            throw new MediaException.NoResultsException("nothing to acquire");
        }
        return info.entries().get(0);
    }
}
