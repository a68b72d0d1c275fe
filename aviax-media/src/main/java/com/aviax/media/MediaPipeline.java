package com.aviax.media;

import com.aviax.common.config.AviaxConfig;
import com.aviax.common.config.ConfigService;
import com.aviax.common.infra.CancellationToken;
import com.aviax.media.acquire.AcquisitionOrchestrator;
import com.aviax.media.acquire.ConfigDirectLinkSwitch;
import com.aviax.media.acquire.DirectLinkResolver;
import com.aviax.media.acquire.DirectLinkSwitch;
import com.aviax.media.acquire.YtDlpDirectLinkResolver;
import com.aviax.media.backend.AntiDetectionProfile;
import com.aviax.media.backend.ExtractionBackend;
import com.aviax.media.backend.FormatOption;
import com.aviax.media.backend.YtDlpBackend;
import com.aviax.media.pacer.JitteredRequestPacer;
import com.aviax.media.pacer.RequestPacer;
import com.aviax.media.playlist.PlaylistExpander;
import com.aviax.media.resolve.FormatCatalog;
import com.aviax.media.resolve.MetadataResolver;
import com.aviax.media.search.SearchProvider;
import com.aviax.media.search.YouTubeWebSearchProvider;
import com.aviax.media.worker.MediaWorkerPool;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Entry point used by the chat front end. All components share one pacer.
 */
@Slf4j
public class MediaPipeline implements AutoCloseable {

    private final MetadataResolver metadataResolver;
    private final AcquisitionOrchestrator orchestrator;
    private final PlaylistExpander playlistExpander;
    private final FormatCatalog formatCatalog;
    private final MediaWorkerPool metadataWorkers;
    private final MediaWorkerPool downloadWorkers;
    private final int defaultPlaylistLimit;

    public MediaPipeline(AviaxConfig config,
            RequestPacer pacer,
            ExtractionBackend backend,
            SearchProvider searchProvider,
            DirectLinkResolver directLinks,
            DirectLinkSwitch directLinkSwitch) {
        AntiDetectionProfile profile = new AntiDetectionProfile(config.getExtraction());
        this.metadataWorkers = new MediaWorkerPool("metadata-worker", config.getExtraction().getWorkerThreads());
        this.downloadWorkers = new MediaWorkerPool("media-worker", config.getDownload().getWorkerThreads());
        this.metadataResolver = new MetadataResolver(config.getExtraction(), pacer, backend, searchProvider,
                metadataWorkers);
        this.orchestrator = new AcquisitionOrchestrator(config, pacer, backend, directLinks, directLinkSwitch,
                downloadWorkers);
        this.playlistExpander = new PlaylistExpander(pacer, backend, profile, metadataWorkers);
        this.formatCatalog = new FormatCatalog(pacer, backend, profile, metadataWorkers);
        this.defaultPlaylistLimit = config.getDownload().getPlaylistLimit();
    }

    /**
     * Wire the production collaborators: yt-dlp, web search, and the config
     * file's direct-link flag.
     */
    public static MediaPipeline create(ConfigService configService) {
        AviaxConfig config = configService.loadConfig();
        log.info("Starting media pipeline (config: {}, downloads: {}, workers: {} metadata / {} download)",
                configService.getConfigPath(), config.getDownload().getDirectory(),
                config.getExtraction().getWorkerThreads(), config.getDownload().getWorkerThreads());
        return new MediaPipeline(config,
                new JitteredRequestPacer(config.getPacer()),
                new YtDlpBackend(config.getExtraction()),
                new YouTubeWebSearchProvider(config.getSearch()),
                new YtDlpDirectLinkResolver(config),
                new ConfigDirectLinkSwitch(configService));
    }

    /**
     * Check whether the text is a link to the target platform.
     */
    public boolean exists(String text) {
        return References.isPlatformLink(text);
    }

    public Metadata details(String query) {
        return metadataResolver.resolve(References.classify(query));
    }

    public Metadata details(Reference ref, CancellationToken token) {
        return metadataResolver.resolve(ref, token);
    }

    public AcquisitionResult acquire(Reference ref, AcquisitionMode mode, CancellationToken token) {
        return orchestrator.acquire(ref, mode, token);
    }

    /**
     * Resolve a free-form query, then acquire the resolved item by id.
     * Sentinel metadata short-circuits to a failed result.
     */
    public AcquisitionResult download(String query, AcquisitionMode mode) {
        return download(References.classify(query), mode, CancellationToken.NONE);
    }

    public AcquisitionResult download(Reference ref, AcquisitionMode mode, CancellationToken token) {
        Metadata metadata = metadataResolver.resolve(ref, token);
        if (metadata.isSentinel()) {
            log.warn("Nothing to download for '{}'", ref.value());
            return AcquisitionResult.failed();
        }
        return orchestrator.acquire(Reference.videoId(metadata.videoId()), mode, token);
    }

    public Stream<String> playlist(String link) {
        return playlist(link, defaultPlaylistLimit);
    }

    public Stream<String> playlist(String link, int limit) {
        return playlistExpander.expand(Reference.playlistUrl(link), limit);
    }

    public List<FormatOption> formats(String link) {
        return formatCatalog.formats(References.classify(link), CancellationToken.NONE);
    }

    public Optional<String> streamUrl(String videoId, boolean audioOnly) {
        return orchestrator.streamUrl(Reference.videoId(videoId), audioOnly, CancellationToken.NONE);
    }

    @Override
    public void close() {
        metadataWorkers.close();
        downloadWorkers.close();
    }
}
