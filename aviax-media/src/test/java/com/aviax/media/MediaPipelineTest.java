package com.aviax.media;

import com.aviax.common.config.AviaxConfig;
import com.aviax.common.config.ConfigService;
import com.aviax.media.acquire.DirectLinkSwitch;
import com.aviax.media.search.SearchResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MediaPipelineTest {

    @TempDir
    Path tempDir;

    private AviaxConfig config() {
        AviaxConfig config = ConfigService.defaults();
        config.getDownload().setDirectory(tempDir.resolve("downloads").toString());
        config.getDownload().setWorkerThreads(1);
        config.getExtraction().setBackoffSeedMs(0);
        config.getExtraction().setBackoffJitterMs(0);
        return config;
    }

    private MediaPipeline pipeline(AviaxConfig config, FakeBackend backend, FakeSearchProvider search) {
        return new MediaPipeline(config, new CountingPacer(), backend, search,
                (link, token) -> {
                    throw new MediaException.DirectResolutionException("unused");
                },
                DirectLinkSwitch.DISABLED);
    }

    private FakeBackend songBackend(Path downloads) {
        return new FakeBackend(call -> {
            if (!call.download()) {
                return FakeBackend.item("dQw4w9WgXcQ", "Test Song", 212);
            }
            Path file = downloads.resolve("dQw4w9WgXcQ.webm");
            try {
                Files.createDirectories(downloads);
                Files.writeString(file, "audio");
            } catch (IOException e) {
                throw new MediaException.DownloadException("write failed", e);
            }
            return FakeBackend.downloaded("dQw4w9WgXcQ", "webm", file.toString());
        });
    }

    @Test
    void shortLink_resolvesAndDownloadsAudio() {
        AviaxConfig config = config();
        var backend = songBackend(Path.of(config.getDownload().getDirectory()));

        try (var pipeline = pipeline(config, backend, FakeSearchProvider.failing())) {
            assertTrue(pipeline.exists("https://youtu.be/dQw4w9WgXcQ"));

            Metadata metadata = pipeline.details("https://youtu.be/dQw4w9WgXcQ");
            assertEquals("Test Song", metadata.title());
            assertEquals(212, metadata.durationSeconds());
            assertEquals("3:32", metadata.durationDisplay());

            AcquisitionResult result = pipeline.download("https://youtu.be/dQw4w9WgXcQ", AcquisitionMode.audioOnly());
            assertTrue(result.succeeded());
            assertFalse(result.direct());
            assertTrue(result.location().endsWith(".mp3"));
            assertTrue(Files.exists(Path.of(result.location())));
        }

        var downloadCall = backend.calls.stream().filter(FakeBackend.Call::download).findFirst().orElseThrow();
        assertEquals("https://www.youtube.com/watch?v=dQw4w9WgXcQ", downloadCall.query());
        assertTrue(downloadCall.thread().startsWith("media-worker-"));
        assertTrue(backend.calls.stream().filter(call -> !call.download())
                .allMatch(call -> call.thread().startsWith("metadata-worker-")));
    }

    @Test
    void totalFailure_yieldsSentinelAndFailedDownload() {
        AviaxConfig config = config();
        config.getExtraction().setAttempts(1);
        var backend = FakeBackend.failing();

        try (var pipeline = pipeline(config, backend, FakeSearchProvider.failing())) {
            Metadata metadata = pipeline.details("some unknown song");
            assertEquals("Unknown Title", metadata.title());
            assertEquals("0:00", metadata.durationDisplay());

            AcquisitionResult result = pipeline.download("some unknown song", AcquisitionMode.audioOnly());
            assertFalse(result.succeeded());
        }
        assertTrue(backend.calls.stream().noneMatch(FakeBackend.Call::download));
    }

    @Test
    void searchFallback_feedsDownloadById() {
        AviaxConfig config = config();
        config.getExtraction().setAttempts(1);
        Path downloads = Path.of(config.getDownload().getDirectory());
        var backend = new FakeBackend(call -> {
            if (!call.download()) {
                throw new MediaException.TransientExtractionException("HTTP Error 429");
            }
            return songBackend(downloads).extract(call.query(), call.options(), true, null);
        });
        var search = FakeSearchProvider.returning(new SearchResult("dQw4w9WgXcQ", "Found", "3:32", List.of()));

        try (var pipeline = pipeline(config, backend, search)) {
            AcquisitionResult result = pipeline.download("rick astley", AcquisitionMode.audioOnly());
            assertTrue(result.succeeded());
        }
        assertEquals(List.of("rick astley"), search.queries);
    }

    @Test
    void playlist_usesConfiguredLimit() {
        AviaxConfig config = config();
        config.getDownload().setPlaylistLimit(2);
        var backend = new FakeBackend(call -> FakeBackend.resultSet(
                FakeBackend.item("a", "A", 1), FakeBackend.item("b", "B", 1), FakeBackend.item("c", "C", 1)));

        try (var pipeline = pipeline(config, backend, FakeSearchProvider.failing())) {
            assertEquals(List.of("a", "b"),
                    pipeline.playlist("https://www.youtube.com/playlist?list=PL1").collect(Collectors.toList()));
        }
    }
}
