package com.aviax.media.playlist;

import com.aviax.common.config.AviaxConfig;
import com.aviax.media.CountingPacer;
import com.aviax.media.FakeBackend;
import com.aviax.media.Reference;
import com.aviax.media.backend.AntiDetectionProfile;
import com.aviax.media.backend.ExtractedInfo;
import com.aviax.media.worker.MediaWorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PlaylistExpanderTest {

    private static final String LINK = "https://www.youtube.com/playlist?list=PL123";

    private final CountingPacer pacer = new CountingPacer();
    private final MediaWorkerPool workers = new MediaWorkerPool("metadata-worker", 1);

    @AfterEach
    void tearDown() {
        workers.close();
    }

    private PlaylistExpander expander(FakeBackend backend) {
        return new PlaylistExpander(pacer, backend, new AntiDetectionProfile(new AviaxConfig.ExtractionConfig()),
                workers);
    }

    private static FakeBackend playlistOf(String... ids) {
        return new FakeBackend(call -> FakeBackend.resultSet(Stream.of(ids)
                .map(id -> FakeBackend.item(id, "Track " + id, 0))
                .toArray(ExtractedInfo[]::new)));
    }

    @Test
    void expand_isLazyUntilConsumed() {
        var backend = playlistOf("a", "b");

        Stream<String> ids = expander(backend).expand(Reference.playlistUrl(LINK), 10);

        assertTrue(backend.calls.isEmpty());
        assertEquals(0, pacer.slots.get());
        assertEquals(List.of("a", "b"), ids.collect(Collectors.toList()));
        assertEquals(1, backend.calls.size());
        assertEquals(1, pacer.slots.get());
    }

    @Test
    void expand_usesFlatExtractionAndKeepsListParameter() {
        var backend = playlistOf("a");
        String link = "https://www.youtube.com/watch?v=abc&list=PL123";

        expander(backend).expand(Reference.directUrl(link), 5).count();

        var call = backend.calls.get(0);
        assertEquals(link, call.query());
        assertTrue(call.options().isFlatPlaylist());
        assertEquals(5, call.options().getPlaylistEnd());
        assertFalse(call.download());
        assertTrue(call.thread().startsWith("metadata-worker-"));
    }

    @Test
    void expand_respectsLimitEvenIfBackendReturnsMore() {
        var ids = expander(playlistOf("a", "b", "c", "d")).expand(Reference.playlistUrl(LINK), 2)
                .collect(Collectors.toList());
        assertEquals(List.of("a", "b"), ids);
    }

    @Test
    void expand_nonPositiveLimitNeverCallsBackend() {
        var backend = playlistOf("a");
        assertEquals(0, expander(backend).expand(Reference.playlistUrl(LINK), 0).count());
        assertTrue(backend.calls.isEmpty());
    }

    @Test
    void expand_backendFailureYieldsEmpty() {
        assertEquals(0, expander(FakeBackend.failing()).expand(Reference.playlistUrl(LINK), 10).count());
    }

    @Test
    void expand_streamCanOnlyBeConsumedOnce() {
        Stream<String> ids = expander(playlistOf("a")).expand(Reference.playlistUrl(LINK), 10);
        ids.count();
        assertThrows(IllegalStateException.class, ids::count);
    }

    @Test
    void expand_rejectsSearchReferences() {
        var expander = expander(playlistOf("a"));
        assertThrows(IllegalArgumentException.class,
                () -> expander.expand(Reference.searchQuery("lofi"), 10));
    }
}
