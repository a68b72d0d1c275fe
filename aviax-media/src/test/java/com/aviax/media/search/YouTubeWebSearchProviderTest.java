package com.aviax.media.search;

import com.aviax.common.config.AviaxConfig;
import com.aviax.media.MediaException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class YouTubeWebSearchProviderTest {

    private static final String RESPONSE = """
            {"contents":{"twoColumnSearchResultsRenderer":{"primaryContents":{"sectionListRenderer":{"contents":[
              {"itemSectionRenderer":{"contents":[
                {"adSlotRenderer":{}},
                {"videoRenderer":{"videoId":"dQw4w9WgXcQ",
                  "title":{"runs":[{"text":"Rick Astley - "},{"text":"Never Gonna Give You Up"}]},
                  "lengthText":{"simpleText":"3:33"},
                  "thumbnail":{"thumbnails":[{"url":"https://i.ytimg.com/vi/dQw4w9WgXcQ/hq720.jpg?sqp=abc"}]}}},
                {"videoRenderer":{"videoId":"second01234",
                  "title":{"simpleText":"Second"},
                  "lengthText":{"simpleText":"1:02:03"},
                  "thumbnail":{"thumbnails":[]}}}
              ]}}
            ]}}}}}
            """;

    private final YouTubeWebSearchProvider provider = new YouTubeWebSearchProvider(new AviaxConfig.SearchConfig());

    @Test
    void parseResults_readsVideoRenderersInOrder() throws MediaException {
        List<SearchResult> results = provider.parseResults(RESPONSE, 5);

        assertEquals(2, results.size());
        SearchResult first = results.get(0);
        assertEquals("dQw4w9WgXcQ", first.id());
        assertEquals("Rick Astley - Never Gonna Give You Up", first.title());
        assertEquals("3:33", first.duration());
        assertEquals(1, first.thumbnails().size());
        assertEquals("Second", results.get(1).title());
    }

    @Test
    void parseResults_respectsLimit() throws MediaException {
        assertEquals(1, provider.parseResults(RESPONSE, 1).size());
    }

    @Test
    void parseResults_garbageIsTransient() {
        assertThrows(MediaException.TransientExtractionException.class,
                () -> provider.parseResults("<html>", 1));
    }

    @Test
    void requestBody_carriesQueryAndClientContext() throws Exception {
        JsonNode body = new ObjectMapper().readTree(provider.requestBody("  lofi beats "));
        assertEquals("lofi beats", body.path("query").asText());
        assertEquals("WEB", body.path("context").path("client").path("clientName").asText());
        assertEquals("en", body.path("context").path("client").path("hl").asText());
    }

    @Test
    void search_blankTextReturnsNothingWithoutNetwork() throws Exception {
        assertTrue(provider.search("  ", 1).isEmpty());
        assertTrue(provider.search("x", 0).isEmpty());
    }

    @Test
    void fallbackAdapter_mapsDurationAndStripsThumbnailQuery() throws MediaException {
        var metadata = SearchFallbackAdapter.toMetadata(provider.parseResults(RESPONSE, 1).get(0));
        assertEquals("dQw4w9WgXcQ", metadata.videoId());
        assertEquals(213, metadata.durationSeconds());
        assertEquals("3:33", metadata.durationDisplay());
        assertEquals("https://i.ytimg.com/vi/dQw4w9WgXcQ/hq720.jpg", metadata.thumbnailUrl());
    }

    @Test
    void fallbackAdapter_handlesSecondsOnlyAndMissingThumbnails() {
        var metadata = SearchFallbackAdapter.toMetadata(new SearchResult("id", "T", "45", List.of()));
        assertEquals(45, metadata.durationSeconds());
        assertEquals("", metadata.thumbnailUrl());
    }
}
