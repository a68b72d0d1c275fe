package com.aviax.media;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReferencesTest {

    @Nested
    class Classify {
        @Test
        void shortLinkIsDirectUrl() {
            Reference ref = References.classify("https://youtu.be/dQw4w9WgXcQ");
            assertEquals(Reference.Kind.DIRECT_URL, ref.kind());
            assertEquals("https://youtu.be/dQw4w9WgXcQ", ref.value());
        }

        @Test
        void watchLinkIsDirectUrl() {
            assertEquals(Reference.Kind.DIRECT_URL,
                    References.classify("  https://www.YouTube.com/watch?v=abc  ").kind());
        }

        @Test
        void playlistPageIsPlaylistUrl() {
            assertEquals(Reference.Kind.PLAYLIST_URL,
                    References.classify("https://www.youtube.com/playlist?list=PL123").kind());
        }

        @Test
        void freeTextIsSearchQuery() {
            Reference ref = References.classify("never gonna give you up");
            assertEquals(Reference.Kind.SEARCH_QUERY, ref.kind());
        }

        @Test
        void otherHostsAreSearchText() {
            assertEquals(Reference.Kind.SEARCH_QUERY,
                    References.classify("https://vimeo.com/12345").kind());
        }

        @Test
        void blankIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> References.classify("  "));
            assertThrows(IllegalArgumentException.class, () -> References.classify(null));
        }
    }

    @Nested
    class BackendQuery {
        @Test
        void directUrlLosesTrackingParameters() {
            Reference ref = Reference.directUrl("https://www.youtube.com/watch?v=abc&t=42&si=xyz");
            assertEquals("https://www.youtube.com/watch?v=abc", References.toBackendQuery(ref));
        }

        @Test
        void videoIdBecomesWatchUrl() {
            assertEquals("https://www.youtube.com/watch?v=dQw4w9WgXcQ",
                    References.toBackendQuery(Reference.videoId("dQw4w9WgXcQ")));
        }

        @Test
        void searchGetsPrefixOnce() {
            assertEquals("ytsearch:lofi beats", References.toBackendQuery(Reference.searchQuery("lofi beats")));
            assertEquals("ytsearch:lofi", References.toBackendQuery(Reference.searchQuery("ytsearch:lofi")));
        }

        @Test
        void playlistPassesThrough() {
            String link = "https://www.youtube.com/playlist?list=PL1&index=2";
            assertEquals(link, References.toBackendQuery(Reference.playlistUrl(link)));
        }
    }

    @Test
    void searchTextIsDeprefixed() {
        assertEquals("lofi", References.toSearchText(Reference.searchQuery("ytsearch:lofi")));
        assertEquals("lofi & chill", References.toSearchText(Reference.searchQuery("lofi & chill")));
        assertEquals("https://youtu.be/x", References.toSearchText(Reference.directUrl("https://youtu.be/x&feature=share")));
    }

    @Test
    void linkSkipsHostCheck() {
        assertEquals(Reference.directUrl("https://example.com/clip"), References.link(" https://example.com/clip "));
        assertEquals(Reference.Kind.PLAYLIST_URL,
                References.link("https://youtube.com/playlist?list=PL9").kind());
    }
}
