package com.aviax.media;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetadataTest {

    @Test
    void durationDisplay_derivedFromSeconds() {
        var metadata = new Metadata("Test Song", 212, "abc", "");
        assertEquals("3:32", metadata.durationDisplay());
    }

    @Test
    void sentinel_hasDocumentedValues() {
        assertEquals("Unknown Title", Metadata.SENTINEL.title());
        assertEquals(0, Metadata.SENTINEL.durationSeconds());
        assertEquals("0:00", Metadata.SENTINEL.durationDisplay());
        assertEquals("", Metadata.SENTINEL.videoId());
        assertEquals("", Metadata.SENTINEL.thumbnailUrl());
        assertTrue(Metadata.SENTINEL.isSentinel());
        assertEquals("", Metadata.SENTINEL.link());
    }

    @Test
    void nullFields_becomeDefaults() {
        var metadata = new Metadata(null, -5, null, null);
        assertEquals("Unknown Title", metadata.title());
        assertEquals(0, metadata.durationSeconds());
        assertEquals("", metadata.videoId());
        assertEquals("", metadata.thumbnailUrl());
    }

    @Test
    void realMetadata_isNotSentinel() {
        var metadata = new Metadata("Unknown Title", 10, "abc", "");
        assertFalse(metadata.isSentinel());
        assertEquals("https://www.youtube.com/watch?v=abc", metadata.link());
    }

    @Test
    void acquisitionMode_namedModesRequireFormatAndTitle() {
        assertThrows(IllegalArgumentException.class, () -> AcquisitionMode.namedSongAudio("", "x"));
        assertThrows(IllegalArgumentException.class, () -> AcquisitionMode.namedSongVideo("137", " "));
        assertTrue(AcquisitionMode.namedSongAudio("251", "x").producesAudio());
        assertFalse(AcquisitionMode.videoUpTo720().producesAudio());
    }
}
