package com.aviax.media;

/**
 * Outcome of an acquisition.
 *
 * @param location  local file path, or a remote URL when {@code direct}
 * @param direct    the location is a remote stream URL; nothing was written locally
 * @param succeeded false when extraction, download or post-processing failed
 */
public record AcquisitionResult(String location, boolean direct, boolean succeeded) {

    public static AcquisitionResult downloaded(String path) {
        return new AcquisitionResult(path, false, true);
    }

    public static AcquisitionResult directLink(String url) {
        return new AcquisitionResult(url, true, true);
    }

    public static AcquisitionResult failed() {
        return new AcquisitionResult("", false, false);
    }
}
