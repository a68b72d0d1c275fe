package com.aviax.media;

/**
 * Base type of the pipeline's internal failures. None of these cross the
 * public resolver, orchestrator or playlist boundaries.
 */
public abstract class MediaException extends Exception {

    protected MediaException(String message) {
        super(message);
    }

    protected MediaException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Network error, timeout or upstream throttling; worth another attempt. */
    public static class TransientExtractionException extends MediaException {
        public TransientExtractionException(String message) {
            super(message);
        }

        public TransientExtractionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** The query matched nothing. */
    public static class NoResultsException extends MediaException {
        public NoResultsException(String message) {
            super(message);
        }
    }

    /** Both the primary backend and the secondary search provider failed. */
    public static class FallbackExhaustedException extends MediaException {
        public FallbackExhaustedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Extraction worked but writing or post-processing the asset failed. */
    public static class DownloadException extends MediaException {
        public DownloadException(String message) {
            super(message);
        }

        public DownloadException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** The direct-link subprocess produced no usable URL. */
    public static class DirectResolutionException extends MediaException {
        public DirectResolutionException(String message) {
            super(message);
        }

        public DirectResolutionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
