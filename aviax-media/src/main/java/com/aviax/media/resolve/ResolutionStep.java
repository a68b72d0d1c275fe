package com.aviax.media.resolve;

import com.aviax.media.Metadata;

/**
 * States of the metadata resolution state machine. Expected fallback paths
 * are values here rather than exceptions.
 */
public sealed interface ResolutionStep {

    /** Resolution finished with real metadata. */
    record Success(Metadata metadata) implements ResolutionStep {
    }

    /** The previous attempt failed transiently; try the primary backend again. */
    record Retry(int nextAttempt, Throwable cause) implements ResolutionStep {
    }

    /** The primary backend is done; consult the secondary search provider. */
    record Fallback(Throwable cause) implements ResolutionStep {
    }

    /** Every strategy failed; the caller gets {@link Metadata#SENTINEL}. */
    record SentinelFailure(Throwable cause) implements ResolutionStep {
    }
}
