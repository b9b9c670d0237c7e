package com.hartwig.alignpipe.fetch;

/**
 * Classification of a failed fetch. Only unclassified failures are worth another attempt.
 */
public enum FetchFailure {
    AUTH_FORBIDDEN(false),
    BAD_REQUEST_OR_KEY_MISMATCH(false),
    RESOURCE_MISSING(false),
    SERVICE_ERROR(false),
    TOOL_MISSING(false),
    UNCLASSIFIED(true),
    RETRIES_EXHAUSTED(false),
    UNEXPECTED_ARCHIVE_SHAPE(false);

    private final boolean transientFailure;

    FetchFailure(final boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
