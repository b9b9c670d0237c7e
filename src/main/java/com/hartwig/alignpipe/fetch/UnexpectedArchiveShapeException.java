package com.hartwig.alignpipe.fetch;

/**
 * The archive service returned a bundle that is neither an aligned BAM with its index nor a single tarball of reads.
 * Fetching again returns the same content, so this is never retried.
 */
public class UnexpectedArchiveShapeException extends FetchException {
    public UnexpectedArchiveShapeException(final String message) {
        super(FetchFailure.UNEXPECTED_ARCHIVE_SHAPE, message);
    }
}
