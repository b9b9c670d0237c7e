package com.hartwig.alignpipe.fetch;

import com.hartwig.alignpipe.PipelineException;

public class FetchException extends PipelineException {
    private final FetchFailure failure;

    public FetchException(final FetchFailure failure, final String message) {
        super(message);
        this.failure = failure;
    }

    public FetchException(final FetchFailure failure, final String message, final Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public FetchFailure getFailure() {
        return failure;
    }
}
