package com.hartwig.alignpipe;

/**
 * Base of all failures raised by the pipeline core.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(final String message) {
        super(message);
    }

    public PipelineException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
