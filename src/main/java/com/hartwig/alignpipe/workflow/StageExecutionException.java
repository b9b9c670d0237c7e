package com.hartwig.alignpipe.workflow;

import com.hartwig.alignpipe.PipelineException;

/**
 * A stage could not complete: its tool exited non-zero, an input was not available or an output was not produced.
 */
public class StageExecutionException extends PipelineException {
    public StageExecutionException(final String message) {
        super(message);
    }

    public StageExecutionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
