package com.hartwig.alignpipe.staging;

import com.hartwig.alignpipe.PipelineException;

public class MalformedStagedFileException extends PipelineException {
    public MalformedStagedFileException(final String message) {
        super(message);
    }

    public MalformedStagedFileException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
