package com.hartwig.alignpipe.storage;

import com.hartwig.alignpipe.PipelineException;
import com.hartwig.alignpipe.workflow.LogicalFileKey;

public class WriteOnceViolationException extends PipelineException {
    public WriteOnceViolationException(final LogicalFileKey key) {
        super(String.format("Key '%s' has already been published", key.path()));
    }
}
