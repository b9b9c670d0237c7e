package com.hartwig.alignpipe.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

import com.hartwig.alignpipe.workflow.LogicalFileKey;

/**
 * Shared store of stage outputs. Every key is written at most once; readers of a published key never see it change.
 */
public interface DurableStore {
    Optional<DurableHandle> find(LogicalFileKey key) throws IOException;

    /**
     * @throws WriteOnceViolationException if the key was published before
     */
    DurableHandle publish(LogicalFileKey key, Path file) throws IOException;

    /**
     * Copies the content of a handle to the given file, replacing it if it exists.
     */
    void read(DurableHandle handle, Path destination) throws IOException;
}
