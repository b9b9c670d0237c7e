package com.hartwig.alignpipe.staging;

import java.nio.file.Path;

import com.hartwig.alignpipe.workflow.LogicalFileKey;

import org.immutables.value.Value;

/**
 * An input materialized in the work directory of a stage.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StagedFile {
    enum Origin {
        /**
         * Copied from the durable store.
         */
        DURABLE_STORE,
        /**
         * Copied from the local cache without touching the durable store or the remote source.
         */
        LOCAL_CACHE,
        /**
         * Fetched from the remote source.
         */
        REMOTE
    }

    @Value.Parameter
    LogicalFileKey key();

    @Value.Parameter
    Path path();

    @Value.Parameter
    Origin origin();

    static StagedFile of(LogicalFileKey key, Path path, Origin origin) {
        return ImmutableStagedFile.of(key, path, origin);
    }
}
