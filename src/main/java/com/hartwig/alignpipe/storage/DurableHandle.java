package com.hartwig.alignpipe.storage;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.hartwig.alignpipe.workflow.LogicalFileKey;

import org.immutables.value.Value;

/**
 * Write-once reference to a published file. Serializable so it can be handed across process boundaries.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableDurableHandle.class)
@JsonSerialize(as = ImmutableDurableHandle.class)
public interface DurableHandle {
    LogicalFileKey key();

    /**
     * URI of the stored content, e.g. <code>file:///...</code> or <code>gs://bucket/...</code>.
     */
    String location();

    String fileName();

    long sizeBytes();

    static ImmutableDurableHandle.Builder builder() {
        return ImmutableDurableHandle.builder();
    }
}
