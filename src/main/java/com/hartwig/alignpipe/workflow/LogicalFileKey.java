package com.hartwig.alignpipe.workflow;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

/**
 * A file of one sample run in a given role, e.g. <code>(S1, aligned-bam)</code>.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableLogicalFileKey.class)
@JsonSerialize(as = ImmutableLogicalFileKey.class)
public interface LogicalFileKey {
    @Value.Parameter
    String sample();

    @Value.Parameter
    String role();

    @Value.Check
    default void check() {
        if (sample().isBlank() || role().isBlank()) {
            throw new IllegalArgumentException(String.format("Sample and role of a file key cannot be blank, but were '%s' and '%s'",
                    sample(),
                    role()));
        }
    }

    static LogicalFileKey of(String sample, String role) {
        return ImmutableLogicalFileKey.of(sample, role);
    }

    default String path() {
        return sample() + "/" + role();
    }
}
