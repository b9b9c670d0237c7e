package com.hartwig.alignpipe.tool;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.immutables.value.Value;

/**
 * A single external process: its argument list, the directory it runs in and where its output streams go.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ToolInvocation {
    List<String> command();

    Path workingDirectory();

    /**
     * File receiving standard output. When absent the output is discarded.
     */
    Optional<Path> stdout();

    /**
     * File receiving standard error. When absent it is inherited from this process.
     */
    Optional<Path> stderr();

    /**
     * Wall clock limit after which the process is killed.
     */
    Optional<Duration> timeout();

    Map<String, String> environment();

    @Value.Check
    default void check() {
        if (command().isEmpty()) {
            throw new IllegalArgumentException("Tool invocation needs at least an executable");
        }
    }

    default String executable() {
        return command().get(0);
    }

    static ImmutableToolInvocation.Builder builder() {
        return ImmutableToolInvocation.builder();
    }
}
