package com.hartwig.alignpipe.tool;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ToolResult {
    int TIMED_OUT_EXIT_CODE = -1;

    @Value.Parameter
    int exitCode();

    @Value.Parameter
    boolean timedOut();

    default boolean succeeded() {
        return !timedOut() && exitCode() == 0;
    }

    static ToolResult exited(int exitCode) {
        return ImmutableToolResult.of(exitCode, false);
    }

    static ToolResult timeout() {
        return ImmutableToolResult.of(TIMED_OUT_EXIT_CODE, true);
    }
}
