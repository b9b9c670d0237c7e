package com.hartwig.alignpipe.tool;

import java.io.IOException;

/**
 * Runs external processes. Exit code 0 is success, anything else is a failure the caller decides about.
 */
public interface ToolRunner {
    /**
     * @throws IOException when the process could not be started, e.g. because the executable is not installed.
     */
    ToolResult run(ToolInvocation invocation) throws IOException, InterruptedException;
}
