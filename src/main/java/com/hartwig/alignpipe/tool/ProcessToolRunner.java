package com.hartwig.alignpipe.tool;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProcessToolRunner implements ToolRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessToolRunner.class);

    @Override
    public ToolResult run(ToolInvocation invocation) throws IOException, InterruptedException {
        var builder = new ProcessBuilder(invocation.command()).directory(invocation.workingDirectory().toFile());
        builder.environment().putAll(invocation.environment());
        builder.redirectOutput(invocation.stdout()
                .map(path -> ProcessBuilder.Redirect.to(path.toFile()))
                .orElse(ProcessBuilder.Redirect.DISCARD));
        builder.redirectError(invocation.stderr()
                .map(path -> ProcessBuilder.Redirect.to(path.toFile()))
                .orElse(ProcessBuilder.Redirect.INHERIT));

        LOGGER.debug("[{}] Running {}", invocation.executable(), String.join(" ", invocation.command()));
        var process = builder.start();
        try {
            if (invocation.timeout().isPresent()) {
                var finished = process.waitFor(invocation.timeout().get().toMillis(), TimeUnit.MILLISECONDS);
                if (!finished) {
                    LOGGER.warn("[{}] Process did not finish within {}, killing it", invocation.executable(), invocation.timeout().get());
                    process.destroyForcibly().waitFor();
                    return ToolResult.timeout();
                }
                return ToolResult.exited(process.exitValue());
            }
            return ToolResult.exited(process.waitFor());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }
}
