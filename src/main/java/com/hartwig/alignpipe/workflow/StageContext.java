package com.hartwig.alignpipe.workflow;

import java.nio.file.Path;
import java.util.Map;

import com.hartwig.alignpipe.definition.ConfigurationBundle;

import org.immutables.value.Value;

/**
 * Everything a stage action may touch: its private work directory, the materialized inputs and the paths its outputs
 * must be written to.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StageContext {
    String stageName();

    String sample();

    Path workDirectory();

    Map<LogicalFileKey, Path> inputs();

    Map<LogicalFileKey, Path> outputs();

    ConfigurationBundle config();

    default Path input(String role) {
        return find(inputs(), role, "input");
    }

    default Path output(String role) {
        return find(outputs(), role, "output");
    }

    private Path find(Map<LogicalFileKey, Path> paths, String role, String kind) {
        var path = paths.get(LogicalFileKey.of(sample(), role));
        if (path == null) {
            throw new StageExecutionException(String.format("[%s] Stage has no %s with role '%s'", stageName(), kind, role));
        }
        return path;
    }

    static ImmutableStageContext.Builder builder() {
        return ImmutableStageContext.builder();
    }
}
