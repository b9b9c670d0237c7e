package com.hartwig.alignpipe.tool;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.immutables.value.Value;

/**
 * Argument contract of one external tool. Arguments may contain the placeholders
 * <ul>
 *     <li><code>${input.ROLE}</code> path of a materialized input</li>
 *     <li><code>${mate.ROLE}</code> second mate of a paired read input, <code>_1.fastq</code> replaced by <code>_2.fastq</code></li>
 *     <li><code>${output.ROLE}</code> path the output must be written to</li>
 *     <li><code>${param.NAME}</code> parameter of the stage configuration</li>
 *     <li><code>${sample}</code> the sample run</li>
 * </ul>
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ToolCommand {
    /**
     * Executable used when the tool runs on the host.
     */
    String executable();

    /**
     * Arguments, passed to the executable on the host or to the entry point of the image.
     */
    List<String> arguments();

    /**
     * Container image to run the tool in. Runs on the host when absent.
     */
    Optional<String> image();

    /**
     * Options of <code>docker run</code>, e.g. to keep a service running in the background.
     */
    @Value.Default
    default List<String> dockerOptions() {
        return DockerCommand.DEFAULT_RUN_OPTIONS;
    }

    /**
     * Role of the output that receives standard output, for tools that only write to stdout.
     */
    Optional<String> stdoutRole();

    Optional<Duration> timeout();

    static ImmutableToolCommand.Builder builder() {
        return ImmutableToolCommand.builder();
    }
}
