package com.hartwig.alignpipe.pipeline;

import java.util.List;

import com.hartwig.alignpipe.definition.ConfigurationBundle;
import com.hartwig.alignpipe.fetch.RemoteLocator;
import com.hartwig.alignpipe.tool.DockerCommand;
import com.hartwig.alignpipe.tool.ImmutableToolCommand;
import com.hartwig.alignpipe.tool.ToolAction;
import com.hartwig.alignpipe.tool.ToolCommand;
import com.hartwig.alignpipe.tool.ToolRunner;
import com.hartwig.alignpipe.workflow.ImmutableStageDefinition;
import com.hartwig.alignpipe.workflow.LogicalFileKey;
import com.hartwig.alignpipe.workflow.StageDefinition;

/**
 * Creates the tool stages of one stage group of one sample run. Every stage gets the configuration bundle of its
 * group.
 */
class StageFactory {
    private final String runId;
    private final ConfigurationBundle config;
    private final ToolRunner runner;
    private final DockerCommand dockerCommand;

    StageFactory(final String runId, final ConfigurationBundle config, final ToolRunner runner) {
        this.runId = runId;
        this.config = config;
        this.runner = runner;
        this.dockerCommand = new DockerCommand(config.getBoolean(Parameters.SUDO));
    }

    String runId() {
        return runId;
    }

    ConfigurationBundle config() {
        return config;
    }

    DockerCommand dockerCommand() {
        return dockerCommand;
    }

    static String in(String role) {
        return "${input." + role + "}";
    }

    static String mate(String role) {
        return "${mate." + role + "}";
    }

    static String out(String role) {
        return "${output." + role + "}";
    }

    LogicalFileKey key(String role) {
        return LogicalFileKey.of(runId, role);
    }

    StageBuilder stage(String name) {
        return new StageBuilder(name);
    }

    class StageBuilder {
        private final ImmutableStageDefinition.Builder definition;
        private final ImmutableToolCommand.Builder command = ToolCommand.builder();

        private StageBuilder(final String name) {
            definition = StageDefinition.builder().name(name).config(config);
        }

        /**
         * Input written by another stage.
         */
        StageBuilder input(String role) {
            definition.addInputKeys(key(role));
            return this;
        }

        StageBuilder remoteInput(String role, RemoteLocator locator) {
            definition.addInputKeys(key(role)).putLocators(key(role), locator);
            return this;
        }

        /**
         * Unencrypted reference file, located by the bundle parameter of the same name.
         */
        StageBuilder reference(String parameter) {
            return remoteInput(parameter, RemoteLocator.objectStore(config.get(parameter)));
        }

        StageBuilder references(List<String> parameters) {
            parameters.forEach(this::reference);
            return this;
        }

        StageBuilder output(String role, String fileName) {
            definition.putOutputs(key(role), fileName);
            return this;
        }

        /**
         * Runs the tool in its image, or on the host when its image is configured as such.
         */
        StageBuilder tool(String tool, String... arguments) {
            command.executable(ToolImages.hostExecutable(tool)).image(ToolImages.image(tool, config)).addArguments(arguments);
            return this;
        }

        /**
         * Runs a command on the host, regardless of images.
         */
        StageBuilder hostCommand(String executable, List<String> arguments) {
            command.executable(executable).addAllArguments(arguments);
            return this;
        }

        StageBuilder stdoutTo(String role) {
            command.stdoutRole(role);
            return this;
        }

        StageBuilder dockerOptions(String... options) {
            command.dockerOptions(List.of(options));
            return this;
        }

        StageDefinition build() {
            return definition.action(new ToolAction(command.build(), runner, dockerCommand)).build();
        }
    }
}
