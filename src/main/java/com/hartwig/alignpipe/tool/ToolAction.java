package com.hartwig.alignpipe.tool;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hartwig.alignpipe.workflow.StageAction;
import com.hartwig.alignpipe.workflow.StageContext;
import com.hartwig.alignpipe.workflow.StageExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage action that resolves the placeholders of a {@link ToolCommand} against the stage context and runs it, either
 * on the host or in a container with the stage work directory mounted.
 */
public class ToolAction implements StageAction {
    private static final Logger LOGGER = LoggerFactory.getLogger(ToolAction.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{(?:(input|mate|output|param)\\.)?([^}]+)}");
    private static final String LOG_DIRECTORY = "logs";

    private final ToolCommand command;
    private final ToolRunner runner;
    private final DockerCommand dockerCommand;

    public ToolAction(final ToolCommand command, final ToolRunner runner, final DockerCommand dockerCommand) {
        this.command = command;
        this.runner = runner;
        this.dockerCommand = dockerCommand;
    }

    public ToolCommand command() {
        return command;
    }

    @Override
    public void execute(StageContext context) {
        var arguments = resolveArguments(context);
        List<String> commandLine;
        if (command.image().isPresent()) {
            var runOptions = new ArrayList<String>();
            for (String option : command.dockerOptions()) {
                runOptions.add(resolve(option, context));
            }
            commandLine = dockerCommand.wrap(command.image().get(), context.workDirectory(), runOptions, arguments);
        } else {
            commandLine = new ArrayList<>();
            commandLine.add(command.executable());
            commandLine.addAll(arguments);
        }
        var logDirectory = context.workDirectory().resolve(LOG_DIRECTORY);
        try {
            Files.createDirectories(logDirectory);
            var invocation = ToolInvocation.builder()
                    .command(commandLine)
                    .workingDirectory(context.workDirectory())
                    .stdout(command.stdoutRole().map(context::output))
                    .stderr(logDirectory.resolve(context.stageName().replace('/', '-') + ".stderr"))
                    .timeout(command.timeout())
                    .build();
            LOGGER.info("[{}] Running {}", context.stageName(), String.join(" ", commandLine));
            var result = runner.run(invocation);
            if (result.timedOut()) {
                throw new StageExecutionException(String.format("[%s] Tool '%s' timed out", context.stageName(), command.executable()));
            }
            if (!result.succeeded()) {
                throw new StageExecutionException(String.format("[%s] Tool '%s' failed with exit code %d, see '%s'",
                        context.stageName(),
                        command.executable(),
                        result.exitCode(),
                        invocation.stderr().orElseThrow()));
            }
        } catch (IOException e) {
            throw new StageExecutionException(String.format("[%s] Could not run tool '%s'", context.stageName(), command.executable()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageExecutionException(String.format("[%s] Interrupted while running tool '%s'",
                    context.stageName(),
                    command.executable()), e);
        }
    }

    List<String> resolveArguments(StageContext context) {
        var resolved = new ArrayList<String>();
        for (String argument : command.arguments()) {
            resolved.add(resolve(argument, context));
        }
        return resolved;
    }

    private String resolve(String argument, StageContext context) {
        var matcher = PLACEHOLDER.matcher(argument);
        var result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement(matcher.group(1), matcher.group(2), context)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private String replacement(String kind, String name, StageContext context) {
        if (kind == null) {
            if (name.equals("sample")) {
                return context.sample();
            }
            throw new StageExecutionException(String.format("[%s] Unknown placeholder '${%s}'", context.stageName(), name));
        }
        switch (kind) {
            case "input":
                return path(context, context.input(name));
            case "mate":
                return path(context, mateOf(context.input(name)));
            case "output":
                return path(context, context.output(name));
            default:
                return context.config().get(name);
        }
    }

    private String path(StageContext context, Path path) {
        if (command.image().isPresent()) {
            return DockerCommand.containerPath(context.workDirectory(), path);
        }
        return path.toAbsolutePath().toString();
    }

    static Path mateOf(Path firstMate) {
        var fileName = firstMate.getFileName().toString();
        var index = fileName.lastIndexOf("_1.fastq");
        if (index < 0) {
            throw new StageExecutionException(String.format("Cannot derive the second mate of '%s'", firstMate));
        }
        return firstMate.resolveSibling(fileName.substring(0, index) + "_2.fastq" + fileName.substring(index + "_1.fastq".length()));
    }
}
