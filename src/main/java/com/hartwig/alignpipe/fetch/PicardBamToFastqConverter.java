package com.hartwig.alignpipe.fetch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.hartwig.alignpipe.tool.DockerCommand;
import com.hartwig.alignpipe.tool.ToolInvocation;
import com.hartwig.alignpipe.tool.ToolRunner;
import com.hartwig.alignpipe.workflow.StageExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts with Picard <code>SamToFastq</code>, either with a <code>picard</code> executable on the host or in a
 * container that has the directory of the BAM mounted.
 */
public class PicardBamToFastqConverter implements BamToFastqConverter {
    private static final Logger LOGGER = LoggerFactory.getLogger(PicardBamToFastqConverter.class);

    private final ToolRunner runner;
    private final DockerCommand dockerCommand;

    public PicardBamToFastqConverter(final ToolRunner runner, final DockerCommand dockerCommand) {
        this.runner = runner;
        this.dockerCommand = dockerCommand;
    }

    @Override
    public Path convert(Path bam, FetchOptions options) {
        var directory = bam.toAbsolutePath().getParent();
        var baseName = BamToFastqConverter.baseName(bam);
        var firstMate = directory.resolve(baseName + "_1.fastq");
        var arguments = new ArrayList<String>();
        if (options.converterImage().isEmpty()) {
            arguments.add("picard");
        }
        arguments.addAll(List.of("SamToFastq",
                "I=" + path(options, directory, bam),
                "F=" + path(options, directory, firstMate),
                "F2=" + path(options, directory, directory.resolve(baseName + "_2.fastq")),
                "FU=" + path(options, directory, directory.resolve(baseName + "_UP.fastq"))));
        var command = options.converterImage().map(image -> dockerCommand.wrap(image, directory, arguments)).orElse(arguments);

        LOGGER.info("[{}] Converting to paired FASTQ", bam);
        try {
            var result = runner.run(ToolInvocation.builder().command(command).workingDirectory(directory).build());
            if (!result.succeeded()) {
                throw new StageExecutionException(String.format("Conversion of '%s' to FASTQ failed with exit code %d",
                        bam,
                        result.exitCode()));
            }
        } catch (IOException e) {
            throw new StageExecutionException(String.format("Could not run the FASTQ conversion of '%s'", bam), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageExecutionException(String.format("Interrupted while converting '%s'", bam), e);
        }
        if (!Files.exists(firstMate)) {
            throw new StageExecutionException(String.format("Conversion of '%s' did not produce '%s'", bam, firstMate));
        }
        return firstMate;
    }

    private static String path(FetchOptions options, Path directory, Path file) {
        return options.converterImage().isPresent() ? DockerCommand.containerPath(directory, file) : file.toString();
    }
}
