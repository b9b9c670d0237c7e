package com.hartwig.alignpipe.execution;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.hartwig.alignpipe.definition.FileSize;
import com.hartwig.alignpipe.staging.StagedFileCache;
import com.hartwig.alignpipe.workflow.LogicalFileKey;
import com.hartwig.alignpipe.workflow.StageContext;
import com.hartwig.alignpipe.workflow.StageDefinition;
import com.hartwig.alignpipe.workflow.StageExecutionException;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one stage in three steps: materialize its inputs into a fresh work directory, execute its action, publish its
 * outputs. The work directory is removed when the stage succeeded and kept for inspection when it failed.
 */
public class StageRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(StageRunner.class);
    public static final String FILE_SIZE_PARAMETER = "file-size";

    private final StagedFileCache stagedFileCache;
    private final Path workRoot;
    private final boolean cacheEnabled;

    public StageRunner(final StagedFileCache stagedFileCache, final Path workRoot, final boolean cacheEnabled) {
        this.stagedFileCache = stagedFileCache;
        this.workRoot = workRoot;
        this.cacheEnabled = cacheEnabled;
    }

    public void run(String runId, StageDefinition stage) {
        run(runId, stage.name(), stage);
    }

    /**
     * @param workPath location of the stage within the run, see {@link com.hartwig.alignpipe.workflow.StageScheduler}.
     * Stages with the same name in different encapsulated nodes get separate work directories.
     */
    public void run(String runId, String workPath, StageDefinition stage) {
        var stageName = runId + "/" + workPath;
        var workDirectory = workRoot.resolve(runId).resolve(workPath);
        try {
            FileUtils.deleteDirectory(workDirectory.toFile());
            Files.createDirectories(workDirectory);
        } catch (IOException e) {
            throw new StageExecutionException(String.format("[%s] Could not create work directory '%s'", stageName, workDirectory), e);
        }
        stage.config().find(FILE_SIZE_PARAMETER).ifPresent(size -> checkDiskSpace(stageName, workDirectory, size));

        LOGGER.info("[{}] Materializing {} inputs", stageName, stage.inputKeys().size());
        var inputs = new LinkedHashMap<LogicalFileKey, Path>();
        for (LogicalFileKey key : stage.inputKeys()) {
            var staged = stagedFileCache.materialize(key, Optional.ofNullable(stage.locators().get(key)), workDirectory, cacheEnabled);
            inputs.put(key, staged.path());
        }
        var outputs = new LinkedHashMap<LogicalFileKey, Path>();
        for (Map.Entry<LogicalFileKey, String> output : stage.outputs().entrySet()) {
            outputs.put(output.getKey(), workDirectory.resolve(output.getValue()));
        }

        var context = StageContext.builder()
                .stageName(stageName)
                .sample(runId)
                .workDirectory(workDirectory)
                .inputs(inputs)
                .outputs(outputs)
                .config(stage.config())
                .build();
        LOGGER.info("[{}] Executing action", stageName);
        stage.action().execute(context);

        for (Map.Entry<LogicalFileKey, Path> output : outputs.entrySet()) {
            if (!Files.exists(output.getValue())) {
                throw new StageExecutionException(String.format("[%s] Stage did not produce output '%s' at '%s'",
                        stageName,
                        output.getKey().role(),
                        output.getValue()));
            }
        }
        for (Map.Entry<LogicalFileKey, Path> output : outputs.entrySet()) {
            if (stagedFileCache.find(output.getKey()).isPresent()) {
                LOGGER.warn("[{}] Output '{}' was published by an earlier attempt, keeping that one",
                        stageName,
                        output.getKey().path());
                continue;
            }
            stagedFileCache.publish(output.getKey(), output.getValue());
        }

        try {
            FileUtils.deleteDirectory(workDirectory.toFile());
        } catch (IOException e) {
            LOGGER.warn("[{}] Could not remove work directory [{}]", stageName, workDirectory, e);
        }
    }

    private static void checkDiskSpace(String stageName, Path workDirectory, String expectedSize) {
        try {
            var usable = Files.getFileStore(workDirectory).getUsableSpace();
            if (usable < FileSize.parseBytes(expectedSize)) {
                LOGGER.warn("[{}] Only {} bytes free in [{}] while inputs of about {} are expected",
                        stageName,
                        usable,
                        workDirectory,
                        expectedSize);
            }
        } catch (IOException e) {
            LOGGER.warn("[{}] Could not determine free space of [{}]", stageName, workDirectory, e);
        }
    }
}
