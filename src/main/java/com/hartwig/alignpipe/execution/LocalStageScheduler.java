package com.hartwig.alignpipe.execution;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import com.hartwig.alignpipe.fetch.FetchException;
import com.hartwig.alignpipe.workflow.StageDefinition;
import com.hartwig.alignpipe.workflow.StageScheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs stages on a bounded pool of local threads.
 */
public class LocalStageScheduler implements StageScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStageScheduler.class);

    private final StageRunner stageRunner;
    private final ExecutorService executor;

    public LocalStageScheduler(final StageRunner stageRunner, final ExecutorService executor) {
        this.stageRunner = stageRunner;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Boolean> schedule(String runId, String workPath, StageDefinition stage) {
        return CompletableFuture.supplyAsync(() -> {
            var stageName = runId + "/" + workPath;
            try {
                stageRunner.run(runId, workPath, stage);
                LOGGER.info("[{}] Stage completed with status 'Success'", stageName);
                return true;
            } catch (FetchException e) {
                LOGGER.error("[{}] Stage failed fetching an input ({}): {}", stageName, e.getFailure(), e.getMessage());
                return false;
            } catch (Exception e) {
                LOGGER.error("[{}] Stage failed with", stageName, e);
                return false;
            }
        }, executor);
    }
}
