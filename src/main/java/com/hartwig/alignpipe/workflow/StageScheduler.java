package com.hartwig.alignpipe.workflow;

import java.util.concurrent.CompletableFuture;

/**
 * Contract of the execution substrate for a single stage.
 */
public interface StageScheduler {
    /**
     * Run the stage of the given sample run. Dependencies have completed when this is called.
     *
     * @param workPath the names of the encapsulated nodes enclosing the stage followed by the stage name, joined by
     * '/'. Unique within a run, unlike the stage name.
     * @return Future that completes with true when the stage succeeded and all its outputs are published.
     */
    CompletableFuture<Boolean> schedule(String runId, String workPath, StageDefinition stage);
}
