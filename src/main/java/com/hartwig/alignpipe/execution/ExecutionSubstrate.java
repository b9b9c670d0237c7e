package com.hartwig.alignpipe.execution;

import java.util.concurrent.CompletableFuture;

import com.hartwig.alignpipe.workflow.PipelineGraph;

/**
 * Executes the graph of one sample run. Nodes run once all their predecessors succeeded; nodes without a path between
 * them may run concurrently.
 */
public interface ExecutionSubstrate {
    /**
     * @return future completing with true iff every node of the graph succeeded
     */
    CompletableFuture<Boolean> submit(String runId, PipelineGraph graph);
}
