package com.hartwig.alignpipe.execution;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;

import com.hartwig.alignpipe.ThreadUtil;
import com.hartwig.alignpipe.staging.StagedFileCache;
import com.hartwig.alignpipe.workflow.GraphExecution;
import com.hartwig.alignpipe.workflow.LogicalFileKey;
import com.hartwig.alignpipe.workflow.PipelineGraph;
import com.hartwig.alignpipe.workflow.PipelineNode;
import com.hartwig.alignpipe.workflow.StageScheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process execution substrate. Each sample run gets a {@link GraphExecution} on a shared pool; nodes whose outputs
 * were all published by an earlier run are not run again.
 */
public class LocalExecutionSubstrate implements ExecutionSubstrate {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalExecutionSubstrate.class);
    private static final int MAX_NESTED_RUNS = 1024;

    private final StageScheduler stageScheduler;
    private final StagedFileCache stagedFileCache;
    private final ExecutorService executorService;
    private final ExecutorService nestedExecutorService;
    private final ConcurrentMap<String, GraphExecution> executionByRunId = new ConcurrentHashMap<>();

    /**
     * @param maxConcurrentRuns number of sample runs executing at the same time, further runs wait for a free slot
     */
    public LocalExecutionSubstrate(final StageScheduler stageScheduler, final StagedFileCache stagedFileCache,
            final int maxConcurrentRuns) {
        this.stageScheduler = stageScheduler;
        this.stagedFileCache = stagedFileCache;
        this.executorService = ThreadUtil.createQueuedExecutorService(maxConcurrentRuns, "sample-run-thread-%d");
        this.nestedExecutorService = ThreadUtil.createExecutorService(MAX_NESTED_RUNS, "nested-run-thread-%d");
    }

    @Override
    public CompletableFuture<Boolean> submit(String runId, PipelineGraph graph) {
        var execution = executionByRunId.computeIfAbsent(runId, id -> newExecution(id, graph));
        if (execution.getGraph() != graph) {
            throw new IllegalArgumentException(String.format("Run '%s' was already submitted with another graph", runId));
        }
        LOGGER.info("[{}] Submitting graph [{}]", runId, graph.name());
        return execution.findOrStart();
    }

    private GraphExecution newExecution(String runId, PipelineGraph graph) {
        var execution = new GraphExecution(runId, graph, stageScheduler, executorService, nestedExecutorService, this::isPublished);
        execution.subscribe(state -> {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("[{}] Execution graph updated: {}", runId, execution.toDotFormat());
            }
        });
        return execution;
    }

    public Map<String, GraphExecution> executions() {
        return Map.copyOf(executionByRunId);
    }

    private boolean isPublished(PipelineNode node) {
        if (node.outputKeys().isEmpty()) {
            return false;
        }
        for (LogicalFileKey key : node.outputKeys()) {
            if (stagedFileCache.find(key).isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
