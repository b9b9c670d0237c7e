package com.hartwig.alignpipe.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.apache.commons.lang3.tuple.Pair;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.traverse.DepthFirstIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One run of a pipeline graph. Nodes are started as soon as all their predecessors succeeded; encapsulated nodes run their
 * sub-graph as a nested execution. When a node fails, everything downstream of it is skipped while independent nodes
 * carry on.
 */
public class GraphExecution {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphExecution.class);

    private final String runId;
    private final String scope;
    private final PipelineGraph graph;
    private final StageScheduler stageScheduler;
    private final ExecutorService executorService;
    private final ExecutorService nestedExecutorService;
    private final Predicate<PipelineNode> alreadyCompleted;

    private final Map<String, NodeState> nodeStateByName = new LinkedHashMap<>();
    private final BlockingQueue<Pair<PipelineNode, Boolean>> nodeDoneQueue = new LinkedBlockingQueue<>();
    private final DefaultDirectedGraph<PipelineNode, NamedEdge> runGraph;
    private final List<GraphExecution> nestedExecutions = Collections.synchronizedList(new ArrayList<>());

    // copy on write map, for viewing the node state from another thread.
    private volatile Map<String, NodeState> nodeStateView;
    private final List<Consumer<Map<String, NodeState>>> nodeStateSubscribers = Collections.synchronizedList(new ArrayList<>());
    private CompletableFuture<Boolean> doneFuture;
    private Future<?> cancellableFuture;
    private volatile boolean started;

    /**
     * @param executorService runs the loop of this execution
     * @param nestedExecutorService runs the loops of the sub-graphs of encapsulated nodes, must not bound the number of
     * threads
     * @param alreadyCompleted Nodes for which this predicate holds are not run again, e.g. because all their outputs were
     * published by an earlier run.
     */
    public GraphExecution(final String runId, final PipelineGraph graph, final StageScheduler stageScheduler,
            final ExecutorService executorService, final ExecutorService nestedExecutorService,
            final Predicate<PipelineNode> alreadyCompleted) {
        this(runId, "", graph, stageScheduler, executorService, nestedExecutorService, alreadyCompleted);
    }

    private GraphExecution(final String runId, final String scope, final PipelineGraph graph,
            final StageScheduler stageScheduler, final ExecutorService executorService,
            final ExecutorService nestedExecutorService, final Predicate<PipelineNode> alreadyCompleted) {
        this.runId = runId;
        this.scope = scope;
        this.graph = graph;
        this.stageScheduler = stageScheduler;
        this.executorService = executorService;
        this.nestedExecutorService = nestedExecutorService;
        this.alreadyCompleted = alreadyCompleted;
        this.runGraph = graph.copyForRun();

        for (PipelineNode node : graph.nodes()) {
            if (alreadyCompleted.test(node)) {
                LOGGER.info("[{}] Skipping node [{}] since its outputs were published by a previous run.", runId, node.name());
                removeKeepingOrder(node);
                nodeStateByName.put(node.name(), NodeState.SUCCEEDED);
            } else {
                nodeStateByName.put(node.name(), NodeState.PENDING);
            }
        }
        nodeStateView = Map.copyOf(nodeStateByName);
    }

    /**
     * Removes a node that does not need to run, connecting its predecessors to its successors so that nodes on either
     * side of it still run in order.
     */
    private void removeKeepingOrder(PipelineNode node) {
        var predecessors = Graphs.predecessorListOf(runGraph, node);
        var successors = Graphs.successorListOf(runGraph, node);
        runGraph.removeVertex(node);
        for (PipelineNode predecessor : predecessors) {
            for (PipelineNode successor : successors) {
                if (!runGraph.containsEdge(predecessor, successor)) {
                    runGraph.addEdge(predecessor, successor, new NamedEdge(NamedEdge.ORDERING));
                }
            }
        }
    }

    public String getRunId() {
        return runId;
    }

    public PipelineGraph getGraph() {
        return graph;
    }

    /**
     * Starts the worker thread for this graph execution.
     *
     * @return Future that returns true if the whole graph finished successfully, false otherwise.
     */
    public synchronized CompletableFuture<Boolean> findOrStart() {
        if (doneFuture != null) {
            return doneFuture;
        }
        // cancelling a CompletableFuture does not interrupt the work behind it, so the raw executor future is kept as well
        doneFuture = new CompletableFuture<>();
        cancellableFuture = executorService.submit(this::runUntilDone);
        return doneFuture;
    }

    public synchronized void cancel() {
        if (cancellableFuture == null) {
            throw new IllegalStateException("Cannot cancel run that was not started yet.");
        }
        synchronized (nestedExecutions) {
            nestedExecutions.forEach(GraphExecution::cancel);
        }
        cancellableFuture.cancel(true);
        if (!started) {
            // the loop never ran, so nothing else completes the future
            doneFuture.complete(false);
        }
    }

    private void runUntilDone() {
        started = true;
        try {
            updateNodeStateView();
            while (!runGraph.vertexSet().isEmpty()) {
                runRound();
                var done = nodeDoneQueue.take();
                onNodeDone(done.getLeft(), done.getRight());
            }
            var success = nodeStateByName.values().stream().allMatch(state -> state == NodeState.SUCCEEDED);
            LOGGER.info("[{}] Finished graph [{}] with status '{}'", runId, graph.name(), success ? "Success" : "Failed");
            doneFuture.complete(success);
        } catch (InterruptedException e) {
            LOGGER.warn("[{}] Run execution interrupted. Cleaning up.", runId);
            Thread.currentThread().interrupt();
            for (PipelineNode node : runGraph.vertexSet()) {
                nodeStateByName.put(node.name(), NodeState.SKIPPED);
            }
            updateNodeStateView();
            doneFuture.complete(false);
        } catch (RuntimeException e) {
            LOGGER.error("[{}] Run execution failed unexpectedly", runId, e);
            doneFuture.completeExceptionally(e);
        }
    }

    private void runRound() {
        var readyNodes = runGraph.vertexSet()
                .stream()
                .filter(node -> runGraph.inDegreeOf(node) == 0)
                .filter(node -> nodeStateByName.get(node.name()) == NodeState.PENDING)
                .collect(Collectors.toList());
        for (PipelineNode node : readyNodes) {
            LOGGER.info("[{}] Starting node [{}]", runId, node.name());
            nodeStateByName.put(node.name(), NodeState.RUNNING);
            launch(node).whenComplete((result, error) -> {
                if (error != null) {
                    LOGGER.error("[{}] Node [{}] failed with", runId, node.name(), error);
                }
                nodeDoneQueue.add(Pair.of(node, error == null && Boolean.TRUE.equals(result)));
            });
        }
        if (!readyNodes.isEmpty()) {
            updateNodeStateView();
        }
    }

    private CompletableFuture<Boolean> launch(PipelineNode node) {
        try {
            if (node instanceof StageDefinition) {
                return stageScheduler.schedule(runId, workPath(node), (StageDefinition) node);
            } else if (node instanceof EncapsulatedNode) {
                var nested = new GraphExecution(runId,
                        workPath(node),
                        ((EncapsulatedNode) node).graph(),
                        stageScheduler,
                        nestedExecutorService,
                        nestedExecutorService,
                        alreadyCompleted);
                var done = nested.findOrStart();
                nestedExecutions.add(nested);
                return done;
            }
            return CompletableFuture.failedFuture(new IllegalStateException("Unknown node type " + node.getClass().getName()));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String workPath(PipelineNode node) {
        return scope.isEmpty() ? node.name() : scope + "/" + node.name();
    }

    private void onNodeDone(PipelineNode node, boolean success) {
        LOGGER.info("[{}] Finished node [{}], result was {}", runId, node.name(), success ? "Success" : "Fail");
        if (!success) {
            var iterator = new DepthFirstIterator<>(runGraph, node);
            var skippedNodes = new ArrayList<PipelineNode>();
            while (iterator.hasNext()) {
                skippedNodes.add(iterator.next());
            }
            runGraph.removeAllVertices(skippedNodes);
            for (PipelineNode skipped : skippedNodes) {
                nodeStateByName.put(skipped.name(), NodeState.SKIPPED);
            }
            nodeStateByName.put(node.name(), NodeState.FAILED);
        } else {
            runGraph.removeVertex(node);
            nodeStateByName.put(node.name(), NodeState.SUCCEEDED);
        }
        updateNodeStateView();
    }

    private void updateNodeStateView() {
        nodeStateView = Map.copyOf(nodeStateByName);
        synchronized (nodeStateSubscribers) {
            nodeStateSubscribers.forEach(subscriber -> subscriber.accept(nodeStateView));
        }
    }

    public Map<String, NodeState> getNodeStateView() {
        return nodeStateView;
    }

    public String toDotFormat() {
        var view = nodeStateView;
        return graph.toDotFormat(node -> view.get(node.name()).color);
    }

    public void subscribe(Consumer<Map<String, NodeState>> subscriber) {
        this.nodeStateSubscribers.add(subscriber);
    }
}
