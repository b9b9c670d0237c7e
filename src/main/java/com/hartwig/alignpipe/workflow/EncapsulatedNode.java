package com.hartwig.alignpipe.workflow;

import java.util.Set;

/**
 * A sub-graph presented to its enclosing graph as a single node. The enclosing graph only sees the keys the sub-graph
 * needs from outside and the keys it produces, never its internal stages or edges.
 */
public final class EncapsulatedNode implements PipelineNode {
    private final String name;
    private final PipelineGraph graph;

    private EncapsulatedNode(final String name, final PipelineGraph graph) {
        this.name = name;
        this.graph = graph;
    }

    public static EncapsulatedNode of(String name, PipelineGraph.Builder subGraph) {
        return new EncapsulatedNode(name, subGraph.buildSubGraph());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<LogicalFileKey> dependencyKeys() {
        return graph.externalInputKeys();
    }

    @Override
    public Set<LogicalFileKey> outputKeys() {
        return graph.producedKeys();
    }

    /**
     * The private sub-graph, for the execution substrate only.
     */
    public PipelineGraph graph() {
        return graph;
    }

    @Override
    public String toString() {
        return name;
    }
}
