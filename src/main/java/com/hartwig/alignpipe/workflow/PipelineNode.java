package com.hartwig.alignpipe.workflow;

import java.util.Set;

/**
 * A vertex of a pipeline graph: either a single stage or an encapsulated sub-graph.
 */
public interface PipelineNode {
    String name();

    /**
     * Keys this node reads that must be written by another node of the graph.
     */
    Set<LogicalFileKey> dependencyKeys();

    /**
     * Keys this node writes.
     */
    Set<LogicalFileKey> outputKeys();
}
