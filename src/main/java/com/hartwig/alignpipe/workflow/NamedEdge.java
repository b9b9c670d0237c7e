package com.hartwig.alignpipe.workflow;

import org.jgrapht.graph.DefaultEdge;

class NamedEdge extends DefaultEdge {
    static final String ORDERING = "after";

    private final String name;

    /**
     * Constructs a dependency edge
     *
     * @param label the role of the file passed along the edge, or {@link #ORDERING} for a structural edge.
     */
    NamedEdge(String label) {
        this.name = label;
    }

    /**
     * Gets the label associated with this edge.
     *
     * @return edge label
     */
    String name() {
        return name;
    }

    @Override
    public String toString() {
        return "(" + getSource() + " : " + getTarget() + " : " + name + ")";
    }
}
