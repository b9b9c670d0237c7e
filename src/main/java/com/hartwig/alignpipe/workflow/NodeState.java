package com.hartwig.alignpipe.workflow;

public enum NodeState {
    PENDING("black"),
    RUNNING("orange"),
    SUCCEEDED("green"),
    FAILED("red"),
    SKIPPED("grey");

    final String color;

    NodeState(final String color) {
        this.color = color;
    }
}
