package com.hartwig.alignpipe.workflow;

/**
 * The work of a stage, typically an external tool invocation.
 */
@FunctionalInterface
public interface StageAction {
    /**
     * Consume the materialized inputs of the context and write every output path of the context.
     *
     * @throws StageExecutionException if the action failed
     */
    void execute(StageContext context);
}
