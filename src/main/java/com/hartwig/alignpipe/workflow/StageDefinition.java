package com.hartwig.alignpipe.workflow;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.hartwig.alignpipe.ConfigurationException;
import com.hartwig.alignpipe.definition.ConfigurationBundle;
import com.hartwig.alignpipe.fetch.RemoteLocator;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StageDefinition extends PipelineNode {
    /**
     * Stage name, unique within its graph.
     */
    @Override
    String name();

    /**
     * All keys materialized into the work directory before the action runs.
     */
    Set<LogicalFileKey> inputKeys();

    /**
     * Inputs fetched from a remote source when no durable copy exists yet. Every key here is also an input key.
     */
    Map<LogicalFileKey, RemoteLocator> locators();

    /**
     * File name, relative to the work directory, of every key the action writes.
     */
    Map<LogicalFileKey, String> outputs();

    ConfigurationBundle config();

    @Value.Auxiliary
    StageAction action();

    @Override
    default Set<LogicalFileKey> outputKeys() {
        return outputs().keySet();
    }

    @Override
    default Set<LogicalFileKey> dependencyKeys() {
        return inputKeys().stream().filter(key -> !locators().containsKey(key)).collect(Collectors.toUnmodifiableSet());
    }

    @Value.Check
    default void check() {
        for (LogicalFileKey key : locators().keySet()) {
            if (!inputKeys().contains(key)) {
                throw new ConfigurationException(String.format("Stage '%s' has a remote locator for '%s' which is not one of its inputs",
                        name(),
                        key.path()));
            }
        }
        for (LogicalFileKey key : outputKeys()) {
            if (inputKeys().contains(key)) {
                throw new ConfigurationException(String.format("Stage '%s' depends on its own output '%s'", name(), key.path()));
            }
        }
    }

    static ImmutableStageDefinition.Builder builder() {
        return ImmutableStageDefinition.builder();
    }
}
