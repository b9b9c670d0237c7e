package com.hartwig.alignpipe.pipeline;

import com.hartwig.alignpipe.definition.ConfigurationBundle;
import com.hartwig.alignpipe.definition.PipelineBundles;
import com.hartwig.alignpipe.definition.PipelineMode;
import com.hartwig.alignpipe.tool.ToolRunner;
import com.hartwig.alignpipe.workflow.PipelineGraph;

/**
 * Builds the graph of one sample run: alignment, then for every branch the mode selects a preprocessing group and a
 * calling group. Each group is one encapsulated node of the returned graph.
 */
public class GraphBuilder {
    private final ToolRunner toolRunner;

    public GraphBuilder(final ToolRunner toolRunner) {
        this.toolRunner = toolRunner;
    }

    /**
     * @param bundles bundles of this sample, with <code>${sample}</code> already substituted
     */
    public PipelineGraph build(String runId, PipelineMode mode, PipelineBundles bundles) {
        var graph = PipelineGraph.builder(runId);
        graph.add(AlignmentStages.create(factory(runId, bundles.alignment())));
        if (mode.includesFirstPath()) {
            graph.add(SparkPreprocessingStages.create(factory(runId, bundles.firstPreprocessing())));
            graph.add(VariantCallingStages.create(factory(runId, bundles.firstCalling()), Branch.FIRST));
        }
        if (mode.includesSecondPath()) {
            graph.add(GatkPreprocessingStages.create(factory(runId, bundles.secondPreprocessing())));
            graph.add(VariantCallingStages.create(factory(runId, bundles.secondCalling()), Branch.SECOND));
        }
        return graph.build();
    }

    private StageFactory factory(String runId, ConfigurationBundle bundle) {
        return new StageFactory(runId, bundle, toolRunner);
    }
}
