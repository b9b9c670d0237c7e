package com.hartwig.alignpipe;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import com.hartwig.alignpipe.definition.ManifestReader;
import com.hartwig.alignpipe.definition.PipelineBundles;
import com.hartwig.alignpipe.definition.PipelineMode;
import com.hartwig.alignpipe.execution.ExecutionSubstrate;
import com.hartwig.alignpipe.pipeline.GraphBuilder;
import com.hartwig.alignpipe.workflow.PipelineGraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the pipeline for every sample of a manifest. Graphs of all samples are built before the first one is submitted, so
 * configuration errors surface before any work starts. After that, samples succeed or fail independently.
 */
public class PipelineDriver {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineDriver.class);

    private final GraphBuilder graphBuilder;
    private final ExecutionSubstrate substrate;

    public PipelineDriver(final GraphBuilder graphBuilder, final ExecutionSubstrate substrate) {
        this.graphBuilder = graphBuilder;
        this.substrate = substrate;
    }

    /**
     * @return success per run id, in manifest order
     */
    public Map<String, Boolean> run(Path manifest, PipelineMode mode, PipelineBundles bundleTemplates) throws InterruptedException {
        var samples = ManifestReader.read(manifest);
        var runIds = runIds(samples);

        var graphs = new LinkedHashMap<String, PipelineGraph>();
        for (int i = 0; i < samples.size(); i++) {
            var runId = runIds.get(i);
            graphs.put(runId, graphBuilder.build(runId, mode, bundleTemplates.forSample(samples.get(i))));
        }
        LOGGER.info("Built {} graph(s) in mode [{}]", graphs.size(), mode.flag());

        var futures = new LinkedHashMap<String, CompletableFuture<Boolean>>();
        for (var entry : graphs.entrySet()) {
            try {
                futures.put(entry.getKey(), substrate.submit(entry.getKey(), entry.getValue()));
            } catch (RuntimeException e) {
                LOGGER.error("[{}] Could not submit run", entry.getKey(), e);
                futures.put(entry.getKey(), CompletableFuture.completedFuture(false));
            }
        }

        var results = new LinkedHashMap<String, Boolean>();
        for (var entry : futures.entrySet()) {
            results.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
        }
        return results;
    }

    private static boolean await(String runId, CompletableFuture<Boolean> future) throws InterruptedException {
        try {
            var success = future.get();
            LOGGER.info("[{}] Finished run. Final result: {}.", runId, success ? "Success" : "Failed");
            return success;
        } catch (ExecutionException e) {
            LOGGER.error("[{}] Run failed unexpectedly", runId, e.getCause());
            return false;
        }
    }

    /**
     * The first occurrence of a sample runs under its own identifier, the n-th duplicate as <code>SAMPLE-n</code>. Run ids
     * are unique even when a manifest already lists such a name.
     */
    static List<String> runIds(List<String> samples) {
        var used = new HashSet<String>();
        var runIds = new ArrayList<String>();
        for (String sample : samples) {
            var runId = sample;
            for (int occurrence = 2; !used.add(runId); occurrence++) {
                runId = sample + "-" + occurrence;
            }
            runIds.add(runId);
        }
        return runIds;
    }
}
