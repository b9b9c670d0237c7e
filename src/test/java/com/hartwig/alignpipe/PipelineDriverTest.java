package com.hartwig.alignpipe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;

import com.hartwig.alignpipe.definition.ImmutablePipelineSettings;
import com.hartwig.alignpipe.definition.PipelineBundles;
import com.hartwig.alignpipe.definition.PipelineMode;
import com.hartwig.alignpipe.definition.PipelineSettings;
import com.hartwig.alignpipe.definition.ReferenceSet;
import com.hartwig.alignpipe.execution.ExecutionSubstrate;
import com.hartwig.alignpipe.execution.LocalExecutionSubstrate;
import com.hartwig.alignpipe.execution.LocalStageScheduler;
import com.hartwig.alignpipe.execution.StageRunner;
import com.hartwig.alignpipe.fetch.FetchOptions;
import com.hartwig.alignpipe.fetch.RemoteFetcher;
import com.hartwig.alignpipe.fetch.RemoteLocator;
import com.hartwig.alignpipe.pipeline.BundleTemplates;
import com.hartwig.alignpipe.pipeline.GraphBuilder;
import com.hartwig.alignpipe.pipeline.ToolImages;
import com.hartwig.alignpipe.staging.FormatNormalizer;
import com.hartwig.alignpipe.staging.StagedFileCache;
import com.hartwig.alignpipe.storage.LocalDurableStore;
import com.hartwig.alignpipe.tool.ToolInvocation;
import com.hartwig.alignpipe.tool.ToolResult;
import com.hartwig.alignpipe.tool.ToolRunner;
import com.hartwig.alignpipe.workflow.EncapsulatedNode;
import com.hartwig.alignpipe.workflow.LogicalFileKey;
import com.hartwig.alignpipe.workflow.PipelineGraph;
import com.hartwig.alignpipe.workflow.PipelineNode;
import com.hartwig.alignpipe.workflow.StageDefinition;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

class PipelineDriverTest {
    private static final ReferenceSet REFERENCES = ReferenceSet.builder()
            .referenceFasta("ref.fa")
            .amb("ref.fa.amb")
            .ann("ref.fa.ann")
            .bwt("ref.fa.bwt")
            .pac("ref.fa.pac")
            .sa("ref.fa.sa")
            .fai("ref.fa.fai")
            .phase("phase.vcf")
            .mills("mills.vcf")
            .dbsnp("dbsnp.vcf")
            .omni("omni.vcf")
            .hapmap("hapmap.vcf")
            .build();

    @TempDir
    Path temp;

    private ExecutionSubstrate substrate;
    private PipelineDriver driver;

    @BeforeEach
    void setUp() {
        substrate = mock(ExecutionSubstrate.class);
        driver = new PipelineDriver(new GraphBuilder(mock(ToolRunner.class)), substrate);
    }

    @Test
    void duplicateSamplesGetNumberedRunIds() {
        assertThat(PipelineDriver.runIds(List.of("S1", "S2", "S1", "S1"))).containsExactly("S1", "S2", "S1-2", "S1-3");
        assertThat(PipelineDriver.runIds(List.of("S1-2", "S1", "S1"))).containsExactly("S1-2", "S1", "S1-3");
    }

    @Test
    void samplesSucceedOrFailIndependently() throws IOException, InterruptedException {
        when(substrate.submit(eq("S1"), any())).thenReturn(CompletableFuture.completedFuture(true));
        when(substrate.submit(eq("S2"), any())).thenReturn(CompletableFuture.completedFuture(false));
        when(substrate.submit(eq("S3"), any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));
        when(substrate.submit(eq("S4"), any())).thenThrow(new IllegalArgumentException("rejected"));

        var results = driver.run(manifest("S1\nS2\nS3\nS4\n"), PipelineMode.SECOND_ONLY, bundles(settings().build()));
        assertThat(results).containsExactly(entry("S1", true), entry("S2", false), entry("S3", false), entry("S4", false));
    }

    @Test
    void duplicateSampleRunsSeparately() throws IOException, InterruptedException {
        when(substrate.submit(any(), any())).thenReturn(CompletableFuture.completedFuture(true));

        var results = driver.run(manifest("S1\nS1\n"), PipelineMode.FIRST_ONLY, bundles(settings().build()));
        assertThat(results.keySet()).containsExactly("S1", "S1-2");
        verify(substrate).submit(eq("S1-2"), any(PipelineGraph.class));
    }

    @Test
    void configurationErrorStopsBeforeAnySubmission() throws IOException {
        var manifest = manifest("S1\nS2\n");
        var bundles = bundles(settings().numNodes(1).build());
        assertThrows(ConfigurationException.class, () -> driver.run(manifest, PipelineMode.BOTH, bundles));
        verifyNoInteractions(substrate);
    }

    @Test
    @Timeout(60)
    void bothBranchesOfEverySampleRunToCompletionIndependently() throws IOException, InterruptedException {
        var images = new LinkedHashMap<String, String>();
        for (String tool : List.of(ToolImages.BWA, ToolImages.SAMTOOLS, ToolImages.PICARD, ToolImages.GATK, ToolImages.ADAM,
                ToolImages.SPARK_MASTER, ToolImages.SPARK_WORKER)) {
            images.put(tool, ToolImages.HOST);
        }
        var bundles = BundleTemplates.create(settings().build(), ReferenceSet.builder().from(REFERENCES).images(images).build());
        var tools = new StubTools(temp.resolve("work"), "S1/first-calling/haplotype-caller");
        var graphBuilder = new GraphBuilder(tools);
        var graph = graphBuilder.build("S1", PipelineMode.BOTH, bundles.forSample("S1"));
        assertThat(graph.nodes()).extracting(PipelineNode::name)
                .containsExactlyInAnyOrder("alignment", "first-preprocessing", "first-calling", "second-preprocessing", "second-calling");
        tools.expectOutputsOf(graph, "");

        var fetcher = mock(RemoteFetcher.class);
        when(fetcher.fetch(any(), any(), any())).thenAnswer(invocation -> {
            RemoteLocator locator = invocation.getArgument(0);
            Path destination = invocation.getArgument(1);
            var name = locator.address().substring(locator.address().lastIndexOf('/') + 1);
            return Files.writeString(destination.resolve(name), "@r1\nACGT\n+\nIIII\n");
        });
        var cache = new StagedFileCache(new LocalDurableStore(temp.resolve("store")),
                fetcher,
                new FormatNormalizer(),
                temp.resolve("cache"),
                FetchOptions.defaults());
        var stagePool = Executors.newFixedThreadPool(8);
        try {
            var scheduler = new LocalStageScheduler(new StageRunner(cache, temp.resolve("work"), true), stagePool);
            var driver = new PipelineDriver(graphBuilder, new LocalExecutionSubstrate(scheduler, cache, 2));

            var results = driver.run(manifest("S1\nS2\n"), PipelineMode.BOTH, bundles);
            assertThat(results).containsExactly(entry("S1", false), entry("S2", true));
        } finally {
            stagePool.shutdownNow();
        }
        assertThat(cache.find(LogicalFileKey.of("S1", "variants.adam"))).isEmpty();
        assertThat(cache.find(LogicalFileKey.of("S1", "variants.gatk"))).isPresent();
        assertThat(cache.find(LogicalFileKey.of("S2", "variants.adam"))).isPresent();
        assertThat(cache.find(LogicalFileKey.of("S2", "variants.gatk"))).isPresent();
    }

    private static Map.Entry<String, Boolean> entry(String runId, boolean success) {
        return Map.entry(runId, success);
    }

    private static ImmutablePipelineSettings.Builder settings() {
        return PipelineSettings.builder().inputBucket("bucket").cpuCount(2);
    }

    private static PipelineBundles bundles(PipelineSettings settings) {
        return BundleTemplates.create(settings, REFERENCES);
    }

    private Path manifest(String content) throws IOException {
        return Files.writeString(temp.resolve("manifest.txt"), content);
    }

    /**
     * Writes the declared outputs of whichever stage it runs for, recognizing the stage by its work directory. Fails the
     * stage at the given location.
     */
    private static class StubTools implements ToolRunner {
        private final Path workRoot;
        private final String failingStage;
        private final Map<String, Collection<String>> outputsByWorkPath = new HashMap<>();

        StubTools(final Path workRoot, final String failingStage) {
            this.workRoot = workRoot;
            this.failingStage = failingStage;
        }

        void expectOutputsOf(PipelineGraph graph, String scope) {
            for (PipelineNode node : graph.nodes()) {
                var workPath = scope.isEmpty() ? node.name() : scope + "/" + node.name();
                if (node instanceof EncapsulatedNode) {
                    expectOutputsOf(((EncapsulatedNode) node).graph(), workPath);
                } else {
                    outputsByWorkPath.put(workPath, ((StageDefinition) node).outputs().values());
                }
            }
        }

        @Override
        public ToolResult run(ToolInvocation invocation) throws IOException {
            var location = workRoot.relativize(invocation.workingDirectory()).toString().replace('\\', '/');
            if (location.equals(failingStage)) {
                return ToolResult.exited(1);
            }
            var workPath = location.substring(location.indexOf('/') + 1);
            for (String output : outputsByWorkPath.getOrDefault(workPath, List.of())) {
                Files.writeString(invocation.workingDirectory().resolve(output), "stub");
            }
            return ToolResult.exited(0);
        }
    }
}
