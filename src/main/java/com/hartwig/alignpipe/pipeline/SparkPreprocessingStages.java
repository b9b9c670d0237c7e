package com.hartwig.alignpipe.pipeline;

import static com.hartwig.alignpipe.pipeline.StageFactory.in;
import static com.hartwig.alignpipe.pipeline.StageFactory.out;

import java.util.ArrayList;
import java.util.List;

import com.hartwig.alignpipe.ConfigurationException;
import com.hartwig.alignpipe.workflow.EncapsulatedNode;
import com.hartwig.alignpipe.workflow.PipelineGraph;
import com.hartwig.alignpipe.workflow.StageDefinition;

/**
 * Preprocessing on a standalone Spark cluster with ADAM. One node runs the Spark master, the remaining nodes run
 * workers. The cluster is started detached before conversion and torn down after the transform.
 */
final class SparkPreprocessingStages {
    static final Branch BRANCH = Branch.FIRST;
    static final String ALIGNED_READS = BRANCH.role("aligned-reads");
    static final String SPARK_PORT = "7077";

    private SparkPreprocessingStages() {
    }

    static EncapsulatedNode create(StageFactory factory) {
        var config = factory.config();
        var numNodes = config.getInt(Parameters.NUM_NODES);
        if (numNodes < 2) {
            throw new ConfigurationException(String.format(
                    "Parameter '%s' must be greater than 1, one node runs the Spark master and the others run workers, but was %d",
                    Parameters.NUM_NODES,
                    numNodes));
        }
        var masterUrl = "spark://" + config.find(Parameters.SPARK_MASTER_HOST).orElse("localhost") + ":" + SPARK_PORT;
        var containerPrefix = "spark-" + factory.runId().replaceAll("[^a-zA-Z0-9_.-]", "_");
        var masterContainer = containerPrefix + "-master";

        var graph = PipelineGraph.builder(BRANCH.preprocessingName());
        graph.add(factory.stage("spark-master")
                .tool(ToolImages.SPARK_MASTER)
                .dockerOptions("-d", "--name", masterContainer, "--net=host")
                .build());

        var containers = new ArrayList<String>();
        containers.add(masterContainer);
        for (int i = 1; i < numNodes; i++) {
            var workerName = "spark-worker-" + i;
            var workerContainer = containerPrefix + "-worker-" + i;
            containers.add(workerContainer);
            graph.add(factory.stage(workerName)
                    .tool(ToolImages.SPARK_WORKER, masterUrl)
                    .dockerOptions("-d", "--name", workerContainer, "--net=host")
                    .build());
            graph.addOrderingEdge("spark-master", workerName);
            graph.addOrderingEdge(workerName, "adam-convert");
        }

        var preprocessedBam = BRANCH.role(Roles.PREPROCESSED_BAM);
        graph.add(factory.stage("adam-convert")
                .input(Roles.ALIGNED_BAM)
                .output(ALIGNED_READS, "aligned-reads.adam")
                .tool(ToolImages.ADAM, adamArguments(config.get(Parameters.DRIVER_MEMORY),
                        config.get(Parameters.EXECUTOR_MEMORY),
                        masterUrl,
                        List.of("transform", in(Roles.ALIGNED_BAM), out(ALIGNED_READS))))
                .build());
        graph.add(factory.stage("adam-transform")
                .input(ALIGNED_READS)
                .reference(Parameters.DBSNP)
                .output(preprocessedBam, "preprocessed" + BRANCH.suffix() + ".bam")
                .tool(ToolImages.ADAM, adamArguments(config.get(Parameters.DRIVER_MEMORY),
                        config.get(Parameters.EXECUTOR_MEMORY),
                        masterUrl,
                        List.of("transform",
                                in(ALIGNED_READS),
                                out(preprocessedBam),
                                "-mark_duplicate_reads",
                                "-recalibrate_base_qualities",
                                "-known_snps",
                                in(Parameters.DBSNP),
                                "-realign_indels",
                                "-sort_reads",
                                "-single")))
                .build());

        graph.add(shutdown(factory, containers));
        graph.addOrderingEdge("adam-transform", "spark-shutdown");
        return EncapsulatedNode.of(BRANCH.preprocessingName(), graph);
    }

    private static StageDefinition shutdown(StageFactory factory, List<String> containers) {
        var stage = factory.stage("spark-shutdown");
        if (ToolImages.image(ToolImages.SPARK_MASTER, factory.config()).isEmpty()) {
            return stage.hostCommand("sh", List.of("-c", "stop-worker.sh; stop-master.sh")).build();
        }
        var docker = factory.dockerCommand().docker();
        var arguments = new ArrayList<>(docker.subList(1, docker.size()));
        arguments.add("rm");
        arguments.add("-f");
        arguments.addAll(containers);
        return stage.hostCommand(docker.get(0), arguments).build();
    }

    private static String[] adamArguments(String driverMemory, String executorMemory, String masterUrl, List<String> adamArguments) {
        var arguments = new ArrayList<String>();
        arguments.add("--master");
        arguments.add(masterUrl);
        arguments.add("--conf");
        arguments.add("spark.driver.memory=" + driverMemory);
        arguments.add("--conf");
        arguments.add("spark.executor.memory=" + executorMemory);
        arguments.add("--");
        arguments.addAll(adamArguments);
        return arguments.toArray(new String[0]);
    }
}
