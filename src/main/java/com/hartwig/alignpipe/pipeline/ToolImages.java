package com.hartwig.alignpipe.pipeline;

import java.util.Map;
import java.util.Optional;

import com.hartwig.alignpipe.definition.ConfigurationBundle;

/**
 * Container images of the tools. A bundle parameter <code>image.TOOL</code> overrides the default; the value
 * {@value #HOST} runs the tool on the host instead.
 */
public final class ToolImages {
    public static final String HOST = "local";

    public static final String BWA = "bwa";
    public static final String BWAKIT = "bwakit";
    public static final String SAMTOOLS = "samtools";
    public static final String PICARD = "picard";
    public static final String GATK = "gatk";
    public static final String ADAM = "adam";
    public static final String SPARK_MASTER = "spark-master";
    public static final String SPARK_WORKER = "spark-worker";
    public static final String GENETORRENT = "genetorrent";

    private static final Map<String, String> DEFAULT_IMAGES = Map.of(BWA,
            "quay.io/ucsc_cgl/bwa",
            BWAKIT,
            "quay.io/ucsc_cgl/bwakit",
            SAMTOOLS,
            "quay.io/ucsc_cgl/samtools",
            PICARD,
            "quay.io/ucsc_cgl/picardtools",
            GATK,
            "quay.io/ucsc_cgl/gatk",
            ADAM,
            "quay.io/ucsc_cgl/adam",
            SPARK_MASTER,
            "quay.io/ucsc_cgl/apache-spark-master",
            SPARK_WORKER,
            "quay.io/ucsc_cgl/apache-spark-worker",
            GENETORRENT,
            "quay.io/ucsc_cgl/genetorrent");

    private static final Map<String, String> HOST_EXECUTABLES = Map.of(ADAM,
            "adam-submit",
            SPARK_MASTER,
            "start-master.sh",
            SPARK_WORKER,
            "start-worker.sh");

    private ToolImages() {
    }

    public static Optional<String> image(String tool, ConfigurationBundle config) {
        var image = config.find(Parameters.IMAGE_PREFIX + tool).orElse(DEFAULT_IMAGES.get(tool));
        if (image == null || image.equals(HOST)) {
            return Optional.empty();
        }
        return Optional.of(image);
    }

    public static String hostExecutable(String tool) {
        return HOST_EXECUTABLES.getOrDefault(tool, tool);
    }
}
