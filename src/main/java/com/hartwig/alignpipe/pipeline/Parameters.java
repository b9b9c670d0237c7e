package com.hartwig.alignpipe.pipeline;

import java.util.List;

/**
 * Names of the configuration bundle parameters read by the stage groups.
 */
public final class Parameters {
    public static final String READS_1 = "reads-1";
    public static final String READS_2 = "reads-2";
    public static final String READS_ARCHIVE = "reads-archive";
    public static final String ARCHIVE_CREDENTIALS = "archive-credentials";
    public static final String SSE_KEY = "sse-key";
    public static final String PER_FILE_ENCRYPTION = "per-file-encryption";

    public static final String SUDO = "sudo";
    public static final String CPU_COUNT = "cpu-count";
    public static final String FILE_SIZE = "file-size";
    public static final String USE_BWAKIT = "use-bwakit";
    public static final String SAMPLE_NAME = "sample-name";

    public static final String NUM_NODES = "num-nodes";
    public static final String DRIVER_MEMORY = "driver-memory";
    public static final String EXECUTOR_MEMORY = "executor-memory";
    public static final String SPARK_MASTER_HOST = "spark-master-host";

    public static final String REFERENCE = "ref.fa";
    public static final String REFERENCE_AMB = "ref.fa.amb";
    public static final String REFERENCE_ANN = "ref.fa.ann";
    public static final String REFERENCE_BWT = "ref.fa.bwt";
    public static final String REFERENCE_PAC = "ref.fa.pac";
    public static final String REFERENCE_SA = "ref.fa.sa";
    public static final String REFERENCE_FAI = "ref.fa.fai";
    public static final String REFERENCE_ALT = "ref.fa.alt";
    public static final String PHASE = "phase.vcf";
    public static final String MILLS = "mills.vcf";
    public static final String DBSNP = "dbsnp.vcf";
    public static final String OMNI = "omni.vcf";
    public static final String HAPMAP = "hapmap.vcf";

    public static final List<String> BWA_INDEX = List.of(REFERENCE_AMB, REFERENCE_ANN, REFERENCE_BWT, REFERENCE_PAC, REFERENCE_SA);

    /**
     * Prefix of parameters overriding the image of a tool, e.g. <code>image.gatk</code>.
     */
    public static final String IMAGE_PREFIX = "image.";

    private Parameters() {
    }
}
