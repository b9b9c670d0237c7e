package com.hartwig.alignpipe.pipeline;

import java.util.HashMap;
import java.util.Map;

import com.hartwig.alignpipe.definition.ConfigurationBundle;
import com.hartwig.alignpipe.definition.PipelineBundles;
import com.hartwig.alignpipe.definition.PipelineSettings;
import com.hartwig.alignpipe.definition.ReferenceSet;

/**
 * Creates the five bundles shared by all samples of an invocation. Values that differ per sample contain
 * <code>${sample}</code>, which the driver substitutes before building the graph of a sample.
 */
public final class BundleTemplates {
    private static final String SAMPLE = "${" + ConfigurationBundle.SAMPLE_PLACEHOLDER + "}";

    private BundleTemplates() {
    }

    public static PipelineBundles create(PipelineSettings settings, ReferenceSet references) {
        var common = commonParameters(settings, references);

        var alignment = new HashMap<>(common);
        alignment.put(Parameters.SAMPLE_NAME, SAMPLE);
        alignment.put(Parameters.USE_BWAKIT, String.valueOf(settings.useBwakit()));
        alignment.put(Parameters.REFERENCE_AMB, references.amb());
        alignment.put(Parameters.REFERENCE_ANN, references.ann());
        alignment.put(Parameters.REFERENCE_BWT, references.bwt());
        alignment.put(Parameters.REFERENCE_PAC, references.pac());
        alignment.put(Parameters.REFERENCE_SA, references.sa());
        references.alt().ifPresent(alt -> alignment.put(Parameters.REFERENCE_ALT, alt));
        alignment.put(Parameters.PER_FILE_ENCRYPTION, String.valueOf(settings.perFileEncryption()));
        settings.sseKey().ifPresent(key -> alignment.put(Parameters.SSE_KEY, key));
        if (settings.archiveQuery().isPresent()) {
            alignment.put(Parameters.READS_ARCHIVE, settings.archiveQuery().get());
            alignment.put(Parameters.ARCHIVE_CREDENTIALS, settings.archiveCredentials().orElseThrow());
        } else {
            var bucket = settings.inputBucket().orElseThrow();
            alignment.put(Parameters.READS_1, readsUrl(settings.bucketRegion(), bucket, 1));
            alignment.put(Parameters.READS_2, readsUrl(settings.bucketRegion(), bucket, 2));
        }

        var firstPreprocessing = new HashMap<>(common);
        firstPreprocessing.put(Parameters.NUM_NODES, String.valueOf(settings.numNodes()));
        firstPreprocessing.put(Parameters.DRIVER_MEMORY, settings.driverMemory());
        firstPreprocessing.put(Parameters.EXECUTOR_MEMORY, settings.executorMemory());

        return PipelineBundles.builder()
                .alignment(bundle(AlignmentStages.NAME, alignment))
                .firstPreprocessing(bundle(Branch.FIRST.preprocessingName(), firstPreprocessing))
                .secondPreprocessing(bundle(Branch.SECOND.preprocessingName(), common))
                .firstCalling(bundle(Branch.FIRST.callingName(), common))
                .secondCalling(bundle(Branch.SECOND.callingName(), common))
                .build();
    }

    /**
     * Reads are laid out as <code>BUCKET/sequence/SAMPLE_1.fastq.gz</code>; us-east-1 has no region in its host name.
     */
    static String readsUrl(String region, String bucket, int mate) {
        var regionPart = region.equals("us-east-1") ? "" : "-" + region;
        var bucketName = bucket.replaceFirst("^s3://", "").replaceAll("/+$", "");
        return String.format("https://s3%s.amazonaws.com/%s/sequence/%s_%d.fastq.gz", regionPart, bucketName, SAMPLE, mate);
    }

    private static Map<String, String> commonParameters(PipelineSettings settings, ReferenceSet references) {
        var parameters = new HashMap<String, String>();
        parameters.put(Parameters.SUDO, String.valueOf(settings.sudo()));
        parameters.put(Parameters.CPU_COUNT, String.valueOf(settings.cpuCount()));
        parameters.put(Parameters.FILE_SIZE, settings.fileSize());
        parameters.put(Parameters.REFERENCE, references.referenceFasta());
        parameters.put(Parameters.REFERENCE_FAI, references.fai());
        parameters.put(Parameters.PHASE, references.phase());
        parameters.put(Parameters.MILLS, references.mills());
        parameters.put(Parameters.DBSNP, references.dbsnp());
        parameters.put(Parameters.OMNI, references.omni());
        parameters.put(Parameters.HAPMAP, references.hapmap());
        references.images().forEach((tool, image) -> parameters.put(Parameters.IMAGE_PREFIX + tool, image));
        return parameters;
    }

    private static ConfigurationBundle bundle(String name, Map<String, String> parameters) {
        return ConfigurationBundle.builder().name(name).params(parameters).build();
    }
}
