package com.hartwig.alignpipe.pipeline;

import static com.hartwig.alignpipe.pipeline.StageFactory.in;
import static com.hartwig.alignpipe.pipeline.StageFactory.mate;
import static com.hartwig.alignpipe.pipeline.StageFactory.out;

import com.hartwig.alignpipe.fetch.RemoteLocator;
import com.hartwig.alignpipe.workflow.EncapsulatedNode;
import com.hartwig.alignpipe.workflow.PipelineGraph;
import com.hartwig.alignpipe.workflow.StageDefinition;

/**
 * BWA alignment of the paired reads of a sample, followed by conversion to BAM, a header matching the reference and
 * read groups. Also produces the sequence dictionary of the reference, which all later groups need.
 */
final class AlignmentStages {
    static final String NAME = "alignment";
    static final String ALIGNED_SAM = "aligned-sam";
    static final String UNSORTED_BAM = "unsorted-bam";
    static final String HEADER_FIXED_BAM = "header-fixed-bam";

    private AlignmentStages() {
    }

    static EncapsulatedNode create(StageFactory factory) {
        var config = factory.config();
        var graph = PipelineGraph.builder(NAME);
        graph.add(align(factory));
        graph.add(factory.stage("sam-to-bam")
                .input(ALIGNED_SAM)
                .output(UNSORTED_BAM, "aligned.unsorted.bam")
                .tool(ToolImages.SAMTOOLS, "view", "-b", "-o", out(UNSORTED_BAM), in(ALIGNED_SAM))
                .build());
        graph.add(factory.stage("sequence-dictionary")
                .reference(Parameters.REFERENCE)
                .output(Roles.REFERENCE_DICTIONARY, dictionaryName(config.get(Parameters.REFERENCE)))
                .tool(ToolImages.PICARD,
                        "CreateSequenceDictionary",
                        "R=" + in(Parameters.REFERENCE),
                        "O=" + out(Roles.REFERENCE_DICTIONARY))
                .build());
        graph.add(factory.stage("fix-header")
                .input(UNSORTED_BAM)
                .input(Roles.REFERENCE_DICTIONARY)
                .output(HEADER_FIXED_BAM, "aligned.header.bam")
                .tool(ToolImages.PICARD,
                        "ReplaceSamHeader",
                        "I=" + in(UNSORTED_BAM),
                        "HEADER=" + in(Roles.REFERENCE_DICTIONARY),
                        "O=" + out(HEADER_FIXED_BAM))
                .build());
        var sampleName = config.get(Parameters.SAMPLE_NAME);
        graph.add(factory.stage("add-read-groups")
                .input(HEADER_FIXED_BAM)
                .output(Roles.ALIGNED_BAM, "aligned.bam")
                .tool(ToolImages.PICARD,
                        "AddOrReplaceReadGroups",
                        "I=" + in(HEADER_FIXED_BAM),
                        "O=" + out(Roles.ALIGNED_BAM),
                        "RGID=1",
                        "RGLB=" + sampleName,
                        "RGPL=illumina",
                        "RGPU=barcode",
                        "RGSM=" + sampleName)
                .build());
        return EncapsulatedNode.of(NAME, graph);
    }

    private static StageDefinition align(StageFactory factory) {
        var config = factory.config();
        var useBwakit = config.getBoolean(Parameters.USE_BWAKIT);
        var stage = factory.stage("bwa-align").reference(Parameters.REFERENCE).references(Parameters.BWA_INDEX);
        if (useBwakit && config.find(Parameters.REFERENCE_ALT).isPresent()) {
            stage.reference(Parameters.REFERENCE_ALT);
        }

        String firstMate;
        String secondMate;
        if (config.find(Parameters.READS_ARCHIVE).isPresent()) {
            stage.remoteInput(Parameters.READS_ARCHIVE,
                    RemoteLocator.archiveService(config.get(Parameters.READS_ARCHIVE), config.get(Parameters.ARCHIVE_CREDENTIALS)));
            firstMate = in(Parameters.READS_ARCHIVE);
            secondMate = mate(Parameters.READS_ARCHIVE);
        } else {
            var encryptionKey = config.find(Parameters.SSE_KEY);
            var perFileEncryption = config.find(Parameters.PER_FILE_ENCRYPTION).map(Boolean::parseBoolean).orElse(true);
            stage.remoteInput(Parameters.READS_1,
                    RemoteLocator.objectStore(config.get(Parameters.READS_1), encryptionKey, perFileEncryption));
            stage.remoteInput(Parameters.READS_2,
                    RemoteLocator.objectStore(config.get(Parameters.READS_2), encryptionKey, perFileEncryption));
            firstMate = in(Parameters.READS_1);
            secondMate = in(Parameters.READS_2);
        }
        return stage.output(ALIGNED_SAM, "aligned.sam")
                .stdoutTo(ALIGNED_SAM)
                .tool(useBwakit ? ToolImages.BWAKIT : ToolImages.BWA,
                        "mem",
                        "-t",
                        config.get(Parameters.CPU_COUNT),
                        in(Parameters.REFERENCE),
                        firstMate,
                        secondMate)
                .build();
    }

    /**
     * GATK expects the dictionary next to the reference, named after it: <code>hg19.fa.gz</code> becomes
     * <code>hg19.dict</code>.
     */
    static String dictionaryName(String referenceLocation) {
        var name = referenceLocation.substring(referenceLocation.lastIndexOf('/') + 1);
        if (name.endsWith(".gz")) {
            name = name.substring(0, name.length() - ".gz".length());
        }
        var extension = name.lastIndexOf('.');
        return (extension > 0 ? name.substring(0, extension) : name) + ".dict";
    }
}
