package com.hartwig.alignpipe.pipeline;

import static com.hartwig.alignpipe.pipeline.StageFactory.in;
import static com.hartwig.alignpipe.pipeline.StageFactory.out;

import com.hartwig.alignpipe.workflow.EncapsulatedNode;
import com.hartwig.alignpipe.workflow.PipelineGraph;

/**
 * GATK best-practices preprocessing: coordinate sort, duplicate marking, indel realignment and base quality score
 * recalibration.
 */
final class GatkPreprocessingStages {
    static final Branch BRANCH = Branch.SECOND;
    static final String SORTED_BAM = BRANCH.role("sorted-bam");
    static final String DEDUP_BAM = BRANCH.role("dedup-bam");
    static final String DEDUP_INDEX = BRANCH.role("dedup-index");
    static final String DEDUP_METRICS = BRANCH.role("dedup-metrics");
    static final String REALIGN_TARGETS = BRANCH.role("realign-targets");
    static final String REALIGNED_BAM = BRANCH.role("realigned-bam");
    static final String REALIGNED_INDEX = BRANCH.role("realigned-index");
    static final String RECALIBRATION_TABLE = BRANCH.role("recal-table");

    private GatkPreprocessingStages() {
    }

    static EncapsulatedNode create(StageFactory factory) {
        var cpuCount = factory.config().get(Parameters.CPU_COUNT);
        var preprocessedBam = BRANCH.role(Roles.PREPROCESSED_BAM);
        var graph = PipelineGraph.builder(BRANCH.preprocessingName());

        graph.add(factory.stage("sort")
                .input(Roles.ALIGNED_BAM)
                .output(SORTED_BAM, "sorted" + BRANCH.suffix() + ".bam")
                .tool(ToolImages.PICARD,
                        "SortSam",
                        "I=" + in(Roles.ALIGNED_BAM),
                        "O=" + out(SORTED_BAM),
                        "SO=coordinate")
                .build());
        graph.add(factory.stage("mark-duplicates")
                .input(SORTED_BAM)
                .output(DEDUP_BAM, "dedup" + BRANCH.suffix() + ".bam")
                .output(DEDUP_INDEX, "dedup" + BRANCH.suffix() + ".bai")
                .output(DEDUP_METRICS, "dedup" + BRANCH.suffix() + ".metrics")
                .tool(ToolImages.PICARD,
                        "MarkDuplicates",
                        "I=" + in(SORTED_BAM),
                        "O=" + out(DEDUP_BAM),
                        "M=" + out(DEDUP_METRICS),
                        "CREATE_INDEX=true")
                .build());
        graph.add(factory.stage("realigner-targets")
                .reference(Parameters.REFERENCE)
                .reference(Parameters.REFERENCE_FAI)
                .reference(Parameters.PHASE)
                .reference(Parameters.MILLS)
                .input(Roles.REFERENCE_DICTIONARY)
                .input(DEDUP_BAM)
                .input(DEDUP_INDEX)
                .output(REALIGN_TARGETS, "realign" + BRANCH.suffix() + ".intervals")
                .tool(ToolImages.GATK,
                        "-T",
                        "RealignerTargetCreator",
                        "-R",
                        in(Parameters.REFERENCE),
                        "-I",
                        in(DEDUP_BAM),
                        "-known",
                        in(Parameters.PHASE),
                        "-known",
                        in(Parameters.MILLS),
                        "--downsampling_type",
                        "NONE",
                        "-nt",
                        cpuCount,
                        "-o",
                        out(REALIGN_TARGETS))
                .build());
        graph.add(factory.stage("indel-realign")
                .reference(Parameters.REFERENCE)
                .reference(Parameters.REFERENCE_FAI)
                .reference(Parameters.PHASE)
                .reference(Parameters.MILLS)
                .input(Roles.REFERENCE_DICTIONARY)
                .input(DEDUP_BAM)
                .input(DEDUP_INDEX)
                .input(REALIGN_TARGETS)
                .output(REALIGNED_BAM, "realigned" + BRANCH.suffix() + ".bam")
                .output(REALIGNED_INDEX, "realigned" + BRANCH.suffix() + ".bai")
                .tool(ToolImages.GATK,
                        "-T",
                        "IndelRealigner",
                        "-R",
                        in(Parameters.REFERENCE),
                        "-I",
                        in(DEDUP_BAM),
                        "-targetIntervals",
                        in(REALIGN_TARGETS),
                        "-known",
                        in(Parameters.PHASE),
                        "-known",
                        in(Parameters.MILLS),
                        "--downsampling_type",
                        "NONE",
                        "-maxReads",
                        "720000",
                        "-maxInMemory",
                        "5400000",
                        "-o",
                        out(REALIGNED_BAM))
                .build());
        graph.add(factory.stage("base-recalibration")
                .reference(Parameters.REFERENCE)
                .reference(Parameters.REFERENCE_FAI)
                .reference(Parameters.DBSNP)
                .reference(Parameters.MILLS)
                .input(Roles.REFERENCE_DICTIONARY)
                .input(REALIGNED_BAM)
                .input(REALIGNED_INDEX)
                .output(RECALIBRATION_TABLE, "recal" + BRANCH.suffix() + ".table")
                .tool(ToolImages.GATK,
                        "-T",
                        "BaseRecalibrator",
                        "-R",
                        in(Parameters.REFERENCE),
                        "-I",
                        in(REALIGNED_BAM),
                        "-nct",
                        cpuCount,
                        "-knownSites",
                        in(Parameters.DBSNP),
                        "-knownSites",
                        in(Parameters.MILLS),
                        "-o",
                        out(RECALIBRATION_TABLE))
                .build());
        graph.add(factory.stage("apply-recalibration")
                .reference(Parameters.REFERENCE)
                .reference(Parameters.REFERENCE_FAI)
                .input(Roles.REFERENCE_DICTIONARY)
                .input(REALIGNED_BAM)
                .input(REALIGNED_INDEX)
                .input(RECALIBRATION_TABLE)
                .output(preprocessedBam, "preprocessed" + BRANCH.suffix() + ".bam")
                .tool(ToolImages.GATK,
                        "-T",
                        "PrintReads",
                        "-R",
                        in(Parameters.REFERENCE),
                        "-I",
                        in(REALIGNED_BAM),
                        "-nct",
                        cpuCount,
                        "-BQSR",
                        in(RECALIBRATION_TABLE),
                        "-o",
                        out(preprocessedBam))
                .build());
        return EncapsulatedNode.of(BRANCH.preprocessingName(), graph);
    }
}
