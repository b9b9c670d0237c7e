package com.hartwig.alignpipe.pipeline;

import static com.hartwig.alignpipe.pipeline.StageFactory.in;
import static com.hartwig.alignpipe.pipeline.StageFactory.out;

import com.hartwig.alignpipe.workflow.EncapsulatedNode;
import com.hartwig.alignpipe.workflow.PipelineGraph;

/**
 * Germline calling with the HaplotypeCaller, filtered by variant quality score recalibration of SNPs and then of
 * indels. The same stages serve both branches; only the key suffix differs.
 */
final class VariantCallingStages {
    private VariantCallingStages() {
    }

    static EncapsulatedNode create(StageFactory factory, Branch branch) {
        var cpuCount = factory.config().get(Parameters.CPU_COUNT);
        var suffix = branch.suffix();
        var bam = branch.role(Roles.PREPROCESSED_BAM);
        var bamIndex = branch.role("preprocessed-index");
        var rawVariants = branch.role("raw-variants");
        var snpRecal = branch.role("snp-recal");
        var snpTranches = branch.role("snp-tranches");
        var indelRecal = branch.role("indel-recal");
        var indelTranches = branch.role("indel-tranches");
        var snpFiltered = branch.role("snp-filtered");
        var variants = branch.role(Roles.VARIANTS);

        var graph = PipelineGraph.builder(branch.callingName());
        // samtools writes the index next to the BAM, named after it
        graph.add(factory.stage("index-bam")
                .input(bam)
                .output(bamIndex, "preprocessed" + suffix + ".bam.bai")
                .tool(ToolImages.SAMTOOLS, "index", in(bam), out(bamIndex))
                .build());
        graph.add(factory.stage("haplotype-caller")
                .reference(Parameters.REFERENCE)
                .reference(Parameters.REFERENCE_FAI)
                .input(Roles.REFERENCE_DICTIONARY)
                .input(bam)
                .input(bamIndex)
                .output(rawVariants, "raw" + suffix + ".vcf")
                .tool(ToolImages.GATK,
                        "-T",
                        "HaplotypeCaller",
                        "-nct",
                        cpuCount,
                        "-R",
                        in(Parameters.REFERENCE),
                        "-I",
                        in(bam),
                        "--genotyping_mode",
                        "DISCOVERY",
                        "--output_mode",
                        "EMIT_VARIANTS_ONLY",
                        "-stand_emit_conf",
                        "10.0",
                        "-stand_call_conf",
                        "30.0",
                        "-o",
                        out(rawVariants))
                .build());
        graph.add(factory.stage("vqsr-snp")
                .reference(Parameters.REFERENCE)
                .reference(Parameters.REFERENCE_FAI)
                .reference(Parameters.HAPMAP)
                .reference(Parameters.OMNI)
                .reference(Parameters.DBSNP)
                .input(Roles.REFERENCE_DICTIONARY)
                .input(rawVariants)
                .output(snpRecal, "snp" + suffix + ".recal")
                .output(snpTranches, "snp" + suffix + ".tranches")
                .tool(ToolImages.GATK,
                        "-T",
                        "VariantRecalibrator",
                        "-R",
                        in(Parameters.REFERENCE),
                        "-input",
                        in(rawVariants),
                        "-nt",
                        cpuCount,
                        "-resource:hapmap,known=false,training=true,truth=true,prior=15.0",
                        in(Parameters.HAPMAP),
                        "-resource:omni,known=false,training=true,truth=false,prior=12.0",
                        in(Parameters.OMNI),
                        "-resource:dbsnp,known=true,training=false,truth=false,prior=2.0",
                        in(Parameters.DBSNP),
                        "-an",
                        "QD",
                        "-an",
                        "DP",
                        "-an",
                        "FS",
                        "-an",
                        "ReadPosRankSum",
                        "-mode",
                        "SNP",
                        "-minNumBad",
                        "1000",
                        "-recalFile",
                        out(snpRecal),
                        "-tranchesFile",
                        out(snpTranches))
                .build());
        graph.add(factory.stage("vqsr-indel")
                .reference(Parameters.REFERENCE)
                .reference(Parameters.REFERENCE_FAI)
                .reference(Parameters.MILLS)
                .input(Roles.REFERENCE_DICTIONARY)
                .input(rawVariants)
                .output(indelRecal, "indel" + suffix + ".recal")
                .output(indelTranches, "indel" + suffix + ".tranches")
                .tool(ToolImages.GATK,
                        "-T",
                        "VariantRecalibrator",
                        "-R",
                        in(Parameters.REFERENCE),
                        "-input",
                        in(rawVariants),
                        "-nt",
                        cpuCount,
                        "-resource:mills,known=true,training=true,truth=true,prior=12.0",
                        in(Parameters.MILLS),
                        "-an",
                        "DP",
                        "-an",
                        "FS",
                        "-an",
                        "ReadPosRankSum",
                        "-mode",
                        "INDEL",
                        "-minNumBad",
                        "1000",
                        "--maxGaussians",
                        "4",
                        "-recalFile",
                        out(indelRecal),
                        "-tranchesFile",
                        out(indelTranches))
                .build());
        graph.add(factory.stage("apply-vqsr-snp")
                .reference(Parameters.REFERENCE)
                .reference(Parameters.REFERENCE_FAI)
                .input(Roles.REFERENCE_DICTIONARY)
                .input(rawVariants)
                .input(snpRecal)
                .input(snpTranches)
                .output(snpFiltered, "snp-filtered" + suffix + ".vcf")
                .tool(ToolImages.GATK,
                        "-T",
                        "ApplyRecalibration",
                        "-R",
                        in(Parameters.REFERENCE),
                        "-input",
                        in(rawVariants),
                        "-mode",
                        "SNP",
                        "--ts_filter_level",
                        "99.0",
                        "-recalFile",
                        in(snpRecal),
                        "-tranchesFile",
                        in(snpTranches),
                        "-o",
                        out(snpFiltered))
                .build());
        graph.add(factory.stage("apply-vqsr-indel")
                .reference(Parameters.REFERENCE)
                .reference(Parameters.REFERENCE_FAI)
                .input(Roles.REFERENCE_DICTIONARY)
                .input(snpFiltered)
                .input(indelRecal)
                .input(indelTranches)
                .output(variants, Roles.VARIANTS + suffix + ".vcf")
                .tool(ToolImages.GATK,
                        "-T",
                        "ApplyRecalibration",
                        "-R",
                        in(Parameters.REFERENCE),
                        "-input",
                        in(snpFiltered),
                        "-mode",
                        "INDEL",
                        "--ts_filter_level",
                        "99.0",
                        "-recalFile",
                        in(indelRecal),
                        "-tranchesFile",
                        in(indelTranches),
                        "-o",
                        out(variants))
                .build());
        return EncapsulatedNode.of(branch.callingName(), graph);
    }
}
