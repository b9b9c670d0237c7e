package com.hartwig.alignpipe.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.hartwig.alignpipe.definition.PipelineSettings;
import com.hartwig.alignpipe.definition.ReferenceSet;

import org.junit.jupiter.api.Test;

class BundleTemplatesTest {
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
            .putImages("gatk", "local")
            .build();

    @Test
    void readsUrlHasRegionInHost() {
        assertThat(BundleTemplates.readsUrl("us-west-2", "s3://my-bucket/", 1)).isEqualTo(
                "https://s3-us-west-2.amazonaws.com/my-bucket/sequence/${sample}_1.fastq.gz");
        assertThat(BundleTemplates.readsUrl("us-east-1", "my-bucket", 2)).isEqualTo(
                "https://s3.amazonaws.com/my-bucket/sequence/${sample}_2.fastq.gz");
    }

    @Test
    void sampleIsSubstitutedPerSample() {
        var settings = PipelineSettings.builder().inputBucket("bucket").cpuCount(2).build();
        var bundles = BundleTemplates.create(settings, REFERENCES).forSample("HG00096");
        assertThat(bundles.alignment().get(Parameters.SAMPLE_NAME)).isEqualTo("HG00096");
        assertThat(bundles.alignment().get(Parameters.READS_1)).endsWith("/bucket/sequence/HG00096_1.fastq.gz");
    }

    @Test
    void groupsGetOnlyTheirParameters() {
        var settings = PipelineSettings.builder().archiveQuery("query.xml").archiveCredentials("cred.key").numNodes(4).build();
        var bundles = BundleTemplates.create(settings, REFERENCES);
        assertThat(bundles.alignment().name()).isEqualTo("alignment");
        assertThat(bundles.alignment().find(Parameters.READS_ARCHIVE)).contains("query.xml");
        assertThat(bundles.alignment().find(Parameters.READS_1)).isEmpty();
        assertThat(bundles.firstPreprocessing().getInt(Parameters.NUM_NODES)).isEqualTo(4);
        assertThat(bundles.secondPreprocessing().find(Parameters.NUM_NODES)).isEmpty();
        assertThat(bundles.secondCalling().name()).isEqualTo("second-calling");
        assertThat(bundles.secondCalling().get(Parameters.IMAGE_PREFIX + "gatk")).isEqualTo("local");
    }

    @Test
    void hostImageRunsToolOnHost() {
        var bundles = BundleTemplates.create(PipelineSettings.builder().inputBucket("bucket").build(), REFERENCES);
        assertThat(ToolImages.image(ToolImages.GATK, bundles.secondCalling())).isEmpty();
        assertThat(ToolImages.image(ToolImages.PICARD, bundles.secondCalling())).contains("quay.io/ucsc_cgl/picardtools");
        assertThat(ToolImages.hostExecutable(ToolImages.ADAM)).isEqualTo("adam-submit");
    }
}
