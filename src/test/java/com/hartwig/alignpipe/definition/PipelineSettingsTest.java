package com.hartwig.alignpipe.definition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.hartwig.alignpipe.ConfigurationException;

import org.junit.jupiter.api.Test;

class PipelineSettingsTest {
    @Test
    void defaults() {
        var settings = PipelineSettings.builder().inputBucket("s3://bucket").build();
        assertThat(settings.bucketRegion()).isEqualTo("us-west-2");
        assertThat(settings.numNodes()).isEqualTo(2);
        assertThat(settings.fileSize()).isEqualTo("100G");
        assertThat(settings.perFileEncryption()).isTrue();
        assertThat(settings.cpuCount()).isPositive();
    }

    @Test
    void exactlyOneReadsSource() {
        assertThrows(ConfigurationException.class, () -> PipelineSettings.builder().build());
        assertThrows(ConfigurationException.class,
                () -> PipelineSettings.builder().inputBucket("s3://bucket").archiveQuery("query.xml").archiveCredentials("cred.key").build());
    }

    @Test
    void archiveQueryNeedsCredentials() {
        var e = assertThrows(ConfigurationException.class, () -> PipelineSettings.builder().archiveQuery("query.xml").build());
        assertThat(e.getMessage()).isEqualTo("An archive query needs archive credentials");
    }

    @Test
    void invalidResourcesFail() {
        assertThrows(ConfigurationException.class, () -> PipelineSettings.builder().inputBucket("b").cpuCount(0).build());
        assertThrows(ConfigurationException.class, () -> PipelineSettings.builder().inputBucket("b").fileSize("huge").build());
    }
}
