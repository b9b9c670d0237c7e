package com.hartwig.alignpipe.definition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.hartwig.alignpipe.ConfigurationException;

import org.junit.jupiter.api.Test;

class PipelineModeTest {
    @Test
    void flagsAndLegacyFlagsAreAccepted() {
        assertThat(PipelineMode.fromFlag("first")).isEqualTo(PipelineMode.FIRST_ONLY);
        assertThat(PipelineMode.fromFlag("adam")).isEqualTo(PipelineMode.FIRST_ONLY);
        assertThat(PipelineMode.fromFlag("GATK")).isEqualTo(PipelineMode.SECOND_ONLY);
        assertThat(PipelineMode.fromFlag(" both ")).isEqualTo(PipelineMode.BOTH);
    }

    @Test
    void pathsPerMode() {
        assertThat(PipelineMode.FIRST_ONLY.includesFirstPath()).isTrue();
        assertThat(PipelineMode.FIRST_ONLY.includesSecondPath()).isFalse();
        assertThat(PipelineMode.SECOND_ONLY.includesFirstPath()).isFalse();
        assertThat(PipelineMode.BOTH.includesFirstPath()).isTrue();
        assertThat(PipelineMode.BOTH.includesSecondPath()).isTrue();
    }

    @Test
    void unknownModeFails() {
        var e = assertThrows(ConfigurationException.class, () -> PipelineMode.fromFlag("fast"));
        assertThat(e.getMessage()).isEqualTo("Pipeline mode must be one of first, second, both, but was 'fast'");
        assertThrows(ConfigurationException.class, () -> PipelineMode.fromFlag(null));
    }
}
