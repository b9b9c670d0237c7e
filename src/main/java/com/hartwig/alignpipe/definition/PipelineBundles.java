package com.hartwig.alignpipe.definition;

import org.immutables.value.Value;

/**
 * One configuration bundle per stage group.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface PipelineBundles {
    ConfigurationBundle alignment();

    ConfigurationBundle firstPreprocessing();

    ConfigurationBundle secondPreprocessing();

    ConfigurationBundle firstCalling();

    ConfigurationBundle secondCalling();

    default PipelineBundles forSample(String sampleId) {
        return builder().alignment(alignment().forSample(sampleId))
                .firstPreprocessing(firstPreprocessing().forSample(sampleId))
                .secondPreprocessing(secondPreprocessing().forSample(sampleId))
                .firstCalling(firstCalling().forSample(sampleId))
                .secondCalling(secondCalling().forSample(sampleId))
                .build();
    }

    static ImmutablePipelineBundles.Builder builder() {
        return ImmutablePipelineBundles.builder();
    }
}
