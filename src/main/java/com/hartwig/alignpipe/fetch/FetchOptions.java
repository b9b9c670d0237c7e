package com.hartwig.alignpipe.fetch;

import java.util.Optional;

import org.immutables.value.Value;

/**
 * Per call settings of a fetch, taken from the configuration of the stage that needs the input.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface FetchOptions {
    @Value.Default
    default RetryPolicy objectStoreRetry() {
        return RetryPolicy.objectStoreDefault();
    }

    @Value.Default
    default RetryPolicy archiveServiceRetry() {
        return RetryPolicy.archiveServiceDefault();
    }

    /**
     * Container image of the archive retrieval tool. The tool runs on the host when absent.
     */
    Optional<String> archiveServiceImage();

    /**
     * Container image of the BAM to FASTQ conversion tool. The tool runs on the host when absent.
     */
    Optional<String> converterImage();

    static FetchOptions defaults() {
        return builder().build();
    }

    static ImmutableFetchOptions.Builder builder() {
        return ImmutableFetchOptions.builder();
    }
}
