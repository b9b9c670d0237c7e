package com.hartwig.alignpipe.definition;

import java.util.Optional;

import com.hartwig.alignpipe.ConfigurationException;

import org.immutables.value.Value;

/**
 * Settings shared by all samples of one invocation, as given on the command line.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface PipelineSettings {
    String DEFAULT_REGION = "us-west-2";

    /**
     * Bucket holding <code>sequence/SAMPLE_1.fastq.gz</code> and <code>sequence/SAMPLE_2.fastq.gz</code>.
     */
    Optional<String> inputBucket();

    @Value.Default
    default String bucketRegion() {
        return DEFAULT_REGION;
    }

    /**
     * Archive service query descriptor, used instead of the input bucket.
     */
    Optional<String> archiveQuery();

    Optional<String> archiveCredentials();

    @Value.Default
    default int numNodes() {
        return 2;
    }

    @Value.Default
    default String driverMemory() {
        return "10g";
    }

    @Value.Default
    default String executorMemory() {
        return "10g";
    }

    @Value.Default
    default String fileSize() {
        return "100G";
    }

    @Value.Default
    default int cpuCount() {
        return Runtime.getRuntime().availableProcessors();
    }

    Optional<String> sseKey();

    @Value.Default
    default boolean perFileEncryption() {
        return true;
    }

    @Value.Default
    default boolean sudo() {
        return false;
    }

    @Value.Default
    default boolean useBwakit() {
        return false;
    }

    @Value.Check
    default void check() {
        if (inputBucket().isPresent() == archiveQuery().isPresent()) {
            throw new ConfigurationException("Exactly one of an input bucket and an archive query must be given");
        }
        if (archiveQuery().isPresent() && archiveCredentials().isEmpty()) {
            throw new ConfigurationException("An archive query needs archive credentials");
        }
        if (cpuCount() < 1) {
            throw new ConfigurationException(String.format("CPU count must be positive, but was %d", cpuCount()));
        }
        FileSize.parseBytes(fileSize());
    }

    static ImmutablePipelineSettings.Builder builder() {
        return ImmutablePipelineSettings.builder();
    }
}
