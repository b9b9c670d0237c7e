package com.hartwig.alignpipe.definition;

import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

/**
 * Locations of the reference genome, its BWA index and the known-sites resources used by preprocessing and calling.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableReferenceSet.class)
@JsonSerialize(as = ImmutableReferenceSet.class)
public interface ReferenceSet {
    /**
     * Reference genome FASTA
     */
    String referenceFasta();

    String amb();

    String ann();

    String bwt();

    String pac();

    String sa();

    String fai();

    /**
     * Alternate contig file, needed for alt-aware alignment only.
     */
    Optional<String> alt();

    /**
     * 1000G phase 1 indels
     */
    String phase();

    /**
     * Mills and 1000G gold standard indels
     */
    String mills();

    String dbsnp();

    String omni();

    String hapmap();

    /**
     * Tool images by tool name, overriding the defaults.
     */
    Map<String, String> images();

    static ImmutableReferenceSet.Builder builder() {
        return ImmutableReferenceSet.builder();
    }
}
