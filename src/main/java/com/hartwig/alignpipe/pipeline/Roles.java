package com.hartwig.alignpipe.pipeline;

/**
 * Roles of the files passed between stage groups. Roles private to a branch carry the suffix of that branch.
 */
public final class Roles {
    public static final String ALIGNED_BAM = "aligned-bam";
    public static final String REFERENCE_DICTIONARY = "ref.dict";
    public static final String PREPROCESSED_BAM = "preprocessed-bam";
    public static final String VARIANTS = "variants";

    private Roles() {
    }
}
