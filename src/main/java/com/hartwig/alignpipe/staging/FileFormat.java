package com.hartwig.alignpipe.staging;

/**
 * Container format of a staged file as detected from its content.
 */
public enum FileFormat {
    TAR,
    GZIP,
    /**
     * BGZF compressed alignment container. Shares the gzip magic bytes but is kept compressed.
     */
    BAM,
    PLAIN;

    public boolean isStable() {
        return this == PLAIN || this == BAM;
    }
}
