package com.hartwig.alignpipe.staging;

import java.nio.file.Path;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface NormalizedFile {
    /**
     * Location of the canonical form.
     */
    @Value.Parameter
    Path path();

    /**
     * Logical name of the canonical form, e.g. with the compression extension stripped.
     */
    @Value.Parameter
    String name();

    /**
     * Format detected on the input of the normalization.
     */
    @Value.Parameter
    FileFormat detectedFormat();

    static NormalizedFile of(Path path, FileFormat detectedFormat) {
        return ImmutableNormalizedFile.of(path, path.getFileName().toString(), detectedFormat);
    }
}
