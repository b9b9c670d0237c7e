package com.hartwig.alignpipe.fetch;

import java.nio.file.Path;

/**
 * Splits an aligned BAM into paired read files.
 */
public interface BamToFastqConverter {
    /**
     * Writes <code>BASE_1.fastq</code>, <code>BASE_2.fastq</code> and <code>BASE_UP.fastq</code> next to the BAM, where
     * <code>BASE</code> is the BAM file name without extension.
     *
     * @return path of the first mate
     */
    Path convert(Path bam, FetchOptions options);

    static String baseName(Path bam) {
        var fileName = bam.getFileName().toString();
        var index = fileName.lastIndexOf('.');
        return index < 0 ? fileName : fileName.substring(0, index);
    }
}
