package com.hartwig.alignpipe.definition;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import com.hartwig.alignpipe.ConfigurationException;

/**
 * Reads a manifest of sample identifiers: one per line, surrounding whitespace stripped, blank lines and lines starting with
 * <code>#</code> skipped. Order and duplicates are preserved.
 */
public final class ManifestReader {
    private ManifestReader() {
    }

    public static List<String> read(Path manifest) {
        if (!Files.isRegularFile(manifest)) {
            throw new ConfigurationException(String.format("Manifest '%s' does not exist", manifest));
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(manifest, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException(String.format("Could not read manifest '%s'", manifest), e);
        }
        var samples = lines.stream().map(String::strip).filter(line -> !line.isEmpty() && !line.startsWith("#")).collect(Collectors.toList());
        if (samples.isEmpty()) {
            throw new ConfigurationException(String.format("Manifest '%s' contains no sample identifiers", manifest));
        }
        return samples;
    }
}
