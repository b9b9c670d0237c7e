package com.hartwig.alignpipe.definition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.hartwig.alignpipe.ConfigurationException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestReaderTest {
    @TempDir
    Path temp;

    @Test
    void readsSamplesInOrderWithDuplicates() throws URISyntaxException {
        var manifest = Path.of(getClass().getClassLoader().getResource("manifest.txt").toURI());
        assertThat(ManifestReader.read(manifest)).containsExactly("HG00096", "HG00097", "HG00096");
    }

    @Test
    void missingManifestFails() {
        var e = assertThrows(ConfigurationException.class, () -> ManifestReader.read(temp.resolve("absent.txt")));
        assertThat(e.getMessage()).contains("does not exist");
    }

    @Test
    void manifestWithoutSamplesFails() throws IOException {
        var manifest = Files.writeString(temp.resolve("empty.txt"), "# nothing\n\n");
        var e = assertThrows(ConfigurationException.class, () -> ManifestReader.read(manifest));
        assertThat(e.getMessage()).contains("contains no sample identifiers");
    }
}
