package com.hartwig.alignpipe;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

class AlignPipeMainTest {
    @TempDir
    Path temp;

    private Path manifest;
    private Path references;

    @BeforeEach
    void setUp() throws IOException {
        manifest = Files.writeString(temp.resolve("manifest.txt"), "S1\n");
        references = temp.resolve("references.yaml");
        try (InputStream input = getClass().getClassLoader().getResourceAsStream("references.yaml")) {
            Files.copy(input, references);
        }
    }

    @Test
    void unknownModeIsConfigurationError() {
        assertThat(execute("--pipeline-mode", "fast", "--input-bucket", "bucket")).isEqualTo(AlignPipeMain.EXIT_CONFIGURATION_ERROR);
    }

    @Test
    void singleSparkNodeIsConfigurationError() {
        assertThat(execute("--pipeline-mode", "first", "--input-bucket", "bucket", "--num-nodes", "1")).isEqualTo(
                AlignPipeMain.EXIT_CONFIGURATION_ERROR);
    }

    @Test
    void missingReadsSourceIsConfigurationError() {
        assertThat(execute("--pipeline-mode", "second")).isEqualTo(AlignPipeMain.EXIT_CONFIGURATION_ERROR);
    }

    @Test
    void unreadableReferencesAreConfigurationError() {
        references = temp.resolve("absent.yaml");
        assertThat(execute("--input-bucket", "bucket")).isEqualTo(AlignPipeMain.EXIT_CONFIGURATION_ERROR);
    }

    @Test
    void missingRequiredOptionIsUsageError() {
        assertThat(new CommandLine(new AlignPipeMain()).execute("--manifest", manifest.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    private int execute(String... options) {
        var arguments = new String[options.length + 8];
        arguments[0] = "--manifest";
        arguments[1] = manifest.toString();
        arguments[2] = "--references";
        arguments[3] = references.toString();
        arguments[4] = "--output-location";
        arguments[5] = temp.resolve("store").toString();
        arguments[6] = "--work-dir";
        arguments[7] = temp.resolve("work").toString();
        System.arraycopy(options, 0, arguments, 8, options.length);
        return new CommandLine(new AlignPipeMain()).execute(arguments);
    }
}
