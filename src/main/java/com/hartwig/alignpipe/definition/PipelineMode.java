package com.hartwig.alignpipe.definition;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.hartwig.alignpipe.ConfigurationException;

/**
 * Selects which preprocessing branches are built for every sample. The first path preprocesses with Spark/ADAM, the
 * second with the GATK best practices.
 */
public enum PipelineMode {
    FIRST_ONLY("first", "adam"),
    SECOND_ONLY("second", "gatk"),
    BOTH("both", "both");

    private final String flag;
    private final String legacyFlag;

    PipelineMode(final String flag, final String legacyFlag) {
        this.flag = flag;
        this.legacyFlag = legacyFlag;
    }

    public boolean includesFirstPath() {
        return this != SECOND_ONLY;
    }

    public boolean includesSecondPath() {
        return this != FIRST_ONLY;
    }

    public String flag() {
        return flag;
    }

    public static PipelineMode fromFlag(String value) {
        if (value != null) {
            var normalized = value.trim().toLowerCase(Locale.ROOT);
            for (PipelineMode mode : values()) {
                if (mode.flag.equals(normalized) || mode.legacyFlag.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new ConfigurationException(String.format("Pipeline mode must be one of %s, but was '%s'",
                Arrays.stream(values()).map(PipelineMode::flag).collect(Collectors.joining(", ")),
                value));
    }
}
