package com.hartwig.alignpipe.pipeline;

/**
 * The two alternative preprocessing paths. Every key written by a branch is namespaced by its suffix.
 */
public enum Branch {
    FIRST("first", ".adam"),
    SECOND("second", ".gatk");

    private final String prefix;
    private final String suffix;

    Branch(final String prefix, final String suffix) {
        this.prefix = prefix;
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    public String role(String role) {
        return role + suffix;
    }

    public String preprocessingName() {
        return prefix + "-preprocessing";
    }

    public String callingName() {
        return prefix + "-calling";
    }
}
