package com.hartwig.alignpipe;

/**
 * Invalid input detected before any stage executes: bad manifest, unknown pipeline mode, missing parameter or an input key
 * that no stage produces. Never retried.
 */
public class ConfigurationException extends PipelineException {
    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
