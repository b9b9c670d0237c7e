package com.hartwig.alignpipe.definition;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.hartwig.alignpipe.ConfigurationException;

import org.immutables.value.Value;

/**
 * Named parameters handed by value to one group of stages. Stages read nothing but their bundle, so graphs of different
 * samples never share configuration state.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ConfigurationBundle {
    String SAMPLE_PLACEHOLDER = "sample";

    /**
     * Name of the bundle, used in error messages.
     */
    String name();

    Map<String, String> params();

    default String get(String key) {
        return find(key).orElseThrow(() -> new ConfigurationException(String.format("Parameter '%s' is missing from configuration '%s'",
                key,
                name())));
    }

    default Optional<String> find(String key) {
        return Optional.ofNullable(params().get(key)).filter(value -> !value.isBlank());
    }

    default int getInt(String key) {
        var value = get(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(String.format("Parameter '%s' in configuration '%s' should be a number, but was '%s'",
                    key,
                    name(),
                    value));
        }
    }

    default boolean getBoolean(String key) {
        return find(key).map(Boolean::parseBoolean).orElse(false);
    }

    /**
     * Copy of this bundle with every <code>${sample}</code> replaced by the given identifier.
     */
    default ConfigurationBundle forSample(String sampleId) {
        var replaced = params().entrySet()
                .stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> replaceKeys(entry.getValue(), Map.of(SAMPLE_PLACEHOLDER, sampleId))));
        return ImmutableConfigurationBundle.builder().from(this).params(replaced).build();
    }

    static String replaceKeys(String input, Map<String, String> map) {
        var output = input;
        for (var entry : map.entrySet()) {
            var key = "${" + entry.getKey() + "}";
            output = output.replace(key, entry.getValue());
        }
        return output;
    }

    static ImmutableConfigurationBundle.Builder builder() {
        return ImmutableConfigurationBundle.builder();
    }
}
