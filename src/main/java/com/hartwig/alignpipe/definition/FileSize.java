package com.hartwig.alignpipe.definition;

import java.util.Locale;
import java.util.regex.Pattern;

import com.hartwig.alignpipe.ConfigurationException;

/**
 * Sizes written as a number with an optional unit, e.g. <code>100G</code>.
 */
public final class FileSize {
    private static final Pattern SIZE = Pattern.compile("(\\d+)([TGMK]?)B?");

    private FileSize() {
    }

    public static long parseBytes(String value) {
        var matcher = SIZE.matcher(value.trim().toUpperCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new ConfigurationException(String.format("File size should be given as a number with unit T, G, M or K, but was '%s'",
                    value));
        }
        var amount = Long.parseLong(matcher.group(1));
        switch (matcher.group(2)) {
            case "T":
                return amount << 40;
            case "G":
                return amount << 30;
            case "M":
                return amount << 20;
            case "K":
                return amount << 10;
            default:
                return amount;
        }
    }
}
