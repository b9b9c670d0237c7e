package com.hartwig.alignpipe.fetch;

import java.util.List;
import java.util.Optional;

/**
 * Classifies a failed object store transfer by the last non-empty line the transfer tool wrote to standard error.
 */
public final class ObjectStoreErrorClassifier {
    private static final String SEPARATOR = ": ";

    private ObjectStoreErrorClassifier() {
    }

    public static FetchFailure classify(List<String> diagnosticLines) {
        var line = lastNonEmptyLine(diagnosticLines);
        if (line.isEmpty()) {
            return FetchFailure.UNCLASSIFIED;
        }
        var error = line.get();
        var detail = lastPart(error);
        if (error.startsWith("boto")) {
            if (detail.startsWith("403")) {
                return FetchFailure.AUTH_FORBIDDEN;
            } else if (detail.startsWith("400")) {
                return FetchFailure.BAD_REQUEST_OR_KEY_MISMATCH;
            }
            return FetchFailure.SERVICE_ERROR;
        } else if (error.startsWith("AttributeError")) {
            if (detail.startsWith("'NoneType'")) {
                return FetchFailure.RESOURCE_MISSING;
            }
            return FetchFailure.SERVICE_ERROR;
        }
        return FetchFailure.UNCLASSIFIED;
    }

    public static Optional<String> lastNonEmptyLine(List<String> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            var line = lines.get(i).strip();
            if (!line.isEmpty()) {
                return Optional.of(line);
            }
        }
        return Optional.empty();
    }

    public static String describe(FetchFailure failure, String url, String diagnostic) {
        switch (failure) {
            case AUTH_FORBIDDEN:
                return String.format("Transfer failed with a \"403 Forbidden\" error while obtaining '%s'. Are the credentials correct?",
                        url);
            case BAD_REQUEST_OR_KEY_MISMATCH:
                return String.format("Transfer failed with a \"400 Bad Request\" error while obtaining '%s'. Is an encrypted file "
                        + "downloaded without a key, or an unencrypted file with one?", url);
            case RESOURCE_MISSING:
                return String.format("Object '%s' does not exist", url);
            case UNCLASSIFIED:
                return String.format("Could not diagnose the error while downloading '%s'", url);
            default:
                return String.format("Transfer failed with '%s' while downloading '%s'", diagnostic, url);
        }
    }

    private static String lastPart(String error) {
        var index = error.lastIndexOf(SEPARATOR);
        return index < 0 ? error : error.substring(index + SEPARATOR.length());
    }
}
