package com.hartwig.alignpipe.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.hartwig.alignpipe.ConfigurationException;
import com.hartwig.alignpipe.tool.ToolInvocation;
import com.hartwig.alignpipe.tool.ToolResult;
import com.hartwig.alignpipe.tool.ToolRunner;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads from the object store with the <code>s3am</code> transfer tool. Failures are classified from the tool's
 * standard error, which is captured into a log that is removed after every attempt.
 */
public class ObjectStoreFetcher implements RemoteFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreFetcher.class);
    static final String TRANSFER_TOOL = "s3am";

    private final ToolRunner runner;
    private final Sleeper sleeper;

    public ObjectStoreFetcher(final ToolRunner runner, final Sleeper sleeper) {
        this.runner = runner;
        this.sleeper = sleeper;
    }

    @Override
    public Path fetch(RemoteLocator locator, Path destination, FetchOptions options) {
        var url = locator.address();
        var target = destination.resolve(fileName(url));
        var command = command(locator, target);
        var policy = options.objectStoreRetry();
        for (int attempt = 0; ; attempt++) {
            var failure = attempt(command, destination, policy.timeoutForAttempt(attempt), url);
            if (failure == null) {
                if (!Files.exists(target)) {
                    throw new FetchException(FetchFailure.SERVICE_ERROR,
                            String.format("Transfer of '%s' reported success but '%s' does not exist", url, target));
                }
                LOGGER.info("[{}] Downloaded to [{}]", url, target);
                return target;
            }
            if (!policy.shouldRetry(failure.getFailure(), attempt + 1)) {
                if (failure.getFailure().isTransient()) {
                    throw new FetchException(FetchFailure.RETRIES_EXHAUSTED,
                            String.format("%s after %d attempts", failure.getMessage(), attempt + 1),
                            failure);
                }
                throw failure;
            }
            LOGGER.warn("[{}] Attempt {} of {} failed: {}", url, attempt + 1, policy.maxAttempts(), failure.getMessage());
            coolDown(policy, url);
        }
    }

    private FetchException attempt(List<String> command, Path destination, Duration timeout, String url) {
        Path diagnosticLog = null;
        try {
            diagnosticLog = Files.createTempFile("s3am-", ".stderr");
            var invocation = ToolInvocation.builder()
                    .command(command)
                    .workingDirectory(destination)
                    .stderr(diagnosticLog)
                    .timeout(timeout)
                    .build();
            ToolResult result;
            try {
                result = runner.run(invocation);
            } catch (IOException e) {
                return new FetchException(FetchFailure.TOOL_MISSING,
                        String.format("Failed to run '%s', is it installed? (%s)", TRANSFER_TOOL, e.getMessage()),
                        e);
            }
            if (result.succeeded()) {
                return null;
            }
            // tool output is not always valid UTF-8, undecodable bytes are replaced
            var lines = FileUtils.readLines(diagnosticLog.toFile(), StandardCharsets.UTF_8);
            var classification = result.timedOut() ? FetchFailure.UNCLASSIFIED : ObjectStoreErrorClassifier.classify(lines);
            var diagnostic = ObjectStoreErrorClassifier.lastNonEmptyLine(lines).orElse("exit code " + result.exitCode());
            return new FetchException(classification, ObjectStoreErrorClassifier.describe(classification, url, diagnostic));
        } catch (IOException e) {
            return new FetchException(FetchFailure.UNCLASSIFIED,
                    String.format("Could not capture diagnostics of the transfer of '%s'", url),
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchFailure.SERVICE_ERROR, String.format("Interrupted while downloading '%s'", url), e);
        } finally {
            deleteQuietly(diagnosticLog);
        }
    }

    private void coolDown(RetryPolicy policy, String url) {
        if (policy.coolDown().isZero()) {
            return;
        }
        try {
            sleeper.sleep(policy.coolDown());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchFailure.SERVICE_ERROR, String.format("Interrupted while retrying '%s'", url), e);
        }
    }

    static List<String> command(RemoteLocator locator, Path target) {
        var command = new ArrayList<>(List.of(TRANSFER_TOOL, "download", "--download-exists", "resume"));
        if (locator.encryptionKey().isPresent()) {
            command.add("--sse-key-file");
            command.add(locator.encryptionKey().get());
            if (locator.perFileEncryption()) {
                command.add("--sse-key-is-master");
            }
        }
        command.add(downloadUrl(locator.address()));
        command.add(target.toString());
        return command;
    }

    /**
     * The transfer tool takes <code>s3://</code> URLs. A path style <code>https://host/bucket/key</code> URL is rewritten
     * to <code>S3://bucket/key</code>.
     */
    static String downloadUrl(String url) {
        try {
            var uri = new URI(url);
            var scheme = uri.getScheme() == null ? "" : uri.getScheme();
            if (scheme.equals("https")) {
                return "S3:/" + uri.getRawPath();
            } else if (scheme.equals("s3")) {
                return url;
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException(String.format("Malformed object store url '%s'", url), e);
        }
        throw new ConfigurationException(String.format("Unexpected url scheme: '%s'", url));
    }

    static String fileName(String url) {
        var trimmed = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOGGER.warn("Could not remove diagnostic log [{}]", file, e);
        }
    }
}
