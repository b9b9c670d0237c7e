package com.hartwig.alignpipe.fetch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.hartwig.alignpipe.staging.FormatNormalizer;
import com.hartwig.alignpipe.tool.DockerCommand;
import com.hartwig.alignpipe.tool.ToolInvocation;
import com.hartwig.alignpipe.tool.ToolRunner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads a bundle from the archive service with <code>genetorrent</code> and turns it into paired reads.
 * <p>
 * The bundle holds one analysis directory. An aligned bundle is a BAM with its index and is converted to FASTQ, an
 * unaligned bundle is a single tarball of reads that is extracted. Either way the result is the path of the first mate,
 * with the second mate next to it.
 */
public class ArchiveServiceFetcher implements RemoteFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveServiceFetcher.class);
    static final String RETRIEVAL_TOOL = "genetorrent";
    private static final Set<String> ALIGNED_EXTENSIONS = Set.of(".bam", ".bai");
    private static final String BUNDLE_DIRECTORY = "bundle";
    static final String READS_DIRECTORY = "fastqs";

    private final ToolRunner runner;
    private final DockerCommand dockerCommand;
    private final RemoteFetcher descriptorFetcher;
    private final BamToFastqConverter converter;
    private final FormatNormalizer normalizer;
    private final Sleeper sleeper;

    /**
     * @param descriptorFetcher fetches query descriptors that live in the object store
     */
    public ArchiveServiceFetcher(final ToolRunner runner, final DockerCommand dockerCommand, final RemoteFetcher descriptorFetcher,
            final BamToFastqConverter converter, final FormatNormalizer normalizer, final Sleeper sleeper) {
        this.runner = runner;
        this.dockerCommand = dockerCommand;
        this.descriptorFetcher = descriptorFetcher;
        this.converter = converter;
        this.normalizer = normalizer;
        this.sleeper = sleeper;
    }

    @Override
    public Path fetch(RemoteLocator locator, Path destination, FetchOptions options) {
        var query = stageFile(queryDescriptor(locator, destination, options), destination.resolve("archive.xml"));
        var credentials = stageFile(Path.of(locator.credentials().orElseThrow()), destination.resolve("archive.key"));
        var bundle = createDirectory(destination.resolve(BUNDLE_DIRECTORY));

        download(locator, destination, query, credentials, bundle, options);
        return unpack(bundle, createDirectory(destination.resolve(READS_DIRECTORY)), options);
    }

    private void download(RemoteLocator locator, Path destination, Path query, Path credentials, Path bundle, FetchOptions options) {
        var policy = options.archiveServiceRetry();
        for (int attempt = 0; ; attempt++) {
            var arguments = new ArrayList<String>();
            arguments.add(RETRIEVAL_TOOL);
            arguments.addAll(List.of("-d",
                    path(options, destination, query),
                    "-c",
                    path(options, destination, credentials),
                    "-p",
                    path(options, destination, bundle),
                    "-k",
                    String.valueOf(policy.timeoutForAttempt(attempt).toMinutes())));
            var command = options.archiveServiceImage()
                    .map(image -> dockerCommand.wrap(image, destination, arguments.subList(1, arguments.size())))
                    .orElse(arguments);
            String failure;
            try {
                var result = runner.run(ToolInvocation.builder().command(command).workingDirectory(destination).build());
                if (result.succeeded()) {
                    LOGGER.info("[{}] Retrieved archive bundle in attempt {}", locator.address(), attempt + 1);
                    return;
                }
                failure = result.timedOut() ? "timed out" : "exit code " + result.exitCode();
            } catch (IOException e) {
                throw new FetchException(FetchFailure.TOOL_MISSING,
                        String.format("Failed to run '%s', is it installed? (%s)", command.get(0), e.getMessage()),
                        e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(FetchFailure.SERVICE_ERROR,
                        String.format("Interrupted while retrieving '%s'", locator.address()),
                        e);
            }
            if (attempt + 1 >= policy.maxAttempts()) {
                throw new FetchException(FetchFailure.RETRIES_EXHAUSTED,
                        String.format("Retrieval of '%s' failed %d times, last with %s", locator.address(), attempt + 1, failure));
            }
            LOGGER.warn("[{}] Retrieval attempt {} of {} failed with {}, retrying in {}",
                    locator.address(),
                    attempt + 1,
                    policy.maxAttempts(),
                    failure,
                    policy.coolDown());
            try {
                sleeper.sleep(policy.coolDown());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(FetchFailure.SERVICE_ERROR,
                        String.format("Interrupted while retrieving '%s'", locator.address()),
                        e);
            }
        }
    }

    Path unpack(Path bundle, Path readsDirectory, FetchOptions options) {
        var analysis = visibleEntries(bundle).stream()
                .filter(name -> !name.endsWith(".gto"))
                .findFirst()
                .map(bundle::resolve)
                .filter(Files::isDirectory)
                .orElseThrow(() -> new UnexpectedArchiveShapeException(String.format("Archive bundle '%s' has no analysis directory",
                        bundle)));
        var files = visibleEntries(analysis);
        if (files.size() == 2) {
            var extensions = files.stream().map(ArchiveServiceFetcher::extension).collect(Collectors.toSet());
            if (!extensions.equals(ALIGNED_EXTENSIONS)) {
                throw unexpectedShape(analysis, files);
            }
            var bam = files.stream().filter(name -> name.endsWith(".bam")).map(analysis::resolve).findFirst().orElseThrow();
            var firstMate = converter.convert(bam, options);
            return moveReads(firstMate.getParent(), BamToFastqConverter.baseName(bam), readsDirectory);
        } else if (files.size() == 1 && files.get(0).endsWith(".tar.gz")) {
            var member = normalizer.extractArchive(analysis.resolve(files.get(0)), readsDirectory);
            var memberName = member.getFileName().toString();
            if (!memberName.endsWith(".fastq") && !memberName.endsWith(".fastq.gz")) {
                throw unexpectedShape(analysis, files);
            }
            return member.resolveSibling(memberName.replace("_2.fastq", "_1.fastq"));
        }
        throw unexpectedShape(analysis, files);
    }

    private static Path moveReads(Path directory, String baseName, Path readsDirectory) {
        try {
            for (String suffix : List.of("_1.fastq", "_2.fastq", "_UP.fastq")) {
                var reads = directory.resolve(baseName + suffix);
                if (Files.exists(reads)) {
                    Files.move(reads, readsDirectory.resolve(reads.getFileName()), StandardCopyOption.REPLACE_EXISTING);
                }
            }
        } catch (IOException e) {
            throw new FetchException(FetchFailure.SERVICE_ERROR, String.format("Could not move converted reads out of '%s'", directory), e);
        }
        return readsDirectory.resolve(baseName + "_1.fastq");
    }

    private Path queryDescriptor(RemoteLocator locator, Path destination, FetchOptions options) {
        var address = locator.address();
        if (address.startsWith("s3://") || address.startsWith("https://")) {
            var descriptorLocator = RemoteLocator.objectStore(address, locator.encryptionKey(), locator.perFileEncryption());
            return descriptorFetcher.fetch(descriptorLocator, createDirectory(destination.resolve("descriptor")), options);
        }
        return Path.of(address);
    }

    private static Path stageFile(Path source, Path target) {
        if (!Files.isRegularFile(source)) {
            throw new FetchException(FetchFailure.RESOURCE_MISSING, String.format("Could not find file '%s'", source));
        }
        try {
            return Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new FetchException(FetchFailure.SERVICE_ERROR, String.format("Could not copy '%s'", source), e);
        }
    }

    private static Path createDirectory(Path directory) {
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new FetchException(FetchFailure.SERVICE_ERROR, String.format("Could not create '%s'", directory), e);
        }
    }

    private static List<String> visibleEntries(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.map(entry -> entry.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new FetchException(FetchFailure.SERVICE_ERROR, String.format("Could not list '%s'", directory), e);
        }
    }

    private static String extension(String fileName) {
        var index = fileName.lastIndexOf('.');
        return index < 0 ? "" : fileName.substring(index);
    }

    private static UnexpectedArchiveShapeException unexpectedShape(Path analysis, List<String> files) {
        return new UnexpectedArchiveShapeException(String.format(
                "Archive bundle '%s' holds %s, expected a BAM with its index or a single tarball of reads",
                analysis,
                files));
    }

    private String path(FetchOptions options, Path destination, Path file) {
        return options.archiveServiceImage().isPresent() ? DockerCommand.containerPath(destination, file) : file.toString();
    }
}
