package com.hartwig.alignpipe.staging;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.Striped;
import com.hartwig.alignpipe.fetch.FetchOptions;
import com.hartwig.alignpipe.fetch.RemoteFetcher;
import com.hartwig.alignpipe.fetch.RemoteLocator;
import com.hartwig.alignpipe.storage.DurableHandle;
import com.hartwig.alignpipe.storage.DurableStore;
import com.hartwig.alignpipe.workflow.LogicalFileKey;
import com.hartwig.alignpipe.workflow.StageExecutionException;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps logical file keys to files in the <code>inputs</code> directory of a stage work directory. All inputs of a stage
 * share that directory, so index files end up next to the files they index.
 * <p>
 * A published key is copied from the durable store; published directories travel as tar files and are unpacked again. An unpublished key with a remote locator is fetched, normalized
 * once and copied together with its companion files (e.g. the second mate of paired reads). With caching enabled,
 * durable copies and fetched directories are kept in a process-local cache directory, so retries of a stage neither
 * read the durable store again nor fetch again.
 */
public class StagedFileCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(StagedFileCache.class);
    static final String INPUTS_DIRECTORY = "inputs";
    private static final String PRIMARY_MARKER = ".primary";
    private static final String PAYLOAD_DIRECTORY = "payload";

    private final DurableStore durableStore;
    private final RemoteFetcher fetcher;
    private final FormatNormalizer normalizer;
    private final Path cacheDirectory;
    private final FetchOptions fetchOptions;
    private final Striped<Lock> locks = Striped.lazyWeakLock(64);

    public StagedFileCache(final DurableStore durableStore, final RemoteFetcher fetcher, final FormatNormalizer normalizer,
            final Path cacheDirectory, final FetchOptions fetchOptions) {
        this.durableStore = durableStore;
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.cacheDirectory = cacheDirectory;
        this.fetchOptions = fetchOptions;
    }

    /**
     * @throws StageExecutionException if the key is neither published nor fetchable
     */
    public StagedFile materialize(LogicalFileKey key, Optional<RemoteLocator> locator, Path workDirectory, boolean cacheEnabled) {
        var inputDirectory = workDirectory.resolve(INPUTS_DIRECTORY);
        try {
            var handle = durableStore.find(key);
            if (handle.isPresent()) {
                return fromDurableStore(key, handle.get(), inputDirectory, cacheEnabled);
            }
            if (locator.isPresent()) {
                return fromRemote(key, locator.get(), workDirectory, inputDirectory, cacheEnabled);
            }
        } catch (IOException e) {
            throw new StageExecutionException(String.format("[%s] Could not materialize input", key.path()), e);
        }
        throw new StageExecutionException(String.format("[%s] Input has not been published and has no remote source", key.path()));
    }

    /**
     * Stores a stage output under its key. Keys are written once.
     */
    public DurableHandle publish(LogicalFileKey key, Path localPath) {
        try {
            if (Files.isDirectory(localPath)) {
                var archive = DirectoryPacker.pack(localPath);
                try {
                    return durableStore.publish(key, archive);
                } finally {
                    Files.deleteIfExists(archive);
                }
            }
            return durableStore.publish(key, localPath);
        } catch (IOException e) {
            throw new StageExecutionException(String.format("[%s] Could not publish '%s'", key.path(), localPath), e);
        }
    }

    public Optional<DurableHandle> find(LogicalFileKey key) {
        try {
            return durableStore.find(key);
        } catch (IOException e) {
            throw new StageExecutionException(String.format("[%s] Could not look up key in the durable store", key.path()), e);
        }
    }

    private StagedFile fromDurableStore(LogicalFileKey key, DurableHandle handle, Path inputDirectory, boolean cacheEnabled)
            throws IOException {
        var target = inputDirectory.resolve(handle.fileName());
        checkUnclaimed(key, target);
        if (!cacheEnabled) {
            durableStore.read(handle, target);
            LOGGER.info("[{}] Copied from durable store", key.path());
            return StagedFile.of(key, unpackIfArchive(target), StagedFile.Origin.DURABLE_STORE);
        }
        var entry = cacheDirectory.resolve("durable-" + hash(handle.location()));
        var lock = locks.get(entry.toString());
        lock.lock();
        try {
            var origin = StagedFile.Origin.LOCAL_CACHE;
            var cached = entry.resolve(handle.fileName());
            if (!Files.exists(cached)) {
                var temporary = entry.resolveSibling(entry.getFileName() + "-" + UUID.randomUUID());
                try {
                    durableStore.read(handle, temporary.resolve(handle.fileName()));
                    FileUtils.deleteDirectory(entry.toFile());
                    Files.move(temporary, entry, StandardCopyOption.ATOMIC_MOVE);
                } finally {
                    FileUtils.deleteQuietly(temporary.toFile());
                }
                origin = StagedFile.Origin.DURABLE_STORE;
            }
            Files.createDirectories(inputDirectory);
            Files.copy(cached, target);
            LOGGER.info("[{}] Copied via local cache, origin {}", key.path(), origin);
            return StagedFile.of(key, unpackIfArchive(target), origin);
        } finally {
            lock.unlock();
        }
    }

    private StagedFile fromRemote(LogicalFileKey key, RemoteLocator locator, Path workDirectory, Path inputDirectory,
            boolean cacheEnabled) throws IOException {
        if (!cacheEnabled) {
            var scratch = Files.createTempDirectory(Files.createDirectories(workDirectory), "fetch-");
            try {
                var primary = fetchAndNormalize(key, locator, scratch);
                return StagedFile.of(key, copyDirectory(key, primary, inputDirectory), StagedFile.Origin.REMOTE);
            } finally {
                FileUtils.deleteQuietly(scratch.toFile());
            }
        }
        var entry = cacheDirectory.resolve("remote-" + hash(locator.kind() + ":" + locator.address()));
        var lock = locks.get(entry.toString());
        lock.lock();
        try {
            var origin = StagedFile.Origin.LOCAL_CACHE;
            if (!Files.exists(entry.resolve(PRIMARY_MARKER))) {
                commitToCache(key, locator, entry);
                origin = StagedFile.Origin.REMOTE;
            }
            var primaryName = Files.readString(entry.resolve(PRIMARY_MARKER), StandardCharsets.UTF_8);
            var primary = entry.resolve(PAYLOAD_DIRECTORY).resolve(primaryName);
            return StagedFile.of(key, copyDirectory(key, primary, inputDirectory), origin);
        } finally {
            lock.unlock();
        }
    }

    private void commitToCache(LogicalFileKey key, RemoteLocator locator, Path entry) throws IOException {
        var scratch = Files.createDirectories(entry.resolveSibling(entry.getFileName() + "-" + UUID.randomUUID()));
        try {
            var primary = fetchAndNormalize(key, locator, scratch.resolve("fetch"));
            var payload = scratch.resolve(PAYLOAD_DIRECTORY);
            Files.move(primary.getParent(), payload, StandardCopyOption.ATOMIC_MOVE);
            Files.writeString(scratch.resolve(PRIMARY_MARKER), primary.getFileName().toString(), StandardCharsets.UTF_8);
            FileUtils.deleteDirectory(entry.toFile());
            Files.move(scratch, entry, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            FileUtils.deleteQuietly(scratch.toFile());
        }
    }

    /**
     * Fetches into the scratch directory and normalizes the fetched file and its companions until stable.
     *
     * @return the normalized primary file
     */
    private Path fetchAndNormalize(LogicalFileKey key, RemoteLocator locator, Path scratch) throws IOException {
        Files.createDirectories(scratch);
        LOGGER.info("[{}] Fetching from [{}]", key.path(), locator.address());
        var fetched = fetcher.fetch(locator, scratch, fetchOptions);
        Path primary = null;
        for (Path file : regularFiles(fetched.getParent())) {
            var normalized = normalizer.normalizeUntilStable(file);
            if (file.equals(fetched)) {
                primary = normalized.path();
            }
        }
        if (primary == null) {
            throw new StageExecutionException(String.format("[%s] Fetch of '%s' returned '%s' which does not exist",
                    key.path(),
                    locator.address(),
                    fetched));
        }
        LOGGER.info("[{}] Staged as [{}]", key.path(), primary.getFileName());
        return primary;
    }

    /**
     * Copies the directory holding the primary file, companions included, into the input directory.
     *
     * @return the primary file in the input directory
     */
    private static Path copyDirectory(LogicalFileKey key, Path primary, Path inputDirectory) throws IOException {
        var target = inputDirectory.resolve(primary.getFileName().toString());
        checkUnclaimed(key, target);
        FileUtils.copyDirectory(primary.getParent().toFile(), inputDirectory.toFile());
        return target;
    }

    private Path unpackIfArchive(Path file) throws IOException {
        if (normalizer.detect(file) != FileFormat.TAR) {
            return file;
        }
        var directory = normalizer.extractArchive(file, file.getParent());
        Files.delete(file);
        return directory;
    }

    private static void checkUnclaimed(LogicalFileKey key, Path target) {
        if (Files.exists(target)) {
            throw new StageExecutionException(String.format("[%s] Input '%s' collides with another input of the stage",
                    key.path(),
                    target.getFileName()));
        }
    }

    private static List<Path> regularFiles(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile).sorted().collect(Collectors.toCollection(ArrayList::new));
        }
    }

    private static String hash(String value) {
        return Hashing.sha256().hashString(value, StandardCharsets.UTF_8).toString().substring(0, 32);
    }
}
