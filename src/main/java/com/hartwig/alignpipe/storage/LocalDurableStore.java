package com.hartwig.alignpipe.storage;

import java.io.IOException;
import java.net.URI;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;

import com.hartwig.alignpipe.workflow.LogicalFileKey;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable store on a (shared) filesystem, laid out as <code>root/SAMPLE/ROLE/data/FILE</code> with the
 * <code>handle.json</code> in the key directory, apart from the published file. A publication is assembled in a staging directory and renamed into place,
 * so a key directory is either absent or complete.
 */
public class LocalDurableStore implements DurableStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalDurableStore.class);
    static final String HANDLE_FILE = "handle.json";
    private static final String STAGING_DIRECTORY = ".staging";
    private static final String DATA_DIRECTORY = "data";

    private final Path root;

    public LocalDurableStore(final Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Optional<DurableHandle> find(LogicalFileKey key) throws IOException {
        var handleFile = keyDirectory(key).resolve(HANDLE_FILE);
        if (!Files.exists(handleFile)) {
            return Optional.empty();
        }
        return Optional.of(HandleSerializer.fromJson(Files.readAllBytes(handleFile)));
    }

    @Override
    public DurableHandle publish(LogicalFileKey key, Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException(String.format("Cannot publish '%s' for key '%s', it is not a file", file, key.path()));
        }
        var target = keyDirectory(key);
        if (Files.exists(target)) {
            throw new WriteOnceViolationException(key);
        }
        var staging = Files.createDirectories(root.resolve(STAGING_DIRECTORY).resolve(UUID.randomUUID().toString()));
        try {
            var fileName = file.getFileName().toString();
            Files.copy(file, Files.createDirectory(staging.resolve(DATA_DIRECTORY)).resolve(fileName));
            var handle = DurableHandle.builder()
                    .key(key)
                    .location(target.resolve(DATA_DIRECTORY).resolve(fileName).toUri().toString())
                    .fileName(fileName)
                    .sizeBytes(Files.size(file))
                    .build();
            Files.write(staging.resolve(HANDLE_FILE), HandleSerializer.toJson(handle));

            Files.createDirectories(target.getParent());
            try {
                Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (FileAlreadyExistsException | DirectoryNotEmptyException e) {
                throw new WriteOnceViolationException(key);
            }
            LOGGER.info("[{}] Published [{}] ({} bytes)", key.path(), handle.location(), handle.sizeBytes());
            return handle;
        } finally {
            FileUtils.deleteQuietly(staging.toFile());
        }
    }

    @Override
    public void read(DurableHandle handle, Path destination) throws IOException {
        var source = Path.of(URI.create(handle.location()));
        Files.createDirectories(destination.toAbsolutePath().getParent());
        Files.copy(source, destination, StandardCopyOption.REPLACE_EXISTING);
    }

    private Path keyDirectory(LogicalFileKey key) {
        var directory = root.resolve(key.sample()).resolve(key.role()).normalize();
        if (!directory.startsWith(root) || directory.equals(root)) {
            throw new IllegalArgumentException(String.format("Key '%s' does not map into the store", key.path()));
        }
        return directory;
    }
}
