package com.hartwig.alignpipe.gcloud.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.BucketInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.hartwig.alignpipe.storage.DurableHandle;
import com.hartwig.alignpipe.storage.DurableStore;
import com.hartwig.alignpipe.storage.HandleSerializer;
import com.hartwig.alignpipe.storage.WriteOnceViolationException;
import com.hartwig.alignpipe.workflow.LogicalFileKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable store in a Google Cloud Storage bucket, laid out as <code>PREFIX/SAMPLE/ROLE/data/FILE</code>. The
 * <code>PREFIX/SAMPLE/ROLE/handle.json</code> blob is written last with a does-not-exist precondition; it both commits
 * the publication and enforces that a key is written once. Published files live under <code>data/</code> whatever their
 * name, so none can overwrite the handle.
 */
public class GcloudDurableStore implements DurableStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(GcloudDurableStore.class);
    private static final String HANDLE_BLOB = "handle.json";
    private static final String DATA_PREFIX = "data/";
    private static final int PRECONDITION_FAILED = 412;

    private final Storage storage;
    private final String bucketName;
    private final String prefix;

    public GcloudDurableStore(final Storage storage, final String bucketName, final String prefix) {
        this.storage = storage;
        this.bucketName = bucketName;
        this.prefix = prefix.isEmpty() || prefix.endsWith("/") ? prefix : prefix + "/";
    }

    public static GcloudDurableStore create(Storage storage, String gcpRegion, String bucketName, String prefix) {
        if (storage.get(bucketName) != null) {
            LOGGER.info("[{}] Bucket already exists. Reusing it.", bucketName);
        } else {
            var bucketInfo = BucketInfo.newBuilder(bucketName).setLocation(gcpRegion).build();
            storage.create(bucketInfo);
            LOGGER.info("[{}] Created output bucket in project [{}]", bucketName, storage.getOptions().getProjectId());
        }
        return new GcloudDurableStore(storage, bucketName, prefix);
    }

    /**
     * @param location <code>gs://bucket[/prefix]</code>
     */
    public static GcloudDurableStore fromLocation(Storage storage, String gcpRegion, String location) {
        var path = location.substring("gs://".length());
        var separator = path.indexOf('/');
        return separator < 0
                ? create(storage, gcpRegion, path, "")
                : create(storage, gcpRegion, path.substring(0, separator), path.substring(separator + 1));
    }

    @Override
    public Optional<DurableHandle> find(LogicalFileKey key) throws IOException {
        var blob = storage.get(blobId(key, HANDLE_BLOB));
        if (blob == null) {
            return Optional.empty();
        }
        return Optional.of(HandleSerializer.fromJson(blob.getContent()));
    }

    @Override
    public DurableHandle publish(LogicalFileKey key, Path file) throws IOException {
        if (find(key).isPresent()) {
            throw new WriteOnceViolationException(key);
        }
        var fileName = file.getFileName().toString();
        var contentId = blobId(key, DATA_PREFIX + fileName);
        storage.createFrom(BlobInfo.newBuilder(contentId).build(), file);
        var handle = DurableHandle.builder()
                .key(key)
                .location(contentId.toGsUtilUri())
                .fileName(fileName)
                .sizeBytes(Files.size(file))
                .build();
        try {
            storage.create(BlobInfo.newBuilder(blobId(key, HANDLE_BLOB)).setContentType("application/json").build(),
                    HandleSerializer.toJson(handle),
                    Storage.BlobTargetOption.doesNotExist());
        } catch (StorageException e) {
            if (e.getCode() == PRECONDITION_FAILED) {
                throw new WriteOnceViolationException(key);
            }
            throw e;
        }
        LOGGER.info("[{}] Published [{}] ({} bytes)", key.path(), handle.location(), handle.sizeBytes());
        return handle;
    }

    @Override
    public void read(DurableHandle handle, Path destination) throws IOException {
        Files.createDirectories(destination.toAbsolutePath().getParent());
        storage.downloadTo(BlobId.fromGsUtilUri(handle.location()), destination);
    }

    private BlobId blobId(LogicalFileKey key, String fileName) {
        return BlobId.of(bucketName, prefix + key.sample() + "/" + key.role() + "/" + fileName);
    }
}
