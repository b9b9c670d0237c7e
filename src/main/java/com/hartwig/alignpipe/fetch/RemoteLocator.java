package com.hartwig.alignpipe.fetch;

import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.hartwig.alignpipe.ConfigurationException;

import org.immutables.value.Value;

/**
 * Where a remote input comes from. Supplied by configuration and never changed by the pipeline.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableRemoteLocator.class)
@JsonSerialize(as = ImmutableRemoteLocator.class)
public interface RemoteLocator {
    enum Kind {
        OBJECT_STORE,
        ARCHIVE_SERVICE
    }

    Kind kind();

    /**
     * <code>s3://</code> or <code>https://</code> URL for the object store, path or URL of the query descriptor for the
     * archive service.
     */
    String address();

    /**
     * Server side encryption key file.
     */
    Optional<String> encryptionKey();

    /**
     * Whether the encryption key is a master key from which a key per file is derived.
     */
    @Value.Default
    default boolean perFileEncryption() {
        return true;
    }

    /**
     * Key file authorizing downloads from the archive service.
     */
    Optional<String> credentials();

    @Value.Check
    default void check() {
        if (address().isBlank()) {
            throw new ConfigurationException("Remote locator needs an address");
        }
        if (kind() == Kind.ARCHIVE_SERVICE && credentials().isEmpty()) {
            throw new ConfigurationException(String.format("Archive query '%s' has no credentials file", address()));
        }
    }

    static RemoteLocator objectStore(String address) {
        return ImmutableRemoteLocator.builder().kind(Kind.OBJECT_STORE).address(address).build();
    }

    static RemoteLocator objectStore(String address, Optional<String> encryptionKey, boolean perFileEncryption) {
        return ImmutableRemoteLocator.builder()
                .kind(Kind.OBJECT_STORE)
                .address(address)
                .encryptionKey(encryptionKey)
                .perFileEncryption(perFileEncryption)
                .build();
    }

    static RemoteLocator archiveService(String query, String credentials) {
        return ImmutableRemoteLocator.builder().kind(Kind.ARCHIVE_SERVICE).address(query).credentials(credentials).build();
    }
}
