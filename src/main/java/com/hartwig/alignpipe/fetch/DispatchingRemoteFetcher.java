package com.hartwig.alignpipe.fetch;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

import com.hartwig.alignpipe.ConfigurationException;

/**
 * Hands a locator to the fetcher of its source kind.
 */
public class DispatchingRemoteFetcher implements RemoteFetcher {
    private final Map<RemoteLocator.Kind, RemoteFetcher> fetcherByKind = new EnumMap<>(RemoteLocator.Kind.class);

    public DispatchingRemoteFetcher(final RemoteFetcher objectStoreFetcher, final RemoteFetcher archiveServiceFetcher) {
        fetcherByKind.put(RemoteLocator.Kind.OBJECT_STORE, objectStoreFetcher);
        fetcherByKind.put(RemoteLocator.Kind.ARCHIVE_SERVICE, archiveServiceFetcher);
    }

    @Override
    public Path fetch(RemoteLocator locator, Path destination, FetchOptions options) {
        var fetcher = fetcherByKind.get(locator.kind());
        if (fetcher == null) {
            throw new ConfigurationException(String.format("No fetcher for locators of kind %s", locator.kind()));
        }
        return fetcher.fetch(locator, destination, options);
    }
}
