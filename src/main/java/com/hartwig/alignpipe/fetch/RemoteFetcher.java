package com.hartwig.alignpipe.fetch;

import java.nio.file.Path;

/**
 * Retrieves one remote input into a local directory.
 */
public interface RemoteFetcher {
    /**
     * @param destination empty directory that receives the fetched file and any companion files
     * @return path of the primary fetched file, inside the destination
     * @throws FetchException classified failure, after the retry budget of the options is spent
     */
    Path fetch(RemoteLocator locator, Path destination, FetchOptions options);
}
