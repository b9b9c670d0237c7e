package com.hartwig.alignpipe.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

class DispatchingRemoteFetcherTest {

    @Test
    void locatorGoesToFetcherOfItsKind() {
        var objectStore = mock(RemoteFetcher.class);
        var archiveService = mock(RemoteFetcher.class);
        var fetcher = new DispatchingRemoteFetcher(objectStore, archiveService);
        var locator = RemoteLocator.objectStore("s3://bucket/ref.fa");
        var destination = Path.of("/tmp/fetch");
        when(objectStore.fetch(locator, destination, FetchOptions.defaults())).thenReturn(destination.resolve("ref.fa"));

        assertThat(fetcher.fetch(locator, destination, FetchOptions.defaults())).isEqualTo(destination.resolve("ref.fa"));
        verifyNoInteractions(archiveService);
    }
}
