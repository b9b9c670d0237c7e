package com.hartwig.alignpipe.staging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import com.hartwig.alignpipe.fetch.FetchOptions;
import com.hartwig.alignpipe.fetch.RemoteFetcher;
import com.hartwig.alignpipe.fetch.RemoteLocator;
import com.hartwig.alignpipe.storage.LocalDurableStore;
import com.hartwig.alignpipe.workflow.LogicalFileKey;
import com.hartwig.alignpipe.workflow.StageExecutionException;

import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StagedFileCacheTest {
    private static final LogicalFileKey ALIGNED_BAM = LogicalFileKey.of("S1", "aligned-bam");
    private static final LogicalFileKey READS = LogicalFileKey.of("S1", "reads-1");
    private static final RemoteLocator READS_LOCATOR = RemoteLocator.objectStore("s3://bucket/S1_1.fastq.gz");

    @TempDir
    Path temp;

    private RemoteFetcher fetcher;
    private LocalDurableStore durableStore;
    private StagedFileCache cache;

    @BeforeEach
    void setUp() {
        fetcher = mock(RemoteFetcher.class);
        durableStore = new LocalDurableStore(temp.resolve("store"));
        cache = new StagedFileCache(durableStore, fetcher, new FormatNormalizer(), temp.resolve("cache"), FetchOptions.defaults());
    }

    @Test
    void publishedKeyIsCopiedWithoutFetching() throws IOException {
        cache.publish(ALIGNED_BAM, Files.writeString(temp.resolve("aligned.bam"), "alignments"));

        var staged = cache.materialize(ALIGNED_BAM, Optional.of(READS_LOCATOR), temp.resolve("work"), false);
        assertThat(staged.origin()).isEqualTo(StagedFile.Origin.DURABLE_STORE);
        assertThat(staged.path()).isEqualTo(temp.resolve("work").resolve("inputs").resolve("aligned.bam"));
        assertThat(staged.path()).hasContent("alignments");
        verifyNoInteractions(fetcher);
    }

    @Test
    void secondCachedCopyComesFromLocalCache() throws IOException {
        cache.publish(ALIGNED_BAM, Files.writeString(temp.resolve("aligned.bam"), "alignments"));

        var first = cache.materialize(ALIGNED_BAM, Optional.empty(), temp.resolve("work-1"), true);
        var second = cache.materialize(ALIGNED_BAM, Optional.empty(), temp.resolve("work-2"), true);
        assertThat(first.origin()).isEqualTo(StagedFile.Origin.DURABLE_STORE);
        assertThat(second.origin()).isEqualTo(StagedFile.Origin.LOCAL_CACHE);
        assertThat(second.path()).hasContent("alignments");
    }

    @Test
    void remoteInputIsFetchedNormalizedAndCopiedWithCompanions() throws IOException {
        givenFetchReturnsPairedReads();

        var staged = cache.materialize(READS, Optional.of(READS_LOCATOR), temp.resolve("work"), false);
        var inputs = temp.resolve("work").resolve("inputs");
        assertThat(staged.origin()).isEqualTo(StagedFile.Origin.REMOTE);
        assertThat(staged.path()).isEqualTo(inputs.resolve("S1_1.fastq"));
        assertThat(staged.path()).hasContent("@r1/1\n");
        assertThat(inputs.resolve("S1_2.fastq")).hasContent("@r1/2\n");
        assertThat(inputs.resolve("S1_1.fastq.gz")).doesNotExist();
    }

    @Test
    void cachedRemoteInputIsFetchedOnce() throws IOException {
        givenFetchReturnsPairedReads();

        var first = cache.materialize(READS, Optional.of(READS_LOCATOR), temp.resolve("work-1"), true);
        var second = cache.materialize(READS, Optional.of(READS_LOCATOR), temp.resolve("work-2"), true);
        assertThat(first.origin()).isEqualTo(StagedFile.Origin.REMOTE);
        assertThat(second.origin()).isEqualTo(StagedFile.Origin.LOCAL_CACHE);
        assertThat(second.path()).hasContent("@r1/1\n");
        assertThat(temp.resolve("work-2").resolve("inputs").resolve("S1_2.fastq")).exists();
        verify(fetcher, times(1)).fetch(eq(READS_LOCATOR), any(), any());
    }

    @Test
    void uncachedRemoteInputIsFetchedEveryTime() throws IOException {
        givenFetchReturnsPairedReads();

        cache.materialize(READS, Optional.of(READS_LOCATOR), temp.resolve("work-1"), false);
        cache.materialize(READS, Optional.of(READS_LOCATOR), temp.resolve("work-2"), false);
        verify(fetcher, times(2)).fetch(eq(READS_LOCATOR), any(), any());
    }

    @Test
    void unpublishedKeyWithoutLocatorFails() {
        var e = assertThrows(StageExecutionException.class,
                () -> cache.materialize(ALIGNED_BAM, Optional.empty(), temp.resolve("work"), true));
        assertThat(e.getMessage()).isEqualTo("[S1/aligned-bam] Input has not been published and has no remote source");
    }

    @Test
    void fetchReturningMissingFileFails() {
        when(fetcher.fetch(any(), any(), any())).thenAnswer(invocation -> invocation.<Path>getArgument(1).resolve("nothing"));
        var e = assertThrows(StageExecutionException.class,
                () -> cache.materialize(READS, Optional.of(READS_LOCATOR), temp.resolve("work"), false));
        assertThat(e.getMessage()).contains("does not exist");
    }

    @Test
    void inputsWithSameFileNameCollide() throws IOException {
        var other = LogicalFileKey.of("S1", "other-bam");
        cache.publish(ALIGNED_BAM, Files.writeString(Files.createDirectories(temp.resolve("a")).resolve("x.bam"), "a"));
        cache.publish(other, Files.writeString(Files.createDirectories(temp.resolve("b")).resolve("x.bam"), "b"));

        cache.materialize(ALIGNED_BAM, Optional.empty(), temp.resolve("work"), false);
        var e = assertThrows(StageExecutionException.class,
                () -> cache.materialize(other, Optional.empty(), temp.resolve("work"), false));
        assertThat(e.getMessage()).contains("collides");
    }

    @Test
    void publishedDirectoryIsUnpackedAgain() throws IOException {
        var key = LogicalFileKey.of("S1", "aligned-reads.adam");
        var dataset = Files.createDirectories(temp.resolve("out").resolve("aligned.adam"));
        Files.writeString(dataset.resolve("part-00000.parquet"), "rows");

        var handle = cache.publish(key, dataset);
        assertThat(handle.fileName()).isEqualTo("aligned.adam.tar");
        assertThat(temp.resolve("out").resolve("aligned.adam.tar")).doesNotExist();

        var staged = cache.materialize(key, Optional.empty(), temp.resolve("work"), false);
        assertThat(staged.path()).isEqualTo(temp.resolve("work").resolve("inputs").resolve("aligned.adam"));
        assertThat(staged.path().resolve("part-00000.parquet")).hasContent("rows");
        assertThat(temp.resolve("work").resolve("inputs").resolve("aligned.adam.tar")).doesNotExist();
    }

    @Test
    void findReflectsPublication() throws IOException {
        assertThat(cache.find(ALIGNED_BAM)).isEmpty();
        cache.publish(ALIGNED_BAM, Files.writeString(temp.resolve("aligned.bam"), "alignments"));
        assertThat(cache.find(ALIGNED_BAM)).isPresent();
    }

    private void givenFetchReturnsPairedReads() {
        when(fetcher.fetch(any(), any(), any())).thenAnswer(invocation -> {
            Path destination = invocation.getArgument(1);
            gzip(destination.resolve("S1_1.fastq.gz"), "@r1/1\n");
            gzip(destination.resolve("S1_2.fastq.gz"), "@r1/2\n");
            return destination.resolve("S1_1.fastq.gz");
        });
    }

    private static void gzip(Path target, String content) throws IOException {
        try (var output = new GzipCompressorOutputStream(Files.newOutputStream(target))) {
            output.write(content.getBytes(StandardCharsets.UTF_8));
        }
    }
}
