package com.hartwig.alignpipe.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.hartwig.alignpipe.staging.FormatNormalizer;
import com.hartwig.alignpipe.tool.DockerCommand;
import com.hartwig.alignpipe.tool.ToolInvocation;
import com.hartwig.alignpipe.tool.ToolResult;
import com.hartwig.alignpipe.tool.ToolRunner;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArchiveServiceFetcherTest {
    private static final String ANALYSIS = "0a1b2c3d-analysis";

    @TempDir
    Path temp;

    private Path destination;
    private RemoteLocator locator;
    private ToolRunner runner;
    private RemoteFetcher descriptorFetcher;
    private BamToFastqConverter converter;
    private List<ToolInvocation> invocations;
    private List<Duration> sleeps;
    private ArchiveServiceFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        destination = Files.createDirectories(temp.resolve("fetch"));
        var query = Files.writeString(temp.resolve("query.xml"), "<ResultSet/>");
        var credentials = Files.writeString(temp.resolve("credentials.key"), "secret");
        locator = RemoteLocator.archiveService(query.toString(), credentials.toString());

        runner = mock(ToolRunner.class);
        descriptorFetcher = mock(RemoteFetcher.class);
        converter = mock(BamToFastqConverter.class);
        invocations = new ArrayList<>();
        sleeps = new ArrayList<>();
        fetcher = new ArchiveServiceFetcher(runner, new DockerCommand(false), descriptorFetcher, converter, new FormatNormalizer(),
                sleeps::add);

        when(converter.convert(any(), any())).thenAnswer(call -> {
            Path bam = call.getArgument(0);
            var base = BamToFastqConverter.baseName(bam);
            for (String suffix : List.of("_1.fastq", "_2.fastq", "_UP.fastq")) {
                Files.writeString(bam.resolveSibling(base + suffix), "@read");
            }
            return bam.resolveSibling(base + "_1.fastq");
        });
    }

    private void retrieve(BundleWriter writer) throws IOException, InterruptedException {
        when(runner.run(any())).thenAnswer(call -> {
            ToolInvocation invocation = call.getArgument(0);
            invocations.add(invocation);
            var command = invocation.command();
            var bundle = Path.of(command.get(command.indexOf("-p") + 1));
            var analysis = Files.createDirectories(bundle.resolve(ANALYSIS));
            Files.writeString(bundle.resolve(ANALYSIS + ".gto"), "manifest");
            writer.write(analysis);
            return ToolResult.exited(0);
        });
    }

    private interface BundleWriter {
        void write(Path analysis) throws IOException;
    }

    @Test
    void alignedBundleIsConvertedToPairedReads() throws IOException, InterruptedException {
        retrieve(analysis -> {
            Files.writeString(analysis.resolve("HG01.bam"), "bam");
            Files.writeString(analysis.resolve("HG01.bai"), "bai");
            Files.writeString(analysis.resolve(".hidden"), "ignored");
        });

        var firstMate = fetcher.fetch(locator, destination, FetchOptions.defaults());
        assertThat(firstMate).isEqualTo(destination.resolve("fastqs/HG01_1.fastq"));
        assertThat(firstMate).exists();
        assertThat(destination.resolve("fastqs/HG01_2.fastq")).exists();
        assertThat(invocations).hasSize(1);
        assertThat(invocations.get(0).command()).containsExactly("genetorrent",
                "-d",
                destination.resolve("archive.xml").toString(),
                "-c",
                destination.resolve("archive.key").toString(),
                "-p",
                destination.resolve("bundle").toString(),
                "-k",
                "10");
        verifyNoInteractions(descriptorFetcher);
    }

    @Test
    void tarballOfReadsIsExtractedToFirstMate() throws IOException, InterruptedException {
        retrieve(analysis -> writeTarball(analysis.resolve("reads.tar.gz"), "HG01_2.fastq", "HG01_1.fastq"));

        var firstMate = fetcher.fetch(locator, destination, FetchOptions.defaults());
        assertThat(firstMate).isEqualTo(destination.resolve("fastqs/HG01_1.fastq"));
        assertThat(firstMate).exists();
        assertThat(destination.resolve("fastqs/HG01_2.fastq")).exists();
        verifyNoInteractions(converter);
    }

    @Test
    void tarballWithoutReadsIsUnexpectedShape() throws IOException, InterruptedException {
        retrieve(analysis -> writeTarball(analysis.resolve("reads.tar.gz"), "notes.txt"));
        var e = assertThrows(UnexpectedArchiveShapeException.class,
                () -> fetcher.fetch(locator, destination, FetchOptions.defaults()));
        assertThat(e.getFailure()).isEqualTo(FetchFailure.UNEXPECTED_ARCHIVE_SHAPE);
    }

    @Test
    void otherBundleShapeIsNotRetried() throws IOException, InterruptedException {
        retrieve(analysis -> {
            Files.writeString(analysis.resolve("a.bam"), "bam");
            Files.writeString(analysis.resolve("a.bai"), "bai");
            Files.writeString(analysis.resolve("a.vcf"), "vcf");
        });
        assertThrows(UnexpectedArchiveShapeException.class, () -> fetcher.fetch(locator, destination, FetchOptions.defaults()));
        verify(runner, times(1)).run(any());
        assertThat(sleeps).isEmpty();
    }

    @Test
    void twoFilesOtherThanBamAndIndexAreUnexpectedShape() throws IOException, InterruptedException {
        retrieve(analysis -> {
            Files.writeString(analysis.resolve("a.bam"), "bam");
            Files.writeString(analysis.resolve("b.bam"), "bam");
        });
        assertThrows(UnexpectedArchiveShapeException.class, () -> fetcher.fetch(locator, destination, FetchOptions.defaults()));
    }

    @Test
    void emptyAnalysisIsUnexpectedShape() throws IOException, InterruptedException {
        retrieve(analysis -> {
        });
        assertThrows(UnexpectedArchiveShapeException.class, () -> fetcher.fetch(locator, destination, FetchOptions.defaults()));
    }

    @Test
    void failedRetrievalIsRetriedAfterCoolDown() throws IOException, InterruptedException {
        when(runner.run(any())).thenAnswer(call -> {
            invocations.add(call.getArgument(0));
            return ToolResult.exited(1);
        });

        var e = assertThrows(FetchException.class, () -> fetcher.fetch(locator, destination, FetchOptions.defaults()));
        assertThat(e.getFailure()).isEqualTo(FetchFailure.RETRIES_EXHAUSTED);
        assertThat(invocations).extracting(invocation -> invocation.command().get(invocation.command().size() - 1))
                .containsExactly("10", "20", "30");
        assertThat(sleeps).containsExactly(Duration.ofMinutes(10), Duration.ofMinutes(10));
    }

    @Test
    void missingToolFailsImmediately() throws IOException, InterruptedException {
        when(runner.run(any())).thenThrow(new IOException("Cannot run program \"genetorrent\""));
        var e = assertThrows(FetchException.class, () -> fetcher.fetch(locator, destination, FetchOptions.defaults()));
        assertThat(e.getFailure()).isEqualTo(FetchFailure.TOOL_MISSING);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void retrievalRunsInContainerWithMountedPaths() throws IOException, InterruptedException {
        when(runner.run(any())).thenAnswer(call -> {
            invocations.add(call.getArgument(0));
            return ToolResult.exited(1);
        });
        var options = FetchOptions.builder()
                .archiveServiceImage("quay.io/ucsc_cgl/genetorrent")
                .archiveServiceRetry(RetryPolicy.builder().maxAttempts(1).build())
                .build();

        assertThrows(FetchException.class, () -> fetcher.fetch(locator, destination, options));
        assertThat(invocations.get(0).command()).containsExactly("docker",
                "run",
                "--rm",
                "--log-driver=none",
                "-v",
                destination.toAbsolutePath() + ":/data",
                "quay.io/ucsc_cgl/genetorrent",
                "-d",
                "/data/archive.xml",
                "-c",
                "/data/archive.key",
                "-p",
                "/data/bundle",
                "-k",
                "10");
    }

    @Test
    void missingCredentialsFileIsResourceMissing() {
        var missing = RemoteLocator.archiveService(locator.address(), temp.resolve("absent.key").toString());
        var e = assertThrows(FetchException.class, () -> fetcher.fetch(missing, destination, FetchOptions.defaults()));
        assertThat(e.getFailure()).isEqualTo(FetchFailure.RESOURCE_MISSING);
    }

    private static void writeTarball(Path tarball, String... members) throws IOException {
        try (OutputStream file = Files.newOutputStream(tarball);
                var gzip = new GzipCompressorOutputStream(file);
                var tar = new TarArchiveOutputStream(gzip)) {
            for (String member : members) {
                var content = "@read\nACGT\n+\nIIII\n".getBytes(StandardCharsets.UTF_8);
                var entry = new TarArchiveEntry(member);
                entry.setSize(content.length);
                tar.putArchiveEntry(entry);
                tar.write(content);
                tar.closeArchiveEntry();
            }
        }
    }
}
