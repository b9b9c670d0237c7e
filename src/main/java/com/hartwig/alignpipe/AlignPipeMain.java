package com.hartwig.alignpipe;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import com.google.cloud.storage.StorageOptions;
import com.hartwig.alignpipe.definition.DefinitionReader;
import com.hartwig.alignpipe.definition.PipelineMode;
import com.hartwig.alignpipe.definition.PipelineSettings;
import com.hartwig.alignpipe.definition.ReferenceSet;
import com.hartwig.alignpipe.execution.LocalExecutionSubstrate;
import com.hartwig.alignpipe.execution.LocalStageScheduler;
import com.hartwig.alignpipe.execution.StageRunner;
import com.hartwig.alignpipe.fetch.ArchiveServiceFetcher;
import com.hartwig.alignpipe.fetch.DispatchingRemoteFetcher;
import com.hartwig.alignpipe.fetch.FetchOptions;
import com.hartwig.alignpipe.fetch.ObjectStoreFetcher;
import com.hartwig.alignpipe.fetch.PicardBamToFastqConverter;
import com.hartwig.alignpipe.fetch.Sleeper;
import com.hartwig.alignpipe.gcloud.storage.GcloudDurableStore;
import com.hartwig.alignpipe.pipeline.BundleTemplates;
import com.hartwig.alignpipe.pipeline.GraphBuilder;
import com.hartwig.alignpipe.pipeline.ToolImages;
import com.hartwig.alignpipe.staging.FormatNormalizer;
import com.hartwig.alignpipe.staging.StagedFileCache;
import com.hartwig.alignpipe.storage.DurableStore;
import com.hartwig.alignpipe.storage.LocalDurableStore;
import com.hartwig.alignpipe.tool.DockerCommand;
import com.hartwig.alignpipe.tool.ProcessToolRunner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

@CommandLine.Command(name = "alignpipe",
                     mixinStandardHelpOptions = true,
                     description = "Aligns, preprocesses and calls variants for every sample of a manifest")
public class AlignPipeMain implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(AlignPipeMain.class);
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_SAMPLE_FAILED = 1;
    static final int EXIT_CONFIGURATION_ERROR = 2;

    @CommandLine.Option(names = { "--manifest" },
                        required = true,
                        description = "File with one sample identifier per line")
    private Path manifest;

    @CommandLine.Option(names = { "--output-location" },
                        required = true,
                        description = "Durable store of stage outputs: gs://bucket[/prefix] or a local directory")
    private String outputLocation;

    @CommandLine.Option(names = { "--references" },
                        required = true,
                        description = "YAML file with the locations of the reference genome, its index and the known sites")
    private Path references;

    @CommandLine.Option(names = { "--pipeline-mode" },
                        defaultValue = "both",
                        description = "Preprocessing branches to run: first (Spark/ADAM), second (GATK) or both")
    private String pipelineMode;

    @CommandLine.Option(names = { "--input-bucket" },
                        description = "Bucket with the reads of every sample under sequence/SAMPLE_1.fastq.gz and _2")
    private String inputBucket;

    @CommandLine.Option(names = { "--bucket-region" },
                        defaultValue = PipelineSettings.DEFAULT_REGION,
                        description = "Region of the input bucket")
    private String bucketRegion;

    @CommandLine.Option(names = { "--archive-query" },
                        description = "Archive service query descriptor, used instead of an input bucket")
    private String archiveQuery;

    @CommandLine.Option(names = { "--archive-credentials" },
                        description = "Credentials key file of the archive service")
    private String archiveCredentials;

    @CommandLine.Option(names = { "--num-nodes" },
                        defaultValue = "2",
                        description = "Spark nodes for the first path: one master and the rest workers")
    private int numNodes;

    @CommandLine.Option(names = { "--driver-memory" },
                        defaultValue = "10g",
                        description = "Memory of the Spark driver")
    private String driverMemory;

    @CommandLine.Option(names = { "--executor-memory" },
                        defaultValue = "10g",
                        description = "Memory of every Spark executor")
    private String executorMemory;

    @CommandLine.Option(names = { "--file-size" },
                        defaultValue = "100G",
                        description = "Expected disk use of a stage, e.g. 100G")
    private String fileSize;

    @CommandLine.Option(names = { "--cpu-count" },
                        description = "Threads per tool, defaults to the number of processors")
    private Integer cpuCount;

    @CommandLine.Option(names = { "--sse-key" },
                        description = "Server-side encryption key file of the input bucket")
    private String sseKey;

    @CommandLine.Option(names = { "--no-per-file-encryption" },
                        description = "The encryption key is used as is instead of as a master key for per-file keys")
    private boolean noPerFileEncryption;

    @CommandLine.Option(names = { "--sudo" },
                        description = "Run docker with sudo")
    private boolean sudo;

    @CommandLine.Option(names = { "--use-bwakit" },
                        description = "Align with bwakit, alt-aware when the reference set has an alt file")
    private boolean useBwakit;

    @CommandLine.Option(names = { "--work-dir" },
                        defaultValue = "${sys:java.io.tmpdir}/alignpipe",
                        description = "Directory holding the work directories of running stages")
    private Path workDirectory;

    @CommandLine.Option(names = { "--cache-dir" },
                        description = "Directory of the local input cache, defaults to WORK_DIR/cache")
    private Path cacheDirectory;

    @CommandLine.Option(names = { "--no-cache" },
                        description = "Fetch inputs again on every stage attempt")
    private boolean noCache;

    @CommandLine.Option(names = { "--max-concurrent-samples" },
                        defaultValue = "4",
                        description = "Samples running at the same time")
    private int maxConcurrentSamples;

    @CommandLine.Option(names = { "--max-concurrent-stages" },
                        defaultValue = "8",
                        description = "Stages running at the same time, over all samples")
    private int maxConcurrentStages;

    @CommandLine.Option(names = { "--gcp-project-id" },
                        description = "Name of the GCP project ID, for a gs:// output location")
    private String gcpProjectId;

    @CommandLine.Option(names = { "--gcp-region" },
                        defaultValue = "europe-west4",
                        description = "Name of the GCP region, for a gs:// output location")
    private String gcpRegion;

    @Override
    public Integer call() {
        try {
            var mode = PipelineMode.fromFlag(pipelineMode);
            var settings = settings();
            var referenceSet = readReferences();
            var bundleTemplates = BundleTemplates.create(settings, referenceSet);

            var toolRunner = new ProcessToolRunner();
            var dockerCommand = new DockerCommand(settings.sudo());
            var normalizer = new FormatNormalizer();
            var objectStoreFetcher = new ObjectStoreFetcher(toolRunner, Sleeper.SYSTEM);
            var archiveServiceFetcher = new ArchiveServiceFetcher(toolRunner,
                    dockerCommand,
                    objectStoreFetcher,
                    new PicardBamToFastqConverter(toolRunner, dockerCommand),
                    normalizer,
                    Sleeper.SYSTEM);
            var fetchOptions = FetchOptions.builder()
                    .archiveServiceImage(ToolImages.image(ToolImages.GENETORRENT, bundleTemplates.alignment()))
                    .converterImage(ToolImages.image(ToolImages.PICARD, bundleTemplates.alignment()))
                    .build();
            var stagedFileCache = new StagedFileCache(durableStore(),
                    new DispatchingRemoteFetcher(objectStoreFetcher, archiveServiceFetcher),
                    normalizer,
                    cacheDirectory != null ? cacheDirectory : workDirectory.resolve("cache"),
                    fetchOptions);

            var stageScheduler = new LocalStageScheduler(new StageRunner(stagedFileCache, workDirectory, !noCache),
                    ThreadUtil.createQueuedExecutorService(maxConcurrentStages, "stage-thread-%d"));
            var substrate = new LocalExecutionSubstrate(stageScheduler, stagedFileCache, maxConcurrentSamples);
            var driver = new PipelineDriver(new GraphBuilder(toolRunner), substrate);

            LOGGER.info("Starting pipeline for manifest [{}]", manifest);
            var results = driver.run(manifest, mode, bundleTemplates);
            var failed = results.entrySet().stream().filter(entry -> !entry.getValue()).map(Map.Entry::getKey).collect(Collectors.toList());
            if (!failed.isEmpty()) {
                LOGGER.error("{} of {} sample run(s) failed: {}", failed.size(), results.size(), failed);
                return EXIT_SAMPLE_FAILED;
            }
            LOGGER.info("All {} sample run(s) succeeded", results.size());
            return EXIT_SUCCESS;
        } catch (ConfigurationException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted while waiting for sample runs");
            return EXIT_SAMPLE_FAILED;
        } catch (Exception e) {
            LOGGER.error("Unexpected exception", e);
            return EXIT_SAMPLE_FAILED;
        }
    }

    private PipelineSettings settings() {
        var settings = PipelineSettings.builder()
                .bucketRegion(bucketRegion)
                .numNodes(numNodes)
                .driverMemory(driverMemory)
                .executorMemory(executorMemory)
                .fileSize(fileSize)
                .perFileEncryption(!noPerFileEncryption)
                .sudo(sudo)
                .useBwakit(useBwakit);
        if (inputBucket != null) {
            settings.inputBucket(inputBucket);
        }
        if (archiveQuery != null) {
            settings.archiveQuery(archiveQuery);
        }
        if (archiveCredentials != null) {
            settings.archiveCredentials(archiveCredentials);
        }
        if (sseKey != null) {
            settings.sseKey(sseKey);
        }
        if (cpuCount != null) {
            settings.cpuCount(cpuCount);
        }
        return settings.build();
    }

    private ReferenceSet readReferences() {
        try (var referencesYaml = new FileInputStream(references.toFile())) {
            return new DefinitionReader().readReferences(referencesYaml);
        } catch (IOException e) {
            throw new ConfigurationException(String.format("Could not read reference set '%s': %s", references, e.getMessage()), e);
        }
    }

    private DurableStore durableStore() {
        if (outputLocation.startsWith("gs://")) {
            var storage = StorageOptions.newBuilder().setProjectId(gcpProjectId).build().getService();
            return GcloudDurableStore.fromLocation(storage, gcpRegion, outputLocation);
        }
        return new LocalDurableStore(Path.of(outputLocation));
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new AlignPipeMain()).execute(args));
    }
}
