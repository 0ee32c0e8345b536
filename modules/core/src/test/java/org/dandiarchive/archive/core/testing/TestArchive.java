package org.dandiarchive.archive.core.testing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dandiarchive.archive.core.asset.AssetChain;
import org.dandiarchive.archive.core.asset.AssetMetadataComposer;
import org.dandiarchive.archive.core.blob.AssetBlobService;
import org.dandiarchive.archive.core.blob.CalculateSha256Task;
import org.dandiarchive.archive.core.config.ArchiveSettings;
import org.dandiarchive.archive.core.dao.AssetBlobRecord;
import org.dandiarchive.archive.core.dao.TaskDao;
import org.dandiarchive.archive.core.dao.VersionRecord;
import org.dandiarchive.archive.core.manifest.ManifestWriter;
import org.dandiarchive.archive.core.manifest.WriteManifestTask;
import org.dandiarchive.archive.core.path.AssetPathIndex;
import org.dandiarchive.archive.core.storage.FilesystemObjectStorage;
import org.dandiarchive.archive.core.task.ArchiveTask;
import org.dandiarchive.archive.core.task.TaskExecutor;
import org.dandiarchive.archive.core.task.TaskRegistry;
import org.dandiarchive.archive.core.task.TaskService;
import org.dandiarchive.archive.core.upload.UploadValidationService;
import org.dandiarchive.archive.core.upload.ValidateUploadTask;
import org.dandiarchive.archive.core.validation.AggregateAssetsSummaryTask;
import org.dandiarchive.archive.core.validation.AssetsSummaryAggregator;
import org.dandiarchive.archive.core.validation.DandiSchemaValidator;
import org.dandiarchive.archive.core.validation.MetadataValidationService;
import org.dandiarchive.archive.core.validation.ValidateAssetTask;
import org.dandiarchive.archive.core.validation.ValidateVersionTask;
import org.dandiarchive.archive.core.version.DandisetService;
import org.dandiarchive.archive.core.version.DraftVersionOrchestrator;
import org.dandiarchive.archive.core.zarr.ZarrArchiveService;
import org.dandiarchive.archive.core.zarr.ZarrChecksumCalculator;
import org.dandiarchive.archive.core.zarr.ZarrIngestTask;
import org.dandiarchive.archive.types.EmbargoStatus;
import org.dandiarchive.archive.util.Sha256Digest;
import org.jdbi.v3.core.Jdbi;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;

/**
 * The archive services wired by hand over an H2 database and a filesystem object
 * store, the way CDI wires them in the application.
 */
public class TestArchive {

    public static final String SCHEMA_VERSION = "0.6.4";

    public final Jdbi jdbi;
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final ArchiveSettings settings;
    public final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    public final FilesystemObjectStorage storage;

    public final TaskService taskService;
    public final AssetPathIndex pathIndex;
    public final AssetChain assetChain;
    public final AssetMetadataComposer composer;
    public final AssetsSummaryAggregator aggregator;
    public final MetadataValidationService validationService;
    public final DandisetService dandisetService;
    public final DraftVersionOrchestrator orchestrator;
    public final ZarrArchiveService zarrService;
    public final AssetBlobService blobService;
    public final UploadValidationService uploadService;
    public final ManifestWriter manifestWriter;
    public final TaskExecutor executor;

    public TestArchive(Path storageRoot) {
        this(storageRoot, null);
    }

    /**
     * @param aggregatorOverride replaces the summary aggregator, or null for the real one
     */
    public TestArchive(Path storageRoot, AssetsSummaryAggregator aggregatorOverride) {
        this.jdbi = TestDatabase.create();
        this.settings = settings();
        this.storage = new FilesystemObjectStorage(storageRoot);
        this.taskService = new TaskService(jdbi, objectMapper, settings, clock);
        this.pathIndex = new AssetPathIndex(jdbi, settings);
        this.assetChain = new AssetChain(pathIndex, objectMapper);
        this.composer = new AssetMetadataComposer(objectMapper, settings);
        this.aggregator = aggregatorOverride != null ? aggregatorOverride : new AssetsSummaryAggregator(objectMapper);
        this.validationService = new MetadataValidationService(jdbi, objectMapper, settings,
                new DandiSchemaValidator(settings), composer, aggregator, taskService);
        this.dandisetService = new DandisetService(jdbi, objectMapper, settings, taskService);
        this.orchestrator = new DraftVersionOrchestrator(jdbi, settings, assetChain, pathIndex,
                validationService, taskService);
        this.zarrService = new ZarrArchiveService(jdbi, taskService, pathIndex, new ZarrChecksumCalculator());
        this.blobService = new AssetBlobService(jdbi, storage, taskService, settings);
        this.uploadService = new UploadValidationService(jdbi, storage, taskService);
        this.manifestWriter = new ManifestWriter(jdbi, objectMapper, storage, composer, validationService);

        List<ArchiveTask> tasks = List.of(
                new ValidateAssetTask(validationService),
                new ValidateVersionTask(validationService),
                new AggregateAssetsSummaryTask(validationService),
                new CalculateSha256Task(blobService),
                new ValidateUploadTask(uploadService),
                new WriteManifestTask(manifestWriter),
                new ZarrIngestTask(zarrService));
        this.executor = new TaskExecutor(taskService, new TaskRegistry(tasks));
    }

    public static ArchiveSettings settings() {
        return new ArchiveSettings(SCHEMA_VERSION, List.of(SCHEMA_VERSION),
                "https://api.example.org", "https://storage.example.org/dandiarchive",
                1000, 3, Duration.ofSeconds(1), Duration.ofSeconds(30), 100);
    }

    // -- scenario helpers --

    public VersionRecord createDraft(String name) {
        return dandisetService.createDandiset(name, objectMapper.createObjectNode(), EmbargoStatus.OPEN);
    }

    /** Uploads {@code content} to storage and registers it as a digested blob. */
    public AssetBlobRecord createBlob(String content) {
        return createBlob(content, null);
    }

    public AssetBlobRecord createBlob(String content, Long embargoedDandisetId) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        String key = "blobs/" + Sha256Digest.of(bytes).toHex();
        storage.put(key, bytes, "application/octet-stream").await().indefinitely();
        AssetBlobRecord blob = blobService.registerBlob(key, md5Hex(bytes), bytes.length, embargoedDandisetId);
        blobService.calculateSha256(blob.id());
        return blobService.get(blob.blobId()).orElseThrow();
    }

    /** Asset metadata carrying every field the validator requires. */
    public ObjectNode assetMetadata(String path) {
        ObjectNode md = objectMapper.createObjectNode();
        md.put("path", path);
        md.put("encodingFormat", "application/x-nwb");
        md.put("schemaVersion", SCHEMA_VERSION);
        return md;
    }

    public int queued(String taskType) {
        return jdbi.withExtension(TaskDao.class, dao -> dao.findByType(taskType)).size();
    }

    public static String md5Hex(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
