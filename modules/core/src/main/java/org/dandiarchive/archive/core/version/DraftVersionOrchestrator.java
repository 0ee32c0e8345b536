package org.dandiarchive.archive.core.version;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.asset.AssetChain;
import org.dandiarchive.archive.core.asset.AssetContent;
import org.dandiarchive.archive.core.asset.AssetMetadata;
import org.dandiarchive.archive.core.config.ArchiveSettings;
import org.dandiarchive.archive.core.dao.AssetBlobDao;
import org.dandiarchive.archive.core.dao.AssetBlobRecord;
import org.dandiarchive.archive.core.dao.AssetDao;
import org.dandiarchive.archive.core.dao.AssetRecord;
import org.dandiarchive.archive.core.dao.VersionDao;
import org.dandiarchive.archive.core.dao.VersionRecord;
import org.dandiarchive.archive.core.dao.ZarrArchiveDao;
import org.dandiarchive.archive.core.dao.ZarrArchiveRecord;
import org.dandiarchive.archive.core.error.AssetNotInVersionException;
import org.dandiarchive.archive.core.error.ContentNotFoundException;
import org.dandiarchive.archive.core.error.ContentRefConflictException;
import org.dandiarchive.archive.core.error.InvalidPathException;
import org.dandiarchive.archive.core.error.VersionImmutableException;
import org.dandiarchive.archive.core.path.AssetPathIndex;
import org.dandiarchive.archive.core.path.PathPage;
import org.dandiarchive.archive.core.task.TaskService;
import org.dandiarchive.archive.core.validation.AggregateAssetsSummaryTask;
import org.dandiarchive.archive.core.validation.MetadataValidationService;
import org.dandiarchive.archive.core.validation.ValidateVersionTask;
import org.dandiarchive.archive.types.ValidationStatus;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for asset changes on a draft version.
 *
 * <p>Each change runs in one transaction that locks the version row, applies the
 * asset chain and path index updates, and marks the version PENDING. After commit
 * the version is queued for validation and summary aggregation, and the asset is
 * validated inline when its content is already digested.
 */
@ApplicationScoped
public class DraftVersionOrchestrator {

    private static final Logger log = Logger.getLogger(DraftVersionOrchestrator.class);

    private final Jdbi jdbi;
    private final ArchiveSettings settings;
    private final AssetChain assetChain;
    private final AssetPathIndex pathIndex;
    private final MetadataValidationService validationService;
    private final TaskService taskService;

    @Inject
    public DraftVersionOrchestrator(Jdbi jdbi, ArchiveSettings settings, AssetChain assetChain,
                                    AssetPathIndex pathIndex, MetadataValidationService validationService,
                                    TaskService taskService) {
        this.jdbi = jdbi;
        this.settings = settings;
        this.assetChain = assetChain;
        this.pathIndex = pathIndex;
        this.validationService = validationService;
        this.taskService = taskService;
    }

    public AssetRecord createAsset(long versionId, AssetRequest request) {
        ObjectNode metadata = prepareMetadata(request);
        String path = AssetMetadata.path(metadata).orElseThrow();

        AssetRecord created = jdbi.inTransaction(handle -> {
            VersionRecord version = lockDraft(handle, versionId);
            AssetContent content = resolveContent(handle, version, request);
            AssetRecord asset = assetChain.attach(handle, version, path, metadata, content);
            handle.attach(VersionDao.class).markModified(versionId, ValidationStatus.PENDING);
            return asset;
        });
        afterChange(versionId, created);
        return created;
    }

    /**
     * Replaces the asset by a successor built from {@code request}, or returns it
     * unchanged when the request matches it exactly. Either way the version is
     * marked modified and re-validated.
     */
    public AssetRecord updateAsset(long versionId, UUID assetId, AssetRequest request) {
        ObjectNode metadata = prepareMetadata(request);
        String path = AssetMetadata.path(metadata).orElseThrow();

        AssetRecord result = jdbi.inTransaction(handle -> {
            VersionRecord version = lockDraft(handle, versionId);
            AssetRecord previous = handle.attach(AssetDao.class).findByAssetId(assetId)
                    .orElseThrow(() -> new AssetNotInVersionException(assetId, versionId));
            AssetContent content = resolveContent(handle, version, request);
            AssetRecord successor = assetChain.replace(handle, version, previous, path, metadata, content);
            // an identical request keeps the asset row but still counts as a modification
            handle.attach(VersionDao.class).markModified(versionId, ValidationStatus.PENDING);
            return successor;
        });
        afterChange(versionId, result);
        return result;
    }

    /**
     * Removes the asset from the draft. The asset record and its history are kept.
     */
    public void deleteAsset(long versionId, UUID assetId) {
        jdbi.useTransaction(handle -> {
            VersionRecord version = lockDraft(handle, versionId);
            AssetRecord asset = handle.attach(AssetDao.class).findByAssetId(assetId)
                    .orElseThrow(() -> new AssetNotInVersionException(assetId, versionId));
            assetChain.detach(handle, version, asset);
            handle.attach(VersionDao.class).markModified(versionId, ValidationStatus.PENDING);
        });
        afterChange(versionId, null);
    }

    /**
     * Immediate children of {@code prefix} in any version, draft or published.
     *
     * @return empty if the prefix names no directory
     */
    public Optional<PathPage> listPaths(long versionId, String prefix, int page, int pageSize) {
        jdbi.withExtension(VersionDao.class, dao -> dao.findById(versionId))
                .orElseThrow(() -> new ContentNotFoundException("Version", versionId));
        return pathIndex.childrenOf(versionId, prefix, page, pageSize);
    }

    /** The asset and its predecessors, newest first. */
    public List<AssetRecord> assetHistory(UUID assetId) {
        return jdbi.withHandle(handle -> {
            AssetRecord asset = handle.attach(AssetDao.class).findByAssetId(assetId)
                    .orElseThrow(() -> new ContentNotFoundException("Asset", assetId));
            return assetChain.history(handle, asset);
        });
    }

    private void afterChange(long versionId, AssetRecord asset) {
        taskService.submitUnique(ValidateVersionTask.TYPE, versionId);
        taskService.submitUnique(AggregateAssetsSummaryTask.TYPE, versionId);
        if (asset == null) {
            return;
        }
        try {
            validationService.validateAsset(asset.id());
        } catch (RuntimeException e) {
            // the pending-asset sweep validates it later
            log.warnf(e, "Inline validation of asset %s failed", asset.assetId());
        }
    }

    private VersionRecord lockDraft(Handle handle, long versionId) {
        VersionRecord version = handle.attach(VersionDao.class).lockById(versionId)
                .orElseThrow(() -> new ContentNotFoundException("Version", versionId));
        if (!version.isDraft()) {
            throw new VersionImmutableException(version.id(), version.version());
        }
        return version;
    }

    private ObjectNode prepareMetadata(AssetRequest request) {
        if ((request.blobId() == null) == (request.zarrId() == null)) {
            throw new ContentRefConflictException("Exactly one of blob_id or zarr_id must be specified");
        }
        if (request.metadata() == null) {
            throw new InvalidPathException(null, "Asset metadata with a path is required");
        }
        String path = AssetMetadata.path(request.metadata())
                .orElseThrow(() -> new InvalidPathException(null, "Asset metadata must contain a path"));
        ObjectNode metadata = AssetMetadata.normalize(request.metadata(), path);
        if (AssetMetadata.schemaVersion(metadata).isEmpty()) {
            metadata.put(AssetMetadata.SCHEMA_VERSION, settings.defaultSchemaVersion());
        }
        return metadata;
    }

    private AssetContent resolveContent(Handle handle, VersionRecord version, AssetRequest request) {
        if (request.zarrId() != null) {
            ZarrArchiveRecord zarr = handle.attach(ZarrArchiveDao.class).findByZarrId(request.zarrId())
                    .orElseThrow(() -> new ContentNotFoundException("Zarr archive", request.zarrId()));
            return new AssetContent.ZarrContent(zarr.id());
        }
        AssetBlobRecord blob = handle.attach(AssetBlobDao.class).findByBlobId(request.blobId())
                .filter(b -> !b.embargoed() || b.embargoedDandisetId() == version.dandisetId())
                .orElseThrow(() -> new ContentNotFoundException("Blob", request.blobId()));
        return blob.embargoed()
                ? new AssetContent.EmbargoedBlobContent(blob.id())
                : new AssetContent.BlobContent(blob.id());
    }
}
