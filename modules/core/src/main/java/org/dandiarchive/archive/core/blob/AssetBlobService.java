package org.dandiarchive.archive.core.blob;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.asset.AssetContent;
import org.dandiarchive.archive.core.config.ArchiveSettings;
import org.dandiarchive.archive.core.dao.AssetBlobDao;
import org.dandiarchive.archive.core.dao.AssetBlobRecord;
import org.dandiarchive.archive.core.dao.AssetDao;
import org.dandiarchive.archive.core.dao.AssetRecord;
import org.dandiarchive.archive.core.dao.DandisetDao;
import org.dandiarchive.archive.core.dao.ZarrArchiveDao;
import org.dandiarchive.archive.core.dao.ZarrArchiveRecord;
import org.dandiarchive.archive.core.error.ContentNotFoundException;
import org.dandiarchive.archive.core.storage.ObjectInfo;
import org.dandiarchive.archive.core.storage.ObjectNotFoundException;
import org.dandiarchive.archive.core.storage.ObjectStorage;
import org.dandiarchive.archive.core.storage.StorageException;
import org.dandiarchive.archive.core.task.TaskService;
import org.dandiarchive.archive.core.validation.ValidateAssetTask;
import org.dandiarchive.archive.types.ValidationStatus;
import org.dandiarchive.archive.util.Etag;
import org.dandiarchive.archive.util.Sha256Digest;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Registers uploaded objects as blobs and fills in their SHA-256 digests.
 */
@ApplicationScoped
public class AssetBlobService {

    private static final Logger log = Logger.getLogger(AssetBlobService.class);

    static final Duration DOWNLOAD_URL_EXPIRY = Duration.ofHours(1);

    private final Jdbi jdbi;
    private final ObjectStorage storage;
    private final TaskService taskService;
    private final ArchiveSettings settings;

    @Inject
    public AssetBlobService(Jdbi jdbi, ObjectStorage storage, TaskService taskService, ArchiveSettings settings) {
        this.jdbi = jdbi;
        this.storage = storage;
        this.taskService = taskService;
        this.settings = settings;
    }

    /**
     * Creates a blob for an uploaded object and schedules its digest computation.
     *
     * @param embargoedDandisetId dandiset that embargoes the blob, or null
     * @throws ContentNotFoundException if the object or the dandiset does not exist
     * @throws IllegalArgumentException if etag or size disagree with the stored object
     */
    public AssetBlobRecord registerBlob(String blobKey, String etag, long size, Long embargoedDandisetId) {
        Etag.requireValid(etag);
        ObjectInfo info;
        try {
            info = storage.stat(blobKey).await().indefinitely();
        } catch (ObjectNotFoundException e) {
            throw new ContentNotFoundException("Object", blobKey);
        }
        if (!etag.equals(info.etag()) || size != info.size()) {
            throw new IllegalArgumentException("Object " + blobKey + " has etag " + info.etag()
                    + " and size " + info.size() + ", expected " + etag + " and " + size);
        }

        AssetBlobRecord blob = jdbi.inTransaction(handle -> {
            if (embargoedDandisetId != null) {
                handle.attach(DandisetDao.class).findById(embargoedDandisetId)
                        .orElseThrow(() -> new ContentNotFoundException("Dandiset", embargoedDandisetId));
            }
            AssetBlobDao dao = handle.attach(AssetBlobDao.class);
            long id = dao.insert(UUID.randomUUID(), blobKey, etag, size, null, embargoedDandisetId);
            return dao.findById(id).orElseThrow();
        });
        taskService.submit(CalculateSha256Task.TYPE, blob.id());
        log.infof("Registered blob %s (%s, %d bytes)", blob.blobId(), blobKey, size);
        return blob;
    }

    public Optional<AssetBlobRecord> get(UUID blobId) {
        return jdbi.withExtension(AssetBlobDao.class, dao -> dao.findByBlobId(blobId));
    }

    /**
     * Computes and stores the blob's SHA-256 if it has none yet, then schedules
     * validation of the pending assets it backs.
     *
     * @return the blob's digest in hex
     */
    public String calculateSha256(long blobId) {
        AssetBlobRecord blob = jdbi.withExtension(AssetBlobDao.class, dao -> dao.findById(blobId))
                .orElseThrow(() -> new ContentNotFoundException("Blob", blobId));
        if (blob.digestReady()) {
            return blob.sha256();
        }

        String sha256;
        try (InputStream in = storage.open(blob.blobKey()).await().indefinitely()) {
            sha256 = Sha256Digest.of(in).toHex();
        } catch (IOException e) {
            throw new StorageException("digest object", blob.blobKey(), e);
        }

        int updated = jdbi.withExtension(AssetBlobDao.class, dao -> dao.setSha256IfAbsent(blobId, sha256));
        if (updated == 0) {
            log.debugf("Blob %s digest was set concurrently", blob.blobId());
        } else {
            log.infof("Blob %s sha256=%s", blob.blobId(), sha256);
        }

        for (long assetId : jdbi.withExtension(AssetDao.class,
                dao -> dao.findIdsByBlob(blobId, ValidationStatus.PENDING))) {
            taskService.submitUnique(ValidateAssetTask.TYPE, assetId);
        }
        return sha256;
    }

    /**
     * Where a client downloads the asset's content: a presigned URL for blobs, the
     * archive prefix for zarr archives.
     */
    public String downloadUrl(UUID assetId) {
        return jdbi.withHandle(handle -> {
            AssetRecord asset = handle.attach(AssetDao.class).findByAssetId(assetId)
                    .orElseThrow(() -> new ContentNotFoundException("Asset", assetId));
            AssetContent content = AssetContent.of(asset);
            if (content instanceof AssetContent.ZarrContent z) {
                ZarrArchiveRecord zarr = handle.attach(ZarrArchiveDao.class).findById(z.zarrId())
                        .orElseThrow(() -> new ContentNotFoundException("Zarr archive", z.zarrId()));
                return settings.storageUrl() + "/zarr/" + zarr.zarrId() + "/";
            }
            long blobId = content.blobColumn() != null ? content.blobColumn() : content.embargoedBlobColumn();
            AssetBlobRecord blob = handle.attach(AssetBlobDao.class).findById(blobId)
                    .orElseThrow(() -> new ContentNotFoundException("Blob", blobId));
            return storage.presignedUrl(blob.blobKey(), DOWNLOAD_URL_EXPIRY).await().indefinitely();
        });
    }
}
