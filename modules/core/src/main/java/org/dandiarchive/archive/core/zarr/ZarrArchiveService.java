package org.dandiarchive.archive.core.zarr;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.dao.AssetDao;
import org.dandiarchive.archive.core.dao.AssetPathRecord;
import org.dandiarchive.archive.core.dao.AssetPathDao;
import org.dandiarchive.archive.core.dao.DandisetDao;
import org.dandiarchive.archive.core.dao.VersionDao;
import org.dandiarchive.archive.core.dao.ZarrArchiveDao;
import org.dandiarchive.archive.core.dao.ZarrArchiveRecord;
import org.dandiarchive.archive.core.dao.ZarrFileDao;
import org.dandiarchive.archive.core.dao.ZarrFileRecord;
import org.dandiarchive.archive.core.dao.ZarrUploadDao;
import org.dandiarchive.archive.core.error.ContentNotFoundException;
import org.dandiarchive.archive.core.error.InvalidPathException;
import org.dandiarchive.archive.core.error.ZarrArchiveBusyException;
import org.dandiarchive.archive.core.error.ZarrUploadsOutstandingException;
import org.dandiarchive.archive.core.path.AssetPathIndex;
import org.dandiarchive.archive.core.task.TaskService;
import org.dandiarchive.archive.core.validation.AggregateAssetsSummaryTask;
import org.dandiarchive.archive.core.validation.ValidateAssetTask;
import org.dandiarchive.archive.types.ValidationStatus;
import org.dandiarchive.archive.types.ZarrArchiveStatus;
import org.dandiarchive.archive.util.AssetPaths;
import org.dandiarchive.archive.util.Etag;
import org.dandiarchive.archive.util.ZarrChecksum;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracks the files of zarr archives and their running count, size and checksum.
 *
 * <p>Writers of one archive are serialized by a row lock on {@code zarr_archive};
 * totals change only through additive updates. Any file change clears the
 * checksum and returns the archive to PENDING. {@link #completeUpload} hands the
 * archive to the {@code zarr.ingest} task, which computes the checksum.
 */
@ApplicationScoped
public class ZarrArchiveService {

    private static final Logger log = Logger.getLogger(ZarrArchiveService.class);

    private final Jdbi jdbi;
    private final TaskService taskService;
    private final AssetPathIndex pathIndex;
    private final ZarrChecksumCalculator checksumCalculator;

    @Inject
    public ZarrArchiveService(Jdbi jdbi, TaskService taskService, AssetPathIndex pathIndex,
                              ZarrChecksumCalculator checksumCalculator) {
        this.jdbi = jdbi;
        this.taskService = taskService;
        this.pathIndex = pathIndex;
        this.checksumCalculator = checksumCalculator;
    }

    public ZarrArchiveRecord createZarr(long dandisetId, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Zarr archive name must not be blank");
        }
        return jdbi.inTransaction(handle -> {
            handle.attach(DandisetDao.class).findById(dandisetId)
                    .orElseThrow(() -> new ContentNotFoundException("Dandiset", dandisetId));
            ZarrArchiveDao dao = handle.attach(ZarrArchiveDao.class);
            long id = dao.insert(UUID.randomUUID(), name, dandisetId, ZarrArchiveStatus.PENDING);
            ZarrArchiveRecord created = dao.findById(id).orElseThrow();
            log.infof("Created zarr archive %s (%s) in dandiset %d", created.zarrId(), name, dandisetId);
            return created;
        });
    }

    public Optional<ZarrArchiveRecord> get(UUID zarrId) {
        return jdbi.withExtension(ZarrArchiveDao.class, dao -> dao.findByZarrId(zarrId));
    }

    public List<ZarrFileRecord> files(UUID zarrId) {
        return jdbi.withHandle(handle -> {
            ZarrArchiveRecord zarr = handle.attach(ZarrArchiveDao.class).findByZarrId(zarrId)
                    .orElseThrow(() -> new ContentNotFoundException("Zarr archive", zarrId));
            return handle.attach(ZarrFileDao.class).findByArchive(zarr.id());
        });
    }

    /** Outstanding upload paths, in request order. */
    public List<String> outstandingUploads(UUID zarrId) {
        return jdbi.withHandle(handle -> {
            ZarrArchiveRecord zarr = handle.attach(ZarrArchiveDao.class).findByZarrId(zarrId)
                    .orElseThrow(() -> new ContentNotFoundException("Zarr archive", zarrId));
            return handle.attach(ZarrUploadDao.class).findPaths(zarr.id());
        });
    }

    /**
     * Records uploads the client is about to perform. Re-requesting a path replaces
     * its expected etag.
     */
    public void requestUploads(UUID zarrId, List<ZarrUploadRequest> uploads) {
        for (ZarrUploadRequest upload : uploads) {
            requireValidFile(upload.path(), upload.etag());
        }
        jdbi.useTransaction(handle -> {
            ZarrArchiveRecord zarr = lockWritable(handle, zarrId);
            ZarrUploadDao dao = handle.attach(ZarrUploadDao.class);
            for (ZarrUploadRequest upload : uploads) {
                dao.delete(zarr.id(), upload.path());
                dao.insert(zarr.id(), upload.path(), upload.etag());
            }
            handle.attach(ZarrArchiveDao.class).resetChecksum(zarr.id(), ZarrArchiveStatus.PENDING);
        });
        log.debugf("Zarr %s: %d uploads requested", zarrId, uploads.size());
    }

    /**
     * Adds or overwrites a file entry and adjusts the archive totals by the difference.
     */
    public void registerFile(UUID zarrId, String path, String etag, long size) {
        requireValidFile(path, etag);
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0, got: " + size);
        }
        jdbi.useTransaction(handle -> {
            ZarrArchiveRecord zarr = lockWritable(handle, zarrId);
            ZarrFileDao files = handle.attach(ZarrFileDao.class);
            Optional<ZarrFileRecord> existing = files.find(zarr.id(), path);
            long deltaFiles;
            long deltaSize;
            if (existing.isPresent()) {
                files.update(zarr.id(), path, etag, size);
                deltaFiles = 0;
                deltaSize = size - existing.get().size();
            } else {
                files.insert(zarr.id(), path, etag, size);
                deltaFiles = 1;
                deltaSize = size;
            }
            handle.attach(ZarrUploadDao.class).delete(zarr.id(), path);
            handle.attach(ZarrArchiveDao.class).applyDelta(zarr.id(), deltaFiles, deltaSize, ZarrArchiveStatus.PENDING);
        });
        log.tracef("Zarr %s: registered %s (%d bytes)", zarrId, path, size);
    }

    public void removeFile(UUID zarrId, String path) {
        jdbi.useTransaction(handle -> {
            ZarrArchiveRecord zarr = lockWritable(handle, zarrId);
            ZarrFileDao files = handle.attach(ZarrFileDao.class);
            ZarrFileRecord existing = files.find(zarr.id(), path)
                    .orElseThrow(() -> new ContentNotFoundException("Zarr file", zarrId + "/" + path));
            files.delete(zarr.id(), path);
            handle.attach(ZarrArchiveDao.class).applyDelta(zarr.id(), -1, -existing.size(), ZarrArchiveStatus.PENDING);
        });
        log.tracef("Zarr %s: removed %s", zarrId, path);
    }

    /**
     * Marks the upload finished and schedules ingestion.
     *
     * @throws ZarrUploadsOutstandingException if requested uploads were never registered
     */
    public void completeUpload(UUID zarrId) {
        jdbi.useTransaction(handle -> {
            ZarrArchiveRecord zarr = lockWritable(handle, zarrId);
            long outstanding = handle.attach(ZarrUploadDao.class).count(zarr.id());
            if (outstanding > 0) {
                throw new ZarrUploadsOutstandingException(zarrId, outstanding);
            }
            handle.attach(ZarrArchiveDao.class).resetChecksum(zarr.id(), ZarrArchiveStatus.UPLOADED);
            // referencing draft assets describe the old content until ingestion re-validates them
            handle.attach(AssetDao.class).resetDraftAssetsOnZarr(zarr.id(), ValidationStatus.PENDING);
        });
        taskService.submitUnique(ZarrIngestTask.TYPE, zarrId);
        log.infof("Zarr %s upload complete, ingestion scheduled", zarrId);
    }

    /**
     * Computes the checksum of an UPLOADED archive and moves it to COMPLETE. An
     * archive left INGESTING by an abandoned run is picked up again; any other
     * state is a no-op.
     *
     * @return true if the archive reached COMPLETE
     */
    public boolean ingest(UUID zarrId) {
        Optional<ZarrArchiveRecord> started = jdbi.inTransaction(handle -> {
            ZarrArchiveDao dao = handle.attach(ZarrArchiveDao.class);
            ZarrArchiveRecord zarr = dao.lockByZarrId(zarrId)
                    .orElseThrow(() -> new ContentNotFoundException("Zarr archive", zarrId));
            if (zarr.status() != ZarrArchiveStatus.UPLOADED && zarr.status() != ZarrArchiveStatus.INGESTING) {
                return Optional.<ZarrArchiveRecord>empty();
            }
            dao.resetChecksum(zarr.id(), ZarrArchiveStatus.INGESTING);
            return Optional.of(zarr);
        });
        if (started.isEmpty()) {
            log.debugf("Zarr %s is not awaiting ingestion", zarrId);
            return false;
        }
        long archiveId = started.get().id();

        List<ZarrFileRecord> files = jdbi.withExtension(ZarrFileDao.class, dao -> dao.findByArchive(archiveId));
        ZarrChecksum checksum = checksumCalculator.compute(files);

        List<Long> affectedVersions = jdbi.inTransaction(handle -> {
            ZarrArchiveDao dao = handle.attach(ZarrArchiveDao.class);
            ZarrArchiveRecord zarr = dao.lockByZarrId(zarrId).orElseThrow();
            if (zarr.status() != ZarrArchiveStatus.INGESTING) {
                return null;
            }
            dao.complete(archiveId, checksum.fileCount(), checksum.totalSize(), checksum.toString(),
                    ZarrArchiveStatus.COMPLETE);
            resizeDraftLeaves(handle, archiveId, checksum.totalSize());
            int reset = handle.attach(AssetDao.class).resetDraftAssetsOnZarr(archiveId, ValidationStatus.PENDING);
            if (reset > 0) {
                log.debugf("Zarr %s: %d draft assets back to PENDING", zarrId, reset);
            }
            return handle.attach(VersionDao.class).findDraftIdsReferencingZarr(archiveId);
        });
        if (affectedVersions == null) {
            log.infof("Zarr %s changed during ingestion, checksum discarded", zarrId);
            return false;
        }
        log.infof("Zarr %s ingested: %s", zarrId, checksum);

        for (long assetId : jdbi.withExtension(AssetDao.class,
                dao -> dao.findIdsByZarr(archiveId, ValidationStatus.PENDING))) {
            taskService.submitUnique(ValidateAssetTask.TYPE, assetId);
        }
        for (long versionId : affectedVersions) {
            taskService.submitUnique(AggregateAssetsSummaryTask.TYPE, versionId);
        }
        return true;
    }

    /**
     * Archives left UPLOADED or INGESTING, for example by an ingest run that timed out
     * or failed for good. Each needs a fresh {@code zarr.ingest} task.
     */
    public List<UUID> awaitingIngestion() {
        return jdbi.withExtension(ZarrArchiveDao.class,
                dao -> dao.findAwaitingIngestion(ZarrArchiveStatus.UPLOADED, ZarrArchiveStatus.INGESTING));
    }

    private void resizeDraftLeaves(Handle handle, long archiveId, long size) {
        for (AssetPathRecord leaf : handle.attach(AssetPathDao.class).findDraftLeavesForZarr(archiveId)) {
            pathIndex.resize(handle, leaf.versionId(), leaf.path(), size);
        }
    }

    private ZarrArchiveRecord lockWritable(Handle handle, UUID zarrId) {
        ZarrArchiveRecord zarr = handle.attach(ZarrArchiveDao.class).lockByZarrId(zarrId)
                .orElseThrow(() -> new ContentNotFoundException("Zarr archive", zarrId));
        if (zarr.status() == ZarrArchiveStatus.INGESTING) {
            throw new ZarrArchiveBusyException(zarrId, zarr.status());
        }
        return zarr;
    }

    private static void requireValidFile(String path, String etag) {
        if (!AssetPaths.isValid(path)) {
            throw new InvalidPathException(path);
        }
        if (!Etag.isValid(etag)) {
            throw new IllegalArgumentException("Invalid etag for " + path + ": " + etag);
        }
    }
}
