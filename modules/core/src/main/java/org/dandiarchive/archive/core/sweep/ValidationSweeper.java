package org.dandiarchive.archive.core.sweep;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.dao.AssetDao;
import org.dandiarchive.archive.core.dao.VersionDao;
import org.dandiarchive.archive.core.manifest.WriteManifestTask;
import org.dandiarchive.archive.core.task.TaskService;
import org.dandiarchive.archive.core.validation.AggregateAssetsSummaryTask;
import org.dandiarchive.archive.core.validation.ValidateAssetTask;
import org.dandiarchive.archive.core.validation.ValidateVersionTask;
import org.dandiarchive.archive.core.zarr.ZarrArchiveService;
import org.dandiarchive.archive.core.zarr.ZarrIngestTask;
import org.dandiarchive.archive.types.ValidationStatus;
import org.dandiarchive.archive.types.ZarrArchiveStatus;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.UUID;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Periodic backstop that re-queues every PENDING asset and draft version, and every
 * zarr archive whose ingestion never finished, so work lost to timeouts, crashes or
 * stale results is picked up again.
 */
@ApplicationScoped
public class ValidationSweeper {

    private static final Logger log = Logger.getLogger(ValidationSweeper.class);

    private final Jdbi jdbi;
    private final TaskService taskService;
    private final ThrottledDispatcher dispatcher;
    private final ZarrArchiveService zarrService;

    @Inject
    public ValidationSweeper(Jdbi jdbi, TaskService taskService, ThrottledDispatcher dispatcher,
                             ZarrArchiveService zarrService) {
        this.jdbi = jdbi;
        this.taskService = taskService;
        this.dispatcher = dispatcher;
        this.zarrService = zarrService;
    }

    @Scheduled(every = "${archive.validation.job-interval:60s}", concurrentExecution = SKIP)
    void sweep() {
        resumeZarrIngestion();
        validatePendingAssetMetadata();
        validateDraftVersionMetadata();
    }

    /**
     * Resubmits ingestion for archives left UPLOADED or INGESTING with no ingest task
     * waiting or running.
     *
     * @return number of archives resubmitted
     */
    public int resumeZarrIngestion() {
        List<UUID> orphaned = zarrService.awaitingIngestion().stream()
                .filter(zarrId -> !taskService.isActive(ZarrIngestTask.TYPE, zarrId))
                .toList();
        if (orphaned.isEmpty()) {
            return 0;
        }
        log.warnf("Found %d zarr archives with abandoned ingestion", orphaned.size());
        return dispatcher.dispatch(orphaned,
                zarrId -> taskService.submitUnique(ZarrIngestTask.TYPE, zarrId));
    }

    /**
     * Queues validation for every PENDING asset whose content is digested.
     *
     * @return number of assets dispatched
     */
    public int validatePendingAssetMetadata() {
        List<Long> assetIds = jdbi.withExtension(AssetDao.class,
                dao -> dao.findValidatableIds(ValidationStatus.PENDING, ZarrArchiveStatus.COMPLETE));
        if (assetIds.isEmpty()) {
            return 0;
        }
        log.infof("Found %d assets to validate", assetIds.size());
        return dispatcher.dispatch(assetIds,
                id -> taskService.submitUnique(ValidateAssetTask.TYPE, id));
    }

    /**
     * Queues validation, summary aggregation and manifest writing for every
     * PENDING draft version.
     *
     * @return number of versions dispatched
     */
    public int validateDraftVersionMetadata() {
        List<Long> versionIds = jdbi.withExtension(VersionDao.class,
                dao -> dao.findDraftIdsByStatus(ValidationStatus.PENDING));
        if (versionIds.isEmpty()) {
            return 0;
        }
        log.infof("Found %d versions to validate", versionIds.size());
        return dispatcher.dispatch(versionIds, id -> {
            taskService.submitUnique(ValidateVersionTask.TYPE, id);
            taskService.submitUnique(AggregateAssetsSummaryTask.TYPE, id);
            taskService.submitUnique(WriteManifestTask.TYPE, id);
        });
    }
}
