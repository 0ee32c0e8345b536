package org.dandiarchive.archive.core.sweep;

import org.dandiarchive.archive.core.dao.AssetBlobRecord;
import org.dandiarchive.archive.core.dao.VersionRecord;
import org.dandiarchive.archive.core.dao.ZarrArchiveRecord;
import org.dandiarchive.archive.core.manifest.WriteManifestTask;
import org.dandiarchive.archive.core.task.TaskStatus;
import org.dandiarchive.archive.core.testing.TestArchive;
import org.dandiarchive.archive.core.validation.AggregateAssetsSummaryTask;
import org.dandiarchive.archive.core.validation.ValidateAssetTask;
import org.dandiarchive.archive.core.validation.ValidateVersionTask;
import org.dandiarchive.archive.core.version.AssetRequest;
import org.dandiarchive.archive.core.zarr.ZarrIngestTask;
import org.dandiarchive.archive.types.ZarrArchiveStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationSweeperTest {

    @TempDir
    Path storageRoot;

    private TestArchive archive;
    private final List<Duration> pauses = new ArrayList<>();
    private ValidationSweeper sweeper;

    @BeforeEach
    void setUp() {
        archive = new TestArchive(storageRoot);
        ThrottledDispatcher dispatcher = new ThrottledDispatcher(archive.settings, pauses::add);
        sweeper = new ValidationSweeper(archive.jdbi, archive.taskService, dispatcher, archive.zarrService);
    }

    @Test
    void pendingDraftIsQueuedForEveryVersionJob() {
        VersionRecord draft = archive.createDraft("sweep");
        archive.executor.drain();
        archive.dandisetService.updateDraftMetadata(draft.id(), "sweep", archive.objectMapper.createObjectNode());
        archive.executor.drain();
        assertThat(archive.taskService.findByStatus(TaskStatus.OPEN)).isEmpty();

        // a sweep finds nothing once the version is decided
        assertThat(sweeper.validateDraftVersionMetadata()).isZero();

        archive.jdbi.useHandle(h -> h.execute("UPDATE version SET status = 0 WHERE id = ?", draft.id()));
        assertThat(sweeper.validateDraftVersionMetadata()).isEqualTo(1);

        assertThat(openTypes()).containsExactlyInAnyOrder(
                ValidateVersionTask.TYPE, AggregateAssetsSummaryTask.TYPE, WriteManifestTask.TYPE);
    }

    @Test
    void onlyDigestedPendingAssetsAreQueued() {
        VersionRecord draft = archive.createDraft("sweep");
        AssetBlobRecord blob = archive.createBlob("digested");
        archive.orchestrator.createAsset(draft.id(), AssetRequest.blob(blob.blobId(), archive.assetMetadata("a.nwb")));
        archive.jdbi.useHandle(h -> h.execute("UPDATE asset SET status = 0"));

        byte[] raw = "raw".getBytes();
        archive.storage.put("blobs/raw", raw, null).await().indefinitely();
        AssetBlobRecord undigested = archive.blobService.registerBlob("blobs/raw", TestArchive.md5Hex(raw), raw.length, null);
        archive.orchestrator.createAsset(draft.id(),
                AssetRequest.blob(undigested.blobId(), archive.assetMetadata("b.nwb")));
        int before = archive.queued(ValidateAssetTask.TYPE);

        assertThat(sweeper.validatePendingAssetMetadata()).isEqualTo(1);
        assertThat(archive.queued(ValidateAssetTask.TYPE)).isEqualTo(before + 1);
    }

    @Test
    void abandonedZarrIngestionIsResumed() {
        VersionRecord draft = archive.createDraft("sweep");
        UUID zarrId = archive.zarrService.createZarr(draft.dandisetId(), "data.zarr").zarrId();
        archive.zarrService.registerFile(zarrId, "0/0", "0123456789abcdef0123456789abcdef", 10);
        archive.zarrService.completeUpload(zarrId);

        // the ingest task died after flipping the archive to INGESTING
        archive.jdbi.useHandle(h -> {
            h.execute("UPDATE zarr_archive SET status = 'INGESTING' WHERE zarr_id = ?", zarrId);
            h.execute("DELETE FROM task WHERE type = ?", ZarrIngestTask.TYPE);
        });
        assertThat(archive.queued(ZarrIngestTask.TYPE)).isZero();

        assertThat(sweeper.resumeZarrIngestion()).isEqualTo(1);
        assertThat(archive.queued(ZarrIngestTask.TYPE)).isEqualTo(1);
        // an ingest already waiting is left alone
        assertThat(sweeper.resumeZarrIngestion()).isZero();

        archive.executor.drain();

        ZarrArchiveRecord zarr = archive.zarrService.get(zarrId).orElseThrow();
        assertThat(zarr.status()).isEqualTo(ZarrArchiveStatus.COMPLETE);
        assertThat(zarr.checksumReady()).isTrue();
        assertThat(sweeper.resumeZarrIngestion()).isZero();
    }

    @Test
    void dispatchIsPacedAtTheConfiguredRate() {
        List<Integer> seen = new ArrayList<>();
        ThrottledDispatcher dispatcher = new ThrottledDispatcher(archive.settings, pauses::add);

        int count = dispatcher.dispatch(List.of(1, 2, 3), seen::add);

        assertThat(count).isEqualTo(3);
        assertThat(seen).containsExactly(1, 2, 3);
        assertThat(pauses).hasSize(3).allMatch(d -> d.equals(Duration.ofMillis(1)));
    }

    @Test
    void dispatchStopsWhenInterrupted() {
        List<Integer> seen = new ArrayList<>();
        ThrottledDispatcher dispatcher = new ThrottledDispatcher(archive.settings, d -> {
            throw new InterruptedException();
        });

        int count = dispatcher.dispatch(List.of(1, 2, 3), seen::add);

        assertThat(count).isEqualTo(1);
        assertThat(seen).containsExactly(1);
        assertThat(Thread.interrupted()).isTrue();
    }

    private List<String> openTypes() {
        return archive.taskService.findByStatus(TaskStatus.OPEN).stream()
                .map(t -> t.type())
                .toList();
    }
}
