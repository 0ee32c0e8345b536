package org.dandiarchive.archive.test.version;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.blob.AssetBlobService;
import org.dandiarchive.archive.core.blob.CalculateSha256Task;
import org.dandiarchive.archive.core.dao.AssetBlobRecord;
import org.dandiarchive.archive.core.dao.AssetRecord;
import org.dandiarchive.archive.core.dao.VersionRecord;
import org.dandiarchive.archive.core.manifest.WriteManifestTask;
import org.dandiarchive.archive.core.path.PathNode;
import org.dandiarchive.archive.core.path.PathPage;
import org.dandiarchive.archive.core.storage.FilesystemObjectStorage;
import org.dandiarchive.archive.core.storage.ObjectStorage;
import org.dandiarchive.archive.core.task.TaskExecutor;
import org.dandiarchive.archive.core.task.TaskRegistry;
import org.dandiarchive.archive.core.upload.ValidateUploadTask;
import org.dandiarchive.archive.core.validation.AggregateAssetsSummaryTask;
import org.dandiarchive.archive.core.validation.ValidateAssetTask;
import org.dandiarchive.archive.core.validation.ValidateVersionTask;
import org.dandiarchive.archive.core.version.AssetRequest;
import org.dandiarchive.archive.core.version.DandisetService;
import org.dandiarchive.archive.core.version.DraftVersionOrchestrator;
import org.dandiarchive.archive.core.zarr.ZarrIngestTask;
import org.dandiarchive.archive.test.H2TestResource;
import org.dandiarchive.archive.types.EmbargoStatus;
import org.dandiarchive.archive.types.ValidationStatus;
import org.dandiarchive.archive.util.Sha256Digest;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the draft workflow through the CDI-wired application against H2 migrated by Flyway.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class DraftVersionWiringTest {

    @Inject
    DraftVersionOrchestrator orchestrator;

    @Inject
    DandisetService dandisetService;

    @Inject
    AssetBlobService blobService;

    @Inject
    ObjectStorage storage;

    @Inject
    TaskRegistry taskRegistry;

    @Inject
    TaskExecutor executor;

    @Inject
    ObjectMapper objectMapper;

    @Test
    void everyTaskTypeIsRegistered() {
        assertThat(taskRegistry.types()).containsExactlyInAnyOrder(
                ValidateAssetTask.TYPE, ValidateVersionTask.TYPE, AggregateAssetsSummaryTask.TYPE,
                CalculateSha256Task.TYPE, ValidateUploadTask.TYPE, WriteManifestTask.TYPE,
                ZarrIngestTask.TYPE);
        assertThat(storage).isInstanceOf(FilesystemObjectStorage.class);
    }

    @Test
    void directoryListingAggregatesAssetsBelow() throws Exception {
        VersionRecord draft = dandisetService.createDandiset("wiring", objectMapper.createObjectNode(),
                EmbargoStatus.OPEN);
        AssetBlobRecord first = blob("first nwb file");
        AssetBlobRecord second = blob("second, longer nwb file");

        AssetRecord b = orchestrator.createAsset(draft.id(), AssetRequest.blob(first.blobId(), metadata("a/b.nwb")));
        orchestrator.createAsset(draft.id(), AssetRequest.blob(second.blobId(), metadata("a/c.nwb")));
        executor.drain();

        PathPage root = orchestrator.listPaths(draft.id(), "", 1, 10).orElseThrow();
        assertThat(root.items()).singleElement().satisfies(node -> {
            assertThat(node.path()).isEqualTo("a/");
            assertThat(node.leaf()).isFalse();
            assertThat(node.fileCount()).isEqualTo(2);
            assertThat(node.totalSize()).isEqualTo(first.size() + second.size());
        });

        PathPage dir = orchestrator.listPaths(draft.id(), "a/", 1, 10).orElseThrow();
        assertThat(dir.items()).extracting(PathNode::name).containsExactly("b.nwb", "c.nwb");
        assertThat(dir.items().get(0).assetId()).isEqualTo(b.assetId());
        assertThat(dandisetService.getAsset(b.assetId()).orElseThrow().status())
                .isEqualTo(ValidationStatus.VALID);
    }

    private AssetBlobRecord blob(String content) throws Exception {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        String key = "blobs/" + Sha256Digest.of(bytes).toHex();
        storage.put(key, bytes, "application/octet-stream").await().indefinitely();
        String etag = HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(bytes));
        AssetBlobRecord blob = blobService.registerBlob(key, etag, bytes.length, null);
        blobService.calculateSha256(blob.id());
        return blobService.get(blob.blobId()).orElseThrow();
    }

    private ObjectNode metadata(String path) {
        ObjectNode md = objectMapper.createObjectNode();
        md.put("path", path);
        md.put("encodingFormat", "application/x-nwb");
        md.put("schemaVersion", "0.6.4");
        return md;
    }
}
