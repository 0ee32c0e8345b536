package org.dandiarchive.archive.core.upload;

import org.dandiarchive.archive.core.dao.UploadValidationRecord;
import org.dandiarchive.archive.core.error.ErrorKind;
import org.dandiarchive.archive.core.error.UploadValidationException;
import org.dandiarchive.archive.core.testing.TestArchive;
import org.dandiarchive.archive.types.UploadValidationState;
import org.dandiarchive.archive.util.Sha256Digest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class UploadValidationServiceTest {

    private static final byte[] CONTENT = "uploaded bytes".getBytes(StandardCharsets.UTF_8);
    private static final String SHA256 = Sha256Digest.of(CONTENT).toHex();

    @TempDir
    Path storageRoot;

    private TestArchive archive;
    private UploadValidationService uploads;

    @BeforeEach
    void setUp() {
        archive = new TestArchive(storageRoot);
        uploads = archive.uploadService;
        archive.storage.put("uploads/one", CONTENT, "application/octet-stream").await().indefinitely();
    }

    @Test
    void matchingDigestSucceeds() {
        UploadValidationRecord started = uploads.requestValidation(SHA256, "uploads/one");
        assertThat(started.state()).isEqualTo(UploadValidationState.IN_PROGRESS);

        archive.executor.drain();

        UploadValidationRecord done = uploads.getValidation(SHA256).orElseThrow();
        assertThat(done.state()).isEqualTo(UploadValidationState.SUCCEEDED);
        assertThat(done.error()).isNull();
    }

    @Test
    void mismatchedDigestFailsWithBothChecksums() {
        String claimed = "0".repeat(64);
        uploads.requestValidation(claimed, "uploads/one");

        assertThat(uploads.runValidation(claimed)).isEqualTo(UploadValidationState.FAILED);

        assertThat(uploads.getValidation(claimed).orElseThrow().error()).isEqualTo(
                "Given checksum " + claimed + " did not match actual checksum " + SHA256 + ".");
    }

    @Test
    void objectDeletedBeforeTheRunFails() {
        uploads.requestValidation(SHA256, "uploads/one");
        archive.storage.delete("uploads/one").await().indefinitely();

        assertThat(uploads.runValidation(SHA256)).isEqualTo(UploadValidationState.FAILED);
        assertThat(uploads.getValidation(SHA256).orElseThrow().error())
                .isEqualTo(UploadValidationService.NO_SUCH_OBJECT);
    }

    @Test
    void secondRequestWhileRunningConflicts() {
        uploads.requestValidation(SHA256, "uploads/one");

        assertThatThrownBy(() -> uploads.requestValidation(SHA256, "uploads/one"))
                .isInstanceOfSatisfying(UploadValidationException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.CONFLICT);
                    assertThat(e.getMessage()).isEqualTo(UploadValidationService.IN_PROGRESS);
                });
    }

    @Test
    void finishedValidationCanBeRestartedWithoutAKey() {
        uploads.requestValidation(SHA256, "uploads/one");
        uploads.runValidation(SHA256);

        UploadValidationRecord restarted = uploads.requestValidation(SHA256, null);

        assertThat(restarted.state()).isEqualTo(UploadValidationState.IN_PROGRESS);
        assertThat(restarted.blobKey()).isEqualTo("uploads/one");
        assertThat(restarted.error()).isNull();
    }

    @Test
    void restartWithoutKeyNeedsAnExistingRecord() {
        assertThatThrownBy(() -> uploads.requestValidation(SHA256, null))
                .isInstanceOfSatisfying(UploadValidationException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void missingObjectIsRejectedUpFront() {
        assertThatThrownBy(() -> uploads.requestValidation(SHA256, "uploads/missing"))
                .isInstanceOfSatisfying(UploadValidationException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_REQUEST);
                    assertThat(e.getMessage()).isEqualTo(UploadValidationService.NO_SUCH_OBJECT);
                });
        assertThat(uploads.getValidation(SHA256)).isEmpty();
    }

    @Test
    void malformedDigestIsRejected() {
        assertThatThrownBy(() -> uploads.requestValidation("xyz", "uploads/one"))
                .isInstanceOf(UploadValidationException.class)
                .hasMessageContaining("Invalid sha256");
    }

    @Test
    void runIsANoOpOnceFinished() {
        uploads.requestValidation(SHA256, "uploads/one");
        uploads.runValidation(SHA256);
        archive.storage.delete("uploads/one").await().indefinitely();

        assertThat(uploads.runValidation(SHA256)).isEqualTo(UploadValidationState.SUCCEEDED);
    }
}
