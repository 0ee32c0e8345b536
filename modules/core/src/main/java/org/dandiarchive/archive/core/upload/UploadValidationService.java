package org.dandiarchive.archive.core.upload;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.dao.UploadValidationDao;
import org.dandiarchive.archive.core.dao.UploadValidationRecord;
import org.dandiarchive.archive.core.error.ErrorKind;
import org.dandiarchive.archive.core.error.UploadValidationException;
import org.dandiarchive.archive.core.storage.ObjectNotFoundException;
import org.dandiarchive.archive.core.storage.ObjectStorage;
import org.dandiarchive.archive.core.storage.StorageException;
import org.dandiarchive.archive.core.task.TaskService;
import org.dandiarchive.archive.types.UploadValidationState;
import org.dandiarchive.archive.util.Sha256Digest;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Checks that an uploaded object really has the SHA-256 digest the client claims.
 *
 * <p>One record per digest; a finished record can be re-run, possibly against a
 * different object key.
 */
@ApplicationScoped
public class UploadValidationService {

    private static final Logger log = Logger.getLogger(UploadValidationService.class);

    static final String NO_SUCH_VALIDATION = "A validation for an object with that checksum does not exist.";
    static final String NO_SUCH_OBJECT = "Object does not exist.";
    static final String IN_PROGRESS = "Validation already in progress.";

    private final Jdbi jdbi;
    private final ObjectStorage storage;
    private final TaskService taskService;

    @Inject
    public UploadValidationService(Jdbi jdbi, ObjectStorage storage, TaskService taskService) {
        this.jdbi = jdbi;
        this.storage = storage;
        this.taskService = taskService;
    }

    /**
     * Starts (or restarts) validation of {@code sha256} against {@code objectKey}.
     *
     * @param objectKey object to check, or null to re-run against the key of the
     *                  existing record
     * @throws UploadValidationException if the digest is malformed, no record or
     *         object exists, or a validation for the digest is still running
     */
    public UploadValidationRecord requestValidation(String sha256, String objectKey) {
        if (!Sha256Digest.isValidHex(sha256)) {
            throw new UploadValidationException(ErrorKind.INVALID_REQUEST, "Invalid sha256 digest: " + sha256);
        }
        Optional<UploadValidationRecord> existing = getValidation(sha256);
        String key;
        if (objectKey != null) {
            key = objectKey;
        } else if (existing.isPresent()) {
            key = existing.get().blobKey();
        } else {
            throw new UploadValidationException(ErrorKind.NOT_FOUND, NO_SUCH_VALIDATION);
        }
        if (!storage.exists(key).await().indefinitely()) {
            throw new UploadValidationException(ErrorKind.INVALID_REQUEST, NO_SUCH_OBJECT);
        }

        UploadValidationRecord record = jdbi.inTransaction(handle -> {
            UploadValidationDao dao = handle.attach(UploadValidationDao.class);
            Optional<UploadValidationRecord> locked = dao.lockBySha256(sha256);
            if (locked.isPresent()) {
                if (locked.get().state() == UploadValidationState.IN_PROGRESS) {
                    throw new UploadValidationException(ErrorKind.CONFLICT, IN_PROGRESS);
                }
                dao.restart(sha256, key, UploadValidationState.IN_PROGRESS);
            } else {
                dao.insert(sha256, key, UploadValidationState.IN_PROGRESS);
            }
            return dao.findBySha256(sha256).orElseThrow();
        });
        taskService.submit(ValidateUploadTask.TYPE, sha256);
        log.debugf("Upload validation started: sha256=%s key=%s", sha256, key);
        return record;
    }

    public Optional<UploadValidationRecord> getValidation(String sha256) {
        return jdbi.withExtension(UploadValidationDao.class, dao -> dao.findBySha256(sha256));
    }

    /**
     * Digests the object and records SUCCEEDED or FAILED. Does nothing unless the
     * record is IN_PROGRESS.
     */
    public UploadValidationState runValidation(String sha256) {
        UploadValidationRecord record = getValidation(sha256)
                .orElseThrow(() -> new UploadValidationException(ErrorKind.NOT_FOUND, NO_SUCH_VALIDATION));
        if (record.state() != UploadValidationState.IN_PROGRESS) {
            return record.state();
        }

        String error = null;
        try (InputStream in = storage.open(record.blobKey()).await().indefinitely()) {
            String actual = Sha256Digest.of(in).toHex();
            if (!actual.equals(sha256)) {
                error = "Given checksum " + sha256 + " did not match actual checksum " + actual + ".";
            }
        } catch (ObjectNotFoundException e) {
            error = NO_SUCH_OBJECT;
        } catch (IOException e) {
            throw new StorageException("digest object", record.blobKey(), e);
        }

        UploadValidationState state = error == null ? UploadValidationState.SUCCEEDED : UploadValidationState.FAILED;
        String finalError = error;
        jdbi.useExtension(UploadValidationDao.class, dao -> dao.finish(sha256, state, finalError));
        if (state == UploadValidationState.FAILED) {
            log.warnf("Upload validation failed for %s: %s", sha256, error);
        } else {
            log.infof("Upload validated: sha256=%s", sha256);
        }
        return state;
    }
}
