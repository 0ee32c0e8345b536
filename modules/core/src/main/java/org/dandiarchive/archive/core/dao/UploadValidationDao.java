package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.types.UploadValidationState;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

@RegisterConstructorMapper(UploadValidationRecord.class)
public interface UploadValidationDao {

    @SqlQuery("SELECT * FROM upload_validation WHERE sha256 = :sha256")
    Optional<UploadValidationRecord> findBySha256(@Bind("sha256") String sha256);

    @SqlQuery("SELECT * FROM upload_validation WHERE sha256 = :sha256 FOR UPDATE")
    Optional<UploadValidationRecord> lockBySha256(@Bind("sha256") String sha256);

    @SqlUpdate("INSERT INTO upload_validation (sha256, blob_key, state) VALUES (:sha256, :blobKey, :state)")
    void insert(@Bind("sha256") String sha256,
                @Bind("blobKey") String blobKey,
                @Bind("state") UploadValidationState state);

    @SqlUpdate("UPDATE upload_validation SET blob_key = :blobKey, state = :state, error = NULL, " +
            "modified = CURRENT_TIMESTAMP WHERE sha256 = :sha256")
    void restart(@Bind("sha256") String sha256,
                 @Bind("blobKey") String blobKey,
                 @Bind("state") UploadValidationState state);

    @SqlUpdate("UPDATE upload_validation SET state = :state, error = :error, modified = CURRENT_TIMESTAMP " +
            "WHERE sha256 = :sha256")
    void finish(@Bind("sha256") String sha256,
                @Bind("state") UploadValidationState state,
                @Bind("error") String error);
}
