package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.types.ValidationStatus;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(VersionRecord.class)
public interface VersionDao {

    @SqlUpdate("INSERT INTO version (dandiset_id, version, name, metadata, status) " +
            "VALUES (:dandisetId, :version, :name, :metadata, :status)")
    @GetGeneratedKeys("id")
    long insert(@Bind("dandisetId") long dandisetId,
                @Bind("version") String version,
                @Bind("name") String name,
                @Bind("metadata") String metadata,
                @Bind("status") ValidationStatus status);

    @SqlQuery("SELECT * FROM version WHERE id = :id")
    Optional<VersionRecord> findById(@Bind("id") long id);

    /** Row-locks the version for the rest of the transaction. */
    @SqlQuery("SELECT * FROM version WHERE id = :id FOR UPDATE")
    Optional<VersionRecord> lockById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM version WHERE dandiset_id = :dandisetId AND version = 'draft'")
    Optional<VersionRecord> findDraft(@Bind("dandisetId") long dandisetId);

    @SqlUpdate("UPDATE version SET status = :status, modified_seq = modified_seq + 1, " +
            "modified = CURRENT_TIMESTAMP WHERE id = :id")
    void markModified(@Bind("id") long id, @Bind("status") ValidationStatus status);

    /** Replaces name and metadata of a version and bumps the sequence. */
    @SqlUpdate("UPDATE version SET name = :name, metadata = :metadata, status = :status, " +
            "modified_seq = modified_seq + 1, modified = CURRENT_TIMESTAMP WHERE id = :id")
    void updateMetadata(@Bind("id") long id,
                        @Bind("name") String name,
                        @Bind("metadata") String metadata,
                        @Bind("status") ValidationStatus status);

    @SqlQuery("SELECT * FROM version WHERE dandiset_id = :dandisetId ORDER BY id")
    List<VersionRecord> findByDandiset(@Bind("dandisetId") long dandisetId);

    /**
     * Records a validation result unless the version changed since {@code seq} was read.
     * Does not bump {@code modified_seq}.
     */
    @SqlUpdate("UPDATE version SET status = :status, validation_errors = :errors " +
            "WHERE id = :id AND modified_seq = :seq")
    int recordValidation(@Bind("id") long id,
                         @Bind("seq") long seq,
                         @Bind("status") ValidationStatus status,
                         @Bind("errors") String errors);

    /**
     * Replaces the metadata if {@code modified_seq} still equals {@code seq}; bumps the
     * sequence and returns the version to {@code status}.
     */
    @SqlUpdate("UPDATE version SET metadata = :metadata, status = :status, " +
            "modified_seq = modified_seq + 1, modified = CURRENT_TIMESTAMP " +
            "WHERE id = :id AND modified_seq = :seq")
    int compareAndSetMetadata(@Bind("id") long id,
                              @Bind("seq") long seq,
                              @Bind("metadata") String metadata,
                              @Bind("status") ValidationStatus status);

    @SqlQuery("SELECT id FROM version WHERE status = :status AND version = 'draft' ORDER BY id")
    List<Long> findDraftIdsByStatus(@Bind("status") ValidationStatus status);

    @SqlQuery("SELECT DISTINCT va.version_id FROM version_asset va " +
            "JOIN asset a ON a.id = va.asset_id " +
            "JOIN version v ON v.id = va.version_id " +
            "WHERE a.zarr_id = :zarrId AND v.version = 'draft'")
    List<Long> findDraftIdsReferencingZarr(@Bind("zarrId") long zarrId);
}
