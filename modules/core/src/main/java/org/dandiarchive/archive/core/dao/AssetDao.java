package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.types.ValidationStatus;
import org.dandiarchive.archive.types.ZarrArchiveStatus;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RegisterConstructorMapper(AssetRecord.class)
public interface AssetDao {

    @SqlUpdate("INSERT INTO asset (asset_id, path, metadata, status, previous_id, blob_id, embargoed_blob_id, zarr_id) " +
            "VALUES (:assetId, :path, :metadata, :status, :previousId, :blobId, :embargoedBlobId, :zarrId)")
    @GetGeneratedKeys("id")
    long insert(@Bind("assetId") UUID assetId,
                @Bind("path") String path,
                @Bind("metadata") String metadata,
                @Bind("status") ValidationStatus status,
                @Bind("previousId") Long previousId,
                @Bind("blobId") Long blobId,
                @Bind("embargoedBlobId") Long embargoedBlobId,
                @Bind("zarrId") Long zarrId);

    @SqlQuery("SELECT * FROM asset WHERE id = :id")
    Optional<AssetRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM asset WHERE asset_id = :assetId")
    Optional<AssetRecord> findByAssetId(@Bind("assetId") UUID assetId);

    // -- version membership --

    @SqlUpdate("INSERT INTO version_asset (version_id, asset_id) VALUES (:versionId, :assetId)")
    void addToVersion(@Bind("versionId") long versionId, @Bind("assetId") long assetId);

    @SqlUpdate("DELETE FROM version_asset WHERE version_id = :versionId AND asset_id = :assetId")
    int removeFromVersion(@Bind("versionId") long versionId, @Bind("assetId") long assetId);

    @SqlQuery("SELECT COUNT(*) FROM version_asset WHERE version_id = :versionId AND asset_id = :assetId")
    int countMembership(@Bind("versionId") long versionId, @Bind("assetId") long assetId);

    default boolean isLive(long versionId, long assetId) {
        return countMembership(versionId, assetId) > 0;
    }

    @SqlQuery("SELECT a.* FROM asset a JOIN version_asset va ON va.asset_id = a.id " +
            "WHERE va.version_id = :versionId AND a.path = :path")
    Optional<AssetRecord> findLiveByPath(@Bind("versionId") long versionId, @Bind("path") String path);

    @SqlQuery("SELECT a.* FROM asset a JOIN version_asset va ON va.asset_id = a.id " +
            "WHERE va.version_id = :versionId ORDER BY a.id")
    List<AssetRecord> findLiveByVersion(@Bind("versionId") long versionId);

    @SqlQuery("SELECT COUNT(*) FROM version_asset WHERE version_id = :versionId")
    long countLive(@Bind("versionId") long versionId);

    // -- validation --

    /** Writes a validation result only while the asset is still pending. */
    @SqlUpdate("UPDATE asset SET status = :status, validation_errors = :errors, modified = CURRENT_TIMESTAMP " +
            "WHERE id = :id AND status = :expected")
    int recordValidation(@Bind("id") long id,
                         @Bind("expected") ValidationStatus expected,
                         @Bind("status") ValidationStatus status,
                         @Bind("errors") String errors);

    /**
     * Pending assets whose backing content is ready: a blob with a digest, or a
     * complete zarr archive with a checksum.
     */
    @SqlQuery("SELECT a.id FROM asset a " +
            "LEFT JOIN asset_blob b ON b.id = COALESCE(a.blob_id, a.embargoed_blob_id) " +
            "LEFT JOIN zarr_archive z ON z.id = a.zarr_id " +
            "WHERE a.status = :pending " +
            "AND ((b.id IS NOT NULL AND b.sha256 IS NOT NULL) " +
            "  OR (z.id IS NOT NULL AND z.checksum IS NOT NULL AND z.status = :complete)) " +
            "ORDER BY a.id")
    List<Long> findValidatableIds(@Bind("pending") ValidationStatus pending,
                                  @Bind("complete") ZarrArchiveStatus complete);

    @SqlQuery("SELECT id FROM asset WHERE status = :status " +
            "AND (blob_id = :blobId OR embargoed_blob_id = :blobId) ORDER BY id")
    List<Long> findIdsByBlob(@Bind("blobId") long blobId, @Bind("status") ValidationStatus status);

    @SqlQuery("SELECT id FROM asset WHERE status = :status AND zarr_id = :zarrId ORDER BY id")
    List<Long> findIdsByZarr(@Bind("zarrId") long zarrId, @Bind("status") ValidationStatus status);

    /** Returns assets live in a draft and backed by the zarr archive to PENDING, clearing their errors. */
    @SqlUpdate("UPDATE asset SET status = :pending, validation_errors = '[]', modified = CURRENT_TIMESTAMP " +
            "WHERE zarr_id = :zarrId AND status <> :pending AND id IN (" +
            "SELECT va.asset_id FROM version_asset va JOIN version v ON v.id = va.version_id " +
            "WHERE v.version = 'draft')")
    int resetDraftAssetsOnZarr(@Bind("zarrId") long zarrId, @Bind("pending") ValidationStatus pending);
}
