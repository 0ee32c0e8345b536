package org.dandiarchive.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RegisterConstructorMapper(AssetBlobRecord.class)
public interface AssetBlobDao {

    @SqlUpdate("INSERT INTO asset_blob (blob_id, blob_key, etag, size, sha256, embargoed_dandiset_id) " +
            "VALUES (:blobId, :blobKey, :etag, :size, :sha256, :embargoedDandisetId)")
    @GetGeneratedKeys("id")
    long insert(@Bind("blobId") UUID blobId,
                @Bind("blobKey") String blobKey,
                @Bind("etag") String etag,
                @Bind("size") long size,
                @Bind("sha256") String sha256,
                @Bind("embargoedDandisetId") Long embargoedDandisetId);

    @SqlQuery("SELECT * FROM asset_blob WHERE id = :id")
    Optional<AssetBlobRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM asset_blob WHERE blob_id = :blobId")
    Optional<AssetBlobRecord> findByBlobId(@Bind("blobId") UUID blobId);

    @SqlQuery("SELECT * FROM asset_blob WHERE sha256 = :sha256 ORDER BY id")
    List<AssetBlobRecord> findBySha256(@Bind("sha256") String sha256);

    /** Sets the digest once; later calls are no-ops and return 0. */
    @SqlUpdate("UPDATE asset_blob SET sha256 = :sha256, modified = CURRENT_TIMESTAMP " +
            "WHERE id = :id AND sha256 IS NULL")
    int setSha256IfAbsent(@Bind("id") long id, @Bind("sha256") String sha256);

    @SqlQuery("SELECT id FROM asset_blob WHERE sha256 IS NULL ORDER BY id")
    List<Long> findIdsMissingSha256();
}
