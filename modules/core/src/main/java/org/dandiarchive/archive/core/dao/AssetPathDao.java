package org.dandiarchive.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(AssetPathRecord.class)
@RegisterConstructorMapper(AssetPathChildRow.class)
public interface AssetPathDao {

    @SqlQuery("SELECT * FROM asset_path WHERE version_id = :versionId AND path = :path")
    Optional<AssetPathRecord> find(@Bind("versionId") long versionId, @Bind("path") String path);

    @SqlUpdate("INSERT INTO asset_path (version_id, path, parent_path, asset_id, aggregate_files, aggregate_size) " +
            "VALUES (:versionId, :path, :parentPath, :assetId, :files, :size)")
    void insert(@Bind("versionId") long versionId,
                @Bind("path") String path,
                @Bind("parentPath") String parentPath,
                @Bind("assetId") Long assetId,
                @Bind("files") long files,
                @Bind("size") long size);

    @SqlUpdate("UPDATE asset_path SET aggregate_files = aggregate_files + :deltaFiles, " +
            "aggregate_size = aggregate_size + :deltaSize " +
            "WHERE version_id = :versionId AND path = :path")
    int adjust(@Bind("versionId") long versionId,
               @Bind("path") String path,
               @Bind("deltaFiles") long deltaFiles,
               @Bind("deltaSize") long deltaSize);

    @SqlUpdate("DELETE FROM asset_path WHERE version_id = :versionId AND path = :path AND aggregate_files <= 0")
    int deleteIfEmpty(@Bind("versionId") long versionId, @Bind("path") String path);

    @SqlUpdate("DELETE FROM asset_path WHERE version_id = :versionId AND path = :path")
    int delete(@Bind("versionId") long versionId, @Bind("path") String path);

    /** One page of the immediate children of {@code parentPath}. Siblings share the prefix, so path order is name order. */
    @SqlQuery("SELECT p.path, p.aggregate_files, p.aggregate_size, a.asset_id AS asset_uuid " +
            "FROM asset_path p LEFT JOIN asset a ON a.id = p.asset_id " +
            "WHERE p.version_id = :versionId AND p.parent_path = :parentPath " +
            "ORDER BY p.path " +
            "LIMIT :limit OFFSET :offset")
    List<AssetPathChildRow> findChildren(@Bind("versionId") long versionId,
                                         @Bind("parentPath") String parentPath,
                                         @Bind("limit") int limit,
                                         @Bind("offset") long offset);

    @SqlQuery("SELECT COUNT(*) FROM asset_path WHERE version_id = :versionId AND parent_path = :parentPath")
    long countChildren(@Bind("versionId") long versionId, @Bind("parentPath") String parentPath);

    @SqlQuery("SELECT * FROM asset_path WHERE version_id = :versionId")
    List<AssetPathRecord> findByVersion(@Bind("versionId") long versionId);

    /** Leaves in draft versions whose asset is backed by the given zarr archive. */
    @SqlQuery("SELECT p.* FROM asset_path p " +
            "JOIN asset a ON a.id = p.asset_id " +
            "JOIN version v ON v.id = p.version_id " +
            "WHERE a.zarr_id = :zarrId AND v.version = 'draft'")
    List<AssetPathRecord> findDraftLeavesForZarr(@Bind("zarrId") long zarrId);
}
