package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.types.ZarrArchiveStatus;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RegisterConstructorMapper(ZarrArchiveRecord.class)
public interface ZarrArchiveDao {

    @SqlUpdate("INSERT INTO zarr_archive (zarr_id, name, dandiset_id, status) " +
            "VALUES (:zarrId, :name, :dandisetId, :status)")
    @GetGeneratedKeys("id")
    long insert(@Bind("zarrId") UUID zarrId,
                @Bind("name") String name,
                @Bind("dandisetId") long dandisetId,
                @Bind("status") ZarrArchiveStatus status);

    @SqlQuery("SELECT * FROM zarr_archive WHERE id = :id")
    Optional<ZarrArchiveRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM zarr_archive WHERE zarr_id = :zarrId")
    Optional<ZarrArchiveRecord> findByZarrId(@Bind("zarrId") UUID zarrId);

    /** Archives whose ingestion has been requested but has not finished. */
    @SqlQuery("SELECT zarr_id FROM zarr_archive WHERE status IN (:uploaded, :ingesting) ORDER BY id")
    List<UUID> findAwaitingIngestion(@Bind("uploaded") ZarrArchiveStatus uploaded,
                                     @Bind("ingesting") ZarrArchiveStatus ingesting);

    /** Serializes writers of one archive for the rest of the transaction. */
    @SqlQuery("SELECT * FROM zarr_archive WHERE zarr_id = :zarrId FOR UPDATE")
    Optional<ZarrArchiveRecord> lockByZarrId(@Bind("zarrId") UUID zarrId);

    /** Applies a file count/size delta and invalidates any previous checksum. */
    @SqlUpdate("UPDATE zarr_archive SET file_count = file_count + :deltaFiles, size = size + :deltaSize, " +
            "checksum = NULL, status = :status, modified = CURRENT_TIMESTAMP WHERE id = :id")
    void applyDelta(@Bind("id") long id,
                    @Bind("deltaFiles") long deltaFiles,
                    @Bind("deltaSize") long deltaSize,
                    @Bind("status") ZarrArchiveStatus status);

    @SqlUpdate("UPDATE zarr_archive SET checksum = NULL, status = :status, modified = CURRENT_TIMESTAMP " +
            "WHERE id = :id")
    void resetChecksum(@Bind("id") long id, @Bind("status") ZarrArchiveStatus status);

    @SqlUpdate("UPDATE zarr_archive SET file_count = :fileCount, size = :size, checksum = :checksum, " +
            "status = :status, modified = CURRENT_TIMESTAMP WHERE id = :id")
    void complete(@Bind("id") long id,
                  @Bind("fileCount") long fileCount,
                  @Bind("size") long size,
                  @Bind("checksum") String checksum,
                  @Bind("status") ZarrArchiveStatus status);
}
