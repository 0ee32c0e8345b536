package org.dandiarchive.archive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(ZarrFileRecord.class)
public interface ZarrFileDao {

    @SqlQuery("SELECT * FROM zarr_file WHERE zarr_archive_id = :archiveId AND path = :path")
    Optional<ZarrFileRecord> find(@Bind("archiveId") long archiveId, @Bind("path") String path);

    @SqlUpdate("INSERT INTO zarr_file (zarr_archive_id, path, etag, size) VALUES (:archiveId, :path, :etag, :size)")
    void insert(@Bind("archiveId") long archiveId,
                @Bind("path") String path,
                @Bind("etag") String etag,
                @Bind("size") long size);

    @SqlUpdate("UPDATE zarr_file SET etag = :etag, size = :size WHERE zarr_archive_id = :archiveId AND path = :path")
    void update(@Bind("archiveId") long archiveId,
                @Bind("path") String path,
                @Bind("etag") String etag,
                @Bind("size") long size);

    @SqlUpdate("DELETE FROM zarr_file WHERE zarr_archive_id = :archiveId AND path = :path")
    int delete(@Bind("archiveId") long archiveId, @Bind("path") String path);

    @SqlQuery("SELECT * FROM zarr_file WHERE zarr_archive_id = :archiveId")
    List<ZarrFileRecord> findByArchive(@Bind("archiveId") long archiveId);
}
