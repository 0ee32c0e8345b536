package org.dandiarchive.archive.core.dao;

import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

/**
 * Outstanding (requested but not yet registered) zarr file uploads.
 */
public interface ZarrUploadDao {

    @SqlUpdate("INSERT INTO zarr_upload (zarr_archive_id, path, etag) VALUES (:archiveId, :path, :etag)")
    void insert(@Bind("archiveId") long archiveId, @Bind("path") String path, @Bind("etag") String etag);

    @SqlUpdate("DELETE FROM zarr_upload WHERE zarr_archive_id = :archiveId AND path = :path")
    int delete(@Bind("archiveId") long archiveId, @Bind("path") String path);

    @SqlUpdate("DELETE FROM zarr_upload WHERE zarr_archive_id = :archiveId")
    int deleteAll(@Bind("archiveId") long archiveId);

    @SqlQuery("SELECT COUNT(*) FROM zarr_upload WHERE zarr_archive_id = :archiveId")
    long count(@Bind("archiveId") long archiveId);

    @SqlQuery("SELECT path FROM zarr_upload WHERE zarr_archive_id = :archiveId ORDER BY id")
    List<String> findPaths(@Bind("archiveId") long archiveId);
}
