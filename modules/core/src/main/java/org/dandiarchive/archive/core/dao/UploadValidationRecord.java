package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.types.UploadValidationState;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record UploadValidationRecord(
        @ColumnName("id") long id,
        @ColumnName("sha256") String sha256,
        @ColumnName("blob_key") String blobKey,
        @ColumnName("state") UploadValidationState state,
        @ColumnName("error") String error,
        @ColumnName("created") Instant created,
        @ColumnName("modified") Instant modified
) {}
