package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.types.ValidationStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable asset row. Exactly one of {@code blobId}, {@code embargoedBlobId}
 * and {@code zarrId} is set; only {@code status} and {@code validationErrors}
 * are written after insert.
 */
public record AssetRecord(
        @ColumnName("id") long id,
        @ColumnName("asset_id") UUID assetId,
        @ColumnName("path") String path,
        @ColumnName("metadata") String metadata,
        @ColumnName("status") ValidationStatus status,
        @ColumnName("validation_errors") String validationErrors,
        @ColumnName("previous_id") Long previousId,
        @ColumnName("blob_id") Long blobId,
        @ColumnName("embargoed_blob_id") Long embargoedBlobId,
        @ColumnName("zarr_id") Long zarrId,
        @ColumnName("created") Instant created,
        @ColumnName("modified") Instant modified
) {}
