package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.types.ValidationStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/**
 * A dandiset version row. {@code modifiedSeq} increases on every change to the
 * version's asset set or metadata and guards asynchronous write-backs.
 */
public record VersionRecord(
        @ColumnName("id") long id,
        @ColumnName("dandiset_id") long dandisetId,
        @ColumnName("version") String version,
        @ColumnName("name") String name,
        @ColumnName("metadata") String metadata,
        @ColumnName("status") ValidationStatus status,
        @ColumnName("validation_errors") String validationErrors,
        @ColumnName("modified_seq") long modifiedSeq,
        @ColumnName("created") Instant created,
        @ColumnName("modified") Instant modified
) {
    public static final String DRAFT = "draft";

    public boolean isDraft() {
        return DRAFT.equals(version);
    }
}
