package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.types.EmbargoStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record DandisetRecord(
        @ColumnName("id") long id,
        @ColumnName("embargo_status") EmbargoStatus embargoStatus,
        @ColumnName("created") Instant created,
        @ColumnName("modified") Instant modified
) {
    /** Six-digit public identifier, e.g. {@code 000123}. */
    public String identifier() {
        return String.format("%06d", id);
    }
}
