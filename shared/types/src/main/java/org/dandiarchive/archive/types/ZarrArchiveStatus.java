package org.dandiarchive.archive.types;

/**
 * Upload/ingest state of a zarr archive. Only {@code COMPLETE} archives carry a checksum.
 */
public enum ZarrArchiveStatus {
    PENDING,
    UPLOADED,
    INGESTING,
    COMPLETE
}
