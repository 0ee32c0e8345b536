package org.dandiarchive.archive.core.zarr;

/**
 * A file a client announced it is about to upload into a zarr archive.
 */
public record ZarrUploadRequest(String path, String etag) {}
