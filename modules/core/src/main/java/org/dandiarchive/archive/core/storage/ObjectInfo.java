package org.dandiarchive.archive.core.storage;

/**
 * Stat result for a stored object. {@code etag} is unquoted.
 */
public record ObjectInfo(String key, long size, String etag) {}
