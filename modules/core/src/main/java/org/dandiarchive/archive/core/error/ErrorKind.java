package org.dandiarchive.archive.core.error;

/**
 * Coarse classification of domain failures, for transport layers that need to
 * map an {@link ArchiveException} onto a status code.
 */
public enum ErrorKind {
    /** Referenced row or object does not exist. */
    NOT_FOUND,
    /** Request is malformed or violates a structural rule. */
    INVALID_REQUEST,
    /** Request conflicts with current state (duplicate path, immutable version). */
    CONFLICT,
    /** Optimistic concurrency check lost; the caller may retry. */
    CONCURRENT_MODIFICATION
}
