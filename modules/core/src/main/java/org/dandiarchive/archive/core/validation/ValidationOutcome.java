package org.dandiarchive.archive.core.validation;

/**
 * Result of one validation run.
 */
public enum ValidationOutcome {
    /** Recorded VALID. */
    VALID,
    /** Recorded INVALID with the validator's errors. */
    INVALID,
    /** Content digest or checksum not computed yet; nothing recorded. */
    DEFERRED,
    /** Record was not PENDING; nothing to do. */
    SKIPPED,
    /** Record changed while validating; result discarded. */
    STALE
}
