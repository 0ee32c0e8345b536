package org.dandiarchive.archive.core.storage;

/**
 * An object store call failed for reasons other than a missing object. Tasks that read blobs
 * list it in {@code retryOn}, so a transient store outage is retried with backoff.
 */
public class StorageException extends RuntimeException {

    private final String key;

    public StorageException(String operation, String key, Throwable cause) {
        super("Failed to " + operation + ": " + key, cause);
        this.key = key;
    }

    public StorageException(String message) {
        super(message);
        this.key = null;
    }

    /** Object key or prefix the failed call addressed, if known. */
    public String key() {
        return key;
    }
}
