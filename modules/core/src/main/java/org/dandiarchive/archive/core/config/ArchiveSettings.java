package org.dandiarchive.archive.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Explicit configuration handed to archive services at construction.
 *
 * @param defaultSchemaVersion  schema version stamped on metadata that does not carry one
 * @param allowedSchemaVersions schema versions the validator accepts
 * @param apiUrl                public API base URL, used to build asset download URLs
 * @param storageUrl            public object storage base URL, used to build asset content URLs
 * @param dispatchPerSecond     rate at which sweeps enqueue validation tasks
 * @param maxTaskRetries        retry budget for retryable task failures
 * @param retryBaseDelay        first backoff delay, doubled per retry
 * @param retryMaxDelay         backoff ceiling
 * @param maxPageSize           upper bound for path listing page sizes
 */
public record ArchiveSettings(
        String defaultSchemaVersion,
        List<String> allowedSchemaVersions,
        String apiUrl,
        String storageUrl,
        double dispatchPerSecond,
        int maxTaskRetries,
        Duration retryBaseDelay,
        Duration retryMaxDelay,
        int maxPageSize
) {
    public ArchiveSettings {
        Objects.requireNonNull(defaultSchemaVersion, "defaultSchemaVersion");
        allowedSchemaVersions = List.copyOf(allowedSchemaVersions);
        Objects.requireNonNull(apiUrl, "apiUrl");
        Objects.requireNonNull(storageUrl, "storageUrl");
        Objects.requireNonNull(retryBaseDelay, "retryBaseDelay");
        Objects.requireNonNull(retryMaxDelay, "retryMaxDelay");
        if (dispatchPerSecond <= 0) {
            throw new IllegalArgumentException("dispatchPerSecond must be > 0, got: " + dispatchPerSecond);
        }
        if (maxTaskRetries < 0) {
            throw new IllegalArgumentException("maxTaskRetries must be >= 0, got: " + maxTaskRetries);
        }
        if (maxPageSize < 1) {
            throw new IllegalArgumentException("maxPageSize must be >= 1, got: " + maxPageSize);
        }
    }

    /**
     * Backoff before retry number {@code attempt} (1-based): base * 2^(attempt-1), capped.
     */
    public Duration retryDelay(int attempt) {
        int shift = Math.max(0, Math.min(attempt - 1, 20));
        Duration delay = retryBaseDelay.multipliedBy(1L << shift);
        return delay.compareTo(retryMaxDelay) > 0 ? retryMaxDelay : delay;
    }
}
