package org.dandiarchive.archive.core.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@ApplicationScoped
public class ArchiveSettingsProducer {

    @ConfigProperty(name = "archive.schema.version", defaultValue = "0.6.4")
    String schemaVersion;

    @ConfigProperty(name = "archive.schema.allowed-versions", defaultValue = "0.6.4")
    List<String> allowedSchemaVersions;

    @ConfigProperty(name = "archive.api-url", defaultValue = "http://localhost:8080")
    String apiUrl;

    @ConfigProperty(name = "archive.storage-url", defaultValue = "http://localhost:9000/dandi-archive")
    String storageUrl;

    @ConfigProperty(name = "archive.validation.dispatch-per-second", defaultValue = "100")
    double dispatchPerSecond;

    @ConfigProperty(name = "archive.tasks.max-retries", defaultValue = "5")
    int maxRetries;

    @ConfigProperty(name = "archive.tasks.retry-base-delay", defaultValue = "PT1S")
    Duration retryBaseDelay;

    @ConfigProperty(name = "archive.tasks.retry-max-delay", defaultValue = "PT10M")
    Duration retryMaxDelay;

    @ConfigProperty(name = "archive.paths.max-page-size", defaultValue = "1000")
    int maxPageSize;

    @Produces
    @Singleton
    public ArchiveSettings archiveSettings() {
        return new ArchiveSettings(schemaVersion, allowedSchemaVersions, apiUrl, storageUrl,
                dispatchPerSecond, maxRetries, retryBaseDelay, retryMaxDelay, maxPageSize);
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
