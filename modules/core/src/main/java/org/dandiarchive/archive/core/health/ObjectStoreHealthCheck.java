package org.dandiarchive.archive.core.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.storage.ObjectStorage;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.time.Duration;

/**
 * Ready while the configured object store answers a listing of the manifest prefix.
 */
@Readiness
@ApplicationScoped
public class ObjectStoreHealthCheck implements HealthCheck {

    static final String MANIFEST_PREFIX = "dandisets/";
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    @Inject
    ObjectStorage storage;

    @Override
    public HealthCheckResponse call() {
        try {
            boolean manifests = !storage.list(MANIFEST_PREFIX)
                    .select().first(1)
                    .collect().asList()
                    .await().atMost(PROBE_TIMEOUT)
                    .isEmpty();
            return HealthCheckResponse.named("object-store")
                    .up()
                    .withData("backend", storage.getClass().getSimpleName())
                    .withData("manifestsWritten", manifests)
                    .build();
        } catch (RuntimeException e) {
            return HealthCheckResponse.named("object-store")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
