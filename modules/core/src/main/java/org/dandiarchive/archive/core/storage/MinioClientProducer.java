package org.dandiarchive.archive.core.storage;

import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;

/**
 * Builds the client for the blob and zarr bucket. Without an access key the client is anonymous,
 * which is enough for digesting and manifest reads against a public bucket.
 */
@ApplicationScoped
@IfBuildProperty(name = "archive.object-store.type", stringValue = "s3")
public class MinioClientProducer {

    private static final Logger log = Logger.getLogger(MinioClientProducer.class);

    @ConfigProperty(name = "archive.minio.endpoint")
    String endpoint;

    @ConfigProperty(name = "archive.minio.access-key")
    Optional<String> accessKey;

    @ConfigProperty(name = "archive.minio.secret-key")
    Optional<String> secretKey;

    @ConfigProperty(name = "archive.minio.region", defaultValue = "us-east-1")
    String region;

    // Whole-object digests stream multi-gigabyte blobs
    @ConfigProperty(name = "archive.minio.read-timeout", defaultValue = "PT10M")
    Duration readTimeout;

    @Produces
    @Singleton
    public MinioClient minioClient() {
        MinioClient.Builder builder = MinioClient.builder()
                .endpoint(endpoint)
                .region(region);
        if (accessKey.isPresent() && secretKey.isPresent()) {
            builder.credentials(accessKey.get(), secretKey.get());
        } else {
            log.warnf("No credentials for %s, object store access is anonymous", endpoint);
        }
        MinioClient client = builder.build();
        client.setTimeout(Duration.ofSeconds(30).toMillis(), 0, readTimeout.toMillis());
        return client;
    }
}
