package org.dandiarchive.archive.core.storage;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetPresignedObjectUrlArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import io.minio.http.Method;
import io.minio.messages.Item;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * S3/MinIO-backed ObjectStorage for production use. All keys live in one bucket.
 */
@ApplicationScoped
@IfBuildProperty(name = "archive.object-store.type", stringValue = "s3")
public class S3ObjectStorage implements ObjectStorage {

    @Inject
    MinioClient minioClient;

    @ConfigProperty(name = "archive.object-store.bucket", defaultValue = "dandiarchive")
    String bucket;

    private volatile boolean bucketChecked;

    private void ensureBucket() {
        if (bucketChecked) {
            return;
        }
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
            }
            bucketChecked = true;
        } catch (ErrorResponseException e) {
            // Concurrent creation, another thread already created the bucket
            if ("BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                bucketChecked = true;
                return;
            }
            throw new StorageException("ensure bucket", bucket, e);
        } catch (Exception e) {
            throw new StorageException("ensure bucket", bucket, e);
        }
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code);
    }

    private static String unquote(String etag) {
        if (etag != null && etag.length() >= 2 && etag.startsWith("\"") && etag.endsWith("\"")) {
            return etag.substring(1, etag.length() - 1);
        }
        return etag;
    }

    @Override
    public Uni<Void> put(String key, byte[] data, String contentType) {
        return Uni.createFrom().voidItem().invoke(() -> {
            ensureBucket();
            try (InputStream is = new ByteArrayInputStream(data)) {
                minioClient.putObject(PutObjectArgs.builder()
                        .bucket(bucket)
                        .object(key)
                        .stream(is, data.length, -1)
                        .contentType(contentType != null ? contentType : "application/octet-stream")
                        .build());
            } catch (Exception e) {
                throw new StorageException("write object", key, e);
            }
        });
    }

    @Override
    public Uni<InputStream> open(String key) {
        return Uni.createFrom().item(() -> {
            try {
                return (InputStream) minioClient.getObject(
                        GetObjectArgs.builder().bucket(bucket).object(key).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new ObjectNotFoundException(key);
                }
                throw new StorageException("read object", key, e);
            } catch (Exception e) {
                throw new StorageException("read object", key, e);
            }
        });
    }

    @Override
    public Uni<ObjectInfo> stat(String key) {
        return Uni.createFrom().item(() -> {
            try {
                StatObjectResponse stat = minioClient.statObject(
                        StatObjectArgs.builder().bucket(bucket).object(key).build());
                return new ObjectInfo(key, stat.size(), unquote(stat.etag()));
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new ObjectNotFoundException(key);
                }
                throw new StorageException("stat object", key, e);
            } catch (Exception e) {
                throw new StorageException("stat object", key, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> {
            try {
                minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
                return true;
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    return false;
                }
                throw new StorageException("check existence", key, e);
            } catch (Exception e) {
                throw new StorageException("check existence", key, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            // MinIO removeObject is silent on missing keys
            try {
                minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new ObjectNotFoundException(key);
                }
                throw new StorageException("delete object", key, e);
            } catch (Exception e) {
                throw new StorageException("delete object", key, e);
            }
            try {
                minioClient.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
            } catch (Exception e) {
                throw new StorageException("delete object", key, e);
            }
        });
    }

    @Override
    public Multi<ObjectInfo> list(String prefix) {
        return Multi.createFrom().items(() -> {
            try {
                List<ObjectInfo> objects = new ArrayList<>();
                for (Result<Item> result : minioClient.listObjects(
                        ListObjectsArgs.builder().bucket(bucket).prefix(prefix).recursive(true).build())) {
                    Item item = result.get();
                    if (!item.isDir()) {
                        objects.add(new ObjectInfo(item.objectName(), item.size(), unquote(item.etag())));
                    }
                }
                return objects.stream();
            } catch (ErrorResponseException e) {
                if ("NoSuchBucket".equals(e.errorResponse().code())) {
                    return java.util.stream.Stream.<ObjectInfo>empty();
                }
                throw new StorageException("list objects", prefix, e);
            } catch (Exception e) {
                throw new StorageException("list objects", prefix, e);
            }
        });
    }

    @Override
    public Uni<String> presignedUrl(String key, Duration expiry) {
        return Uni.createFrom().item(() -> {
            try {
                return minioClient.getPresignedObjectUrl(GetPresignedObjectUrlArgs.builder()
                        .method(Method.GET)
                        .bucket(bucket)
                        .object(key)
                        .expiry((int) expiry.toSeconds(), TimeUnit.SECONDS)
                        .build());
            } catch (Exception e) {
                throw new StorageException("presign object", key, e);
            }
        });
    }
}
