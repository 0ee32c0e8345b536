package org.dandiarchive.archive.core.storage;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import java.io.InputStream;
import java.time.Duration;

/**
 * Key-addressed object storage holding blob uploads, zarr files and manifests.
 *
 * <p>Keys are forward-slash separated, e.g. {@code blobs/abc/def/abcdef...} or
 * {@code zarr/{zarrId}/0/0.0}. All keys live in a single bucket or root directory.
 */
public interface ObjectStorage {

    /**
     * Writes an object, overwriting any previous content under the key.
     *
     * @param contentType optional content type (may be null)
     * @throws StorageException on I/O errors
     */
    Uni<Void> put(String key, byte[] data, String contentType);

    /**
     * Opens an object for reading. The caller closes the stream.
     *
     * @throws ObjectNotFoundException if the object does not exist
     * @throws StorageException on I/O errors
     */
    Uni<InputStream> open(String key);

    /**
     * Size and entity tag of an object.
     *
     * @throws ObjectNotFoundException if the object does not exist
     */
    Uni<ObjectInfo> stat(String key);

    Uni<Boolean> exists(String key);

    /**
     * Deletes an object.
     *
     * @throws ObjectNotFoundException if the object does not exist
     */
    Uni<Void> delete(String key);

    /**
     * Lists objects whose key starts with {@code prefix}, recursively.
     */
    Multi<ObjectInfo> list(String prefix);

    /**
     * A time-limited URL that lets an anonymous client download the object.
     */
    Uni<String> presignedUrl(String key, Duration expiry);
}
