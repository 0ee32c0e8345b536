package org.dandiarchive.archive.core.storage;

import org.dandiarchive.archive.core.testing.TestArchive;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FilesystemObjectStorageTest {

    @TempDir
    Path root;

    private FilesystemObjectStorage storage;

    @BeforeEach
    void setUp() {
        storage = new FilesystemObjectStorage(root);
    }

    @Test
    void putThenReadBack() throws Exception {
        byte[] data = "hello".getBytes(StandardCharsets.UTF_8);
        storage.put("a/b/c.txt", data, "text/plain").await().indefinitely();

        try (InputStream in = storage.open("a/b/c.txt").await().indefinitely()) {
            assertThat(in.readAllBytes()).isEqualTo(data);
        }
        ObjectInfo info = storage.stat("a/b/c.txt").await().indefinitely();
        assertThat(info.key()).isEqualTo("a/b/c.txt");
        assertThat(info.size()).isEqualTo(5);
        assertThat(info.etag()).isEqualTo(TestArchive.md5Hex(data));
    }

    @Test
    void missingObjectIsReported() {
        assertThat(storage.exists("nope").await().indefinitely()).isFalse();
        assertThatThrownBy(() -> storage.stat("nope").await().indefinitely())
                .isInstanceOf(ObjectNotFoundException.class);
        assertThatThrownBy(() -> storage.delete("nope").await().indefinitely())
                .isInstanceOf(ObjectNotFoundException.class);
    }

    @Test
    void listIsSortedAndScopedToPrefix() {
        storage.put("zarr/1/b", new byte[1], null).await().indefinitely();
        storage.put("zarr/1/a", new byte[2], null).await().indefinitely();
        storage.put("zarr/2/a", new byte[3], null).await().indefinitely();

        List<ObjectInfo> listed = storage.list("zarr/1/").collect().asList().await().indefinitely();

        assertThat(listed).extracting(ObjectInfo::key).containsExactly("zarr/1/a", "zarr/1/b");
    }

    @Test
    void deleteRemovesEmptyParents() {
        storage.put("x/y/z", new byte[1], null).await().indefinitely();

        storage.delete("x/y/z").await().indefinitely();

        assertThat(Files.exists(root.resolve("x"))).isFalse();
        assertThat(Files.exists(root)).isTrue();
    }

    @Test
    void keysCannotEscapeTheRoot() {
        assertThatThrownBy(() -> storage.put("../outside", new byte[1], null).await().indefinitely())
                .isInstanceOf(StorageException.class);
    }

    @Test
    void presignedUrlPointsAtTheFile() {
        storage.put("k", new byte[1], null).await().indefinitely();

        assertThat(storage.presignedUrl("k", Duration.ofMinutes(5)).await().indefinitely())
                .isEqualTo(root.resolve("k").toAbsolutePath().normalize().toUri().toString());
    }
}
