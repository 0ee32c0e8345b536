package org.dandiarchive.archive.core.storage;

import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem-backed ObjectStorage for development and testing.
 *
 * <p>Layout: {@code {root}/{key}}. Entity tags are the MD5 of the content, as S3
 * reports them for single-part uploads. Presigned URLs are plain {@code file:} URIs.
 */
@ApplicationScoped
@IfBuildProperty(name = "archive.object-store.type", stringValue = "filesystem")
public class FilesystemObjectStorage implements ObjectStorage {

    private final Path root;

    @Inject
    public FilesystemObjectStorage(@ConfigProperty(name = "archive.object-store.filesystem.root") String root) {
        this(Path.of(root));
    }

    public FilesystemObjectStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    private Path resolvePath(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new StorageException("Key escapes storage root: " + key);
        }
        return path;
    }

    private String keyOf(Path path) {
        return root.relativize(path).toString().replace(path.getFileSystem().getSeparator(), "/");
    }

    @Override
    public Uni<Void> put(String key, byte[] data, String contentType) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(key);
            try {
                Files.createDirectories(path.getParent());
                Path tmp = Files.createTempFile(path.getParent(), ".put-", ".tmp");
                Files.write(tmp, data);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new StorageException("write object", key, e);
            }
        });
    }

    @Override
    public Uni<InputStream> open(String key) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(key);
            if (!Files.isRegularFile(path)) {
                throw new ObjectNotFoundException(key);
            }
            try {
                return Files.newInputStream(path);
            } catch (IOException e) {
                throw new StorageException("read object", key, e);
            }
        });
    }

    @Override
    public Uni<ObjectInfo> stat(String key) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(key);
            if (!Files.isRegularFile(path)) {
                throw new ObjectNotFoundException(key);
            }
            return info(path);
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> Files.isRegularFile(resolvePath(key)));
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(key);
            try {
                if (!Files.deleteIfExists(path)) {
                    throw new ObjectNotFoundException(key);
                }
                pruneEmptyParents(path.getParent());
            } catch (IOException e) {
                throw new StorageException("delete object", key, e);
            }
        });
    }

    private void pruneEmptyParents(Path dir) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(root)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            Files.delete(current);
            current = current.getParent();
        }
    }

    @Override
    public Multi<ObjectInfo> list(String prefix) {
        return Multi.createFrom().items(() -> {
            if (!Files.isDirectory(root)) {
                return Stream.<ObjectInfo>empty();
            }
            try (Stream<Path> files = Files.walk(root)) {
                List<Path> matching = files
                        .filter(Files::isRegularFile)
                        .filter(p -> !p.getFileName().toString().startsWith(".put-"))
                        .filter(p -> keyOf(p).startsWith(prefix))
                        .sorted()
                        .collect(Collectors.toList());
                return matching.stream().map(this::info);
            } catch (IOException e) {
                throw new StorageException("list objects", prefix, e);
            }
        });
    }

    @Override
    public Uni<String> presignedUrl(String key, Duration expiry) {
        return Uni.createFrom().item(() -> resolvePath(key).toUri().toString());
    }

    private ObjectInfo info(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] buf = new byte[8192];
            long size = 0;
            int n;
            while ((n = in.read(buf)) != -1) {
                md5.update(buf, 0, n);
                size += n;
            }
            return new ObjectInfo(keyOf(path), size, HexFormat.of().formatHex(md5.digest()));
        } catch (IOException e) {
            throw new StorageException("stat object", keyOf(path), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
