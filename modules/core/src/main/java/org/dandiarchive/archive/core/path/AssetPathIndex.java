package org.dandiarchive.archive.core.path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.config.ArchiveSettings;
import org.dandiarchive.archive.core.dao.AssetPathDao;
import org.dandiarchive.archive.core.dao.AssetPathRecord;
import org.dandiarchive.archive.core.error.InvalidPathException;
import org.dandiarchive.archive.util.AssetPaths;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Optional;

/**
 * Directory tree over the live assets of each version.
 *
 * <p>Every directory node carries the file count and total size of its subtree.
 * Mutations touch only the leaf and its ancestors and must run in the same
 * transaction as the asset-set change they mirror, under the version row lock.
 * The root is implicit: it always exists and is not stored.
 */
@ApplicationScoped
public class AssetPathIndex {

    private static final Logger log = Logger.getLogger(AssetPathIndex.class);

    private final Jdbi jdbi;
    private final ArchiveSettings settings;

    @Inject
    public AssetPathIndex(Jdbi jdbi, ArchiveSettings settings) {
        this.jdbi = jdbi;
        this.settings = settings;
    }

    /**
     * Adds a leaf for {@code path} and adds one file of {@code size} bytes to every
     * ancestor, creating missing directory nodes.
     */
    public void add(Handle handle, long versionId, String path, long assetId, long size) {
        AssetPathDao dao = handle.attach(AssetPathDao.class);
        for (String dir : AssetPaths.ancestors(path)) {
            if (dao.adjust(versionId, dir, 1, size) == 0) {
                dao.insert(versionId, dir, AssetPaths.parentOf(dir), null, 1, size);
            }
        }
        dao.insert(versionId, path, AssetPaths.parentOf(path), assetId, 1, size);
        log.tracef("Path index +%s (%d bytes) in version %d", path, size, versionId);
    }

    /**
     * Removes the leaf at {@code path} and subtracts it from every ancestor,
     * deleting directories left without files.
     */
    public void remove(Handle handle, long versionId, String path) {
        AssetPathDao dao = handle.attach(AssetPathDao.class);
        AssetPathRecord leaf = dao.find(versionId, path)
                .orElseThrow(() -> new IllegalStateException(
                        "Path index has no leaf '" + path + "' in version " + versionId));
        dao.delete(versionId, path);
        List<String> ancestors = AssetPaths.ancestors(path);
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            String dir = ancestors.get(i);
            dao.adjust(versionId, dir, -1, -leaf.aggregateSize());
            dao.deleteIfEmpty(versionId, dir);
        }
        log.tracef("Path index -%s in version %d", path, versionId);
    }

    /**
     * Changes the size recorded for the leaf at {@code path}, e.g. after a zarr
     * archive finished ingesting. No-op when the size is unchanged.
     */
    public void resize(Handle handle, long versionId, String path, long newSize) {
        AssetPathDao dao = handle.attach(AssetPathDao.class);
        Optional<AssetPathRecord> leaf = dao.find(versionId, path);
        if (leaf.isEmpty()) {
            return;
        }
        long delta = newSize - leaf.get().aggregateSize();
        if (delta == 0) {
            return;
        }
        dao.adjust(versionId, path, 0, delta);
        for (String dir : AssetPaths.ancestors(path)) {
            dao.adjust(versionId, dir, 0, delta);
        }
    }

    /**
     * Fails with {@link InvalidPathException} if {@code path} would shadow an existing
     * directory or sit below an existing leaf.
     */
    public void checkPlacement(Handle handle, long versionId, String path) {
        AssetPathDao dao = handle.attach(AssetPathDao.class);
        if (dao.find(versionId, path + "/").isPresent()) {
            throw new InvalidPathException(path, "Path '" + path + "' is already a directory");
        }
        for (String dir : AssetPaths.ancestors(path)) {
            String asLeaf = dir.substring(0, dir.length() - 1);
            if (dao.find(versionId, asLeaf).isPresent()) {
                throw new InvalidPathException(path, "Path '" + path + "' is below existing asset '" + asLeaf + "'");
            }
        }
    }

    /**
     * Immediate children of {@code prefix}, ordered by name.
     *
     * @param prefix   {@code ""} for the root, otherwise a directory ending in {@code /}
     * @param page     1-based page number
     * @param pageSize clamped to the configured maximum
     * @return empty if {@code prefix} names no directory in the version
     * @throws InvalidPathException if {@code prefix} is not a directory prefix
     */
    public Optional<PathPage> childrenOf(long versionId, String prefix, int page, int pageSize) {
        if (!AssetPaths.isDirectoryPrefix(prefix)) {
            throw new InvalidPathException(prefix, "Not a directory prefix: '" + prefix + "'");
        }
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1, got: " + page);
        }
        int size = Math.max(1, Math.min(pageSize, settings.maxPageSize()));

        return jdbi.withExtension(AssetPathDao.class, dao -> {
            if (!prefix.isEmpty() && dao.find(versionId, prefix).isEmpty()) {
                return Optional.empty();
            }
            long total = dao.countChildren(versionId, prefix);
            long offset = (long) (page - 1) * size;
            List<PathNode> nodes = offset >= total
                    ? List.of()
                    : dao.findChildren(versionId, prefix, size, offset).stream()
                            .map(row -> new PathNode(
                                    row.path(),
                                    AssetPaths.nameOf(row.path()),
                                    !row.path().endsWith("/"),
                                    row.aggregateFiles(),
                                    row.aggregateSize(),
                                    row.assetUuid()))
                            .toList();
            return Optional.of(new PathPage(nodes, page, size, total));
        });
    }

    /** All stored nodes of a version, in no particular order. */
    public List<AssetPathRecord> nodes(long versionId) {
        return jdbi.withExtension(AssetPathDao.class, dao -> dao.findByVersion(versionId));
    }
}
