package org.dandiarchive.archive.core.asset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.dao.AssetBlobDao;
import org.dandiarchive.archive.core.dao.AssetDao;
import org.dandiarchive.archive.core.dao.AssetRecord;
import org.dandiarchive.archive.core.dao.VersionRecord;
import org.dandiarchive.archive.core.dao.ZarrArchiveDao;
import org.dandiarchive.archive.core.dao.ZarrArchiveRecord;
import org.dandiarchive.archive.core.error.AssetNotInVersionException;
import org.dandiarchive.archive.core.error.ContentNotFoundException;
import org.dandiarchive.archive.core.error.CrossDandisetZarrException;
import org.dandiarchive.archive.core.error.DuplicatePathException;
import org.dandiarchive.archive.core.error.InvalidPathException;
import org.dandiarchive.archive.core.error.VersionImmutableException;
import org.dandiarchive.archive.core.path.AssetPathIndex;
import org.dandiarchive.archive.types.ValidationStatus;
import org.dandiarchive.archive.util.AssetPaths;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Attaches, replaces and detaches assets on a draft version.
 *
 * <p>Asset rows are never rewritten: a replacement inserts a successor whose
 * {@code previous_id} points at the replaced row, and detaching only drops the
 * version membership. Callers pass a {@link Handle} with an open transaction in
 * which they already hold the version row lock.
 */
@ApplicationScoped
public class AssetChain {

    private static final Logger log = Logger.getLogger(AssetChain.class);

    private final AssetPathIndex pathIndex;
    private final ObjectMapper objectMapper;

    @Inject
    public AssetChain(AssetPathIndex pathIndex, ObjectMapper objectMapper) {
        this.pathIndex = pathIndex;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates an asset at {@code path} and makes it live in {@code version}.
     *
     * @throws VersionImmutableException   if the version is not the draft
     * @throws InvalidPathException        if the path is unsafe or collides with a directory
     * @throws DuplicatePathException      if a live asset already has the path
     * @throws CrossDandisetZarrException  if a zarr archive belongs to another dandiset
     * @throws ContentNotFoundException    if the referenced content does not exist
     */
    public AssetRecord attach(Handle handle, VersionRecord version, String path,
                              ObjectNode metadata, AssetContent content) {
        requireDraft(version);
        requireValidPath(path);
        AssetDao assets = handle.attach(AssetDao.class);
        if (assets.findLiveByPath(version.id(), path).isPresent()) {
            throw new DuplicatePathException(path);
        }
        pathIndex.checkPlacement(handle, version.id(), path);
        long size = contentSize(handle, version, content);

        AssetRecord created = insert(assets, path, AssetMetadata.normalize(metadata, path), content, null);
        assets.addToVersion(version.id(), created.id());
        pathIndex.add(handle, version.id(), path, created.id(), size);
        log.debugf("Attached asset %s at '%s' to version %d", created.assetId(), path, version.id());
        return created;
    }

    /**
     * Replaces {@code previous} in {@code version} by a successor with the given path,
     * metadata and content. Returns {@code previous} itself when nothing changed.
     *
     * @throws AssetNotInVersionException if {@code previous} is not live in the version
     * @throws DuplicatePathException     if another live asset already has the new path
     */
    public AssetRecord replace(Handle handle, VersionRecord version, AssetRecord previous, String path,
                               ObjectNode metadata, AssetContent content) {
        requireDraft(version);
        requireValidPath(path);
        AssetDao assets = handle.attach(AssetDao.class);
        requireLive(assets, version, previous);

        ObjectNode normalized = AssetMetadata.normalize(metadata, path);
        if (isIdentical(previous, path, normalized, content)) {
            log.debugf("Replacement of asset %s is unchanged", previous.assetId());
            return previous;
        }

        Optional<AssetRecord> atPath = assets.findLiveByPath(version.id(), path);
        if (atPath.isPresent() && atPath.get().id() != previous.id()) {
            throw new DuplicatePathException(path);
        }
        long size = contentSize(handle, version, content);

        assets.removeFromVersion(version.id(), previous.id());
        pathIndex.remove(handle, version.id(), previous.path());
        pathIndex.checkPlacement(handle, version.id(), path);

        AssetRecord successor = insert(assets, path, normalized, content, previous.id());
        assets.addToVersion(version.id(), successor.id());
        pathIndex.add(handle, version.id(), path, successor.id(), size);
        log.debugf("Replaced asset %s by %s at '%s' in version %d",
                previous.assetId(), successor.assetId(), path, version.id());
        return successor;
    }

    /**
     * Removes {@code asset} from {@code version}. The asset row is kept.
     */
    public void detach(Handle handle, VersionRecord version, AssetRecord asset) {
        requireDraft(version);
        AssetDao assets = handle.attach(AssetDao.class);
        requireLive(assets, version, asset);
        assets.removeFromVersion(version.id(), asset.id());
        pathIndex.remove(handle, version.id(), asset.path());
        log.debugf("Detached asset %s from version %d", asset.assetId(), version.id());
    }

    /**
     * The asset followed by every asset it replaced, newest first.
     */
    public List<AssetRecord> history(Handle handle, AssetRecord asset) {
        AssetDao assets = handle.attach(AssetDao.class);
        List<AssetRecord> chain = new ArrayList<>();
        AssetRecord current = asset;
        chain.add(current);
        while (current.previousId() != null) {
            long previousId = current.previousId();
            current = assets.findById(previousId)
                    .orElseThrow(() -> new IllegalStateException("Broken asset chain at row " + previousId));
            chain.add(current);
        }
        return chain;
    }

    /**
     * Size in bytes of the content as currently known: the blob size, or the zarr
     * archive's running total.
     */
    public long contentSize(Handle handle, VersionRecord version, AssetContent content) {
        if (content instanceof AssetContent.ZarrContent z) {
            ZarrArchiveRecord zarr = handle.attach(ZarrArchiveDao.class).findById(z.zarrId())
                    .orElseThrow(() -> new ContentNotFoundException("Zarr archive", z.zarrId()));
            if (zarr.dandisetId() != version.dandisetId()) {
                throw new CrossDandisetZarrException(zarr.zarrId(), zarr.dandisetId(), version.dandisetId());
            }
            return zarr.size();
        }
        long blobId = content instanceof AssetContent.BlobContent b
                ? b.blobId()
                : ((AssetContent.EmbargoedBlobContent) content).blobId();
        return handle.attach(AssetBlobDao.class).findById(blobId)
                .orElseThrow(() -> new ContentNotFoundException("Blob", blobId))
                .size();
    }

    private boolean isIdentical(AssetRecord previous, String path, ObjectNode metadata, AssetContent content) {
        if (!previous.path().equals(path) || !AssetContent.of(previous).equals(content)) {
            return false;
        }
        try {
            // Compare parsed trees so numeric node types match
            JsonNode stored = objectMapper.readTree(previous.metadata());
            return stored.equals(objectMapper.readTree(objectMapper.writeValueAsString(metadata)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored metadata of asset " + previous.assetId() + " is not JSON", e);
        }
    }

    private AssetRecord insert(AssetDao assets, String path, ObjectNode metadata, AssetContent content, Long previousId) {
        String json;
        try {
            json = objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Asset metadata is not serializable", e);
        }
        long id = assets.insert(UUID.randomUUID(), path, json, ValidationStatus.PENDING, previousId,
                content.blobColumn(), content.embargoedBlobColumn(), content.zarrColumn());
        return assets.findById(id).orElseThrow();
    }

    private static void requireDraft(VersionRecord version) {
        if (!version.isDraft()) {
            throw new VersionImmutableException(version.id(), version.version());
        }
    }

    private static void requireValidPath(String path) {
        if (!AssetPaths.isValid(path)) {
            throw new InvalidPathException(path);
        }
    }

    private static void requireLive(AssetDao assets, VersionRecord version, AssetRecord asset) {
        Objects.requireNonNull(asset, "asset");
        if (!assets.isLive(version.id(), asset.id())) {
            throw new AssetNotInVersionException(asset.assetId(), version.id());
        }
    }
}
