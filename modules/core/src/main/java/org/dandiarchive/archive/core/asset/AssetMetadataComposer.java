package org.dandiarchive.archive.core.asset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.config.ArchiveSettings;
import org.dandiarchive.archive.core.dao.AssetBlobDao;
import org.dandiarchive.archive.core.dao.AssetBlobRecord;
import org.dandiarchive.archive.core.dao.AssetRecord;
import org.dandiarchive.archive.core.dao.ZarrArchiveDao;
import org.dandiarchive.archive.core.dao.ZarrArchiveRecord;
import org.dandiarchive.archive.core.error.ContentNotFoundException;
import org.jdbi.v3.core.Handle;

/**
 * Builds the full metadata document of an asset from its stored metadata, its
 * identity and its backing content.
 */
@ApplicationScoped
public class AssetMetadataComposer {

    public static final String DIGEST_ETAG = "dandi:dandi-etag";
    public static final String DIGEST_SHA256 = "dandi:sha2-256";
    public static final String DIGEST_ZARR = "dandi:dandi-zarr-checksum";
    public static final String ZARR_ENCODING = "application/x-zarr";

    private final ObjectMapper objectMapper;
    private final ArchiveSettings settings;

    @Inject
    public AssetMetadataComposer(ObjectMapper objectMapper, ArchiveSettings settings) {
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    public ComposedMetadata compose(Handle handle, AssetRecord asset) {
        ObjectNode doc = parse(asset);
        if (!doc.has(AssetMetadata.SCHEMA_VERSION)) {
            doc.put(AssetMetadata.SCHEMA_VERSION, settings.defaultSchemaVersion());
        }
        doc.put("schemaKey", "Asset");
        doc.put("id", "dandiasset:" + asset.assetId());
        doc.put("identifier", asset.assetId().toString());
        doc.put(AssetMetadata.PATH, asset.path());

        String downloadUrl = settings.apiUrl() + "/api/assets/" + asset.assetId() + "/download/";
        AssetContent content = AssetContent.of(asset);
        if (content instanceof AssetContent.ZarrContent z) {
            ZarrArchiveRecord zarr = handle.attach(ZarrArchiveDao.class).findById(z.zarrId())
                    .orElseThrow(() -> new ContentNotFoundException("Zarr archive", z.zarrId()));
            doc.put("contentSize", zarr.size());
            doc.put("encodingFormat", ZARR_ENCODING);
            doc.putArray("contentUrl")
                    .add(downloadUrl)
                    .add(settings.storageUrl() + "/zarr/" + zarr.zarrId() + "/");
            if (!zarr.checksumReady()) {
                doc.remove("digest");
                return new ComposedMetadata(doc, false);
            }
            doc.putObject("digest").put(DIGEST_ZARR, zarr.checksum());
            return new ComposedMetadata(doc, true);
        }

        long blobId = content.blobColumn() != null ? content.blobColumn() : content.embargoedBlobColumn();
        AssetBlobRecord blob = handle.attach(AssetBlobDao.class).findById(blobId)
                .orElseThrow(() -> new ContentNotFoundException("Blob", blobId));
        doc.put("contentSize", blob.size());
        doc.putArray("contentUrl")
                .add(downloadUrl)
                .add(settings.storageUrl() + "/" + blob.blobKey());
        ObjectNode digest = doc.putObject("digest");
        digest.put(DIGEST_ETAG, blob.etag());
        if (!blob.digestReady()) {
            return new ComposedMetadata(doc, false);
        }
        digest.put(DIGEST_SHA256, blob.sha256());
        return new ComposedMetadata(doc, true);
    }

    private ObjectNode parse(AssetRecord asset) {
        try {
            JsonNode node = objectMapper.readTree(asset.metadata());
            if (node instanceof ObjectNode object) {
                return object;
            }
            throw new IllegalStateException("Metadata of asset " + asset.assetId() + " is not a JSON object");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Metadata of asset " + asset.assetId() + " is not JSON", e);
        }
    }
}
