package org.dandiarchive.archive.core.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.asset.AssetMetadataComposer;
import org.dandiarchive.archive.core.dao.AssetDao;
import org.dandiarchive.archive.core.dao.AssetRecord;
import org.dandiarchive.archive.core.dao.VersionDao;
import org.dandiarchive.archive.core.dao.VersionRecord;
import org.dandiarchive.archive.core.error.ContentNotFoundException;
import org.dandiarchive.archive.core.storage.ObjectStorage;
import org.dandiarchive.archive.core.validation.MetadataValidationService;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.List;

/**
 * Publishes a version's metadata as JSON-LD files next to its content:
 * {@code dandisets/{id}/{version}/dandiset.jsonld}, {@code assets.jsonld} and
 * {@code collection.jsonld}.
 */
@ApplicationScoped
public class ManifestWriter {

    private static final Logger log = Logger.getLogger(ManifestWriter.class);

    static final String CONTENT_TYPE = "application/ld+json";

    private final Jdbi jdbi;
    private final ObjectMapper objectMapper;
    private final ObjectStorage storage;
    private final AssetMetadataComposer composer;
    private final MetadataValidationService validationService;

    @Inject
    public ManifestWriter(Jdbi jdbi, ObjectMapper objectMapper, ObjectStorage storage,
                          AssetMetadataComposer composer, MetadataValidationService validationService) {
        this.jdbi = jdbi;
        this.objectMapper = objectMapper;
        this.storage = storage;
        this.composer = composer;
        this.validationService = validationService;
    }

    public static String prefix(VersionRecord version) {
        return String.format("dandisets/%06d/%s/", version.dandisetId(), version.version());
    }

    /**
     * Writes the three manifest files for the version.
     *
     * @return the storage prefix the files were written under
     */
    public String writeManifests(long versionId) {
        VersionRecord version = jdbi.withExtension(VersionDao.class, dao -> dao.findById(versionId))
                .orElseThrow(() -> new ContentNotFoundException("Version", versionId));
        ObjectNode dandiset = validationService.versionDocument(version);

        ArrayNode assets = objectMapper.createArrayNode();
        jdbi.useHandle(handle -> {
            List<AssetRecord> live = handle.attach(AssetDao.class).findLiveByVersion(versionId);
            for (AssetRecord asset : live) {
                assets.add(composer.compose(handle, asset).document());
            }
        });

        ObjectNode collection = objectMapper.createObjectNode();
        collection.put("@context", contextUrl(dandiset));
        collection.put("id", dandiset.path("id").asText());
        collection.put("@type", "prov:Collection");
        ArrayNode members = collection.putArray("hasMember");
        for (JsonNode asset : assets) {
            members.add(asset.path("id").asText());
        }

        String prefix = prefix(version);
        put(prefix + "dandiset.jsonld", dandiset);
        put(prefix + "assets.jsonld", assets);
        put(prefix + "collection.jsonld", collection);
        log.debugf("Wrote manifests for version %d under %s (%d assets)", (Object) versionId, prefix, assets.size());
        return prefix;
    }

    private static String contextUrl(JsonNode dandiset) {
        return "https://raw.githubusercontent.com/dandi/schema/master/releases/"
                + dandiset.path("schemaVersion").asText() + "/context.json";
    }

    private void put(String key, JsonNode document) {
        byte[] bytes;
        try {
            bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize manifest " + key, e);
        }
        storage.put(key, bytes, CONTENT_TYPE).await().indefinitely();
    }
}
