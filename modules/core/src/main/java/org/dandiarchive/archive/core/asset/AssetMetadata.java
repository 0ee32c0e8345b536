package org.dandiarchive.archive.core.asset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Rules for the metadata document stored on an asset.
 *
 * <p>Fields derived from the asset's identity and content are never stored; they
 * are merged back in when the asset is validated or published in a manifest.
 */
public final class AssetMetadata {

    public static final String PATH = "path";
    public static final String SCHEMA_VERSION = "schemaVersion";

    /** Fields computed from the asset record and its content. */
    public static final List<String> COMPUTED_FIELDS =
            List.of("id", "identifier", "contentUrl", "contentSize", "digest");

    private AssetMetadata() {
    }

    /**
     * Copy of {@code draft} without computed fields, with {@code path} set.
     */
    public static ObjectNode normalize(ObjectNode draft, String path) {
        ObjectNode copy = draft.deepCopy();
        copy.remove(COMPUTED_FIELDS);
        copy.put(PATH, path);
        return copy;
    }

    public static Optional<String> path(JsonNode metadata) {
        JsonNode node = metadata.get(PATH);
        return node != null && node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
    }

    public static Optional<String> schemaVersion(JsonNode metadata) {
        JsonNode node = metadata.get(SCHEMA_VERSION);
        return node != null && node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
    }
}
