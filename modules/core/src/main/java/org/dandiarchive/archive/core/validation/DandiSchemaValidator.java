package org.dandiarchive.archive.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.asset.AssetMetadataComposer;
import org.dandiarchive.archive.core.config.ArchiveSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Built-in validator for the {@code Asset} and {@code Dandiset} models.
 *
 * <p>Checks run in a fixed order: schema version, required fields, list-typed
 * fields, then digest keys. An unsupported schema version stops validation.
 */
@ApplicationScoped
public class DandiSchemaValidator implements MetadataValidator {

    static final String FIELD_REQUIRED = "field required";
    static final String NOT_A_LIST = "value is not a valid list";
    static final String DIGEST_MISSING = "Digest is missing dandi-etag or sha256 keys.";

    private static final Map<String, List<String>> REQUIRED = Map.of(
            "Asset", List.of("id", "identifier", "path", "contentSize", "encodingFormat", "digest"),
            "Dandiset", List.of("name", "description", "contributor", "license"));

    private static final Map<String, List<String>> LIST_FIELDS = Map.of(
            "Asset", List.of("keywords", "contentUrl", "wasAttributedTo", "wasGeneratedBy", "approach",
                    "measurementTechnique", "variableMeasured", "sameAs"),
            "Dandiset", List.of("license", "contributor", "keywords", "about", "relatedResource",
                    "ethicsApproval", "studyTarget", "protocol"));

    private final List<String> allowedVersions;

    @Inject
    public DandiSchemaValidator(ArchiveSettings settings) {
        this.allowedVersions = settings.allowedSchemaVersions();
    }

    @Override
    public List<ValidationError> validate(JsonNode document, String schemaVersion) {
        if (schemaVersion == null || !allowedVersions.contains(schemaVersion)) {
            return List.of(new ValidationError("", "Metadata version " + schemaVersion
                    + " is not allowed. Allowed are: " + String.join(", ", allowedVersions) + "."));
        }

        String schemaKey = document.path("schemaKey").asText("Asset");
        List<ValidationError> errors = new ArrayList<>();
        for (String field : REQUIRED.getOrDefault(schemaKey, List.of())) {
            JsonNode value = document.get(field);
            if (value == null || value.isNull()) {
                errors.add(new ValidationError(field, FIELD_REQUIRED));
            }
        }
        for (String field : LIST_FIELDS.getOrDefault(schemaKey, List.of())) {
            JsonNode value = document.get(field);
            if (value != null && !value.isNull() && !value.isArray()) {
                errors.add(new ValidationError(field, NOT_A_LIST));
            }
        }
        if ("Asset".equals(schemaKey)) {
            checkDigest(document, errors);
        }
        return errors;
    }

    private static void checkDigest(JsonNode document, List<ValidationError> errors) {
        JsonNode digest = document.get("digest");
        if (digest == null || digest.isNull()) {
            return;
        }
        if (AssetMetadataComposer.ZARR_ENCODING.equals(document.path("encodingFormat").asText(null))) {
            if (!digest.has(AssetMetadataComposer.DIGEST_ZARR)) {
                errors.add(new ValidationError("digest", "Digest is missing dandi-zarr-checksum key."));
            }
            return;
        }
        if (!digest.has(AssetMetadataComposer.DIGEST_ETAG) || !digest.has(AssetMetadataComposer.DIGEST_SHA256)) {
            errors.add(new ValidationError("digest", DIGEST_MISSING));
        }
    }
}
