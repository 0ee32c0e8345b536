package org.dandiarchive.archive.core.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dandiarchive.archive.core.testing.TestArchive;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DandiSchemaValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final DandiSchemaValidator validator = new DandiSchemaValidator(TestArchive.settings());

    @Test
    void completeBlobAssetIsValid() {
        assertThat(validator.validate(blobAsset(), "0.6.4")).isEmpty();
    }

    @Test
    void unsupportedSchemaVersionStopsValidation() {
        ObjectNode doc = mapper.createObjectNode().put("schemaKey", "Asset");

        assertThat(validator.validate(doc, "0.1.0")).containsExactly(
                new ValidationError("", "Metadata version 0.1.0 is not allowed. Allowed are: 0.6.4."));
    }

    @Test
    void reportsEachMissingRequiredField() {
        ObjectNode doc = blobAsset();
        doc.remove("encodingFormat");
        doc.remove("contentSize");

        assertThat(validator.validate(doc, "0.6.4")).containsExactlyInAnyOrder(
                new ValidationError("contentSize", DandiSchemaValidator.FIELD_REQUIRED),
                new ValidationError("encodingFormat", DandiSchemaValidator.FIELD_REQUIRED));
    }

    @Test
    void listFieldMustBeAList() {
        ObjectNode doc = blobAsset().put("keywords", "ephys");

        assertThat(validator.validate(doc, "0.6.4"))
                .containsExactly(new ValidationError("keywords", DandiSchemaValidator.NOT_A_LIST));
    }

    @Test
    void blobDigestNeedsEtagAndSha256() {
        ObjectNode doc = blobAsset();
        ((ObjectNode) doc.get("digest")).remove("dandi:sha2-256");

        assertThat(validator.validate(doc, "0.6.4"))
                .containsExactly(new ValidationError("digest", DandiSchemaValidator.DIGEST_MISSING));
    }

    @Test
    void zarrDigestNeedsZarrChecksum() {
        ObjectNode doc = blobAsset().put("encodingFormat", "application/x-zarr");

        assertThat(validator.validate(doc, "0.6.4"))
                .extracting(ValidationError::message)
                .containsExactly("Digest is missing dandi-zarr-checksum key.");
    }

    @Test
    void dandisetRequiresDescriptiveFields() {
        ObjectNode doc = mapper.createObjectNode().put("schemaKey", "Dandiset").put("name", "n");

        assertThat(validator.validate(doc, "0.6.4"))
                .extracting(ValidationError::field)
                .containsExactly("description", "contributor", "license");
    }

    private ObjectNode blobAsset() {
        ObjectNode doc = mapper.createObjectNode();
        doc.put("schemaKey", "Asset");
        doc.put("id", "dandiasset:1");
        doc.put("identifier", "1");
        doc.put("path", "a.nwb");
        doc.put("contentSize", 10);
        doc.put("encodingFormat", "application/x-nwb");
        doc.putObject("digest")
                .put("dandi:dandi-etag", "0123456789abcdef0123456789abcdef-1")
                .put("dandi:sha2-256", "a".repeat(64));
        return doc;
    }
}
