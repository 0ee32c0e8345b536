package org.dandiarchive.archive.core.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Schema check for asset and dandiset metadata documents.
 *
 * <p>The document's {@code schemaKey} selects the model. The returned errors are
 * stored and shown to users as-is, so their order and wording must be stable.
 */
public interface MetadataValidator {

    /**
     * @return violations in a deterministic order, empty if the document is valid
     */
    List<ValidationError> validate(JsonNode document, String schemaVersion);
}
