package org.dandiarchive.archive.core.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.asset.AssetMetadata;
import org.dandiarchive.archive.core.asset.AssetMetadataComposer;
import org.dandiarchive.archive.core.asset.ComposedMetadata;
import org.dandiarchive.archive.core.config.ArchiveSettings;
import org.dandiarchive.archive.core.dao.AssetDao;
import org.dandiarchive.archive.core.dao.AssetRecord;
import org.dandiarchive.archive.core.dao.VersionDao;
import org.dandiarchive.archive.core.dao.VersionRecord;
import org.dandiarchive.archive.core.error.ContentNotFoundException;
import org.dandiarchive.archive.core.error.VersionMetadataConcurrentlyModifiedException;
import org.dandiarchive.archive.core.task.TaskService;
import org.dandiarchive.archive.types.ValidationStatus;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates asset and version metadata and maintains the version's
 * {@code assetsSummary}.
 *
 * <p>Every entry point is idempotent and may run against state that changed
 * since it was scheduled. Asset results are written only while the asset is
 * still PENDING; version results only while {@code modified_seq} is unchanged.
 */
@ApplicationScoped
public class MetadataValidationService {

    private static final Logger log = Logger.getLogger(MetadataValidationService.class);

    private final Jdbi jdbi;
    private final ObjectMapper objectMapper;
    private final ArchiveSettings settings;
    private final MetadataValidator validator;
    private final AssetMetadataComposer composer;
    private final AssetsSummaryAggregator aggregator;
    private final TaskService taskService;

    @Inject
    public MetadataValidationService(Jdbi jdbi, ObjectMapper objectMapper, ArchiveSettings settings,
                                     MetadataValidator validator, AssetMetadataComposer composer,
                                     AssetsSummaryAggregator aggregator, TaskService taskService) {
        this.jdbi = jdbi;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.validator = validator;
        this.composer = composer;
        this.aggregator = aggregator;
        this.taskService = taskService;
    }

    /**
     * Validates a PENDING asset once its content digest or zarr checksum exists.
     *
     * @param assetId asset row id
     */
    public ValidationOutcome validateAsset(long assetId) {
        return jdbi.inTransaction(handle -> {
            AssetDao assets = handle.attach(AssetDao.class);
            AssetRecord asset = assets.findById(assetId)
                    .orElseThrow(() -> new ContentNotFoundException("Asset", assetId));
            if (asset.status() != ValidationStatus.PENDING) {
                return ValidationOutcome.SKIPPED;
            }
            ComposedMetadata composed = composer.compose(handle, asset);
            if (!composed.contentReady()) {
                log.debugf("Asset %s content not ready, validation deferred", asset.assetId());
                return ValidationOutcome.DEFERRED;
            }

            ObjectNode document = composed.document();
            List<ValidationError> errors = validator.validate(
                    document, AssetMetadata.schemaVersion(document).orElse(null));
            ValidationStatus status = errors.isEmpty() ? ValidationStatus.VALID : ValidationStatus.INVALID;
            if (assets.recordValidation(assetId, ValidationStatus.PENDING, status, toJson(errors)) == 0) {
                return ValidationOutcome.STALE;
            }
            log.debugf("Asset %s validated: %s (%d errors)", asset.assetId(), status, errors.size());
            return status == ValidationStatus.VALID ? ValidationOutcome.VALID : ValidationOutcome.INVALID;
        });
    }

    /**
     * Validates a PENDING version's metadata. The result is discarded if the
     * version changes in the meantime; it stays PENDING for the next sweep.
     */
    public ValidationOutcome validateVersion(long versionId) {
        VersionRecord version = jdbi.withExtension(VersionDao.class, dao -> dao.findById(versionId))
                .orElseThrow(() -> new ContentNotFoundException("Version", versionId));
        if (version.status() != ValidationStatus.PENDING) {
            return ValidationOutcome.SKIPPED;
        }

        ObjectNode document = versionDocument(version);
        List<ValidationError> errors = validator.validate(
                document, AssetMetadata.schemaVersion(document).orElse(null));
        ValidationStatus status = errors.isEmpty() ? ValidationStatus.VALID : ValidationStatus.INVALID;
        String errorsJson = toJson(errors);
        int updated = jdbi.withExtension(VersionDao.class, dao ->
                dao.recordValidation(versionId, version.modifiedSeq(), status, errorsJson));
        if (updated == 0) {
            log.debugf("Version %d changed during validation, result discarded", versionId);
            return ValidationOutcome.STALE;
        }
        log.debugf("Version %d validated: %s (%d errors)", (Object) versionId, status, errors.size());
        return status == ValidationStatus.VALID ? ValidationOutcome.VALID : ValidationOutcome.INVALID;
    }

    /**
     * Recomputes the version's {@code assetsSummary} and writes it back with a
     * compare-and-set on {@code modified_seq}.
     *
     * @return true if the metadata changed
     * @throws VersionMetadataConcurrentlyModifiedException if the version changed
     *         while the summary was being computed
     */
    public boolean aggregateAssetsSummary(long versionId) {
        boolean written = jdbi.inTransaction(handle -> {
            VersionRecord version = handle.attach(VersionDao.class).findById(versionId)
                    .orElseThrow(() -> new ContentNotFoundException("Version", versionId));

            List<AssetsSummaryAggregator.AssetSummaryInput> inputs = new ArrayList<>();
            for (AssetRecord asset : handle.attach(AssetDao.class).findLiveByVersion(versionId)) {
                ObjectNode doc = composer.compose(handle, asset).document();
                inputs.add(new AssetsSummaryAggregator.AssetSummaryInput(
                        asset.path(), doc, doc.path("contentSize").asLong()));
            }
            // Round-trip so numeric node types match the stored document
            ObjectNode summary = parseObject(toJson(aggregator.summarize(inputs)), "assetsSummary");

            ObjectNode metadata = parseObject(version.metadata(), "version " + versionId);
            if (summary.equals(metadata.get("assetsSummary"))) {
                return false;
            }
            metadata.set("assetsSummary", summary);
            int updated = handle.attach(VersionDao.class).compareAndSetMetadata(
                    versionId, version.modifiedSeq(), toJson(metadata), ValidationStatus.PENDING);
            if (updated == 0) {
                throw new VersionMetadataConcurrentlyModifiedException(versionId, version.modifiedSeq());
            }
            return true;
        });
        if (written) {
            log.debugf("Version %d assetsSummary updated", versionId);
            taskService.submitUnique(ValidateVersionTask.TYPE, versionId);
        }
        return written;
    }

    /** Version metadata with the fields derived from the dandiset and version identity. */
    public ObjectNode versionDocument(VersionRecord version) {
        ObjectNode doc = parseObject(version.metadata(), "version " + version.id());
        String identifier = String.format("DANDI:%06d", version.dandisetId());
        String dandiset = String.format("%06d", version.dandisetId());
        if (!doc.has(AssetMetadata.SCHEMA_VERSION)) {
            doc.put(AssetMetadata.SCHEMA_VERSION, settings.defaultSchemaVersion());
        }
        if (!doc.has("name")) {
            doc.put("name", version.name());
        }
        doc.put("schemaKey", "Dandiset");
        doc.put("id", identifier + "/" + version.version());
        doc.put("identifier", identifier);
        doc.put("version", version.version());
        doc.put("url", settings.apiUrl() + "/dandiset/" + dandiset + "/" + version.version());
        return doc;
    }

    private ObjectNode parseObject(String json, String owner) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node instanceof ObjectNode object) {
                return object;
            }
            throw new IllegalStateException("Metadata of " + owner + " is not a JSON object");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Metadata of " + owner + " is not JSON", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize: " + value, e);
        }
    }
}
