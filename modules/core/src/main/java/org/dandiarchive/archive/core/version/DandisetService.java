package org.dandiarchive.archive.core.version;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.asset.AssetMetadata;
import org.dandiarchive.archive.core.config.ArchiveSettings;
import org.dandiarchive.archive.core.dao.AssetDao;
import org.dandiarchive.archive.core.dao.AssetRecord;
import org.dandiarchive.archive.core.dao.DandisetDao;
import org.dandiarchive.archive.core.dao.DandisetRecord;
import org.dandiarchive.archive.core.dao.VersionDao;
import org.dandiarchive.archive.core.dao.VersionRecord;
import org.dandiarchive.archive.core.error.ContentNotFoundException;
import org.dandiarchive.archive.core.error.VersionImmutableException;
import org.dandiarchive.archive.core.task.TaskService;
import org.dandiarchive.archive.core.validation.ValidateVersionTask;
import org.dandiarchive.archive.types.EmbargoStatus;
import org.dandiarchive.archive.types.ValidationStatus;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Dandisets, their versions, and explicit lookups of assets by id or version.
 */
@ApplicationScoped
public class DandisetService {

    private static final Logger log = Logger.getLogger(DandisetService.class);

    private final Jdbi jdbi;
    private final ObjectMapper objectMapper;
    private final ArchiveSettings settings;
    private final TaskService taskService;

    @Inject
    public DandisetService(Jdbi jdbi, ObjectMapper objectMapper, ArchiveSettings settings, TaskService taskService) {
        this.jdbi = jdbi;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.taskService = taskService;
    }

    /**
     * Creates a dandiset with an empty draft version.
     *
     * @return the draft version
     */
    public VersionRecord createDandiset(String name, ObjectNode metadata, EmbargoStatus embargoStatus) {
        ObjectNode md = prepare(name, metadata);
        VersionRecord draft = jdbi.inTransaction(handle -> {
            long dandisetId = handle.attach(DandisetDao.class).insert(embargoStatus);
            VersionDao versions = handle.attach(VersionDao.class);
            long versionId = versions.insert(dandisetId, VersionRecord.DRAFT, name, toJson(md),
                    ValidationStatus.PENDING);
            return versions.findById(versionId).orElseThrow();
        });
        taskService.submitUnique(ValidateVersionTask.TYPE, draft.id());
        log.infof("Created dandiset %06d (%s)", draft.dandisetId(), embargoStatus);
        return draft;
    }

    /**
     * Replaces the draft's metadata. The computed {@code assetsSummary} is kept.
     *
     * @throws VersionImmutableException if the version is not a draft
     */
    public VersionRecord updateDraftMetadata(long versionId, String name, ObjectNode metadata) {
        ObjectNode md = prepare(name, metadata);
        VersionRecord updated = jdbi.inTransaction(handle -> {
            VersionDao versions = handle.attach(VersionDao.class);
            VersionRecord version = versions.lockById(versionId)
                    .orElseThrow(() -> new ContentNotFoundException("Version", versionId));
            if (!version.isDraft()) {
                throw new VersionImmutableException(version.id(), version.version());
            }
            JsonNode summary = parse(version.metadata()).get("assetsSummary");
            if (summary != null) {
                md.set("assetsSummary", summary);
            }
            versions.updateMetadata(versionId, name, toJson(md), ValidationStatus.PENDING);
            return versions.findById(versionId).orElseThrow();
        });
        taskService.submitUnique(ValidateVersionTask.TYPE, versionId);
        return updated;
    }

    public Optional<DandisetRecord> getDandiset(long dandisetId) {
        return jdbi.withExtension(DandisetDao.class, dao -> dao.findById(dandisetId));
    }

    public Optional<VersionRecord> getVersion(long versionId) {
        return jdbi.withExtension(VersionDao.class, dao -> dao.findById(versionId));
    }

    public Optional<VersionRecord> getDraft(long dandisetId) {
        return jdbi.withExtension(VersionDao.class, dao -> dao.findDraft(dandisetId));
    }

    public List<VersionRecord> versionsOf(long dandisetId) {
        return jdbi.withExtension(VersionDao.class, dao -> dao.findByDandiset(dandisetId));
    }

    public Optional<AssetRecord> getAsset(UUID assetId) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.findByAssetId(assetId));
    }

    public List<AssetRecord> assetsOfVersion(long versionId) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.findLiveByVersion(versionId));
    }

    private ObjectNode prepare(String name, ObjectNode metadata) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dandiset name must not be blank");
        }
        ObjectNode md = metadata != null ? metadata.deepCopy() : objectMapper.createObjectNode();
        md.put("name", name);
        if (!md.has(AssetMetadata.SCHEMA_VERSION)) {
            md.put(AssetMetadata.SCHEMA_VERSION, settings.defaultSchemaVersion());
        }
        md.remove(List.of("id", "identifier", "version", "url", "assetsSummary"));
        return md;
    }

    private JsonNode parse(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored version metadata is not JSON", e);
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
