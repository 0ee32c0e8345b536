package org.dandiarchive.archive.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.asset.AssetMetadataComposer;
import org.dandiarchive.archive.util.AssetPaths;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the {@code assetsSummary} block of a version's metadata from the
 * metadata of its live assets.
 *
 * <p>Collections keep first-seen order over the input, so the same asset list
 * always yields the same summary.
 */
@ApplicationScoped
public class AssetsSummaryAggregator {

    /** A live asset's stored metadata with the size of its content. */
    public record AssetSummaryInput(String path, JsonNode metadata, long contentSize) {}

    private static final String NWB_ENCODING = "application/x-nwb";

    private final ObjectMapper objectMapper;

    @Inject
    public AssetsSummaryAggregator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode summarize(List<AssetSummaryInput> assets) {
        long bytes = 0;
        Set<String> subjects = new LinkedHashSet<>();
        Set<JsonNode> species = new LinkedHashSet<>();
        Set<JsonNode> approach = new LinkedHashSet<>();
        Set<JsonNode> techniques = new LinkedHashSet<>();
        Set<JsonNode> variables = new LinkedHashSet<>();
        boolean nwb = false;
        boolean bids = false;
        boolean ngff = false;

        for (AssetSummaryInput asset : assets) {
            bytes += asset.contentSize();
            JsonNode md = asset.metadata();
            for (JsonNode attributed : md.path("wasAttributedTo")) {
                if ("Participant".equals(attributed.path("schemaKey").asText())) {
                    String id = attributed.path("identifier").asText(null);
                    if (id != null) {
                        subjects.add(id);
                    }
                    JsonNode sp = attributed.get("species");
                    if (sp != null && !sp.isNull()) {
                        species.add(sp);
                    }
                }
            }
            md.path("approach").forEach(approach::add);
            md.path("measurementTechnique").forEach(techniques::add);
            md.path("variableMeasured").forEach(variables::add);

            String encoding = md.path("encodingFormat").asText("");
            nwb |= NWB_ENCODING.equals(encoding);
            ngff |= asset.path().endsWith(".ome.zarr")
                    || (AssetMetadataComposer.ZARR_ENCODING.equals(encoding) && asset.path().contains(".ome."));
            bids |= "dataset_description.json".equals(AssetPaths.basename(asset.path()));
        }

        ObjectNode summary = objectMapper.createObjectNode();
        summary.put("schemaKey", "AssetsSummary");
        summary.put("numberOfBytes", bytes);
        summary.put("numberOfFiles", assets.size());
        if (!subjects.isEmpty()) {
            summary.put("numberOfSubjects", subjects.size());
        }
        putList(summary, "species", species);
        putList(summary, "approach", approach);
        putList(summary, "measurementTechnique", techniques);
        putList(summary, "variableMeasured", variables);

        ArrayNode standards = objectMapper.createArrayNode();
        if (nwb) {
            standards.add(standard("Neurodata Without Borders (NWB)", "RRID:SCR_015242"));
        }
        if (bids) {
            standards.add(standard("Brain Imaging Data Structure (BIDS)", "RRID:SCR_016124"));
        }
        if (ngff) {
            standards.add(standard("OME/NGFF Standard", "DOI:10.25504/FAIRsharing.9af712"));
        }
        if (!standards.isEmpty()) {
            summary.set("dataStandard", standards);
        }
        return summary;
    }

    private void putList(ObjectNode target, String field, Set<JsonNode> values) {
        if (!values.isEmpty()) {
            ArrayNode array = target.putArray(field);
            values.forEach(array::add);
        }
    }

    private ObjectNode standard(String name, String identifier) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("schemaKey", "StandardsType");
        node.put("name", name);
        node.put("identifier", identifier);
        return node;
    }
}
