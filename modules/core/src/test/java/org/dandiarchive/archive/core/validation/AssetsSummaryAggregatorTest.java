package org.dandiarchive.archive.core.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dandiarchive.archive.core.validation.AssetsSummaryAggregator.AssetSummaryInput;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AssetsSummaryAggregatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AssetsSummaryAggregator aggregator = new AssetsSummaryAggregator(mapper);

    @Test
    void emptyVersionHasOnlyTotals() {
        ObjectNode summary = aggregator.summarize(List.of());

        assertThat(summary.get("schemaKey").asText()).isEqualTo("AssetsSummary");
        assertThat(summary.get("numberOfBytes").asLong()).isZero();
        assertThat(summary.get("numberOfFiles").asInt()).isZero();
        assertThat(summary.has("numberOfSubjects")).isFalse();
        assertThat(summary.has("species")).isFalse();
        assertThat(summary.has("dataStandard")).isFalse();
    }

    @Test
    void countsDistinctSubjectsAndSpecies() {
        ObjectNode one = participant("sub-01", "Mus musculus");
        ObjectNode two = participant("sub-02", "Mus musculus");
        ObjectNode again = participant("sub-01", "Mus musculus");

        ObjectNode summary = aggregator.summarize(List.of(
                new AssetSummaryInput("sub-01/a.nwb", one, 10),
                new AssetSummaryInput("sub-02/b.nwb", two, 20),
                new AssetSummaryInput("sub-01/c.nwb", again, 30)));

        assertThat(summary.get("numberOfSubjects").asInt()).isEqualTo(2);
        assertThat(summary.get("numberOfBytes").asLong()).isEqualTo(60);
        assertThat(summary.get("species")).hasSize(1);
    }

    @Test
    void detectsDataStandardsFromEncodingAndPaths() {
        ObjectNode nwb = mapper.createObjectNode().put("encodingFormat", "application/x-nwb");
        ObjectNode plain = mapper.createObjectNode();

        ObjectNode summary = aggregator.summarize(List.of(
                new AssetSummaryInput("a.nwb", nwb, 1),
                new AssetSummaryInput("dataset_description.json", plain, 1),
                new AssetSummaryInput("image.ome.zarr", plain, 1)));

        assertThat(summary.get("dataStandard"))
                .extracting(node -> node.get("identifier").asText())
                .containsExactly("RRID:SCR_015242", "RRID:SCR_016124", "DOI:10.25504/FAIRsharing.9af712");
    }

    @Test
    void collectsDistinctApproaches() {
        ObjectNode a = mapper.createObjectNode();
        a.putArray("approach").addObject().put("name", "electrophysiological approach");
        ObjectNode b = a.deepCopy();

        ObjectNode summary = aggregator.summarize(List.of(
                new AssetSummaryInput("a.nwb", a, 1),
                new AssetSummaryInput("b.nwb", b, 1)));

        assertThat(summary.get("approach")).hasSize(1);
    }

    private ObjectNode participant(String id, String species) {
        ObjectNode md = mapper.createObjectNode();
        ObjectNode p = md.putArray("wasAttributedTo").addObject();
        p.put("schemaKey", "Participant");
        p.put("identifier", id);
        p.putObject("species").put("name", species);
        return md;
    }
}
