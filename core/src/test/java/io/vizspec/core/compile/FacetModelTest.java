package io.vizspec.core.compile;

import static io.vizspec.core.testkit.TestSpecs.json;
import static io.vizspec.core.testkit.TestSpecs.parsedModel;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FacetModel")
class FacetModelTest {

    private static final String ROW_COLUMN = """
            {"name": "grid", "data": {"url": "cars.json"},
             "facet": {"row": {"field": "origin", "type": "nominal"},
                       "column": {"field": "cylinders", "type": "ordinal"}},
             "spec": {"mark": "point", "encoding": {"x": {"field": "hp", "type": "quantitative"}}}}
            """;

    @Test
    @DisplayName("a column facet adds a domain source counting the columns")
    void sources() {
        List<ObjectNode> sources = parsedModel(ROW_COLUMN).assembleSources(List.of());

        assertThat(sources).containsExactly(
                (ObjectNode) json("{\"name\": \"source_0\", \"url\": \"cars.json\"}"),
                (ObjectNode) json("""
                        {"name": "grid_column_domain", "source": "source_0",
                         "transform": [{"type": "aggregate", "groupby": ["cylinders"]}]}
                        """));
    }

    @Test
    @DisplayName("one cell group partitions the source by the facet fields")
    void cellGroup() {
        JsonNode cell = parsedModel(ROW_COLUMN).assembleMarks().get(0);

        assertThat(cell.get("name").asText()).isEqualTo("grid_cell");
        assertThat(cell.get("style").asText()).isEqualTo("cell");
        assertThat(cell.at("/from/facet")).isEqualTo(json("""
                {"name": "grid_facet", "data": "source_0", "groupby": ["origin", "cylinders"]}
                """));
        assertThat(cell.at("/encode/update/width/signal").asText()).isEqualTo("grid_child_width");
        assertThat(cell.at("/marks/0/from/data").asText()).isEqualTo("grid_facet");
        assertThat(cell.at("/axes/0/scale").asText()).isEqualTo("grid_child_x");
    }

    @Test
    void rowColumnLayout() {
        assertThat(parsedModel(ROW_COLUMN).assembleLayout()).isEqualTo(json("""
                {"columns": {"signal": "length(data('grid_column_domain'))"}, "bounds": "full", "align": "all"}
                """));
    }

    @Test
    @DisplayName("a flat facet wraps by its explicit columns and needs no domain source")
    void flatFacet() {
        Model facet = parsedModel("""
                {"data": {"url": "weather.csv"}, "columns": 3,
                 "facet": {"field": "site", "type": "nominal"},
                 "spec": {"mark": "bar"}}
                """);

        assertThat(facet.assembleSources(List.of())).hasSize(1);
        assertThat(facet.assembleLayout())
                .isEqualTo(json("{\"columns\": 3, \"bounds\": \"full\", \"align\": \"all\"}"));
        assertThat(facet.assembleMarks().at("/0/from/facet/groupby")).isEqualTo(json("[\"site\"]"));
    }

    @Test
    @DisplayName("without data the cell has no facet source")
    void withoutData() {
        Model facet = parsedModel("""
                {"facet": {"row": {"field": "a", "type": "nominal"}}, "spec": {"mark": "point"}}
                """);

        JsonNode cell = facet.assembleMarks().get(0);
        assertThat(cell.has("from")).isFalse();
        assertThat(cell.at("/marks/0").has("from")).isFalse();
        assertThat(facet.assembleLayout().get("columns").asInt()).isEqualTo(1);
    }
}
