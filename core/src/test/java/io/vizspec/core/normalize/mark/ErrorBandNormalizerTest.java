package io.vizspec.core.normalize.mark;

import static io.vizspec.core.testkit.TestSpecs.json;
import static io.vizspec.core.testkit.TestSpecs.normalize;
import static io.vizspec.core.testkit.TestSpecs.normalized;
import static io.vizspec.core.testkit.TestSpecs.spec;
import static io.vizspec.core.testkit.TestSpecs.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.error.UnsupportedSpecException;
import io.vizspec.core.error.VizSpecException;
import io.vizspec.core.model.VizSpec;
import io.vizspec.core.normalize.CoreNormalizer;
import io.vizspec.core.normalize.NormalizationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ErrorBandNormalizer")
class ErrorBandNormalizerTest {

    private static final String BORDERED_BAND = """
            {"mark": {"type": "errorband", "extent": "iqr", "borders": true, "interpolate": "monotone"},
             "encoding": {"x": {"field": "year", "type": "temporal"},
                          "y": {"field": "price", "type": "quantitative"}}}
            """;

    @Test
    @DisplayName("iqr band: median center, quartile bounds, no calculations")
    void iqrTransform() {
        ObjectNode out = normalized(BORDERED_BAND);

        assertThat(out.get("transform")).isEqualTo(json("""
                [{"aggregate": [{"op": "median", "field": "price", "as": "center_price"},
                                {"op": "q1", "field": "price", "as": "lower_price"},
                                {"op": "q3", "field": "price", "as": "upper_price"}],
                  "groupby": ["year"]}]
                """));
    }

    @Test
    @DisplayName("band area plus one border line per bound, interpolation carried over")
    void borders() {
        JsonNode layer = normalized(BORDERED_BAND).get("layer");

        assertThat(layer).hasSize(3);
        assertThat(layer.get(0).get("mark")).isEqualTo(json("""
                {"type": "area", "style": "errorband-band", "opacity": 0.3,
                 "point": false, "line": false, "interpolate": "monotone"}
                """));
        assertThat(layer.get(0).at("/encoding/y2/field").asText()).isEqualTo("upper_price");
        assertThat(layer.get(1).get("mark")).isEqualTo(json("""
                {"type": "line", "style": "errorband-borders", "point": false, "interpolate": "monotone"}
                """));
        assertThat(layer.get(1).at("/encoding/y/field").asText()).isEqualTo("lower_price");
        assertThat(layer.get(2).at("/encoding/y/field").asText()).isEqualTo("upper_price");
    }

    @Test
    @DisplayName("configured path overlays do not leak into the band members")
    void noOverlaysFromConfig() {
        VizSpec band = spec(BORDERED_BAND);
        VizConfig config = VizConfig.fromJson(json("""
                {"area": {"line": true, "point": true}, "line": {"point": true}}
                """));

        NormalizationResult result = new CoreNormalizer().normalize(band, config);

        assertThat(write(result.spec()).get("layer")).hasSize(3);
    }

    @Test
    void withoutBordersOnlyTheBand() {
        NormalizationResult result = normalize("""
                {"mark": "errorband", "encoding": {"y": {"field": "v", "type": "quantitative"}}}
                """);

        assertThat(write(result.spec()).get("layer")).hasSize(1);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void rejectsUnknownExtent() {
        VizSpec band = spec("""
                {"name": "bad", "mark": {"type": "errorband", "extent": "variance"},
                 "encoding": {"y": {"field": "v", "type": "quantitative"}}}
                """);

        assertThatThrownBy(() -> new CoreNormalizer().normalize(band, VizConfig.defaults()))
                .isInstanceOf(UnsupportedSpecException.class)
                .hasMessageContaining("variance")
                .satisfies(e -> {
                    UnsupportedSpecException unsupported = (UnsupportedSpecException) e;
                    assertThat(unsupported.specName()).isEqualTo("bad");
                    assertThat(unsupported.stage()).isEqualTo(VizSpecException.Stage.NORMALIZE);
                });
    }
}
