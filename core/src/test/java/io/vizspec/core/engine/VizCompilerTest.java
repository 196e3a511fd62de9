package io.vizspec.core.engine;

import static io.vizspec.core.testkit.TestSpecs.json;
import static io.vizspec.core.testkit.TestSpecs.spec;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.diagnostic.Warning;
import io.vizspec.core.diagnostic.WarningKind;
import io.vizspec.core.error.SpecParseException;
import io.vizspec.core.error.UnsupportedSpecException;
import io.vizspec.core.error.VizSpecException;
import io.vizspec.core.model.ConcatSpec;
import io.vizspec.core.normalize.CoreNormalizer;
import io.vizspec.core.spec.SpecParser;
import io.vizspec.core.spi.CompileListener;
import io.vizspec.core.spi.CompileListener.CompileFailedEvent;
import io.vizspec.core.spi.CompileListener.CompiledEvent;
import io.vizspec.core.spi.CompileListener.NormalizedEvent;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("VizCompiler")
class VizCompilerTest {

    private static final String BAR_CHART = """
            {"name": "sales", "title": "Sales by region", "description": "Quarterly sales",
             "data": {"url": "sales.csv"}, "mark": "bar",
             "encoding": {"x": {"field": "region", "type": "nominal"},
                          "y": {"field": "amount", "type": "quantitative"}}}
            """;

    private CapturingListener listener;
    private VizCompiler compiler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        listener = new CapturingListener();
        compiler = new VizCompiler(new SpecParser(), new CoreNormalizer(), VizConfig.defaults(), listener);
    }

    @Nested
    class Output {

        @Test
        @DisplayName("a unit compiles to schema, description, data, signals, marks, axes and title")
        void unitOutput() {
            ObjectNode output = compiler.compile(json(BAR_CHART)).output();

            assertThat(output.fieldNames())
                    .toIterable()
                    .containsExactly("$schema", "description", "data", "signals", "marks", "axes", "title");
            assertThat(output.get("$schema").asText()).isEqualTo(VizCompiler.RENDER_SCHEMA);
            assertThat(output.get("data")).isEqualTo(json("[{\"name\": \"source_0\", \"url\": \"sales.csv\"}]"));
            assertThat(output.get("signals"))
                    .extracting(signal -> signal.get("name").asText())
                    .containsExactly("sales_x_step", "sales_width", "sales_height");
            assertThat(output.at("/marks/0/type").asText()).isEqualTo("rect");
            assertThat(output.get("title")).isEqualTo(json("{\"text\": \"Sales by region\"}"));
        }

        @Test
        @DisplayName("selection stores follow the data sources; top-level signals follow size signals")
        void selectionOutput() {
            ObjectNode output = compiler.compile(json("""
                    {"data": {"values": [{"a": 1}]}, "mark": "point",
                     "selection": {"pick": {"type": "single"}}}
                    """)).output();

            assertThat(output.get("data"))
                    .extracting(data -> data.get("name").asText())
                    .containsExactly("source_0", "pick_store");
            assertThat(output.get("signals"))
                    .extracting(signal -> signal.get("name").asText())
                    .containsExactly("width", "height", "pick", "pick_tuple", "pick_modify");
        }

        @Test
        @DisplayName("a concat root lays out one group per child")
        void concatOutput() {
            ObjectNode output = compiler.compile(json("""
                    {"vconcat": [{"mark": "point"}, {"mark": "bar"}]}
                    """)).output();

            assertThat(output.get("layout")).isEqualTo(json("""
                    {"columns": 1, "bounds": "full", "align": "each"}
                    """));
            assertThat(output.get("marks")).hasSize(2);
            assertThat(output.has("data")).isFalse();
        }

        @Test
        @DisplayName("repeat specs are expanded before the model tree is built")
        void repeatCompiles() {
            CompileResult result = compiler.compile(json("""
                    {"data": {"url": "cars.json"}, "repeat": ["hp", "mpg"],
                     "spec": {"mark": "point",
                              "encoding": {"x": {"field": {"repeat": "repeat"}, "type": "quantitative"}}}}
                    """));

            assertThat(result.normalizedSpec()).isInstanceOf(ConcatSpec.class);
            assertThat(result.output().get("marks")).hasSize(2);
            assertThat(result.output().at("/marks/1/marks/0/encode/update/x/field").asText()).isEqualTo("mpg");
        }
    }

    @Nested
    class Configuration {

        @Test
        @DisplayName("the spec's config property overrides the base config")
        void specConfig() {
            VizCompiler wide = new VizCompiler(
                    new SpecParser(),
                    new CoreNormalizer(),
                    VizConfig.fromJson(json("{\"view\": {\"continuousWidth\": 500, \"continuousHeight\": 100}}")),
                    null);

            ObjectNode output = wide.compile(json("""
                    {"mark": "point", "config": {"view": {"continuousHeight": 300}}}
                    """)).output();

            assertThat(output.get("signals")).containsExactly(
                    json("{\"name\": \"width\", \"value\": 500}"), json("{\"name\": \"height\", \"value\": 300}"));
        }

        @Test
        void compilesYamlFiles() throws IOException {
            Path file = tempDir.resolve("chart.yaml");
            Files.writeString(file, """
                    name: from-file
                    mark: line
                    encoding:
                      x: {field: t, type: temporal}
                    """);

            CompileResult result = compiler.compile(file);

            assertThat(result.normalizedSpec().name()).isEqualTo("from-file");
            assertThat(result.output().at("/marks/0/name").asText()).isEqualTo("from_file_marks");
        }
    }

    @Nested
    class Warnings {

        @Test
        @DisplayName("normalization warnings come before compilation warnings")
        void warningOrder() {
            CompileResult result = compiler.compile(json("""
                    {"hconcat": [{"mark": "point",
                                  "encoding": {"row": {"field": "r", "type": "nominal"},
                                               "facet": {"field": "f", "type": "nominal"}}}],
                     "resolve": {"axis": {"x": "shared"}}}
                    """));

            assertThat(result.warnings())
                    .extracting(Warning::kind)
                    .containsExactly(WarningKind.FACET_CHANNEL_DROPPED, WarningKind.CONCAT_CANNOT_SHARE_AXIS);
        }

        @Test
        void warningsAreImmutable() {
            CompileResult result = compiler.compile(spec("{\"mark\": \"point\"}"));

            assertThatThrownBy(() -> result.warnings().add(null)).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    class Listener {

        @Test
        @DisplayName("a successful compile reports normalized then compiled")
        void successEvents() {
            compiler.compile(json(BAR_CHART));

            assertThat(listener.normalized).containsExactly(new NormalizedEvent("sales", 0));
            assertThat(listener.compiled).singleElement().satisfies(event -> {
                assertThat(event.specName()).isEqualTo("sales");
                assertThat(event.warningCount()).isZero();
                assertThat(event.durationMs()).isGreaterThanOrEqualTo(0);
            });
            assertThat(listener.failed).isEmpty();
        }

        @Test
        @DisplayName("a parse failure is reported once, with the parse stage")
        void parseFailure() {
            assertThatThrownBy(() -> compiler.compile(json("{\"name\": \"broken\", \"data\": {}}")))
                    .isInstanceOf(SpecParseException.class);

            assertThat(listener.failed).singleElement().satisfies(event -> {
                assertThat(event.stage()).isEqualTo(VizSpecException.Stage.PARSE);
                assertThat(event.specName()).isEqualTo("broken");
            });
            assertThat(listener.normalized).isEmpty();
        }

        @Test
        @DisplayName("an unsupported combination is reported with the normalize stage")
        void unsupportedFailure() {
            assertThatThrownBy(() -> compiler.compile(json("""
                            {"name": "bad", "mark": "boxplot",
                             "encoding": {"x": {"field": "a", "type": "nominal"}}}
                            """)))
                    .isInstanceOf(UnsupportedSpecException.class);

            assertThat(listener.failed)
                    .extracting(CompileFailedEvent::stage)
                    .containsExactly(VizSpecException.Stage.NORMALIZE);
            assertThat(listener.compiled).isEmpty();
        }

        @Test
        @DisplayName("a throwing listener never affects the result")
        void throwingListener() {
            CompileListener throwing = mock(CompileListener.class);
            doThrow(new IllegalStateException("metrics down")).when(throwing).onCompiled(any());
            doThrow(new IllegalStateException("metrics down")).when(throwing).onNormalized(any());
            VizCompiler guarded =
                    new VizCompiler(new SpecParser(), new CoreNormalizer(), VizConfig.defaults(), throwing);

            CompileResult result = guarded.compile(json(BAR_CHART));

            assertThat(result.output().get("marks")).hasSize(1);
            verify(throwing).onNormalized(new NormalizedEvent("sales", 0));
            verify(throwing).onCompiled(any(CompiledEvent.class));
            verify(throwing, never()).onCompileFailed(any());
        }

        @Test
        void normalizeAloneReportsOnlyNormalized() {
            compiler.normalize(spec("{\"mark\": {\"type\": \"line\", \"point\": true}}"));

            assertThat(listener.normalized).hasSize(1);
            assertThat(listener.compiled).isEmpty();
        }
    }

    /** Records every event it receives. */
    static final class CapturingListener implements CompileListener {

        final List<NormalizedEvent> normalized = new ArrayList<>();
        final List<CompiledEvent> compiled = new ArrayList<>();
        final List<CompileFailedEvent> failed = new ArrayList<>();

        @Override
        public void onNormalized(NormalizedEvent event) {
            normalized.add(event);
        }

        @Override
        public void onCompiled(CompiledEvent event) {
            compiled.add(event);
        }

        @Override
        public void onCompileFailed(CompileFailedEvent event) {
            failed.add(event);
        }
    }
}
