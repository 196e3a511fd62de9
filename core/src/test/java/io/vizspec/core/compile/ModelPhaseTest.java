package io.vizspec.core.compile;

import static io.vizspec.core.testkit.TestSpecs.model;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vizspec.core.diagnostic.Diagnostics;
import io.vizspec.core.error.PhaseOrderException;
import io.vizspec.core.error.VizSpecException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Model phase order")
class ModelPhaseTest {

    private static final String CONCAT = """
            {"name": "dashboard",
             "hconcat": [{"mark": "point"}, {"layer": [{"mark": "line"}, {"mark": "rule"}]}]}
            """;

    @Test
    void phasesFollowTheirFixedOrder() {
        assertThat(Phase.CONSTRUCTED.next()).isEqualTo(Phase.DATA);
        assertThat(Phase.DATA.next()).isEqualTo(Phase.SELECTIONS);
        assertThat(Phase.AXES_AND_HEADERS.next()).isEqualTo(Phase.LAYOUT_SIZE);
        assertThat(Phase.LAYOUT_SIZE.next()).isNull();
    }

    @Test
    @DisplayName("parse() drives the whole tree into the last phase")
    void parseReachesEveryNode() {
        Model root = model(CONCAT, new Diagnostics());

        root.parse();

        assertThat(root.phase()).isEqualTo(Phase.LAYOUT_SIZE);
        Model layer = root.children().get(1);
        assertThat(root.children()).allSatisfy(child -> assertThat(child.phase()).isEqualTo(Phase.LAYOUT_SIZE));
        assertThat(layer.children()).allSatisfy(member -> assertThat(member.phase()).isEqualTo(Phase.LAYOUT_SIZE));
    }

    @Test
    void skippingAPhaseFails() {
        Model root = model(CONCAT, new Diagnostics());

        assertThatThrownBy(root::parseSelections)
                .isInstanceOf(PhaseOrderException.class)
                .hasMessage("Cannot enter phase SELECTIONS of model 'dashboard' from phase CONSTRUCTED")
                .satisfies(e -> {
                    PhaseOrderException error = (PhaseOrderException) e;
                    assertThat(error.specName()).isEqualTo("dashboard");
                    assertThat(error.stage()).isEqualTo(VizSpecException.Stage.COMPILE);
                });
    }

    @Test
    void repeatingAPhaseFails() {
        Model root = model(CONCAT, new Diagnostics());
        root.parseData();

        assertThatThrownBy(root::parseData).isInstanceOf(PhaseOrderException.class);
    }

    @Test
    @DisplayName("assembling before the last phase fails")
    void assembleBeforeParseCompletes() {
        Model root = model(CONCAT, new Diagnostics());
        root.parseData();
        root.parseSelections();

        assertThatThrownBy(root::assembleMarks)
                .isInstanceOf(PhaseOrderException.class)
                .hasMessageContaining("before parsing completed (phase SELECTIONS)");
        assertThatThrownBy(() -> root.children().get(0).assembleSignals())
                .isInstanceOf(PhaseOrderException.class);
    }

    @Test
    @DisplayName("children are named by position under their parent's name")
    void childNames() {
        Model root = model(CONCAT, new Diagnostics());

        Model layer = root.children().get(1);
        assertThat(root.children().get(0).name()).isEqualTo("dashboard_concat_0");
        assertThat(layer.name()).isEqualTo("dashboard_concat_1");
        assertThat(layer.children().get(1).name()).isEqualTo("dashboard_concat_1_layer_1");
        assertThat(layer.children().get(0).scaleName("x")).isEqualTo("dashboard_concat_1_x");
    }

    @Test
    void unnamedRootUsesBareSuffixes() {
        Model root = model("{\"mark\": \"bar\"}", new Diagnostics());

        assertThat(root.name()).isNull();
        assertThat(root.getName("marks")).isEqualTo("marks");
        assertThat(model("{\"name\": \"sales chart\", \"mark\": \"bar\"}", new Diagnostics()).getName("marks"))
                .isEqualTo("sales_chart_marks");
    }
}
