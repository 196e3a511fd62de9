package io.vizspec.core.compile;

import static io.vizspec.core.testkit.TestSpecs.model;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vizspec.core.diagnostic.Diagnostics;
import io.vizspec.core.error.UnsupportedSpecException;
import io.vizspec.core.error.VizSpecException;
import org.junit.jupiter.api.Test;

class ModelBuilderTest {

    @Test
    void buildsOneModelPerNodeInDeclarationOrder() {
        Model root = model("""
                {"vconcat": [
                  {"mark": "point"},
                  {"layer": [{"mark": "line"}, {"mark": "area"}]},
                  {"facet": {"field": "f", "type": "nominal"}, "spec": {"mark": "bar"}}]}
                """, new Diagnostics());

        assertThat(root).isInstanceOf(ConcatModel.class);
        assertThat(root.children())
                .extracting(Model::type)
                .containsExactly("unit", "layer", "facet");
        assertThat(root.children().get(1).children())
                .extracting(child -> ((UnitModel) child).markType())
                .containsExactly("line", "area");
        assertThat(((FacetModel) root.children().get(2)).child().name()).isEqualTo("concat_2_child");
        assertThat(root.children().get(0).parent()).isSameAs(root);
    }

    @Test
    void repeatSpecsAreRejected() {
        assertThatThrownBy(() -> model("""
                        {"name": "grid", "repeat": ["a", "b"], "spec": {"mark": "point"}}
                        """, new Diagnostics()))
                .isInstanceOf(UnsupportedSpecException.class)
                .hasMessageContaining("normalized")
                .extracting(e -> ((VizSpecException) e).stage())
                .isEqualTo(VizSpecException.Stage.COMPILE);
    }
}
