package io.vizspec.core.compile;

import io.vizspec.core.error.UnsupportedSpecException;
import io.vizspec.core.error.VizSpecException;
import io.vizspec.core.model.ConcatSpec;
import io.vizspec.core.model.FacetSpec;
import io.vizspec.core.model.LayerSpec;
import io.vizspec.core.model.RepeatSpec;
import io.vizspec.core.model.SpecVisitor;
import io.vizspec.core.model.UnitSpec;
import io.vizspec.core.model.VizSpec;

/**
 * Builds the model tree of a canonical spec, depth-first and left-to-right. Each model builds its
 * own children in its constructor, so declaration order is preserved.
 */
public final class ModelBuilder {

    private ModelBuilder() {
        // utility class
    }

    /**
     * Builds the model of a canonical spec node.
     *
     * @param spec            canonical spec node
     * @param parent          parent model, or {@code null} for the root
     * @param parentGivenName name assigned by the parent; used when the spec has none
     * @param context         per-compilation context
     * @throws UnsupportedSpecException for a repeat spec, which canonical trees never contain
     */
    public static Model build(VizSpec spec, Model parent, String parentGivenName, CompileContext context) {
        return spec.accept(new SpecVisitor<Model>() {
            @Override
            public Model visitUnit(UnitSpec unit) {
                return new UnitModel(unit, parent, parentGivenName, context);
            }

            @Override
            public Model visitLayer(LayerSpec layer) {
                return new LayerModel(layer, parent, parentGivenName, context);
            }

            @Override
            public Model visitFacet(FacetSpec facet) {
                return new FacetModel(facet, parent, parentGivenName, context);
            }

            @Override
            public Model visitRepeat(RepeatSpec repeat) {
                throw new UnsupportedSpecException(
                        "Repeat specs must be normalized into concat specs before compilation",
                        repeat.name(),
                        VizSpecException.Stage.COMPILE);
            }

            @Override
            public Model visitConcat(ConcatSpec concat) {
                return new ConcatModel(concat, parent, parentGivenName, context);
            }
        });
    }
}
