package io.vizspec.core.normalize;

import io.vizspec.core.error.UnsupportedSpecException;
import io.vizspec.core.error.VizSpecException;
import io.vizspec.core.model.ConcatSpec;
import io.vizspec.core.model.FacetSpec;
import io.vizspec.core.model.LayerSpec;
import io.vizspec.core.model.RepeatSpec;
import io.vizspec.core.model.SpecVisitor;
import io.vizspec.core.model.UnitSpec;
import io.vizspec.core.model.VizSpec;
import java.util.ArrayList;
import java.util.List;

/**
 * Generic recursive rewrite over the spec variants. Subclasses decide what happens to units and
 * repeats; the default layer, facet and concat handlers only recurse into children, preserving
 * their declaration order.
 */
public abstract class SpecMapper {

    /** Maps any spec node by dispatching on its variant. */
    public VizSpec map(VizSpec spec, NormalizerParams params) {
        return spec.accept(new Dispatch(params));
    }

    /** Maps a unit into a unit or a layer. */
    public abstract VizSpec mapUnit(UnitSpec spec, NormalizerParams params);

    /** Maps a repeat; repeats never survive mapping. */
    protected abstract VizSpec mapRepeat(RepeatSpec spec, NormalizerParams params);

    public VizSpec mapLayer(LayerSpec spec, NormalizerParams params) {
        List<VizSpec> members = new ArrayList<>(spec.layer().size());
        for (VizSpec member : spec.layer()) {
            members.add(mapLayerOrUnit(member, params));
        }
        return spec.withLayer(members);
    }

    /**
     * Maps a layer member. Layers may only contain units and layers.
     *
     * @throws UnsupportedSpecException for any other variant
     */
    public VizSpec mapLayerOrUnit(VizSpec spec, NormalizerParams params) {
        if (spec instanceof LayerSpec layer) {
            return mapLayer(layer, params);
        }
        if (spec instanceof UnitSpec unit) {
            return mapUnit(unit, params);
        }
        throw new UnsupportedSpecException(
                "Invalid spec: a layer may only contain unit or layer specs, found "
                        + spec.getClass().getSimpleName(),
                spec.name(),
                VizSpecException.Stage.NORMALIZE);
    }

    public VizSpec mapFacet(FacetSpec spec, NormalizerParams params) {
        return spec.withSpec(map(spec.spec(), params));
    }

    public VizSpec mapConcat(ConcatSpec spec, NormalizerParams params) {
        List<VizSpec> children = new ArrayList<>(spec.children().size());
        for (VizSpec child : spec.children()) {
            children.add(map(child, params));
        }
        return spec.withChildren(children);
    }

    private final class Dispatch implements SpecVisitor<VizSpec> {

        private final NormalizerParams params;

        Dispatch(NormalizerParams params) {
            this.params = params;
        }

        @Override
        public VizSpec visitUnit(UnitSpec spec) {
            return mapUnit(spec, params);
        }

        @Override
        public VizSpec visitLayer(LayerSpec spec) {
            return mapLayer(spec, params);
        }

        @Override
        public VizSpec visitFacet(FacetSpec spec) {
            return mapFacet(spec, params);
        }

        @Override
        public VizSpec visitRepeat(RepeatSpec spec) {
            return mapRepeat(spec, params);
        }

        @Override
        public VizSpec visitConcat(ConcatSpec spec) {
            return mapConcat(spec, params);
        }
    }
}
