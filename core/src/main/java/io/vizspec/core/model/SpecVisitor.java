package io.vizspec.core.model;

/**
 * Exhaustive dispatch over the {@link VizSpec} variants.
 *
 * @param <R> result type
 */
public interface SpecVisitor<R> {

    R visitUnit(UnitSpec spec);

    R visitLayer(LayerSpec spec);

    R visitFacet(FacetSpec spec);

    R visitRepeat(RepeatSpec spec);

    R visitConcat(ConcatSpec spec);
}
