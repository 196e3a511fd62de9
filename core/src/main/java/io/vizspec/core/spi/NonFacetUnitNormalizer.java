package io.vizspec.core.spi;

import io.vizspec.core.config.VizConfig;
import io.vizspec.core.model.UnitSpec;
import io.vizspec.core.model.VizSpec;
import io.vizspec.core.normalize.NormalizerParams;

/**
 * A member of the unit normalizer chain. The chain is a fixed ordered list; the first member whose
 * {@link #hasMatchingType} returns {@code true} consumes the unit and no later member sees it.
 */
public interface NonFacetUnitNormalizer {

    /** Short stable name used in logs, e.g. {@code "boxplot"}. */
    String name();

    /** Returns {@code true} if this normalizer expands the given unit under the given config. */
    boolean hasMatchingType(UnitSpec spec, VizConfig config);

    /**
     * Expands a matched unit into a unit or layer subtree.
     *
     * @param spec      the unit, with repeat references already substituted
     * @param params    the active normalization context
     * @param normalize callback that normalizes the produced members
     * @return a unit or layer spec
     */
    VizSpec run(UnitSpec spec, NormalizerParams params, LayerOrUnitNormalizer normalize);

    /** Recursive normalization of a layer member. */
    @FunctionalInterface
    interface LayerOrUnitNormalizer {
        VizSpec normalize(VizSpec spec, NormalizerParams params);
    }
}
