package io.vizspec.core.normalize;

import io.vizspec.core.diagnostic.Warning;
import io.vizspec.core.model.VizSpec;
import java.util.List;

/**
 * A canonical spec tree and the warnings emitted while producing it.
 *
 * @param spec     canonical tree: no repeat nodes, no facet channels inside unit encodings
 * @param warnings corrective actions, in the order they were taken
 */
public record NormalizationResult(VizSpec spec, List<Warning> warnings) {

    /** Canonical constructor with defensive copies. */
    public NormalizationResult {
        warnings = List.copyOf(warnings);
    }
}
