package io.vizspec.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.diagnostic.Warning;
import io.vizspec.core.model.VizSpec;
import java.util.List;

/**
 * Outcome of a compilation.
 *
 * @param output         the assembled low-level rendering spec
 * @param normalizedSpec the canonical tree the output was compiled from
 * @param warnings       normalization warnings followed by compilation warnings
 */
public record CompileResult(ObjectNode output, VizSpec normalizedSpec, List<Warning> warnings) {

    /** Copies the collections so the record stays immutable. */
    public CompileResult {
        warnings = List.copyOf(warnings);
    }
}
