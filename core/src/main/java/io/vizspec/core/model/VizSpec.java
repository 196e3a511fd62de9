package io.vizspec.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A node of a visualization spec tree. The variant set is closed: every consumer dispatches
 * through {@link SpecVisitor}, so adding a variant is a compile error until all visitors handle
 * it.
 *
 * <p>Nodes are immutable values. {@link #properties()} carries the top-level properties the
 * variant does not model itself (title, description, transform, ...) and is never mutated after
 * construction.
 */
public sealed interface VizSpec permits UnitSpec, LayerSpec, FacetSpec, RepeatSpec, ConcatSpec {

    /** Explicit node name, or {@code null}. */
    String name();

    /** Explicit data definition, or {@code null} when the node inherits its data. */
    JsonNode data();

    /** Pass-through properties, never null. */
    ObjectNode properties();

    VizSpec withName(String name);

    VizSpec withData(JsonNode data);

    <R> R accept(SpecVisitor<R> visitor);
}
