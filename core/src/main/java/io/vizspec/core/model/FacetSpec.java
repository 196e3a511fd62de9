package io.vizspec.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Repeats an inner unit or layer once per distinct value of a field.
 *
 * @param facet either a single field definition or a mapping keyed by {@code row}/{@code column}
 */
public record FacetSpec(
        String name,
        JsonNode data,
        JsonNode facet,
        VizSpec spec,
        CompositionLayout layout,
        JsonNode resolve,
        ObjectNode properties)
        implements VizSpec {

    /** Canonical constructor with defensive copies. */
    public FacetSpec {
        data = Specs.absentToNull(data);
        layout = layout != null ? layout : CompositionLayout.EMPTY;
        resolve = Specs.absentToNull(resolve);
        properties = Specs.copyProperties(properties);
    }

    /** Returns {@code true} for the row/column form of the facet definition. */
    public boolean isFacetMapping() {
        return isFacetMapping(facet);
    }

    /** Returns {@code true} if the facet definition is keyed by {@code row} and/or {@code column}. */
    public static boolean isFacetMapping(JsonNode facet) {
        return facet != null
                && facet.isObject()
                && (Specs.absentToNull(facet.get(Channels.ROW)) != null
                        || Specs.absentToNull(facet.get(Channels.COLUMN)) != null);
    }

    @Override
    public FacetSpec withName(String name) {
        return new FacetSpec(name, data, facet, spec, layout, resolve, properties);
    }

    @Override
    public FacetSpec withData(JsonNode data) {
        return new FacetSpec(name, data, facet, spec, layout, resolve, properties);
    }

    public FacetSpec withFacet(JsonNode facet) {
        return new FacetSpec(name, data, facet, spec, layout, resolve, properties);
    }

    public FacetSpec withSpec(VizSpec spec) {
        return new FacetSpec(name, data, facet, spec, layout, resolve, properties);
    }

    public FacetSpec withLayout(CompositionLayout layout) {
        return new FacetSpec(name, data, facet, spec, layout, resolve, properties);
    }

    @Override
    public <R> R accept(SpecVisitor<R> visitor) {
        return visitor.visitFacet(this);
    }
}
