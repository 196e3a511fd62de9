package io.vizspec.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Layout properties of a composition. {@code align}, {@code center} and {@code spacing} are either
 * a single value or an object keyed by {@code row}/{@code column}.
 */
public record CompositionLayout(JsonNode align, JsonNode center, JsonNode spacing, JsonNode bounds, Integer columns) {

    public static final CompositionLayout EMPTY = new CompositionLayout(null, null, null, null, null);

    /** Canonical constructor normalizing JSON nulls. */
    public CompositionLayout {
        align = Specs.absentToNull(align);
        center = Specs.absentToNull(center);
        spacing = Specs.absentToNull(spacing);
        bounds = Specs.absentToNull(bounds);
    }

    public CompositionLayout withColumns(Integer columns) {
        return new CompositionLayout(align, center, spacing, bounds, columns);
    }

    /** Returns a layout where every property present in {@code override} replaces this one's. */
    public CompositionLayout overlay(CompositionLayout override) {
        return new CompositionLayout(
                override.align != null ? override.align : align,
                override.center != null ? override.center : center,
                override.spacing != null ? override.spacing : spacing,
                override.bounds != null ? override.bounds : bounds,
                override.columns != null ? override.columns : columns);
    }

    public boolean isEmpty() {
        return align == null && center == null && spacing == null && bounds == null && columns == null;
    }
}
