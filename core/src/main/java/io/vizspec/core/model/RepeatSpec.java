package io.vizspec.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Repeats a template spec once per repeat value; normalization expands it into a concat. */
public record RepeatSpec(
        String name,
        JsonNode data,
        RepeatDefinition repeat,
        VizSpec spec,
        CompositionLayout layout,
        JsonNode resolve,
        ObjectNode properties)
        implements VizSpec {

    /** Canonical constructor with defensive copies. */
    public RepeatSpec {
        data = Specs.absentToNull(data);
        layout = layout != null ? layout : CompositionLayout.EMPTY;
        resolve = Specs.absentToNull(resolve);
        properties = Specs.copyProperties(properties);
    }

    @Override
    public RepeatSpec withName(String name) {
        return new RepeatSpec(name, data, repeat, spec, layout, resolve, properties);
    }

    @Override
    public RepeatSpec withData(JsonNode data) {
        return new RepeatSpec(name, data, repeat, spec, layout, resolve, properties);
    }

    @Override
    public <R> R accept(SpecVisitor<R> visitor) {
        return visitor.visitRepeat(this);
    }
}
