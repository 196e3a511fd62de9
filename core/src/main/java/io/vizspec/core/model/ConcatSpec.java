package io.vizspec.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/** Children placed side by side ({@code hconcat}), stacked ({@code vconcat}) or wrapped ({@code concat}). */
public record ConcatSpec(
        String name,
        JsonNode data,
        ConcatKind kind,
        List<VizSpec> children,
        CompositionLayout layout,
        JsonNode resolve,
        ObjectNode properties)
        implements VizSpec {

    public ConcatSpec {
        data = Specs.absentToNull(data);
        children = Specs.copyList(children);
        layout = layout != null ? layout : CompositionLayout.EMPTY;
        resolve = Specs.absentToNull(resolve);
        properties = Specs.copyProperties(properties);
    }

    @Override
    public ConcatSpec withName(String name) {
        return new ConcatSpec(name, data, kind, children, layout, resolve, properties);
    }

    @Override
    public ConcatSpec withData(JsonNode data) {
        return new ConcatSpec(name, data, kind, children, layout, resolve, properties);
    }

    public ConcatSpec withChildren(List<VizSpec> children) {
        return new ConcatSpec(name, data, kind, children, layout, resolve, properties);
    }

    @Override
    public <R> R accept(SpecVisitor<R> visitor) {
        return visitor.visitConcat(this);
    }
}
