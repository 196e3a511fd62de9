package io.vizspec.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;

/**
 * Units or layers drawn on top of each other. The layer's own encoding and projection are shared
 * with every member; normalization pushes them down and removes them from the canonical layer.
 */
public record LayerSpec(
        String name,
        JsonNode data,
        List<VizSpec> layer,
        Map<String, JsonNode> encoding,
        JsonNode projection,
        JsonNode width,
        JsonNode height,
        JsonNode view,
        JsonNode resolve,
        ObjectNode properties)
        implements VizSpec {

    /** Canonical constructor with defensive copies. */
    public LayerSpec {
        data = Specs.absentToNull(data);
        layer = Specs.copyList(layer);
        encoding = Specs.copyEncoding(encoding);
        projection = Specs.absentToNull(projection);
        width = Specs.absentToNull(width);
        height = Specs.absentToNull(height);
        view = Specs.absentToNull(view);
        resolve = Specs.absentToNull(resolve);
        properties = Specs.copyProperties(properties);
    }

    /** Convenience constructor for a bare layer. */
    public LayerSpec(List<VizSpec> layer, ObjectNode properties) {
        this(null, null, layer, null, null, null, null, null, null, properties);
    }

    @Override
    public LayerSpec withName(String name) {
        return new LayerSpec(name, data, layer, encoding, projection, width, height, view, resolve, properties);
    }

    @Override
    public LayerSpec withData(JsonNode data) {
        return new LayerSpec(name, data, layer, encoding, projection, width, height, view, resolve, properties);
    }

    public LayerSpec withLayer(List<VizSpec> layer) {
        return new LayerSpec(name, data, layer, encoding, projection, width, height, view, resolve, properties);
    }

    /** Returns a copy with the shared encoding and projection removed. */
    public LayerSpec withoutSharedEncoding() {
        return new LayerSpec(name, data, layer, null, null, width, height, view, resolve, properties);
    }

    @Override
    public <R> R accept(SpecVisitor<R> visitor) {
        return visitor.visitLayer(this);
    }
}
