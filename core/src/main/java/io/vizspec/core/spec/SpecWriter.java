package io.vizspec.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.model.CompositionLayout;
import io.vizspec.core.model.ConcatSpec;
import io.vizspec.core.model.FacetSpec;
import io.vizspec.core.model.LayerSpec;
import io.vizspec.core.model.RepeatDefinition;
import io.vizspec.core.model.RepeatSpec;
import io.vizspec.core.model.SpecVisitor;
import io.vizspec.core.model.UnitSpec;
import io.vizspec.core.model.VizSpec;
import java.util.List;
import java.util.Map;

/**
 * Writes {@link VizSpec} trees back to JSON. Key order is deterministic: {@code name}, {@code
 * data}, the preserved properties in their original order, the variant's own fields, then layout
 * fields. Absent values are omitted, never written as null.
 */
public final class SpecWriter implements SpecVisitor<ObjectNode> {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final SpecWriter INSTANCE = new SpecWriter();

    private SpecWriter() {}

    /** Writes the given spec tree. */
    public static ObjectNode write(VizSpec spec) {
        return spec.accept(INSTANCE);
    }

    @Override
    public ObjectNode visitUnit(UnitSpec spec) {
        ObjectNode out = header(spec);
        out.set("mark", spec.mark().deepCopy());
        putEncoding(out, spec.encoding());
        putIfPresent(out, "projection", spec.projection());
        putIfPresent(out, "selection", spec.selection());
        putIfPresent(out, "width", spec.width());
        putIfPresent(out, "height", spec.height());
        putIfPresent(out, "view", spec.view());
        return out;
    }

    @Override
    public ObjectNode visitLayer(LayerSpec spec) {
        ObjectNode out = header(spec);
        out.set("layer", writeAll(spec.layer()));
        putEncoding(out, spec.encoding());
        putIfPresent(out, "projection", spec.projection());
        putIfPresent(out, "width", spec.width());
        putIfPresent(out, "height", spec.height());
        putIfPresent(out, "view", spec.view());
        putIfPresent(out, "resolve", spec.resolve());
        return out;
    }

    @Override
    public ObjectNode visitFacet(FacetSpec spec) {
        ObjectNode out = header(spec);
        out.set("facet", spec.facet().deepCopy());
        out.set("spec", write(spec.spec()));
        putIfPresent(out, "resolve", spec.resolve());
        putLayout(out, spec.layout());
        return out;
    }

    @Override
    public ObjectNode visitRepeat(RepeatSpec spec) {
        ObjectNode out = header(spec);
        RepeatDefinition repeat = spec.repeat();
        if (repeat.isFlat()) {
            out.set("repeat", strings(repeat.values()));
        } else {
            ObjectNode rowColumn = out.putObject("repeat");
            if (repeat.row() != null) {
                rowColumn.set("row", strings(repeat.row()));
            }
            if (repeat.column() != null) {
                rowColumn.set("column", strings(repeat.column()));
            }
        }
        out.set("spec", write(spec.spec()));
        putIfPresent(out, "resolve", spec.resolve());
        putLayout(out, spec.layout());
        return out;
    }

    @Override
    public ObjectNode visitConcat(ConcatSpec spec) {
        ObjectNode out = header(spec);
        out.set(spec.kind().key(), writeAll(spec.children()));
        putIfPresent(out, "resolve", spec.resolve());
        putLayout(out, spec.layout());
        return out;
    }

    private static ObjectNode header(VizSpec spec) {
        ObjectNode out = NODES.objectNode();
        if (spec.name() != null) {
            out.put("name", spec.name());
        }
        putIfPresent(out, "data", spec.data());
        out.setAll(spec.properties().deepCopy());
        return out;
    }

    private static ArrayNode writeAll(List<VizSpec> specs) {
        ArrayNode array = NODES.arrayNode();
        specs.forEach(child -> array.add(write(child)));
        return array;
    }

    private static ArrayNode strings(List<String> values) {
        ArrayNode array = NODES.arrayNode();
        values.forEach(array::add);
        return array;
    }

    private static void putEncoding(ObjectNode out, Map<String, JsonNode> encoding) {
        if (encoding == null) {
            return;
        }
        ObjectNode node = out.putObject("encoding");
        encoding.forEach((channel, def) -> node.set(channel, def.deepCopy()));
    }

    private static void putLayout(ObjectNode out, CompositionLayout layout) {
        putIfPresent(out, "align", layout.align());
        putIfPresent(out, "center", layout.center());
        putIfPresent(out, "spacing", layout.spacing());
        putIfPresent(out, "bounds", layout.bounds());
        if (layout.columns() != null) {
            out.put("columns", layout.columns());
        }
    }

    private static void putIfPresent(ObjectNode out, String key, JsonNode value) {
        if (value != null) {
            out.set(key, value.deepCopy());
        }
    }
}
