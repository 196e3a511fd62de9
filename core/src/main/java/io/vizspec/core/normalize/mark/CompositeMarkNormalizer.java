package io.vizspec.core.normalize.mark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.model.Channels;
import io.vizspec.core.model.LayerSpec;
import io.vizspec.core.model.UnitSpec;
import io.vizspec.core.model.VizSpec;
import io.vizspec.core.normalize.NormalizerParams;
import io.vizspec.core.spi.NonFacetUnitNormalizer;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base class of the composite marks. A composite mark unit matches on its mark type and expands
 * into a layer: one shared summarizing transform on the layer, primitive-mark members below it.
 */
abstract class CompositeMarkNormalizer implements NonFacetUnitNormalizer {

    protected static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final String markName;

    protected CompositeMarkNormalizer(String markName) {
        this.markName = markName;
    }

    @Override
    public String name() {
        return markName;
    }

    @Override
    public boolean hasMatchingType(UnitSpec spec, VizConfig config) {
        return markName.equals(spec.markType());
    }

    @Override
    public final VizSpec run(UnitSpec spec, NormalizerParams params, LayerOrUnitNormalizer normalize) {
        ContinuousAxis axis = ContinuousAxis.of(spec, markName);
        Map<String, JsonNode> shared = sharedEncoding(spec, axis);
        LayerSpec layer = expand(spec, spec.markDef(), axis, shared, params.config());
        return normalize.normalize(layer, params);
    }

    /**
     * Builds the layer replacing the composite mark unit.
     *
     * @param spec    the composite mark unit
     * @param markDef the mark as a definition object
     * @param axis    the summarized axis
     * @param shared  encoding channels every member keeps
     * @param config  active configuration
     */
    protected abstract LayerSpec expand(
            UnitSpec spec, ObjectNode markDef, ContinuousAxis axis, Map<String, JsonNode> shared, VizConfig config);

    /** A mark property, falling back to {@code config.<markName>.<property>}. */
    protected JsonNode markProperty(ObjectNode markDef, VizConfig config, String property) {
        JsonNode value = markDef.get(property);
        if (value != null && !value.isNull()) {
            return value;
        }
        return config.compositeMarkConfig(markName).path(property);
    }

    /** Encoding minus the summarized channel, its secondary channel and {@code size}. */
    private static Map<String, JsonNode> sharedEncoding(UnitSpec spec, ContinuousAxis axis) {
        Map<String, JsonNode> shared = new LinkedHashMap<>(spec.encoding());
        shared.remove(axis.channel());
        shared.remove(axis.secondary());
        shared.remove(Channels.SIZE);
        return shared;
    }

    /** Raw (non-aggregated) fields of the shared encoding; the summary is grouped by them. */
    protected static ArrayNode groupBy(Map<String, JsonNode> shared) {
        Set<String> fields = new LinkedHashSet<>();
        for (JsonNode def : shared.values()) {
            if (def.isObject() && def.path("field").isTextual() && !def.hasNonNull("aggregate")) {
                fields.add(def.get("field").asText());
            }
        }
        ArrayNode groupBy = NODES.arrayNode();
        fields.forEach(groupBy::add);
        return groupBy;
    }

    protected static ObjectNode aggregateOp(String op, String field, String as) {
        ObjectNode node = NODES.objectNode();
        node.put("op", op);
        node.put("field", field);
        node.put("as", as);
        return node;
    }

    protected static ObjectNode calculate(String expression, String as) {
        ObjectNode node = NODES.objectNode();
        node.put("calculate", expression);
        node.put("as", as);
        return node;
    }

    protected static String datum(String field) {
        return "datum[\"" + field + "\"]";
    }

    /** A member mark definition with the given type and style. */
    protected static ObjectNode mark(String type, String style) {
        ObjectNode mark = NODES.objectNode();
        mark.put("type", type);
        mark.put("style", style);
        return mark;
    }

    /**
     * A layer member plotting {@code field} (and {@code field2} when not null) on the summarized
     * axis, plus the shared channels.
     */
    protected static UnitSpec member(
            ObjectNode mark, ContinuousAxis axis, String field, String field2, Map<String, JsonNode> shared) {
        Map<String, JsonNode> encoding = new LinkedHashMap<>(shared);
        ObjectNode main = NODES.objectNode();
        main.put("field", field);
        main.put("type", "quantitative");
        if (axis.title() != null) {
            main.set("title", axis.title());
        }
        encoding.put(axis.channel(), main);
        if (field2 != null) {
            ObjectNode secondary = NODES.objectNode();
            secondary.put("field", field2);
            encoding.put(axis.secondary(), secondary);
        }
        return UnitSpec.builder().mark(mark).encoding(encoding).build();
    }

    /**
     * Wraps the members into a layer carrying the unit's name, data, size, view and properties.
     * The summarizing transforms are appended after any transform the unit declared.
     */
    protected static LayerSpec layer(UnitSpec spec, List<ObjectNode> transforms, List<VizSpec> members) {
        ObjectNode properties = spec.properties().deepCopy();
        ArrayNode transform = NODES.arrayNode();
        JsonNode declared = properties.get("transform");
        if (declared != null && declared.isArray()) {
            transform.addAll((ArrayNode) declared);
        }
        transforms.forEach(transform::add);
        properties.set("transform", transform);
        JsonNode resolve = properties.remove("resolve");
        return new LayerSpec(
                spec.name(),
                spec.data(),
                members,
                null,
                null,
                spec.width(),
                spec.height(),
                spec.view(),
                resolve,
                properties);
    }
}
