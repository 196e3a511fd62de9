package io.vizspec.core.normalize.mark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.model.Channels;
import io.vizspec.core.model.LayerSpec;
import io.vizspec.core.model.UnitSpec;
import io.vizspec.core.model.VizSpec;
import io.vizspec.core.normalize.NormalizerParams;
import io.vizspec.core.spi.NonFacetUnitNormalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adds point overlays to line, trail and rule marks, and point and/or line overlays to area marks.
 * Overlays come from the mark's {@code point}/{@code line} properties, else from {@code
 * config.<mark>}; a {@code shape} encoding also implies points. The base member's mark disables
 * both overlays explicitly so that normalizing the result again changes nothing.
 */
public final class PathOverlayNormalizer implements NonFacetUnitNormalizer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Set<String> POINT_OVERLAY_MARKS = Set.of("line", "rule", "trail", "area");

    @Override
    public String name() {
        return "path-overlay";
    }

    @Override
    public boolean hasMatchingType(UnitSpec spec, VizConfig config) {
        String type = spec.markType();
        if (type == null || !POINT_OVERLAY_MARKS.contains(type)) {
            return false;
        }
        ObjectNode markDef = spec.markDef();
        JsonNode markConfig = config.markConfig(type);
        if (pointOverlay(markDef, markConfig, spec.encoding()) != null) {
            return true;
        }
        return "area".equals(type) && lineOverlay(markDef, markConfig) != null;
    }

    @Override
    public VizSpec run(UnitSpec spec, NormalizerParams params, LayerOrUnitNormalizer normalize) {
        ObjectNode markDef = spec.markDef();
        String type = markDef.get("type").asText();
        JsonNode markConfig = params.config().markConfig(type);
        ObjectNode pointOverlay = pointOverlay(markDef, markConfig, spec.encoding());
        ObjectNode lineOverlay = "area".equals(type) ? lineOverlay(markDef, markConfig) : null;
        Map<String, JsonNode> encoding = spec.encoding() != null ? spec.encoding() : Map.of();

        ObjectNode baseMark = NODES.objectNode();
        if ("area".equals(type) && !markDef.has("opacity") && !markDef.has("fillOpacity")) {
            baseMark.put("opacity", 0.7);
        }
        baseMark.setAll(markDef);
        baseMark.put("point", false);
        if ("area".equals(type)) {
            baseMark.put("line", false);
        }
        Map<String, JsonNode> baseEncoding = new LinkedHashMap<>(encoding);
        baseEncoding.remove(Channels.SHAPE);

        List<VizSpec> layer = new ArrayList<>();
        layer.add(UnitSpec.builder()
                .mark(baseMark)
                .encoding(baseEncoding)
                .projection(spec.projection())
                .selection(spec.selection())
                .build());

        if (lineOverlay != null) {
            ObjectNode lineMark = NODES.objectNode();
            lineMark.put("type", "line");
            copy(markDef, lineMark, "clip", "interpolate", "tension", "tooltip");
            lineMark.setAll(lineOverlay);
            lineMark.put("point", false);
            layer.add(UnitSpec.builder()
                    .mark(lineMark)
                    .encoding(encoding)
                    .projection(spec.projection())
                    .build());
        }
        if (pointOverlay != null) {
            ObjectNode pointMark = NODES.objectNode();
            pointMark.put("type", "point");
            pointMark.put("opacity", 1);
            pointMark.put("filled", true);
            copy(markDef, pointMark, "clip", "tooltip");
            pointMark.setAll(pointOverlay);
            layer.add(UnitSpec.builder()
                    .mark(pointMark)
                    .encoding(encoding)
                    .projection(spec.projection())
                    .build());
        }

        ObjectNode properties = spec.properties().deepCopy();
        JsonNode resolve = properties.remove("resolve");
        LayerSpec layerSpec = new LayerSpec(
                spec.name(),
                spec.data(),
                layer,
                null,
                null,
                spec.width(),
                spec.height(),
                spec.view(),
                resolve,
                properties);
        return normalize.normalize(layerSpec, params);
    }

    /**
     * Point overlay properties, or {@code null} for none. {@code "transparent"} yields an invisible
     * overlay; an explicit {@code false} disables the overlay regardless of config.
     */
    static ObjectNode pointOverlay(ObjectNode markDef, JsonNode markConfig, Map<String, JsonNode> encoding) {
        JsonNode point = markDef.get("point");
        if (point != null && !point.isNull()) {
            if ("transparent".equals(point.asText(null))) {
                ObjectNode transparent = NODES.objectNode();
                transparent.put("opacity", 0);
                return transparent;
            }
            if (point.isObject()) {
                return ((ObjectNode) point).deepCopy();
            }
            return point.asBoolean(false) ? NODES.objectNode() : null;
        }
        JsonNode configured = markConfig.path("point");
        boolean shapeEncoded = encoding != null && encoding.containsKey(Channels.SHAPE);
        if (configured.asBoolean(false) || configured.isObject() || shapeEncoded) {
            return configured.isObject() ? ((ObjectNode) configured).deepCopy() : NODES.objectNode();
        }
        return null;
    }

    /** Line overlay properties of an area, or {@code null} for none. */
    static ObjectNode lineOverlay(ObjectNode markDef, JsonNode markConfig) {
        JsonNode line = markDef.get("line");
        if (line == null || line.isNull()) {
            line = markConfig.path("line");
        }
        if (line.isObject()) {
            return ((ObjectNode) line).deepCopy();
        }
        return line.asBoolean(false) ? NODES.objectNode() : null;
    }

    private static void copy(ObjectNode from, ObjectNode to, String... properties) {
        for (String property : properties) {
            JsonNode value = from.get(property);
            if (value != null) {
                to.set(property, value);
            }
        }
    }
}
