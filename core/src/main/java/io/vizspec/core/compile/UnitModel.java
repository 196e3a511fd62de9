package io.vizspec.core.compile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.model.Channels;
import io.vizspec.core.model.UnitSpec;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** A single mark. Leaf of the model tree. */
public final class UnitModel extends Model {

    private static final Set<String> STROKED_MARKS = Set.of("line", "rule", "trail");

    /** Mark properties that do not become static encodings. */
    private static final Set<String> NON_ENCODED_MARK_PROPERTIES =
            Set.of("type", "style", "point", "line", "clip", "tooltip", "filled", "extent", "ticks", "borders");

    private final UnitSpec spec;
    private final String renderType;

    public UnitModel(UnitSpec spec, Model parent, String parentGivenName, CompileContext context) {
        super(spec, "unit", parent, parentGivenName, context);
        this.spec = spec;
        this.renderType = MarkTypes.renderType(spec.markType(), name());
    }

    @Override
    public UnitSpec spec() {
        return spec;
    }

    public String markType() {
        return spec.markType();
    }

    @Override
    protected JsonNode view() {
        return spec.view();
    }

    @Override
    protected void doParseData() {
        parseOwnData();
    }

    @Override
    protected void doParseSelections() {
        component.setSelection(Selections.parseUnitSelections(this, spec.selection()));
    }

    @Override
    protected void doParseMarkGroup() {
        ObjectNode mark = NODES.objectNode();
        mark.put("name", getName("marks"));
        mark.put("type", renderType);
        mark.putArray("style").add(spec.markType());
        ObjectNode markDef = spec.markDef();
        if (markDef.hasNonNull("clip")) {
            mark.set("clip", markDef.get("clip"));
        }
        String source = component.data().source();
        if (source != null) {
            mark.putObject("from").put("data", source);
        }
        mark.putObject("encode").set("update", encodeUpdate(markDef));

        ArrayNode marks = NODES.arrayNode();
        marks.add(mark);
        component.setMarks(marks);
    }

    private ObjectNode encodeUpdate(ObjectNode markDef) {
        ObjectNode update = NODES.objectNode();
        if (spec.encoding() != null) {
            for (Map.Entry<String, JsonNode> entry : spec.encoding().entrySet()) {
                ObjectNode ref = channelRef(entry.getKey(), entry.getValue());
                if (ref != null) {
                    update.set(encodeChannel(entry.getKey()), ref);
                }
            }
        }
        Iterator<Map.Entry<String, JsonNode>> properties = markDef.fields();
        while (properties.hasNext()) {
            Map.Entry<String, JsonNode> property = properties.next();
            String channel = encodeChannel(property.getKey());
            if (!NON_ENCODED_MARK_PROPERTIES.contains(property.getKey()) && !update.has(channel)) {
                update.set(channel, valueRef(property.getValue()));
            }
        }
        return update;
    }

    /** {@code color} is drawn as stroke for path-like marks and as fill otherwise. */
    private String encodeChannel(String channel) {
        if (Channels.COLOR.equals(channel)) {
            return STROKED_MARKS.contains(spec.markType()) ? "stroke" : "fill";
        }
        return channel;
    }

    private ObjectNode channelRef(String channel, JsonNode def) {
        if (!def.isObject()) {
            return null;
        }
        String scaleChannel = Channels.primaryChannel(channel);
        boolean scaled = Channels.SCALE_CHANNELS.contains(scaleChannel);
        ObjectNode ref = NODES.objectNode();
        if (Channels.isFieldDef(def)) {
            if (scaled) {
                ref.put("scale", scaleName(scaleChannel));
            }
            ref.put("field", fieldName(def));
            return ref;
        }
        if (Channels.isDatumDef(def)) {
            if (scaled) {
                ref.put("scale", scaleName(scaleChannel));
            }
            ref.set("value", def.get("datum").deepCopy());
            return ref;
        }
        if (def.has("value")) {
            return valueRef(def.get("value"));
        }
        return null;
    }

    /** Output field name: aggregated fields are prefixed with their operation. */
    private static String fieldName(JsonNode fieldDef) {
        String aggregate = fieldDef.path("aggregate").asText(null);
        if ("count".equals(aggregate)) {
            return "__count";
        }
        String field = fieldDef.path("field").asText();
        return aggregate != null ? aggregate + "_" + field : field;
    }

    @Override
    protected void doParseAxesAndHeaders() {
        ArrayNode axes = NODES.arrayNode();
        for (String channel : Channels.POSITION_SCALE_CHANNELS) {
            JsonNode def = spec.channel(channel);
            if (!(Channels.isFieldDef(def) || Channels.isDatumDef(def)) || !def.isObject()) {
                continue;
            }
            JsonNode axisDef = def.get("axis");
            if (axisDef != null && axisDef.isNull()) {
                continue;
            }
            ObjectNode axis = NODES.objectNode();
            axis.put("scale", scaleName(channel));
            axis.put("orient", Channels.X.equals(channel) ? "bottom" : "left");
            JsonNode title = def.hasNonNull("title") ? def.get("title") : def.get("field");
            if (title != null && title.isValueNode()) {
                axis.set("title", title.deepCopy());
            }
            if ("quantitative".equals(def.path("type").asText(null))) {
                axis.put("grid", true);
            }
            if (axisDef != null && axisDef.isObject()) {
                axis.setAll(((ObjectNode) axisDef).deepCopy());
            }
            axes.add(axis);
        }
        component.setAxes(axes);
    }

    @Override
    protected void doParseLayoutSize() {
        JsonNode width = spec.width() != null
                ? spec.width()
                : LayoutSignals.defaultSize(spec.channel(Channels.X), "width", config());
        JsonNode height = spec.height() != null
                ? spec.height()
                : LayoutSignals.defaultSize(spec.channel(Channels.Y), "height", config());
        component.setLayoutSize(new LayoutSize(width, height));
    }

    @Override
    public List<ObjectNode> assembleSignals() {
        requireParsed("assemble signals");
        return Selections.unitSignals(component.selection().values());
    }

    @Override
    public List<ObjectNode> assembleLayoutSignals() {
        requireParsed("assemble layout signals");
        if (parent() instanceof LayerModel) {
            // sized by the enclosing layer
            return List.of();
        }
        return LayoutSignals.sizeSignals(this, component.layoutSize());
    }

    @Override
    public List<ObjectNode> assembleSelectionTopLevelSignals(List<ObjectNode> signals) {
        requireParsed("assemble selection signals");
        return Selections.topLevelSignals(component.selection().values(), signals);
    }

    @Override
    public List<ObjectNode> assembleSelectionData(List<ObjectNode> data) {
        requireParsed("assemble selection data");
        return Selections.storeData(component.selection().values(), data);
    }

    @Override
    public ArrayNode assembleMarks() {
        requireParsed("assemble marks");
        return component.marks().deepCopy();
    }
}
