package io.vizspec.core.compile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.model.Channels;
import java.util.ArrayList;
import java.util.List;

/** Size defaults and size signals of units and layers. */
final class LayoutSignals {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private LayoutSignals() {
        // utility class
    }

    /**
     * The default size of a dimension: a step for a discrete position field, the configured
     * continuous size otherwise.
     */
    static JsonNode defaultSize(JsonNode positionDef, String sizeType, VizConfig config) {
        String fieldType = positionDef != null ? positionDef.path("type").asText("") : "";
        if (Channels.isFieldDef(positionDef) && ("nominal".equals(fieldType) || "ordinal".equals(fieldType))) {
            ObjectNode step = NODES.objectNode();
            step.put("step", config.viewStep());
            return step;
        }
        int continuous = "width".equals(sizeType) ? config.viewContinuousWidth() : config.viewContinuousHeight();
        return NODES.numberNode(continuous);
    }

    /** Width and height signals of a model with its own view size. */
    static List<ObjectNode> sizeSignals(Model model, LayoutSize size) {
        List<ObjectNode> signals = new ArrayList<>();
        addSizeSignals(signals, model, "width", Channels.X, size.width(), 0);
        addSizeSignals(signals, model, "height", Channels.Y, size.height(), 1);
        return signals;
    }

    private static void addSizeSignals(
            List<ObjectNode> signals, Model model, String sizeType, String channel, JsonNode size, int index) {
        if (size == null) {
            return;
        }
        String name = model.getName(sizeType);
        if (LayoutSize.isStep(size)) {
            String stepName = model.getName(channel + "_step");
            ObjectNode step = NODES.objectNode();
            step.put("name", stepName);
            step.set("value", size.get("step"));
            signals.add(step);

            ObjectNode signal = NODES.objectNode();
            signal.put("name", name);
            signal.put(
                    "update", "bandspace(domain('" + model.scaleName(channel) + "').length, 0.1, 0.05) * " + stepName);
            signals.add(signal);
        } else if (LayoutSize.isContainer(size)) {
            int fallback = index == 0 ? model.config().viewContinuousWidth() : model.config().viewContinuousHeight();
            String containerSize = "containerSize()[" + index + "]";
            String expression = "isFinite(" + containerSize + ") ? " + containerSize + " : " + fallback;
            ObjectNode signal = NODES.objectNode();
            signal.put("name", name);
            signal.put("init", expression);
            ObjectNode resize = NODES.objectNode();
            resize.put("events", "window:resize");
            resize.put("update", expression);
            signal.putArray("on").add(resize);
            signals.add(signal);
        } else {
            ObjectNode signal = NODES.objectNode();
            signal.put("name", name);
            signal.set("value", size);
            signals.add(signal);
        }
    }
}
