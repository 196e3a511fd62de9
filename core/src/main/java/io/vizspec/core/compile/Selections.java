package io.vizspec.core.compile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.error.UnsupportedSpecException;
import io.vizspec.core.error.VizSpecException;
import io.vizspec.core.model.Identifiers;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Parsing and assembly of selection definitions. */
final class Selections {

    static final Set<String> TYPES = Set.of("single", "multi", "interval");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Selections() {
        // utility class
    }

    /**
     * Parses a unit's {@code selection} object.
     *
     * @throws UnsupportedSpecException for a selection type other than single, multi or interval
     */
    static Map<String, SelectionComponent> parseUnitSelections(Model model, JsonNode selection) {
        Map<String, SelectionComponent> parsed = new LinkedHashMap<>();
        if (selection == null) {
            return parsed;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = selection.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode def = field.getValue();
            String type = def.path("type").asText(null);
            if (type == null || !TYPES.contains(type)) {
                throw new UnsupportedSpecException(
                        "Unsupported selection type '" + type + "' for selection '" + field.getKey() + "'",
                        model.name(),
                        VizSpecException.Stage.COMPILE);
            }
            String name = Identifiers.varName(field.getKey());
            parsed.put(
                    name,
                    new SelectionComponent(
                            name, type, def.path("resolve").asText("global"), def.deepCopy(), model.name()));
        }
        return parsed;
    }

    /** Merges the children's selections in order; a later child wins on a name collision. */
    static Map<String, SelectionComponent> mergeChildSelections(List<Model> children) {
        Map<String, SelectionComponent> merged = new LinkedHashMap<>();
        for (Model child : children) {
            merged.putAll(child.component().selection());
        }
        return merged;
    }

    /** Per-unit signals: the tuple being selected and the store modification it triggers. */
    static List<ObjectNode> unitSignals(Collection<SelectionComponent> selections) {
        List<ObjectNode> signals = new ArrayList<>();
        for (SelectionComponent selection : selections) {
            String tuple = selection.name() + "_tuple";
            ObjectNode tupleSignal = NODES.objectNode();
            tupleSignal.put("name", tuple);
            tupleSignal.putNull("value");
            signals.add(tupleSignal);

            ObjectNode modify = NODES.objectNode();
            modify.put("name", selection.name() + "_modify");
            modify.put("update", "modify(\"" + selection.storeName() + "\", " + tuple + ", true)");
            signals.add(modify);
        }
        return signals;
    }

    /** Appends one resolving signal per selection not yet present in {@code signals}. */
    static List<ObjectNode> topLevelSignals(Collection<SelectionComponent> selections, List<ObjectNode> signals) {
        List<ObjectNode> out = new ArrayList<>(signals);
        for (SelectionComponent selection : selections) {
            if (containsName(out, selection.name())) {
                continue;
            }
            ObjectNode signal = NODES.objectNode();
            signal.put("name", selection.name());
            signal.put(
                    "update",
                    "vlSelectionResolve(\"" + selection.storeName() + "\", \"" + selection.resolve() + "\")");
            out.add(signal);
        }
        return out;
    }

    /** Appends one store dataset per selection not yet present in {@code data}. */
    static List<ObjectNode> storeData(Collection<SelectionComponent> selections, List<ObjectNode> data) {
        List<ObjectNode> out = new ArrayList<>(data);
        for (SelectionComponent selection : selections) {
            if (containsName(out, selection.storeName())) {
                continue;
            }
            ObjectNode store = NODES.objectNode();
            store.put("name", selection.storeName());
            out.add(store);
        }
        return out;
    }

    private static boolean containsName(List<ObjectNode> nodes, String name) {
        for (ObjectNode node : nodes) {
            if (name.equals(node.path("name").asText(null))) {
                return true;
            }
        }
        return false;
    }
}
