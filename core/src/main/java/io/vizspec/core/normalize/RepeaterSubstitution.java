package io.vizspec.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.diagnostic.Diagnostics;
import io.vizspec.core.model.Channels;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Substitutes repeat references ({@code {"field": {"repeat": "row"}}}) with the values bound by
 * the active {@link Repeater}. Unresolvable references are dropped with a warning.
 */
public final class RepeaterSubstitution {

    private RepeaterSubstitution() {
        // utility class
    }

    /**
     * Substitutes every channel of an encoding. Array-valued channels are substituted element-wise.
     *
     * @return the substituted encoding, or {@code null} if {@code encoding} is null
     */
    public static Map<String, JsonNode> replaceInEncoding(
            Map<String, JsonNode> encoding, Repeater repeater, Diagnostics diagnostics) {
        if (encoding == null) {
            return null;
        }
        Map<String, JsonNode> out = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : encoding.entrySet()) {
            JsonNode def = entry.getValue();
            if (def.isArray()) {
                ArrayNode replaced = JsonNodeFactory.instance.arrayNode();
                for (JsonNode element : def) {
                    JsonNode r = replaceInChannelDef(element, repeater, diagnostics);
                    if (r != null) {
                        replaced.add(r);
                    }
                }
                out.put(entry.getKey(), replaced);
            } else {
                JsonNode r = replaceInChannelDef(def, repeater, diagnostics);
                if (r != null) {
                    out.put(entry.getKey(), r);
                }
            }
        }
        return out;
    }

    /**
     * Substitutes a facet definition: either a single field definition, or a row/column mapping
     * in which unresolvable channels are removed.
     *
     * @return the substituted facet, or {@code null} when no facet field is left after dropping
     *     unresolvable references
     */
    public static JsonNode replaceInFacet(JsonNode facet, Repeater repeater, Diagnostics diagnostics) {
        if (facet == null || !facet.isObject()) {
            return facet;
        }
        ObjectNode facetObject = (ObjectNode) facet;
        if (!isFacetMapping(facetObject)) {
            return replaceInFieldDef(facetObject, repeater, diagnostics);
        }
        ObjectNode mapping = facetObject.deepCopy();
        for (String channel : new String[] {Channels.ROW, Channels.COLUMN}) {
            JsonNode def = mapping.get(channel);
            if (def != null && def.isObject()) {
                ObjectNode replaced = replaceInFieldDef((ObjectNode) def, repeater, diagnostics);
                if (replaced != null) {
                    mapping.set(channel, replaced);
                } else {
                    mapping.remove(channel);
                }
            }
        }
        return isFacetMapping(mapping) ? mapping : null;
    }

    private static boolean isFacetMapping(ObjectNode facet) {
        return facet.has(Channels.ROW) || facet.has(Channels.COLUMN);
    }

    private static JsonNode replaceInChannelDef(JsonNode def, Repeater repeater, Diagnostics diagnostics) {
        if (!def.isObject()) {
            return def;
        }
        ObjectNode object = (ObjectNode) def;
        if (Channels.isFieldDef(object)) {
            ObjectNode replaced = replaceInFieldDef(object, repeater, diagnostics);
            if (replaced != null) {
                return replaced;
            }
            if (object.has("condition")) {
                ObjectNode conditionOnly = JsonNodeFactory.instance.objectNode();
                conditionOnly.set("condition", object.get("condition"));
                return conditionOnly;
            }
            return null;
        }
        JsonNode condition = object.get("condition");
        if (condition != null && condition.isObject() && Channels.isFieldDef(condition)) {
            ObjectNode replacedCondition = replaceInFieldDef((ObjectNode) condition, repeater, diagnostics);
            ObjectNode copy = object.deepCopy();
            if (replacedCondition != null) {
                copy.set("condition", replacedCondition);
            } else {
                copy.remove("condition");
            }
            return copy;
        }
        return def;
    }

    private static ObjectNode replaceInFieldDef(ObjectNode fieldDef, Repeater repeater, Diagnostics diagnostics) {
        ObjectNode replaced = replaceRepeat(fieldDef, repeater, diagnostics);
        if (replaced == null) {
            return null;
        }
        JsonNode sort = replaced.get("sort");
        if (sort != null && sort.isObject() && sort.has("field")) {
            ObjectNode replacedSort = replaceRepeat((ObjectNode) sort, repeater, diagnostics);
            if (replacedSort != null && replacedSort != sort) {
                replaced = replaced == fieldDef ? fieldDef.deepCopy() : replaced;
                replaced.set("sort", replacedSort);
            }
        }
        return replaced;
    }

    /** Returns the object with its field reference resolved, the same object if none, or null. */
    private static ObjectNode replaceRepeat(ObjectNode object, Repeater repeater, Diagnostics diagnostics) {
        JsonNode field = object.get("field");
        if (field == null || !field.isObject() || !field.path("repeat").isTextual()) {
            return object;
        }
        String key = field.get("repeat").asText();
        String value = repeater != null ? repeater.value(key) : null;
        if (value == null) {
            diagnostics.noSuchRepeatedValue(key);
            return null;
        }
        ObjectNode copy = object.deepCopy();
        copy.put("field", value);
        return copy;
    }
}
