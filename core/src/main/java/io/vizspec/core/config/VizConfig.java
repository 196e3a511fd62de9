package io.vizspec.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;

/**
 * Read-only configuration consulted by the unit normalizers' match predicates and by layout size
 * parsing. Built-in defaults are deep-merged with overlays (server defaults, then the spec's own
 * {@code config} property); later overlays win key by key.
 *
 * <p>Immutable and thread-safe: the backing tree is copied on construction and never exposed
 * mutably.
 */
public final class VizConfig {

    private static final ObjectNode DEFAULTS = buildDefaults();
    private static final VizConfig DEFAULT_CONFIG = new VizConfig(DEFAULTS);

    private final ObjectNode root;

    private VizConfig(ObjectNode root) {
        this.root = root;
    }

    /** Returns the built-in defaults. */
    public static VizConfig defaults() {
        return DEFAULT_CONFIG;
    }

    /**
     * Returns the defaults overlaid with the given config object. A null or non-object overlay
     * yields the defaults.
     */
    public static VizConfig fromJson(JsonNode overlay) {
        return DEFAULT_CONFIG.merge(overlay);
    }

    /** Returns a new config with {@code overlay} deep-merged over this one. */
    public VizConfig merge(JsonNode overlay) {
        if (overlay == null || !overlay.isObject() || overlay.isEmpty()) {
            return this;
        }
        ObjectNode merged = root.deepCopy();
        deepMerge(merged, (ObjectNode) overlay);
        return new VizConfig(merged);
    }

    /** Config block for a primitive mark type, e.g. {@code line}; missing node if absent. */
    public JsonNode markConfig(String markType) {
        return root.path(markType);
    }

    /** Config block for a composite mark, e.g. {@code boxplot}; missing node if absent. */
    public JsonNode compositeMarkConfig(String compositeMark) {
        return root.path(compositeMark);
    }

    /** Default width of a view with a continuous x scale. */
    public int viewContinuousWidth() {
        return root.path("view").path("continuousWidth").asInt(200);
    }

    /** Default height of a view with a continuous y scale. */
    public int viewContinuousHeight() {
        return root.path("view").path("continuousHeight").asInt(200);
    }

    /** Default band step of a discrete position scale. */
    public int viewStep() {
        return root.path("view").path("step").asInt(20);
    }

    /** Returns a copy of the full config tree. */
    public ObjectNode toJson() {
        return root.deepCopy();
    }

    private static void deepMerge(ObjectNode target, ObjectNode overlay) {
        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                deepMerge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue().deepCopy());
            }
        }
    }

    private static ObjectNode buildDefaults() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode defaults = f.objectNode();
        ObjectNode view = defaults.putObject("view");
        view.put("continuousWidth", 200);
        view.put("continuousHeight", 200);
        view.put("step", 20);
        defaults.putObject("boxplot").put("extent", 1.5).put("size", 14);
        defaults.putObject("errorbar").put("extent", "stderr");
        defaults.putObject("errorband").put("extent", "stderr");
        defaults.putObject("line");
        defaults.putObject("area");
        defaults.putObject("trail");
        return defaults;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VizConfig that)) return false;
        return root.equals(that.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "VizConfig" + root;
    }
}
