package io.vizspec.core.compile;

import io.vizspec.core.error.UnsupportedSpecException;
import io.vizspec.core.error.VizSpecException;
import java.util.Map;

/** Maps primitive mark types onto rendering mark types. */
final class MarkTypes {

    private static final Map<String, String> RENDER_TYPES = Map.ofEntries(
            Map.entry("area", "area"),
            Map.entry("arc", "arc"),
            Map.entry("bar", "rect"),
            Map.entry("circle", "symbol"),
            Map.entry("geoshape", "shape"),
            Map.entry("image", "image"),
            Map.entry("line", "line"),
            Map.entry("point", "symbol"),
            Map.entry("rect", "rect"),
            Map.entry("rule", "rule"),
            Map.entry("square", "symbol"),
            Map.entry("text", "text"),
            Map.entry("tick", "rect"),
            Map.entry("trail", "trail"));

    private MarkTypes() {
        // utility class
    }

    /**
     * Returns the rendering mark type.
     *
     * @throws UnsupportedSpecException for composite or unknown mark types
     */
    static String renderType(String markType, String modelName) {
        String type = markType != null ? RENDER_TYPES.get(markType) : null;
        if (type == null) {
            throw new UnsupportedSpecException(
                    "Unsupported mark type '" + markType + "'", modelName, VizSpecException.Stage.COMPILE);
        }
        return type;
    }
}
