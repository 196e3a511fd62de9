package io.vizspec.core.compile;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Resolved width and height of a model. Each dimension is a number, a {@code {"step": n}} object,
 * the text {@code "container"}, or {@code null} when the model does not define it.
 */
public record LayoutSize(JsonNode width, JsonNode height) {

    public JsonNode get(String sizeType) {
        return "width".equals(sizeType) ? width : height;
    }

    /** Returns {@code true} for a fixed numeric size. */
    public static boolean isFixed(JsonNode size) {
        return size != null && size.isNumber();
    }

    /** Returns {@code true} for a {@code {"step": n}} size. */
    public static boolean isStep(JsonNode size) {
        return size != null && size.isObject() && size.path("step").isNumber();
    }

    public static boolean isContainer(JsonNode size) {
        return size != null && "container".equals(size.asText(null));
    }
}
