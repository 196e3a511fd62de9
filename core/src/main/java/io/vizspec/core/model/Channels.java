package io.vizspec.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/** Channel names and channel-definition predicates. */
public final class Channels {

    public static final String ROW = "row";
    public static final String COLUMN = "column";
    public static final String FACET = "facet";

    public static final String X = "x";
    public static final String Y = "y";
    public static final String X2 = "x2";
    public static final String Y2 = "y2";
    public static final String COLOR = "color";
    public static final String SHAPE = "shape";
    public static final String SIZE = "size";
    public static final String OPACITY = "opacity";

    /** Channels that turn a unit into a facet. */
    public static final List<String> FACET_CHANNELS = List.of(ROW, COLUMN, FACET);

    /** Position channels backed by a scale. */
    public static final List<String> POSITION_SCALE_CHANNELS = List.of(X, Y);

    /** Channels encoded through a scale of their own (or of their primary channel for x2/y2). */
    public static final List<String> SCALE_CHANNELS =
            List.of(X, Y, COLOR, "fill", "stroke", SHAPE, SIZE, OPACITY, "fillOpacity", "strokeOpacity");

    private Channels() {
        // utility class
    }

    /**
     * Returns {@code true} if the definition maps a data field: an object with a non-null {@code
     * field}, a {@code count} aggregate, or an array containing such an object.
     */
    public static boolean isFieldDef(JsonNode def) {
        if (def == null) {
            return false;
        }
        if (def.isArray()) {
            for (JsonNode element : def) {
                if (isFieldDef(element)) {
                    return true;
                }
            }
            return false;
        }
        if (!def.isObject()) {
            return false;
        }
        JsonNode field = def.get("field");
        return (field != null && !field.isNull()) || "count".equals(def.path("aggregate").asText(null));
    }

    /** {@code channelHasField}: the encoding maps the channel to a field definition. */
    public static boolean channelHasField(Map<String, JsonNode> encoding, String channel) {
        return encoding != null && isFieldDef(encoding.get(channel));
    }

    /** Datum definitions carry a constant in data space rather than a field. */
    public static boolean isDatumDef(JsonNode def) {
        return def != null && def.isObject() && def.has("datum");
    }

    /** The primary channel of a secondary range channel, e.g. {@code x} for {@code x2}. */
    public static String primaryChannel(String channel) {
        return switch (channel) {
            case X2 -> X;
            case Y2 -> Y;
            default -> channel;
        };
    }

    /** The layout size dimension of a position channel. */
    public static String sizeType(String positionChannel) {
        return X.equals(positionChannel) ? "width" : "height";
    }
}
