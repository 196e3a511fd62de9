package io.vizspec.core.normalize.mark;

import com.fasterxml.jackson.databind.JsonNode;
import io.vizspec.core.error.UnsupportedSpecException;
import io.vizspec.core.error.VizSpecException;
import io.vizspec.core.model.Channels;
import io.vizspec.core.model.UnitSpec;

/**
 * The quantitative position channel a composite mark summarizes.
 *
 * @param channel   {@code x} or {@code y}
 * @param secondary {@code x2} or {@code y2}
 * @param field     the summarized field
 * @param title     axis title of the summarized channel
 */
record ContinuousAxis(String channel, String secondary, String field, JsonNode title) {

    /** Mark orientation: a continuous {@code y} axis gives vertical marks. */
    String orient() {
        return Channels.Y.equals(channel) ? "vertical" : "horizontal";
    }

    /**
     * Finds the continuous axis of a composite mark unit. With both axes quantitative the mark's
     * {@code orient} decides, defaulting to vertical.
     *
     * @throws UnsupportedSpecException if neither axis is a quantitative raw field
     */
    static ContinuousAxis of(UnitSpec spec, String markName) {
        JsonNode x = spec.channel(Channels.X);
        JsonNode y = spec.channel(Channels.Y);
        boolean xContinuous = isContinuous(x);
        boolean yContinuous = isContinuous(y);

        String channel;
        if (xContinuous && yContinuous) {
            String orient = spec.markDef().path("orient").asText("vertical");
            channel = "horizontal".equals(orient) ? Channels.X : Channels.Y;
        } else if (xContinuous) {
            channel = Channels.X;
        } else if (yContinuous) {
            channel = Channels.Y;
        } else {
            throw new UnsupportedSpecException(
                    "Need a continuous (quantitative) x or y field for the " + markName + " mark",
                    spec.name(),
                    VizSpecException.Stage.NORMALIZE);
        }
        JsonNode def = Channels.X.equals(channel) ? x : y;
        String field = def.get("field").asText();
        JsonNode title = def.hasNonNull("title") ? def.get("title") : def.get("field");
        return new ContinuousAxis(channel, channel + "2", field, title);
    }

    private static boolean isContinuous(JsonNode def) {
        return def != null
                && def.isObject()
                && def.path("field").isTextual()
                && "quantitative".equals(def.path("type").asText(null))
                && !def.hasNonNull("aggregate");
    }
}
