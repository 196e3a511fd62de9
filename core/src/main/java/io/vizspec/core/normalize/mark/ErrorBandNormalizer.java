package io.vizspec.core.normalize.mark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.model.VizSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Expands {@code errorband} into an area, with border lines when the mark sets {@code borders}. */
public final class ErrorBandNormalizer extends ErrorExtentNormalizer {

    public static final String ERRORBAND = "errorband";

    public ErrorBandNormalizer() {
        super(ERRORBAND);
    }

    @Override
    protected List<VizSpec> members(
            ObjectNode markDef, ContinuousAxis axis, String lower, String upper, Map<String, JsonNode> shared) {
        ObjectNode band = mark("area", "errorband-band");
        band.put("opacity", 0.3);
        // the band must not pick up configured path overlays
        band.put("point", false);
        band.put("line", false);
        JsonNode interpolate = markDef.get("interpolate");
        if (interpolate != null) {
            band.set("interpolate", interpolate);
        }
        List<VizSpec> members = new ArrayList<>();
        members.add(member(band, axis, lower, upper, shared));
        if (markDef.path("borders").asBoolean(false) || markDef.path("borders").isObject()) {
            for (String field : List.of(lower, upper)) {
                ObjectNode border = mark("line", "errorband-borders");
                border.put("point", false);
                if (interpolate != null) {
                    border.set("interpolate", interpolate);
                }
                members.add(member(border, axis, field, null, shared));
            }
        }
        return members;
    }
}
