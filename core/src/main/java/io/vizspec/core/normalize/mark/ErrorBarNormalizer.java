package io.vizspec.core.normalize.mark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.model.VizSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Expands {@code errorbar} into a rule, with end ticks when the mark sets {@code ticks}. */
public final class ErrorBarNormalizer extends ErrorExtentNormalizer {

    public static final String ERRORBAR = "errorbar";

    public ErrorBarNormalizer() {
        super(ERRORBAR);
    }

    @Override
    protected List<VizSpec> members(
            ObjectNode markDef, ContinuousAxis axis, String lower, String upper, Map<String, JsonNode> shared) {
        List<VizSpec> members = new ArrayList<>();
        members.add(member(mark("rule", "errorbar-rule"), axis, lower, upper, shared));
        if (markDef.path("ticks").asBoolean(false) || markDef.path("ticks").isObject()) {
            members.add(member(mark("tick", "errorbar-ticks"), axis, lower, null, shared));
            members.add(member(mark("tick", "errorbar-ticks"), axis, upper, null, shared));
        }
        return members;
    }
}
