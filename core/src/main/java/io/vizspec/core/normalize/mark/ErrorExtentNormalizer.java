package io.vizspec.core.normalize.mark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.error.UnsupportedSpecException;
import io.vizspec.core.error.VizSpecException;
import io.vizspec.core.model.LayerSpec;
import io.vizspec.core.model.UnitSpec;
import io.vizspec.core.model.VizSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared summary of error bars and error bands: each extent yields a {@code lower_<field>} and
 * {@code upper_<field>} pair around a center.
 */
abstract class ErrorExtentNormalizer extends CompositeMarkNormalizer {

    static final List<String> EXTENTS = List.of("stderr", "stdev", "ci", "iqr");

    ErrorExtentNormalizer(String markName) {
        super(markName);
    }

    @Override
    protected final LayerSpec expand(
            UnitSpec spec, ObjectNode markDef, ContinuousAxis axis, Map<String, JsonNode> shared, VizConfig config) {
        String extent = markProperty(markDef, config, "extent").asText("stderr");
        if (!EXTENTS.contains(extent)) {
            throw new UnsupportedSpecException(
                    "Unsupported " + name() + " extent '" + extent + "', expected one of " + EXTENTS,
                    spec.name(),
                    VizSpecException.Stage.NORMALIZE);
        }
        String field = axis.field();
        String center = "center_" + field;
        String lower = "lower_" + field;
        String upper = "upper_" + field;

        ArrayNode ops = NODES.arrayNode();
        List<ObjectNode> calculations = new ArrayList<>();
        switch (extent) {
            case "ci" -> {
                ops.add(aggregateOp("mean", field, center));
                ops.add(aggregateOp("ci0", field, lower));
                ops.add(aggregateOp("ci1", field, upper));
            }
            case "iqr" -> {
                ops.add(aggregateOp("median", field, center));
                ops.add(aggregateOp("q1", field, lower));
                ops.add(aggregateOp("q3", field, upper));
            }
            default -> {
                String spread = "extent_" + field;
                ops.add(aggregateOp("mean", field, center));
                ops.add(aggregateOp(extent, field, spread));
                calculations.add(calculate(datum(center) + " - " + datum(spread), lower));
                calculations.add(calculate(datum(center) + " + " + datum(spread), upper));
            }
        }
        ObjectNode aggregate = NODES.objectNode();
        aggregate.set("aggregate", ops);
        aggregate.set("groupby", groupBy(shared));

        List<ObjectNode> transforms = new ArrayList<>();
        transforms.add(aggregate);
        transforms.addAll(calculations);
        return layer(spec, transforms, members(markDef, axis, lower, upper, shared));
    }

    /** The primitive-mark members plotting the {@code lower}..{@code upper} range. */
    protected abstract List<VizSpec> members(
            ObjectNode markDef, ContinuousAxis axis, String lower, String upper, Map<String, JsonNode> shared);
}
