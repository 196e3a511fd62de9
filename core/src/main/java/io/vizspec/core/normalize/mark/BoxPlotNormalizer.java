package io.vizspec.core.normalize.mark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.model.LayerSpec;
import io.vizspec.core.model.UnitSpec;
import io.vizspec.core.model.VizSpec;
import java.util.List;
import java.util.Map;

/**
 * Expands {@code boxplot} into whisker rules, a box bar and a median tick. The {@code extent} is
 * either {@code "min-max"} or the IQR multiplier {@code k} of Tukey whiskers.
 */
public final class BoxPlotNormalizer extends CompositeMarkNormalizer {

    public static final String BOXPLOT = "boxplot";

    public BoxPlotNormalizer() {
        super(BOXPLOT);
    }

    @Override
    protected LayerSpec expand(
            UnitSpec spec, ObjectNode markDef, ContinuousAxis axis, Map<String, JsonNode> shared, VizConfig config) {
        String field = axis.field();
        String lowerBox = "lower_box_" + field;
        String upperBox = "upper_box_" + field;
        String midBox = "mid_box_" + field;
        String lowerWhisker = "lower_whisker_" + field;
        String upperWhisker = "upper_whisker_" + field;

        JsonNode extent = markProperty(markDef, config, "extent");
        boolean minMax = "min-max".equals(extent.asText(null));

        ArrayNode ops = NODES.arrayNode();
        ops.add(aggregateOp("q1", field, lowerBox));
        ops.add(aggregateOp("q3", field, upperBox));
        ops.add(aggregateOp("median", field, midBox));
        ops.add(aggregateOp("min", field, minMax ? lowerWhisker : "min_" + field));
        ops.add(aggregateOp("max", field, minMax ? upperWhisker : "max_" + field));
        ObjectNode aggregate = NODES.objectNode();
        aggregate.set("aggregate", ops);
        aggregate.set("groupby", groupBy(shared));

        List<ObjectNode> transforms;
        if (minMax) {
            transforms = List.of(aggregate);
        } else {
            double k = extent.isNumber() ? extent.asDouble() : 1.5;
            String iqr = "iqr_" + field;
            transforms = List.of(
                    aggregate,
                    calculate(datum(upperBox) + " - " + datum(lowerBox), iqr),
                    calculate(
                            "max(" + datum("min_" + field) + ", " + datum(lowerBox) + " - " + k + " * " + datum(iqr)
                                    + ")",
                            lowerWhisker),
                    calculate(
                            "min(" + datum("max_" + field) + ", " + datum(upperBox) + " + " + k + " * " + datum(iqr)
                                    + ")",
                            upperWhisker));
        }

        JsonNode size = markProperty(markDef, config, "size");
        ObjectNode box = mark("bar", "boxplot-box");
        box.put("orient", axis.orient());
        ObjectNode median = mark("tick", "boxplot-median");
        median.put("orient", axis.orient());
        median.put("color", "white");
        if (!size.isMissingNode()) {
            box.set("size", size);
            median.set("size", size);
        }

        List<VizSpec> members = List.of(
                member(mark("rule", "boxplot-rule"), axis, lowerWhisker, lowerBox, shared),
                member(mark("rule", "boxplot-rule"), axis, upperBox, upperWhisker, shared),
                member(box, axis, lowerBox, upperBox, shared),
                member(median, axis, midBox, null, shared));
        return layer(spec, transforms, members);
    }
}
