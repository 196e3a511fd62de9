package io.vizspec.core.normalize.mark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.model.Channels;
import io.vizspec.core.model.UnitSpec;
import io.vizspec.core.model.VizSpec;
import io.vizspec.core.normalize.NormalizerParams;
import io.vizspec.core.spi.NonFacetUnitNormalizer;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rewrites the deprecated {@code scale.rangeStep} of {@code x}/{@code y} into {@code width}/{@code
 * height: {"step": n}}. A size the unit already declares wins over the moved step.
 */
public final class RangeStepNormalizer implements NonFacetUnitNormalizer {

    @Override
    public String name() {
        return "range-step";
    }

    @Override
    public boolean hasMatchingType(UnitSpec spec, VizConfig config) {
        for (String channel : Channels.POSITION_SCALE_CHANNELS) {
            if (rangeStep(spec.channel(channel)) != null) {
                return true;
            }
        }
        return false;
    }

    @Override
    public VizSpec run(UnitSpec spec, NormalizerParams params, LayerOrUnitNormalizer normalize) {
        Map<String, JsonNode> encoding = new LinkedHashMap<>(spec.encoding());
        UnitSpec.Builder builder = spec.toBuilder();
        for (String channel : Channels.POSITION_SCALE_CHANNELS) {
            JsonNode def = encoding.get(channel);
            JsonNode rangeStep = rangeStep(def);
            if (rangeStep == null) {
                continue;
            }
            ObjectNode step = JsonNodeFactory.instance.objectNode();
            step.set("step", rangeStep);
            if ("width".equals(Channels.sizeType(channel))) {
                builder.width(spec.width() != null ? spec.width() : step);
            } else {
                builder.height(spec.height() != null ? spec.height() : step);
            }
            params.diagnostics().rangeStepDeprecated(channel);

            ObjectNode defWithoutRangeStep = ((ObjectNode) def).deepCopy();
            ObjectNode scale = (ObjectNode) defWithoutRangeStep.get("scale");
            scale.remove("rangeStep");
            if (scale.isEmpty()) {
                defWithoutRangeStep.remove("scale");
            }
            encoding.put(channel, defWithoutRangeStep);
        }
        return builder.encoding(encoding).build();
    }

    private static JsonNode rangeStep(JsonNode def) {
        if (def == null || !def.isObject() || !(Channels.isFieldDef(def) || Channels.isDatumDef(def))) {
            return null;
        }
        JsonNode rangeStep = def.path("scale").get("rangeStep");
        return rangeStep != null && !rangeStep.isNull() ? rangeStep : null;
    }
}
