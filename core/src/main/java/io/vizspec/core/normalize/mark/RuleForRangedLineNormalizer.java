package io.vizspec.core.normalize.mark;

import com.fasterxml.jackson.databind.JsonNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.model.Channels;
import io.vizspec.core.model.UnitSpec;
import io.vizspec.core.model.VizSpec;
import io.vizspec.core.normalize.NormalizerParams;
import io.vizspec.core.spi.NonFacetUnitNormalizer;
import java.util.List;

/**
 * A {@code line} with {@code x2}/{@code y2} over a pre-binned or datum primary channel draws
 * segments, not a continuous path: it becomes a {@code rule}.
 */
public final class RuleForRangedLineNormalizer implements NonFacetUnitNormalizer {

    private static final List<String> SECONDARY_RANGE_CHANNELS = List.of(Channels.X2, Channels.Y2);

    @Override
    public String name() {
        return "rule-for-ranged-line";
    }

    @Override
    public boolean hasMatchingType(UnitSpec spec, VizConfig config) {
        // only the plain string form; a line mark definition object is left alone
        if (spec.mark() == null || !spec.mark().isTextual() || !"line".equals(spec.mark().asText())) {
            return false;
        }
        for (String channel : SECONDARY_RANGE_CHANNELS) {
            if (spec.channel(channel) == null) {
                continue;
            }
            JsonNode primary = spec.channel(Channels.primaryChannel(channel));
            if ((Channels.isFieldDef(primary) && isBinned(primary)) || Channels.isDatumDef(primary)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public VizSpec run(UnitSpec spec, NormalizerParams params, LayerOrUnitNormalizer normalize) {
        params.diagnostics().lineWithRange(spec.channel(Channels.X2) != null, spec.channel(Channels.Y2) != null);
        return normalize.normalize(spec.toBuilder().mark("rule").build(), params);
    }

    private static boolean isBinned(JsonNode fieldDef) {
        return "binned".equals(fieldDef.path("bin").asText(null));
    }
}
