package io.vizspec.core.diagnostic;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the warnings of one normalize/compile call. Each warning is also logged at WARN as a
 * {@code spec.warning} event. Recording a warning never changes control flow.
 *
 * <p>Not thread-safe: one instance per call, threaded explicitly through the pipeline.
 */
public final class Diagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Warning> warnings = new ArrayList<>();

    /** Records and logs a warning. */
    public void warn(Warning warning) {
        warnings.add(warning);
        LOG.warn(
                "spec.warning kind={} details={} message={}",
                warning.kind().code(),
                warning.details(),
                warning.message());
    }

    /** Returns an immutable snapshot of the warnings recorded so far, in order. */
    public List<Warning> warnings() {
        return List.copyOf(warnings);
    }

    /** Returns {@code true} if at least one warning of the given kind was recorded. */
    public boolean has(WarningKind kind) {
        return warnings.stream().anyMatch(w -> w.kind() == kind);
    }

    // --- Message factories ---

    public void facetChannelDropped(List<String> channels) {
        warn(new Warning(
                WarningKind.FACET_CHANNEL_DROPPED,
                "Facet encoding dropped as " + String.join(" and ", channels) + (channels.size() > 1 ? " are" : " is")
                        + " also specified.",
                Map.of("dropped", "facet", "channels", List.copyOf(channels))));
    }

    public void columnsNotSupportedByRowCol(String type) {
        warn(new Warning(
                WarningKind.COLUMNS_NOT_SUPPORTED_BY_ROW_COL,
                "The \"columns\" property cannot be used when \"" + type + "\" has nested row/column.",
                Map.of("type", type)));
    }

    public void encodingOverridden(List<String> channels) {
        warn(new Warning(
                WarningKind.ENCODING_OVERRIDDEN,
                "Layer's shared " + String.join(",", channels) + " channel" + (channels.size() == 1 ? " is" : "s are")
                        + " overridden.",
                Map.of("channels", List.copyOf(channels))));
    }

    public void projectionOverridden(JsonNode parentProjection, JsonNode projection) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parentProjection", parentProjection.toString());
        details.put("projection", projection.toString());
        warn(new Warning(
                WarningKind.PROJECTION_OVERRIDDEN,
                "Layer's shared projection " + parentProjection + " is overridden by a partial projection "
                        + projection + ".",
                details));
    }

    public void noSuchRepeatedValue(String repeatField) {
        warn(new Warning(
                WarningKind.NO_SUCH_REPEATED_VALUE,
                "Unknown repeated value \"" + repeatField + "\".",
                Map.of("repeat", String.valueOf(repeatField))));
    }

    public void lineWithRange(boolean hasX2, boolean hasY2) {
        String channels = hasX2 && hasY2 ? "x2 and y2" : hasX2 ? "x2" : "y2";
        warn(new Warning(
                WarningKind.LINE_WITH_RANGE,
                "Line mark is for continuous lines and thus cannot be used with " + channels
                        + ". We will use the rule mark (line segments) instead.",
                Map.of("channels", channels)));
    }

    public void rangeStepDeprecated(String channel) {
        warn(new Warning(
                WarningKind.RANGE_STEP_DEPRECATED,
                "Scale's \"rangeStep\" is deprecated. Please use \"width\"/\"height\": {\"step\": ...} instead.",
                Map.of("channel", channel)));
    }

    public void concatCannotShareAxis(String modelName) {
        warn(new Warning(
                WarningKind.CONCAT_CANNOT_SHARE_AXIS,
                "Axes cannot be shared in concatenated or repeated views.",
                Map.of("model", modelName != null ? modelName : "")));
    }
}
