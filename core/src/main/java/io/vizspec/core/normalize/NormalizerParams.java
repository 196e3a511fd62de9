package io.vizspec.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.diagnostic.Diagnostics;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Context threaded through the recursive normalization. Read-only for each call; branches derive
 * new instances ({@link #withRepeater}, {@link #withParents}) instead of mutating this one.
 *
 * @param parentEncoding   encoding inherited from enclosing layers, or null
 * @param parentProjection projection inherited from enclosing layers, or null
 * @param repeater         active repeat bindings, or null outside any repeat
 * @param config           configuration consulted by the unit normalizers
 * @param diagnostics      warning collector of the current call
 */
public record NormalizerParams(
        Map<String, JsonNode> parentEncoding,
        JsonNode parentProjection,
        Repeater repeater,
        VizConfig config,
        Diagnostics diagnostics) {

    /** Canonical constructor with defensive copies. */
    public NormalizerParams {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        parentEncoding =
                parentEncoding != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parentEncoding)) : null;
    }

    /** Context for the root of a tree: nothing inherited, no repeat bindings. */
    public static NormalizerParams root(VizConfig config, Diagnostics diagnostics) {
        return new NormalizerParams(null, null, null, config, diagnostics);
    }

    public NormalizerParams withRepeater(Repeater repeater) {
        return new NormalizerParams(parentEncoding, parentProjection, repeater, config, diagnostics);
    }

    public NormalizerParams withParents(Map<String, JsonNode> parentEncoding, JsonNode parentProjection) {
        return new NormalizerParams(parentEncoding, parentProjection, repeater, config, diagnostics);
    }

    public NormalizerParams withoutParents() {
        return new NormalizerParams(null, null, repeater, config, diagnostics);
    }

    public NormalizerParams withConfig(VizConfig config) {
        return new NormalizerParams(parentEncoding, parentProjection, repeater, config, diagnostics);
    }
}
