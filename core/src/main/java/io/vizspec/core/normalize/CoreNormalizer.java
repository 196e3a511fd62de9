package io.vizspec.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.diagnostic.Diagnostics;
import io.vizspec.core.error.UnsupportedSpecException;
import io.vizspec.core.error.VizSpecException;
import io.vizspec.core.model.Channels;
import io.vizspec.core.model.CompositionLayout;
import io.vizspec.core.model.ConcatKind;
import io.vizspec.core.model.ConcatSpec;
import io.vizspec.core.model.FacetSpec;
import io.vizspec.core.model.Identifiers;
import io.vizspec.core.model.LayerSpec;
import io.vizspec.core.model.RepeatDefinition;
import io.vizspec.core.model.RepeatSpec;
import io.vizspec.core.model.UnitSpec;
import io.vizspec.core.model.VizSpec;
import io.vizspec.core.normalize.mark.BoxPlotNormalizer;
import io.vizspec.core.normalize.mark.ErrorBandNormalizer;
import io.vizspec.core.normalize.mark.ErrorBarNormalizer;
import io.vizspec.core.normalize.mark.PathOverlayNormalizer;
import io.vizspec.core.normalize.mark.RangeStepNormalizer;
import io.vizspec.core.normalize.mark.RuleForRangedLineNormalizer;
import io.vizspec.core.spi.NonFacetUnitNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a spec tree into its canonical form.
 *
 * <ul>
 *   <li>Units with {@code row}/{@code column}/{@code facet} channels become explicit facet specs.
 *   <li>Repeats are expanded into concat specs, one child per repeat value combination.
 *   <li>Layer encodings and projections are pushed down into their members.
 *   <li>Plain units run through the unit normalizer chain (first match wins).
 * </ul>
 *
 * <p>Corrective actions are reported through the {@link Diagnostics} of the call. Unsupported
 * combinations throw {@link UnsupportedSpecException} and no partial tree is returned.
 *
 * <p>Thread-safe: instances hold no per-call state.
 */
public class CoreNormalizer extends SpecMapper {

    private static final Logger LOG = LoggerFactory.getLogger(CoreNormalizer.class);

    private static final List<String> FACET_LAYOUT_KEYS = List.of("align", "center", "spacing", "columns");

    private final List<NonFacetUnitNormalizer> nonFacetUnitNormalizers;

    /** Creates a normalizer with the built-in chain. */
    public CoreNormalizer() {
        this(defaultChain());
    }

    /**
     * Creates a normalizer with a custom chain. The order of the list is the match order.
     *
     * @param nonFacetUnitNormalizers chain members, first match wins
     */
    public CoreNormalizer(List<NonFacetUnitNormalizer> nonFacetUnitNormalizers) {
        this.nonFacetUnitNormalizers = List.copyOf(nonFacetUnitNormalizers);
    }

    /** The built-in chain: composite marks first, then path overlay, ranged line and range step. */
    public static List<NonFacetUnitNormalizer> defaultChain() {
        return List.of(
                new BoxPlotNormalizer(),
                new ErrorBarNormalizer(),
                new ErrorBandNormalizer(),
                new PathOverlayNormalizer(),
                new RuleForRangedLineNormalizer(),
                new RangeStepNormalizer());
    }

    public List<NonFacetUnitNormalizer> nonFacetUnitNormalizers() {
        return nonFacetUnitNormalizers;
    }

    /**
     * Normalizes a whole tree.
     *
     * @param spec   the input tree
     * @param config configuration consulted by the chain
     * @return the canonical tree and the warnings emitted while producing it
     * @throws UnsupportedSpecException if the tree contains an unsupported combination
     */
    public NormalizationResult normalize(VizSpec spec, VizConfig config) {
        Diagnostics diagnostics = new Diagnostics();
        VizSpec normalized = map(spec, NormalizerParams.root(config, diagnostics));
        LOG.debug("normalize.complete name={} warnings={}", spec.name(), diagnostics.warnings().size());
        return new NormalizationResult(normalized, diagnostics.warnings());
    }

    @Override
    public VizSpec map(VizSpec spec, NormalizerParams params) {
        if (spec instanceof UnitSpec unit && hasFacetChannel(unit)) {
            return mapFacetedUnit(unit, params);
        }
        return super.map(spec, params);
    }

    @Override
    public VizSpec mapUnit(UnitSpec spec, NormalizerParams params) {
        if (hasFacetChannel(spec)) {
            throw new UnsupportedSpecException(
                    "Faceted unit spec is not allowed inside a layer; use a facet spec wrapping the layer instead",
                    spec.name(),
                    VizSpecException.Stage.NORMALIZE);
        }
        UnitSpec replaced = spec.withEncoding(
                RepeaterSubstitution.replaceInEncoding(spec.encoding(), params.repeater(), params.diagnostics()));

        if (params.parentEncoding() != null || params.parentProjection() != null) {
            return mapUnitWithParentEncodingOrProjection(replaced, params);
        }

        for (NonFacetUnitNormalizer normalizer : nonFacetUnitNormalizers) {
            if (normalizer.hasMatchingType(replaced, params.config())) {
                LOG.debug("normalize.unit normalizer={} mark={}", normalizer.name(), replaced.markType());
                return normalizer.run(replaced, params, this::mapLayerOrUnit);
            }
        }
        return replaced;
    }

    @Override
    public VizSpec mapLayer(LayerSpec spec, NormalizerParams params) {
        Diagnostics diagnostics = params.diagnostics();
        NormalizerParams layerParams = params.withParents(
                mergeEncoding(params.parentEncoding(), spec.encoding(), diagnostics),
                mergeProjection(params.parentProjection(), spec.projection(), diagnostics));
        return super.mapLayer(spec.withoutSharedEncoding(), layerParams);
    }

    @Override
    public VizSpec mapFacet(FacetSpec spec, NormalizerParams params) {
        FacetSpec facetSpec = spec;
        if (facetSpec.isFacetMapping() && facetSpec.layout().columns() != null) {
            facetSpec = facetSpec.withLayout(facetSpec.layout().withColumns(null));
            params.diagnostics().columnsNotSupportedByRowCol("facet");
        }
        JsonNode facet =
                RepeaterSubstitution.replaceInFacet(facetSpec.facet(), params.repeater(), params.diagnostics());
        if (facet == null && facetSpec.facet() != null) {
            // nothing left to facet by: the inner spec stands alone
            VizSpec inner = facetSpec.spec();
            if (inner.data() == null && facetSpec.data() != null) {
                inner = inner.withData(facetSpec.data());
            }
            if (facetSpec.name() != null) {
                inner = inner.withName(facetSpec.name());
            }
            return map(inner, params);
        }
        return super.mapFacet(facetSpec.withFacet(facet), params);
    }

    @Override
    protected VizSpec mapRepeat(RepeatSpec spec, NormalizerParams params) {
        RepeatDefinition repeat = spec.repeat();
        CompositionLayout layout = spec.layout();
        if (!repeat.isFlat() && layout.columns() != null) {
            layout = layout.withColumns(null);
            params.diagnostics().columnsNotSupportedByRowCol("repeat");
        }

        Repeater repeater = params.repeater();
        List<String> rowValues = !repeat.isFlat() && repeat.row() != null
                ? repeat.row()
                : Collections.singletonList(repeater != null ? repeater.row() : null);
        List<String> columnValues = !repeat.isFlat() && repeat.column() != null
                ? repeat.column()
                : Collections.singletonList(repeater != null ? repeater.column() : null);
        List<String> repeatValues = repeat.isFlat()
                ? repeat.values()
                : Collections.singletonList(repeater != null ? repeater.repeat() : null);

        List<VizSpec> children = new ArrayList<>();
        for (String repeatValue : repeatValues) {
            for (String rowValue : rowValues) {
                for (String columnValue : columnValues) {
                    Repeater childRepeater = new Repeater(repeatValue, rowValue, columnValue);
                    VizSpec child = map(spec.spec(), params.withRepeater(childRepeater));
                    String childName = token("__repeat_", repeatValue)
                            + token("__row_", rowValue)
                            + token("__column_", columnValue);
                    // data moves up to the wrapping concat
                    children.add(child.withName(childName.isEmpty() ? null : childName).withData(null));
                }
            }
        }

        Integer columns;
        if (repeat.isFlat()) {
            columns = layout.columns();
        } else {
            columns = repeat.column() != null ? repeat.column().size() : 1;
        }
        JsonNode data = spec.spec().data() != null ? spec.spec().data() : spec.data();
        return new ConcatSpec(
                spec.name(),
                data,
                ConcatKind.CONCAT,
                children,
                layout.withColumns(columns),
                spec.resolve(),
                spec.properties());
    }

    private static String token(String prefix, String value) {
        return value != null && !value.isEmpty() ? prefix + Identifiers.varName(value) : "";
    }

    private VizSpec mapUnitWithParentEncodingOrProjection(UnitSpec spec, NormalizerParams params) {
        Diagnostics diagnostics = params.diagnostics();
        JsonNode mergedProjection = mergeProjection(params.parentProjection(), spec.projection(), diagnostics);
        Map<String, JsonNode> mergedEncoding = mergeEncoding(params.parentEncoding(), spec.encoding(), diagnostics);
        UnitSpec merged = spec.toBuilder()
                .projection(mergedProjection != null ? mergedProjection : spec.projection())
                .encoding(mergedEncoding != null ? mergedEncoding : spec.encoding())
                .build();
        return mapUnit(merged, params.withoutParents());
    }

    private VizSpec mapFacetedUnit(UnitSpec spec, NormalizerParams params) {
        Map<String, JsonNode> encoding = new LinkedHashMap<>(spec.encoding());
        JsonNode row = encoding.remove(Channels.ROW);
        JsonNode column = encoding.remove(Channels.COLUMN);
        JsonNode facet = encoding.remove(Channels.FACET);

        UnitSpec inner = UnitSpec.builder()
                .width(spec.width())
                .height(spec.height())
                .view(spec.view())
                .projection(spec.projection())
                .mark(spec.mark())
                .encoding(RepeaterSubstitution.replaceInEncoding(encoding, params.repeater(), params.diagnostics()))
                .selection(spec.selection())
                .build();

        ObjectNode outerProperties = spec.properties().deepCopy();
        CompositionLayout declaredLayout = extractLayout(outerProperties);
        JsonNode resolve = outerProperties.remove("resolve");

        FacetMappingAndLayout mappingAndLayout = facetMappingAndLayout(row, column, facet, params);
        FacetSpec outer = new FacetSpec(
                spec.name(),
                spec.data(),
                mappingAndLayout.facet(),
                inner,
                declaredLayout.overlay(mappingAndLayout.layout()),
                resolve,
                outerProperties);
        return mapFacet(outer, params);
    }

    private FacetMappingAndLayout facetMappingAndLayout(
            JsonNode row, JsonNode column, JsonNode facet, NormalizerParams params) {
        boolean hasRow = Channels.isFieldDef(row);
        boolean hasColumn = Channels.isFieldDef(column);
        if (hasRow || hasColumn) {
            if (Channels.isFieldDef(facet)) {
                List<String> present = new ArrayList<>();
                if (hasRow) {
                    present.add(Channels.ROW);
                }
                if (hasColumn) {
                    present.add(Channels.COLUMN);
                }
                params.diagnostics().facetChannelDropped(present);
            }

            ObjectNode mapping = JsonNodeFactory.instance.objectNode();
            Map<String, ObjectNode> perAxis = new LinkedHashMap<>();
            for (String channel : List.of(Channels.ROW, Channels.COLUMN)) {
                JsonNode def = Channels.ROW.equals(channel) ? row : column;
                if (!Channels.isFieldDef(def) || !def.isObject()) {
                    continue;
                }
                ObjectNode defWithoutLayout = ((ObjectNode) def).deepCopy();
                for (String prop : FACET_LAYOUT_KEYS) {
                    JsonNode value = defWithoutLayout.remove(prop);
                    if (value != null && !"columns".equals(prop)) {
                        perAxis.computeIfAbsent(prop, k -> JsonNodeFactory.instance.objectNode())
                                .set(channel, value);
                    }
                }
                mapping.set(channel, defWithoutLayout);
            }
            CompositionLayout layout = new CompositionLayout(
                    perAxis.get("align"), perAxis.get("center"), perAxis.get("spacing"), null, null);
            return new FacetMappingAndLayout(mapping, layout);
        }

        ObjectNode facetDef = ((ObjectNode) facet).deepCopy();
        CompositionLayout layout = extractLayout(facetDef);
        if (layout.bounds() != null) {
            facetDef.set("bounds", layout.bounds());
        }
        return new FacetMappingAndLayout(
                facetDef,
                new CompositionLayout(layout.align(), layout.center(), layout.spacing(), null, layout.columns()));
    }

    /** Removes layout keys from the object and returns them as a layout. */
    private static CompositionLayout extractLayout(ObjectNode object) {
        JsonNode columnsNode = object.remove("columns");
        Integer columns = columnsNode != null && columnsNode.canConvertToInt() ? columnsNode.asInt() : null;
        return new CompositionLayout(
                object.remove("align"),
                object.remove("center"),
                object.remove("spacing"),
                object.remove("bounds"),
                columns);
    }

    private static boolean hasFacetChannel(UnitSpec spec) {
        for (String channel : Channels.FACET_CHANNELS) {
            if (spec.channelHasField(channel)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Overlays a child encoding on its parent's. Every parent channel the child redefines is
     * reported in a single warning.
     *
     * @return the merged encoding, or {@code null} if it would be empty
     */
    static Map<String, JsonNode> mergeEncoding(
            Map<String, JsonNode> parentEncoding, Map<String, JsonNode> encoding, Diagnostics diagnostics) {
        if (parentEncoding != null && encoding != null) {
            List<String> overridden = new ArrayList<>();
            for (String channel : parentEncoding.keySet()) {
                if (encoding.get(channel) != null) {
                    overridden.add(channel);
                }
            }
            if (!overridden.isEmpty()) {
                diagnostics.encodingOverridden(overridden);
            }
        }
        Map<String, JsonNode> merged = new LinkedHashMap<>();
        if (parentEncoding != null) {
            merged.putAll(parentEncoding);
        }
        if (encoding != null) {
            merged.putAll(encoding);
        }
        return merged.isEmpty() ? null : merged;
    }

    /** The child projection replaces the parent's entirely. */
    static JsonNode mergeProjection(JsonNode parentProjection, JsonNode projection, Diagnostics diagnostics) {
        if (parentProjection != null && projection != null) {
            diagnostics.projectionOverridden(parentProjection, projection);
        }
        return projection != null ? projection : parentProjection;
    }

    private record FacetMappingAndLayout(JsonNode facet, CompositionLayout layout) {}
}
