package io.vizspec.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.compile.CompileContext;
import io.vizspec.core.compile.Model;
import io.vizspec.core.compile.ModelBuilder;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.diagnostic.Diagnostics;
import io.vizspec.core.diagnostic.Warning;
import io.vizspec.core.error.VizSpecException;
import io.vizspec.core.model.VizSpec;
import io.vizspec.core.normalize.CoreNormalizer;
import io.vizspec.core.normalize.NormalizationResult;
import io.vizspec.core.spec.SpecParser;
import io.vizspec.core.spi.CompileListener;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiler facade: parse, normalize, build the model tree, run the parse phases and assemble the
 * rendering spec.
 *
 * <p>
 * Thread-safe: holds only immutable collaborators. Every call builds its own model tree and
 * {@link Diagnostics}.
 */
public final class VizCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(VizCompiler.class);

    static final String RENDER_SCHEMA = "https://vega.github.io/schema/vega/v5.json";

    private final SpecParser parser;
    private final CoreNormalizer normalizer;
    private final VizConfig baseConfig;
    private final CompileListener listener;

    /** Creates a compiler with a lenient parser, the built-in chain and default config. */
    public VizCompiler() {
        this(new SpecParser(), new CoreNormalizer(), VizConfig.defaults(), null);
    }

    /**
     * Creates a compiler.
     *
     * @param parser     parser for path and JSON inputs
     * @param normalizer normalizer run before model construction
     * @param baseConfig configuration the spec's own {@code config} is merged over
     * @param listener   lifecycle listener, or {@code null}
     */
    public VizCompiler(SpecParser parser, CoreNormalizer normalizer, VizConfig baseConfig, CompileListener listener) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig must not be null");
        this.listener = listener;
    }

    public SpecParser parser() {
        return parser;
    }

    /** The effective config of a spec: the base config with the spec's {@code config} merged over it. */
    public VizConfig configFor(VizSpec spec) {
        return baseConfig.merge(spec.properties().get("config"));
    }

    public NormalizationResult normalize(VizSpec spec) {
        return normalize(spec, configFor(spec));
    }

    /**
     * Normalizes a spec tree.
     *
     * @throws io.vizspec.core.error.UnsupportedSpecException for an unsupported combination
     */
    public NormalizationResult normalize(VizSpec spec, VizConfig config) {
        NormalizationResult result = normalizer.normalize(spec, config);
        notifyNormalized(spec, result);
        return result;
    }

    /** Parses and compiles a YAML or JSON spec file. */
    public CompileResult compile(Path path) {
        VizSpec spec;
        try {
            spec = parser.parse(path);
        } catch (VizSpecException e) {
            failed(e);
            throw e;
        }
        return compile(spec);
    }

    /** Parses and compiles a spec tree. */
    public CompileResult compile(JsonNode json) {
        VizSpec spec;
        try {
            spec = parser.parse(json, "<json>");
        } catch (VizSpecException e) {
            failed(e);
            throw e;
        }
        return compile(spec);
    }

    public CompileResult compile(VizSpec spec) {
        return compile(spec, configFor(spec));
    }

    /**
     * Compiles a spec.
     *
     * @param spec   the input tree; normalized first
     * @param config effective configuration
     * @return the rendering spec, the canonical tree and every warning emitted
     * @throws VizSpecException if the tree contains an unsupported combination
     */
    public CompileResult compile(VizSpec spec, VizConfig config) {
        long start = System.nanoTime();
        try {
            NormalizationResult normalized = normalize(spec, config);

            Diagnostics diagnostics = new Diagnostics();
            Model root = ModelBuilder.build(normalized.spec(), null, null, new CompileContext(config, diagnostics));
            root.parse();
            ObjectNode output = assemble(root);

            List<Warning> warnings = new ArrayList<>(normalized.warnings());
            warnings.addAll(diagnostics.warnings());
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.info(
                    "compile.complete name={} root={} warnings={} durationMs={}",
                    spec.name(),
                    root.type(),
                    warnings.size(),
                    durationMs);
            notifyCompiled(spec, warnings.size(), durationMs);
            return new CompileResult(output, normalized.spec(), warnings);
        } catch (VizSpecException e) {
            failed(e);
            throw e;
        }
    }

    /**
     * Assembles the rendering spec of a fully parsed model tree: data sources then selection
     * stores, signals (layout, top-level selection, root group), the root group body and title.
     */
    static ObjectNode assemble(Model root) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode out = nodes.objectNode();
        out.put("$schema", RENDER_SCHEMA);
        JsonNode description = root.spec().properties().get("description");
        if (description != null && description.isTextual()) {
            out.set("description", description);
        }

        List<ObjectNode> data = root.assembleSelectionData(root.assembleSources(List.of()));
        if (!data.isEmpty()) {
            out.set("data", toArray(data));
        }

        List<ObjectNode> signals = root.assembleSelectionTopLevelSignals(root.assembleLayoutSignals());
        signals = new ArrayList<>(signals);
        signals.addAll(root.assembleSignals());
        if (!signals.isEmpty()) {
            out.set("signals", toArray(signals));
        }

        ObjectNode layout = root.assembleLayout();
        if (layout != null) {
            out.set("layout", layout);
        }
        out.set("marks", root.assembleMarks());
        ArrayNode axes = root.assembleAxes();
        if (!axes.isEmpty()) {
            out.set("axes", axes);
        }
        JsonNode title = root.assembleTitle();
        if (title != null) {
            out.set("title", title);
        }
        return out;
    }

    private static ArrayNode toArray(List<ObjectNode> nodes) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        nodes.forEach(array::add);
        return array;
    }

    private void failed(VizSpecException e) {
        LOG.warn("compile.failed name={} stage={} reason={}", e.specName(), e.stage(), e.getMessage());
        notifyCompileFailed(e);
    }

    private void notifyNormalized(VizSpec spec, NormalizationResult result) {
        if (listener == null) return;
        try {
            listener.onNormalized(new CompileListener.NormalizedEvent(spec.name(), result.warnings().size()));
        } catch (Exception e) {
            LOG.warn("CompileListener.onNormalized failed", e);
        }
    }

    private void notifyCompiled(VizSpec spec, int warningCount, long durationMs) {
        if (listener == null) return;
        try {
            listener.onCompiled(new CompileListener.CompiledEvent(spec.name(), warningCount, durationMs));
        } catch (Exception e) {
            LOG.warn("CompileListener.onCompiled failed", e);
        }
    }

    private void notifyCompileFailed(VizSpecException cause) {
        if (listener == null) return;
        try {
            listener.onCompileFailed(
                    new CompileListener.CompileFailedEvent(cause.specName(), cause.stage(), cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("CompileListener.onCompileFailed failed", e);
        }
    }
}
