package io.vizspec.core.compile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.error.PhaseOrderException;
import io.vizspec.core.model.CompositionLayout;
import io.vizspec.core.model.Identifiers;
import io.vizspec.core.model.VizSpec;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiled, stateful counterpart of one canonical spec node.
 *
 * <p>A model goes through the parse phases in the fixed order of {@link Phase}: {@link
 * #parseData}, {@link #parseSelections}, {@link #parseMarkGroup}, {@link #parseAxesAndHeaders},
 * {@link #parseLayoutSize}. Each phase is invoked on the root and propagated to the children by
 * the concrete model. Calling a phase out of order, twice, or any {@code assemble*} method before
 * the last phase throws {@link PhaseOrderException}.
 *
 * <p>Phase outputs live in the write-once {@link ModelComponent}. The assemble methods are pure
 * reads of that state.
 */
public abstract class Model {

    protected static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** View properties that become static group encodings. */
    private static final Set<String> VIEW_ENCODE_PROPERTIES = Set.of(
            "fill", "fillOpacity", "stroke", "strokeWidth", "strokeOpacity", "strokeDash", "cornerRadius", "opacity");

    private final VizSpec spec;
    private final String type;
    private final Model parent;
    private final String name;
    protected final CompileContext context;
    protected final ModelComponent component;

    private Phase phase = Phase.CONSTRUCTED;

    protected Model(VizSpec spec, String type, Model parent, String parentGivenName, CompileContext context) {
        this.spec = spec;
        this.type = type;
        this.parent = parent;
        this.name = spec.name() != null ? spec.name() : parentGivenName;
        this.context = context;
        this.component = new ModelComponent(this.name);
    }

    public VizSpec spec() {
        return spec;
    }

    /** {@code unit}, {@code layer}, {@code facet} or {@code concat}. */
    public String type() {
        return type;
    }

    public Model parent() {
        return parent;
    }

    public String name() {
        return name;
    }

    public ModelComponent component() {
        return component;
    }

    public Phase phase() {
        return phase;
    }

    public VizConfig config() {
        return context.config();
    }

    /** Child models in declaration order. */
    public List<Model> children() {
        return List.of();
    }

    /** Sanitized {@code <name>_<suffix>}, or just the suffix for an unnamed model. */
    public String getName(String suffix) {
        return Identifiers.varName(name != null && !name.isEmpty() ? name + "_" + suffix : suffix);
    }

    /**
     * Name of the scale backing a channel. Layer members draw on their layer's scales, so the
     * name belongs to the outermost enclosing layer.
     */
    public String scaleName(String channel) {
        Model owner = this;
        while (owner.parent instanceof LayerModel) {
            owner = owner.parent;
        }
        return owner.getName(channel);
    }

    /** Runs every parse phase in order. */
    public void parse() {
        parseData();
        parseSelections();
        parseMarkGroup();
        parseAxesAndHeaders();
        parseLayoutSize();
    }

    public final void parseData() {
        enter(Phase.DATA);
        doParseData();
    }

    public final void parseSelections() {
        enter(Phase.SELECTIONS);
        doParseSelections();
    }

    public final void parseMarkGroup() {
        enter(Phase.MARK_GROUP);
        doParseMarkGroup();
    }

    public final void parseAxesAndHeaders() {
        enter(Phase.AXES_AND_HEADERS);
        doParseAxesAndHeaders();
    }

    public final void parseLayoutSize() {
        enter(Phase.LAYOUT_SIZE);
        doParseLayoutSize();
    }

    protected abstract void doParseData();

    protected abstract void doParseSelections();

    protected abstract void doParseMarkGroup();

    protected abstract void doParseAxesAndHeaders();

    protected abstract void doParseLayoutSize();

    private void enter(Phase target) {
        if (phase.next() != target) {
            throw new PhaseOrderException(
                    "Cannot enter phase " + target + " of model '" + name + "' from phase " + phase, name);
        }
        phase = target;
    }

    /** Guards assemble steps: every parse phase of this model must have run. */
    protected final void requireParsed(String step) {
        if (phase != Phase.LAYOUT_SIZE) {
            throw new PhaseOrderException(
                    "Cannot " + step + " for model '" + name + "' before parsing completed (phase " + phase + ")",
                    name);
        }
    }

    // --- Data ---

    /**
     * Sets this model's data component: a new source when the spec declares data, otherwise the
     * source its parent hands down. Parents parse data before their children.
     */
    protected final void parseOwnData() {
        JsonNode data = spec.data();
        if (data != null) {
            String source = data.path("name").isTextual() ? data.get("name").asText() : context.nextSourceName();
            component.setData(new DataComponent(source, data));
        } else if (parent != null) {
            component.setData(new DataComponent(parent.childSource(), null));
        } else {
            component.setData(DataComponent.NONE);
        }
    }

    /** The source children inherit when they declare no data of their own. */
    protected String childSource() {
        return component.data().source();
    }

    /** Appends this subtree's data sources, parents before children. */
    public List<ObjectNode> assembleSources(List<ObjectNode> data) {
        requireParsed("assemble sources");
        List<ObjectNode> out = new ArrayList<>(data);
        DataComponent own = component.data();
        if (own.owned()) {
            ObjectNode source = NODES.objectNode();
            source.put("name", own.source());
            Iterator<Map.Entry<String, JsonNode>> fields = own.data().fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!"name".equals(field.getKey())) {
                    source.set(field.getKey(), field.getValue().deepCopy());
                }
            }
            out.add(source);
        }
        for (Model child : children()) {
            out = child.assembleSources(out);
        }
        return out;
    }

    // --- Assembly ---

    /** Signals defined inside this model's own group. */
    public abstract List<ObjectNode> assembleSignals();

    /** Size signals of this subtree. */
    public abstract List<ObjectNode> assembleLayoutSignals();

    /** Appends the top-level selection signals of this subtree to {@code signals}. */
    public abstract List<ObjectNode> assembleSelectionTopLevelSignals(List<ObjectNode> signals);

    /** Appends the selection store datasets of this subtree to {@code data}. */
    public abstract List<ObjectNode> assembleSelectionData(List<ObjectNode> data);

    /** The marks of this model's group. */
    public abstract ArrayNode assembleMarks();

    public ArrayNode assembleAxes() {
        requireParsed("assemble axes");
        ArrayNode axes = component.axes();
        return axes != null ? axes.deepCopy() : NODES.arrayNode();
    }

    /** Grid layout of this model's group, or {@code null} for models that do not lay out children. */
    public ObjectNode assembleLayout() {
        return null;
    }

    /**
     * Merges an explicit composition layout over the defaults. {@code spacing} is written as
     * {@code padding}.
     */
    protected static ObjectNode assembleLayout(CompositionLayout layout, ObjectNode defaults) {
        ObjectNode out = NODES.objectNode();
        if (layout.spacing() != null) {
            out.set("padding", layout.spacing());
        }
        out.setAll(defaults);
        if (layout.columns() != null) {
            out.put("columns", layout.columns());
        }
        if (layout.bounds() != null) {
            out.set("bounds", layout.bounds());
        }
        if (layout.align() != null) {
            out.set("align", layout.align());
        }
        if (layout.center() != null) {
            out.set("center", layout.center());
        }
        return out;
    }

    /** The title as a title object, or {@code null}. */
    public JsonNode assembleTitle() {
        JsonNode title = spec.properties().get("title");
        if (title == null || title.isNull()) {
            return null;
        }
        if (title.isObject()) {
            return title.deepCopy();
        }
        ObjectNode text = NODES.objectNode();
        text.set("text", title);
        return text;
    }

    /** View background properties of units and layers; {@code null} for other models. */
    protected JsonNode view() {
        return null;
    }

    /** Group style: the view's style, {@code "cell"} by default for units and layers. */
    public JsonNode assembleGroupStyle() {
        if (!"unit".equals(type) && !"layer".equals(type)) {
            return null;
        }
        JsonNode view = view();
        if (view != null && view.hasNonNull("style")) {
            return view.get("style").deepCopy();
        }
        return NODES.textNode("cell");
    }

    /**
     * Static encoding of this model's group: view background properties, plus the description and
     * size signal references when nested.
     *
     * @return the encode entry, or {@code null} if it would be empty
     */
    public ObjectNode assembleGroupEncodeEntry(boolean isTopLevel) {
        ObjectNode entry = NODES.objectNode();
        JsonNode view = view();
        if (view != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = view.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (VIEW_ENCODE_PROPERTIES.contains(field.getKey())) {
                    entry.set(field.getKey(), valueRef(field.getValue()));
                }
            }
        }
        if (!isTopLevel) {
            JsonNode description = spec.properties().get("description");
            if (description != null && description.isTextual()) {
                entry.set("description", valueRef(description));
            }
            if ("unit".equals(type) || "layer".equals(type)) {
                ObjectNode sized = NODES.objectNode();
                sized.set("width", signalRef(getName("width")));
                sized.set("height", signalRef(getName("height")));
                sized.setAll(entry);
                return sized;
            }
        }
        return entry.isEmpty() ? null : entry;
    }

    /**
     * The body of this model's group: signals (when any), layout (when any), marks and axes (when
     * any).
     */
    public ObjectNode assembleGroup(List<ObjectNode> signals) {
        requireParsed("assemble group");
        ObjectNode group = NODES.objectNode();
        List<ObjectNode> allSignals = new ArrayList<>(signals);
        allSignals.addAll(assembleSignals());
        if (!allSignals.isEmpty()) {
            group.set("signals", toArray(allSignals));
        }
        ObjectNode layout = assembleLayout();
        if (layout != null) {
            group.set("layout", layout);
        }
        group.set("marks", assembleMarks());
        ArrayNode axes = assembleAxes();
        if (!axes.isEmpty()) {
            group.set("axes", axes);
        }
        return group;
    }

    protected static ObjectNode valueRef(JsonNode value) {
        ObjectNode ref = NODES.objectNode();
        ref.set("value", value.deepCopy());
        return ref;
    }

    protected static ObjectNode signalRef(String signal) {
        ObjectNode ref = NODES.objectNode();
        ref.put("signal", signal);
        return ref;
    }

    protected static ArrayNode toArray(List<ObjectNode> nodes) {
        ArrayNode array = NODES.arrayNode();
        nodes.forEach(array::add);
        return array;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name + ", phase=" + phase + "]";
    }
}
