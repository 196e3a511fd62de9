package io.vizspec.core.compile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.model.ConcatKind;
import io.vizspec.core.model.ConcatSpec;
import java.util.ArrayList;
import java.util.List;

/**
 * Children laid out in a grid: one column for {@code vconcat}, one row for {@code hconcat}, and
 * {@code columns} wrapping for {@code concat}. Every child keeps its own axes.
 */
public final class ConcatModel extends Model {

    private final ConcatSpec spec;
    private final String concatType;
    private final List<Model> children;

    public ConcatModel(ConcatSpec spec, Model parent, String parentGivenName, CompileContext context) {
        super(spec, "concat", parent, parentGivenName, context);
        this.spec = spec;
        JsonNode axisResolve = spec.resolve() != null ? spec.resolve().path("axis") : null;
        if (axisResolve != null
                && ("shared".equals(axisResolve.path("x").asText(null))
                        || "shared".equals(axisResolve.path("y").asText(null)))) {
            context.diagnostics().concatCannotShareAxis(name());
        }
        this.concatType = spec.kind() == ConcatKind.VCONCAT
                ? "vconcat"
                : spec.kind() == ConcatKind.HCONCAT ? "hconcat" : "concat";

        List<Model> built = new ArrayList<>(spec.children().size());
        for (int i = 0; i < spec.children().size(); i++) {
            built.add(ModelBuilder.build(spec.children().get(i), this, getName("concat_" + i), context));
        }
        this.children = List.copyOf(built);
    }

    @Override
    public ConcatSpec spec() {
        return spec;
    }

    /** {@code vconcat}, {@code hconcat} or {@code concat}. */
    public String concatType() {
        return concatType;
    }

    @Override
    public List<Model> children() {
        return children;
    }

    @Override
    protected void doParseData() {
        parseOwnData();
        for (Model child : children) {
            child.parseData();
        }
    }

    /**
     * Merges the children's selections so they can be referenced across sibling views. Each child
     * keeps its own definitions for the signals of its group.
     */
    @Override
    protected void doParseSelections() {
        for (Model child : children) {
            child.parseSelections();
        }
        component.setSelection(Selections.mergeChildSelections(children));
    }

    @Override
    protected void doParseMarkGroup() {
        for (Model child : children) {
            child.parseMarkGroup();
        }
    }

    @Override
    protected void doParseAxesAndHeaders() {
        for (Model child : children) {
            child.parseAxesAndHeaders();
        }
    }

    /**
     * A dimension is merged when every child has the same fixed size in it: the width of a single
     * column, the height of a single row.
     */
    @Override
    protected void doParseLayoutSize() {
        for (Model child : children) {
            child.parseLayoutSize();
        }
        Integer columns = columns();
        JsonNode width = columns != null && columns == 1 ? mergedSize("width") : null;
        JsonNode height = columns == null ? mergedSize("height") : null;
        component.setLayoutSize(new LayoutSize(width, height));
    }

    private JsonNode mergedSize(String sizeType) {
        JsonNode merged = null;
        for (Model child : children) {
            JsonNode size = child.component().layoutSize().get(sizeType);
            if (!LayoutSize.isFixed(size) || (merged != null && !merged.equals(size))) {
                return null;
            }
            merged = size;
        }
        return merged;
    }

    /** Effective column count; {@code null} means unconstrained. */
    private Integer columns() {
        if (spec.layout().columns() != null) {
            return spec.layout().columns();
        }
        return "vconcat".equals(concatType) ? Integer.valueOf(1) : null;
    }

    @Override
    public List<ObjectNode> assembleSignals() {
        requireParsed("assemble signals");
        for (Model child : children) {
            child.assembleSignals();
        }
        return List.of();
    }

    @Override
    public List<ObjectNode> assembleLayoutSignals() {
        requireParsed("assemble layout signals");
        List<ObjectNode> signals = new ArrayList<>();
        LayoutSize size = component.layoutSize();
        Integer columns = columns();
        if (size.width() != null) {
            signals.add(sizeSignal(columns != null && columns == 1 ? "width" : "childWidth", size.width()));
        }
        if (size.height() != null) {
            signals.add(sizeSignal(columns == null ? "height" : "childHeight", size.height()));
        }
        for (Model child : children) {
            signals.addAll(child.assembleLayoutSignals());
        }
        return signals;
    }

    private ObjectNode sizeSignal(String sizeType, JsonNode value) {
        ObjectNode signal = NODES.objectNode();
        signal.put("name", getName(sizeType));
        signal.set("value", value);
        return signal;
    }

    @Override
    public List<ObjectNode> assembleSelectionTopLevelSignals(List<ObjectNode> signals) {
        requireParsed("assemble selection signals");
        List<ObjectNode> out = signals;
        for (Model child : children) {
            out = child.assembleSelectionTopLevelSignals(out);
        }
        return out;
    }

    @Override
    public List<ObjectNode> assembleSelectionData(List<ObjectNode> data) {
        requireParsed("assemble selection data");
        List<ObjectNode> out = data;
        for (Model child : children) {
            out = child.assembleSelectionData(out);
        }
        return out;
    }

    /** One group per child; title, style and encode entry appear only when the child has them. */
    @Override
    public ArrayNode assembleMarks() {
        requireParsed("assemble marks");
        ArrayNode marks = NODES.arrayNode();
        for (Model child : children) {
            JsonNode title = child.assembleTitle();
            JsonNode style = child.assembleGroupStyle();
            ObjectNode encodeEntry = child.assembleGroupEncodeEntry(false);

            ObjectNode group = NODES.objectNode();
            group.put("type", "group");
            group.put("name", child.getName("group"));
            if (title != null) {
                group.set("title", title);
            }
            if (style != null) {
                group.set("style", style);
            }
            if (encodeEntry != null) {
                group.putObject("encode").set("update", encodeEntry);
            }
            group.setAll(child.assembleGroup(List.of()));
            marks.add(group);
        }
        return marks;
    }

    @Override
    public ObjectNode assembleLayout() {
        return assembleLayout(spec.layout(), assembleDefaultLayout());
    }

    /** Children of differing sizes align per row and column band. */
    ObjectNode assembleDefaultLayout() {
        ObjectNode layout = NODES.objectNode();
        if ("vconcat".equals(concatType)) {
            layout.put("columns", 1);
        }
        layout.put("bounds", "full");
        layout.put("align", "each");
        return layout;
    }
}
