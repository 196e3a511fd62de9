package io.vizspec.core.compile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.model.LayerSpec;
import io.vizspec.core.model.VizSpec;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Members drawn on top of each other in one group, sharing scales, axes and size. */
public final class LayerModel extends Model {

    private final LayerSpec spec;
    private final List<Model> children;

    public LayerModel(LayerSpec spec, Model parent, String parentGivenName, CompileContext context) {
        super(spec, "layer", parent, parentGivenName, context);
        this.spec = spec;
        List<Model> built = new ArrayList<>(spec.layer().size());
        for (int i = 0; i < spec.layer().size(); i++) {
            VizSpec member = spec.layer().get(i);
            built.add(ModelBuilder.build(member, this, getName("layer_" + i), context));
        }
        this.children = List.copyOf(built);
    }

    @Override
    public LayerSpec spec() {
        return spec;
    }

    @Override
    public List<Model> children() {
        return children;
    }

    @Override
    protected JsonNode view() {
        return spec.view();
    }

    @Override
    protected void doParseData() {
        parseOwnData();
        for (Model child : children) {
            child.parseData();
        }
    }

    @Override
    protected void doParseSelections() {
        for (Model child : children) {
            child.parseSelections();
        }
        component.setSelection(Selections.mergeChildSelections(children));
    }

    @Override
    protected void doParseMarkGroup() {
        ArrayNode marks = NODES.arrayNode();
        for (Model child : children) {
            child.parseMarkGroup();
            marks.addAll(child.component().marks());
        }
        component.setMarks(marks);
    }

    /** Members share the layer's scales; the first axis per scale and orientation wins. */
    @Override
    protected void doParseAxesAndHeaders() {
        ArrayNode axes = NODES.arrayNode();
        Set<String> seen = new HashSet<>();
        for (Model child : children) {
            child.parseAxesAndHeaders();
            for (JsonNode axis : child.component().axes()) {
                String key = axis.path("scale").asText() + "/" + axis.path("orient").asText();
                if (seen.add(key)) {
                    axes.add(axis.deepCopy());
                }
            }
        }
        component.setAxes(axes);
    }

    /** An explicit layer size wins; otherwise the first member's size is used. */
    @Override
    protected void doParseLayoutSize() {
        for (Model child : children) {
            child.parseLayoutSize();
        }
        JsonNode width = spec.width();
        JsonNode height = spec.height();
        for (Model child : children) {
            LayoutSize childSize = child.component().layoutSize();
            if (width == null) {
                width = childSize.width();
            }
            if (height == null) {
                height = childSize.height();
            }
        }
        component.setLayoutSize(new LayoutSize(width, height));
    }

    @Override
    public List<ObjectNode> assembleSignals() {
        requireParsed("assemble signals");
        List<ObjectNode> signals = new ArrayList<>();
        for (Model child : children) {
            signals.addAll(child.assembleSignals());
        }
        return signals;
    }

    @Override
    public List<ObjectNode> assembleLayoutSignals() {
        requireParsed("assemble layout signals");
        if (parent() instanceof LayerModel) {
            return List.of();
        }
        return LayoutSignals.sizeSignals(this, component.layoutSize());
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

    @Override
    public ArrayNode assembleMarks() {
        requireParsed("assemble marks");
        return component.marks().deepCopy();
    }
}
