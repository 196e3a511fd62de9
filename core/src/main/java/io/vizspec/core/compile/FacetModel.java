package io.vizspec.core.compile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.model.Channels;
import io.vizspec.core.model.FacetSpec;
import java.util.List;

/**
 * Repeats its child once per facet cell. The child draws from the faceted data of its cell and
 * the cells are laid out in a grid.
 */
public final class FacetModel extends Model {

    private final FacetSpec spec;
    private final Model child;

    public FacetModel(FacetSpec spec, Model parent, String parentGivenName, CompileContext context) {
        super(spec, "facet", parent, parentGivenName, context);
        this.spec = spec;
        this.child = ModelBuilder.build(spec.spec(), this, getName("child"), context);
    }

    @Override
    public FacetSpec spec() {
        return spec;
    }

    public Model child() {
        return child;
    }

    @Override
    public List<Model> children() {
        return List.of(child);
    }

    /** Facet field definitions keyed by {@code row}/{@code column}, or {@code facet} for the flat form. */
    private JsonNode facetDef(String channel) {
        if (spec.isFacetMapping()) {
            return Channels.FACET.equals(channel) ? null : spec.facet().get(channel);
        }
        return Channels.FACET.equals(channel) ? spec.facet() : null;
    }

    @Override
    protected void doParseData() {
        parseOwnData();
        child.parseData();
    }

    /** Cells read the per-cell partition of this model's source. */
    @Override
    protected String childSource() {
        return component.data().source() != null ? getName("facet") : null;
    }

    @Override
    protected void doParseSelections() {
        child.parseSelections();
        component.setSelection(Selections.mergeChildSelections(List.of(child)));
    }

    @Override
    protected void doParseMarkGroup() {
        child.parseMarkGroup();
    }

    @Override
    protected void doParseAxesAndHeaders() {
        child.parseAxesAndHeaders();
    }

    @Override
    protected void doParseLayoutSize() {
        child.parseLayoutSize();
        component.setLayoutSize(child.component().layoutSize());
    }

    @Override
    public List<ObjectNode> assembleSources(List<ObjectNode> data) {
        List<ObjectNode> out = super.assembleSources(data);
        String source = component.data().source();
        JsonNode column = facetDef(Channels.COLUMN);
        if (source != null && Channels.isFieldDef(column)) {
            ObjectNode domain = NODES.objectNode();
            domain.put("name", getName("column_domain"));
            domain.put("source", source);
            ObjectNode aggregate = domain.putArray("transform").addObject();
            aggregate.put("type", "aggregate");
            aggregate.putArray("groupby").add(column.path("field").asText());
            out.add(domain);
        }
        return out;
    }

    @Override
    public List<ObjectNode> assembleSignals() {
        requireParsed("assemble signals");
        return List.of();
    }

    @Override
    public List<ObjectNode> assembleLayoutSignals() {
        requireParsed("assemble layout signals");
        return child.assembleLayoutSignals();
    }

    @Override
    public List<ObjectNode> assembleSelectionTopLevelSignals(List<ObjectNode> signals) {
        requireParsed("assemble selection signals");
        return child.assembleSelectionTopLevelSignals(signals);
    }

    @Override
    public List<ObjectNode> assembleSelectionData(List<ObjectNode> data) {
        requireParsed("assemble selection data");
        return child.assembleSelectionData(data);
    }

    /** One cell group, faceted by the row/column (or flat facet) fields. */
    @Override
    public ArrayNode assembleMarks() {
        requireParsed("assemble marks");
        ObjectNode cell = NODES.objectNode();
        cell.put("name", getName("cell"));
        cell.put("type", "group");
        cell.put("style", "cell");
        String source = component.data().source();
        if (source != null) {
            ObjectNode facet = cell.putObject("from").putObject("facet");
            facet.put("name", getName("facet"));
            facet.put("data", source);
            ArrayNode groupBy = facet.putArray("groupby");
            for (String channel : Channels.FACET_CHANNELS) {
                JsonNode def = facetDef(channel);
                if (Channels.isFieldDef(def)) {
                    groupBy.add(def.path("field").asText());
                }
            }
        }
        ObjectNode update = cell.putObject("encode").putObject("update");
        update.set("width", signalRef(child.getName("width")));
        update.set("height", signalRef(child.getName("height")));
        cell.setAll(child.assembleGroup(List.of()));

        ArrayNode marks = NODES.arrayNode();
        marks.add(cell);
        return marks;
    }

    @Override
    public ObjectNode assembleLayout() {
        ObjectNode defaults = NODES.objectNode();
        if (spec.isFacetMapping()) {
            if (Channels.isFieldDef(facetDef(Channels.COLUMN)) && component.data().source() != null) {
                defaults.putObject("columns").put("signal", "length(data('" + getName("column_domain") + "'))");
            } else {
                defaults.put("columns", 1);
            }
        }
        defaults.put("bounds", "full");
        defaults.put("align", "all");
        return assembleLayout(spec.layout(), defaults);
    }
}
