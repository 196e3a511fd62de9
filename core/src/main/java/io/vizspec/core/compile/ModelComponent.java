package io.vizspec.core.compile;

import com.fasterxml.jackson.databind.node.ArrayNode;
import io.vizspec.core.error.PhaseOrderException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Phase outputs of one model. Every field is written by exactly one phase, exactly once; later
 * phases and the assemble steps only read.
 */
public final class ModelComponent {

    private final String modelName;

    private DataComponent data;
    private Map<String, SelectionComponent> selection;
    private ArrayNode marks;
    private ArrayNode axes;
    private LayoutSize layoutSize;

    ModelComponent(String modelName) {
        this.modelName = modelName;
    }

    public DataComponent data() {
        return data;
    }

    void setData(DataComponent data) {
        checkUnset(this.data, "data");
        this.data = data;
    }

    /** Selections by name, in insertion order; empty before the selection phase. */
    public Map<String, SelectionComponent> selection() {
        return selection != null ? Collections.unmodifiableMap(selection) : Map.of();
    }

    void setSelection(Map<String, SelectionComponent> selection) {
        checkUnset(this.selection, "selection");
        this.selection = new LinkedHashMap<>(selection);
    }

    /** Mark definitions of this model's own level; {@code null} for models that only group children. */
    public ArrayNode marks() {
        return marks;
    }

    void setMarks(ArrayNode marks) {
        checkUnset(this.marks, "marks");
        this.marks = marks;
    }

    public ArrayNode axes() {
        return axes;
    }

    void setAxes(ArrayNode axes) {
        checkUnset(this.axes, "axes");
        this.axes = axes;
    }

    public LayoutSize layoutSize() {
        return layoutSize;
    }

    void setLayoutSize(LayoutSize layoutSize) {
        checkUnset(this.layoutSize, "layoutSize");
        this.layoutSize = layoutSize;
    }

    private void checkUnset(Object current, String field) {
        if (current != null) {
            throw new PhaseOrderException(
                    "Component '" + field + "' of model '" + modelName + "' is already set", modelName);
        }
    }
}
