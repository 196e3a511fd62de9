package io.vizspec.core.model;

import java.util.List;

/**
 * What a repeat iterates over: either a flat list of field names, or row and/or column lists.
 *
 * @param values flat values; {@code null} for the row/column form
 * @param row    row values; {@code null} when absent
 * @param column column values; {@code null} when absent
 */
public record RepeatDefinition(List<String> values, List<String> row, List<String> column) {

    public RepeatDefinition {
        values = values != null ? List.copyOf(values) : null;
        row = row != null ? List.copyOf(row) : null;
        column = column != null ? List.copyOf(column) : null;
    }

    public static RepeatDefinition flat(List<String> values) {
        return new RepeatDefinition(values, null, null);
    }

    public static RepeatDefinition rowColumn(List<String> row, List<String> column) {
        return new RepeatDefinition(null, row, column);
    }

    /** Returns {@code true} for the flat form. */
    public boolean isFlat() {
        return values != null;
    }
}
