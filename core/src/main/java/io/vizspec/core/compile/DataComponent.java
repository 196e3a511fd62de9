package io.vizspec.core.compile;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The data a model draws from.
 *
 * @param source name of the data source, or {@code null} when no ancestor declares data
 * @param data   the declared data when this model owns the source, else {@code null}
 */
public record DataComponent(String source, JsonNode data) {

    static final DataComponent NONE = new DataComponent(null, null);

    /** Returns {@code true} if this model declared the source itself. */
    public boolean owned() {
        return data != null;
    }
}
