package io.vizspec.core.compile;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A parsed selection definition.
 *
 * @param name       sanitized selection name, used as the prefix of its signals and store
 * @param type       {@code single}, {@code multi} or {@code interval}
 * @param resolve    how the store resolves across units: {@code global}, {@code union} or {@code intersect}
 * @param definition the declared definition
 * @param unitName   name of the unit model that declared it
 */
public record SelectionComponent(String name, String type, String resolve, JsonNode definition, String unitName) {

    public String storeName() {
        return name + "_store";
    }
}
