package io.vizspec.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Copy helpers shared by the spec records' canonical constructors. */
final class Specs {

    private Specs() {
        // utility class
    }

    static ObjectNode copyProperties(ObjectNode properties) {
        return properties != null ? properties.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    /** Missing and JSON null collapse to {@code null}. */
    static JsonNode absentToNull(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node;
    }

    static Map<String, JsonNode> copyEncoding(Map<String, JsonNode> encoding) {
        return encoding != null ? Collections.unmodifiableMap(new LinkedHashMap<>(encoding)) : null;
    }

    static <T> List<T> copyList(List<T> list) {
        return list != null ? List.copyOf(list) : List.of();
    }
}
