package io.vizspec.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;

/**
 * A single mark with its encoding. Before normalization the encoding may still embed the {@code
 * row}, {@code column} and {@code facet} channels; canonical units never do.
 *
 * @param name       explicit name, or null
 * @param data       explicit data, or null
 * @param mark       mark type string or mark definition object
 * @param encoding   channel name to channel definition; {@code null} means no encoding at all,
 *                   which is distinct from an empty one
 * @param projection projection definition, or null
 * @param selection  named selection definitions, or null
 * @param width      width (number, {@code "container"} or {@code {"step": n}}), or null
 * @param height     height, or null
 * @param view       view background properties, or null
 * @param properties pass-through properties
 */
public record UnitSpec(
        String name,
        JsonNode data,
        JsonNode mark,
        Map<String, JsonNode> encoding,
        JsonNode projection,
        JsonNode selection,
        JsonNode width,
        JsonNode height,
        JsonNode view,
        ObjectNode properties)
        implements VizSpec {

    /** Canonical constructor with defensive copies. */
    public UnitSpec {
        data = Specs.absentToNull(data);
        encoding = Specs.copyEncoding(encoding);
        projection = Specs.absentToNull(projection);
        selection = Specs.absentToNull(selection);
        width = Specs.absentToNull(width);
        height = Specs.absentToNull(height);
        view = Specs.absentToNull(view);
        properties = Specs.copyProperties(properties);
    }

    /** The mark type, e.g. {@code "bar"}, whether the mark is a string or a definition object. */
    public String markType() {
        if (mark == null) {
            return null;
        }
        return mark.isTextual() ? mark.asText() : mark.path("type").asText(null);
    }

    /** The mark as a definition object ({@code "bar"} becomes {@code {"type": "bar"}}). */
    public ObjectNode markDef() {
        if (mark != null && mark.isObject()) {
            return ((ObjectNode) mark).deepCopy();
        }
        ObjectNode def = JsonNodeFactory.instance.objectNode();
        def.put("type", markType());
        return def;
    }

    /** Returns the definition of the given channel, or null. */
    public JsonNode channel(String channel) {
        return encoding != null ? encoding.get(channel) : null;
    }

    /** Returns {@code true} if the channel maps a data field. */
    public boolean channelHasField(String channel) {
        return Channels.channelHasField(encoding, channel);
    }

    @Override
    public UnitSpec withName(String name) {
        return toBuilder().name(name).build();
    }

    @Override
    public UnitSpec withData(JsonNode data) {
        return toBuilder().data(data).build();
    }

    public UnitSpec withEncoding(Map<String, JsonNode> encoding) {
        return toBuilder().encoding(encoding).build();
    }

    public UnitSpec withMark(JsonNode mark) {
        return toBuilder().mark(mark).build();
    }

    @Override
    public <R> R accept(SpecVisitor<R> visitor) {
        return visitor.visitUnit(this);
    }

    /** Creates an empty builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** Creates a builder pre-populated with this spec's values. */
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .data(data)
                .mark(mark)
                .encoding(encoding)
                .projection(projection)
                .selection(selection)
                .width(width)
                .height(height)
                .view(view)
                .properties(properties);
    }

    /** Builder for {@link UnitSpec}. */
    public static final class Builder {
        private String name;
        private JsonNode data;
        private JsonNode mark;
        private Map<String, JsonNode> encoding;
        private JsonNode projection;
        private JsonNode selection;
        private JsonNode width;
        private JsonNode height;
        private JsonNode view;
        private ObjectNode properties;

        Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder data(JsonNode data) {
            this.data = data;
            return this;
        }

        public Builder mark(JsonNode mark) {
            this.mark = mark;
            return this;
        }

        public Builder mark(String markType) {
            this.mark = JsonNodeFactory.instance.textNode(markType);
            return this;
        }

        public Builder encoding(Map<String, JsonNode> encoding) {
            this.encoding = encoding;
            return this;
        }

        public Builder projection(JsonNode projection) {
            this.projection = projection;
            return this;
        }

        public Builder selection(JsonNode selection) {
            this.selection = selection;
            return this;
        }

        public Builder width(JsonNode width) {
            this.width = width;
            return this;
        }

        public Builder height(JsonNode height) {
            this.height = height;
            return this;
        }

        public Builder view(JsonNode view) {
            this.view = view;
            return this;
        }

        public Builder properties(ObjectNode properties) {
            this.properties = properties;
            return this;
        }

        public UnitSpec build() {
            return new UnitSpec(name, data, mark, encoding, projection, selection, width, height, view, properties);
        }
    }
}
