package io.vizspec.core.testkit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.compile.CompileContext;
import io.vizspec.core.compile.Model;
import io.vizspec.core.compile.ModelBuilder;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.diagnostic.Diagnostics;
import io.vizspec.core.model.VizSpec;
import io.vizspec.core.normalize.CoreNormalizer;
import io.vizspec.core.normalize.NormalizationResult;
import io.vizspec.core.spec.SpecParser;
import io.vizspec.core.spec.SpecWriter;

/** Shared helpers: specs are written as JSON text blocks and compared as JSON trees. */
public final class TestSpecs {

    public static final ObjectMapper JSON = new ObjectMapper();

    private static final SpecParser PARSER = new SpecParser();

    private TestSpecs() {}

    public static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid test JSON: " + e.getMessage(), e);
        }
    }

    public static VizSpec spec(String text) {
        return PARSER.parse(json(text), "<test>");
    }

    public static ObjectNode write(VizSpec spec) {
        return SpecWriter.write(spec);
    }

    public static NormalizationResult normalize(String text) {
        return new CoreNormalizer().normalize(spec(text), VizConfig.defaults());
    }

    /** Normalizes and writes the canonical tree back to JSON. */
    public static ObjectNode normalized(String text) {
        return write(normalize(text).spec());
    }

    /** Builds the model tree of an already canonical spec, without running any phase. */
    public static Model model(String text, Diagnostics diagnostics) {
        return ModelBuilder.build(spec(text), null, null, new CompileContext(VizConfig.defaults(), diagnostics));
    }

    /** Builds the model tree of an already canonical spec and runs every parse phase. */
    public static Model parsedModel(String text) {
        Model model = model(text, new Diagnostics());
        model.parse();
        return model;
    }
}
