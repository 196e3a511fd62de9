package io.vizspec.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.engine.VizCompiler;
import io.vizspec.core.model.VizSpec;
import io.vizspec.core.normalize.NormalizationResult;
import io.vizspec.core.spec.SpecWriter;

/** {@code POST /normalize}: request spec in, canonical spec and warnings out. */
public final class NormalizeHandler extends SpecRequestHandler {

    public NormalizeHandler(VizCompiler compiler, int maxBodyBytes) {
        super(compiler, maxBodyBytes);
    }

    @Override
    protected ObjectNode process(JsonNode specJson) {
        VizSpec spec = compiler.parser().parse(specJson, "<request>");
        NormalizationResult result = compiler.normalize(spec);
        return response(SpecWriter.write(result.spec()), result.warnings());
    }
}
