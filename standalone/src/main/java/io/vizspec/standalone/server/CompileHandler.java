package io.vizspec.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.engine.CompileResult;
import io.vizspec.core.engine.VizCompiler;

/** {@code POST /compile}: request spec in, rendering spec and warnings out. */
public final class CompileHandler extends SpecRequestHandler {

    public CompileHandler(VizCompiler compiler, int maxBodyBytes) {
        super(compiler, maxBodyBytes);
    }

    @Override
    protected ObjectNode process(JsonNode specJson) {
        CompileResult result = compiler.compile(specJson);
        return response(result.output(), result.warnings());
    }
}
