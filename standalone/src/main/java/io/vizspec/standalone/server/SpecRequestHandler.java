package io.vizspec.standalone.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.vizspec.core.diagnostic.Warning;
import io.vizspec.core.engine.VizCompiler;
import io.vizspec.core.error.SchemaValidationException;
import io.vizspec.core.error.SpecParseException;
import io.vizspec.core.error.UnsupportedSpecException;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared request pipeline of the spec endpoints: body size check, JSON parse, the endpoint's own
 * processing, and the mapping of failures to problem details.
 *
 * <p>
 * Successful responses are {@code {"spec": ..., "warnings": [...]}}.
 */
abstract class SpecRequestHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(SpecRequestHandler.class);

    static final ObjectMapper MAPPER = new ObjectMapper();

    protected final VizCompiler compiler;
    private final int maxBodyBytes;

    SpecRequestHandler(VizCompiler compiler, int maxBodyBytes) {
        this.compiler = compiler;
        this.maxBodyBytes = maxBodyBytes;
    }

    /** The response body for a parsed request spec. */
    protected abstract ObjectNode process(JsonNode specJson);

    @Override
    public void handle(Context ctx) throws IOException {
        if (maxBodyBytes > 0 && ctx.contentLength() > maxBodyBytes) {
            tooLarge(ctx, ctx.contentLength());
            return;
        }
        byte[] body = ctx.bodyAsBytes();
        if (maxBodyBytes > 0 && body.length > maxBodyBytes) {
            // chunked request without Content-Length
            tooLarge(ctx, body.length);
            return;
        }

        JsonNode specJson;
        try {
            specJson = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            LOG.warn("request.rejected path={} reason=malformed-json", ctx.path());
            problem(ctx, 400, ProblemDetail.badRequest("Request body is not valid JSON", ctx.path()));
            return;
        }

        try {
            ObjectNode response = process(specJson);
            ctx.status(200);
            ctx.contentType("application/json");
            ctx.result(MAPPER.writeValueAsString(response));
        } catch (SpecParseException | SchemaValidationException e) {
            problem(ctx, 400, ProblemDetail.invalidSpec(e, ctx.path()));
        } catch (UnsupportedSpecException e) {
            problem(ctx, 422, ProblemDetail.unsupportedSpec(e, ctx.path()));
        } catch (RuntimeException e) {
            LOG.error("request.failed path={} reason={}", ctx.path(), e.getMessage(), e);
            problem(ctx, 500, ProblemDetail.internalError(e.getMessage(), ctx.path()));
        }
    }

    private void tooLarge(Context ctx, long size) {
        LOG.warn("request.rejected path={} reason=body-too-large bytes={} limit={}", ctx.path(), size, maxBodyBytes);
        problem(ctx, 413, ProblemDetail.bodyTooLarge("Request body exceeds " + maxBodyBytes + " bytes", ctx.path()));
    }

    private static void problem(Context ctx, int status, JsonNode body) {
        ctx.status(status);
        ctx.contentType(ProblemDetail.CONTENT_TYPE);
        ctx.result(body.toString());
    }

    /** {@code {"spec": spec, "warnings": [{kind, message, details}, ...]}}. */
    static ObjectNode response(JsonNode spec, List<Warning> warnings) {
        ObjectNode out = MAPPER.createObjectNode();
        out.set("spec", spec);
        ArrayNode array = out.putArray("warnings");
        for (Warning warning : warnings) {
            ObjectNode entry = array.addObject();
            entry.put("kind", warning.kind().code());
            entry.put("message", warning.message());
            entry.set("details", MAPPER.valueToTree(warning.details()));
        }
        return out;
    }
}
