package io.vizspec.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vizspec.core.error.VizSpecException;

/**
 * Builds RFC 9457 Problem Details bodies for the compile service.
 *
 * <pre>{@code
 * {
 * "type": "urn:vizspec:compile:unsupported-spec",
 * "title": "Unsupported Spec",
 * "status": 422,
 * "detail": "Layer member has facet channels",
 * "instance": "/compile",
 * "stage": "NORMALIZE"
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe: all methods are stateless.
 */
public final class ProblemDetail {

    /** Content type of every problem response. */
    public static final String CONTENT_TYPE = "application/problem+json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_BAD_REQUEST = "urn:vizspec:compile:bad-request";
    static final String URN_INVALID_SPEC = "urn:vizspec:compile:invalid-spec";
    static final String URN_UNSUPPORTED_SPEC = "urn:vizspec:compile:unsupported-spec";
    static final String URN_BODY_TOO_LARGE = "urn:vizspec:compile:body-too-large";
    static final String URN_INTERNAL_ERROR = "urn:vizspec:compile:internal-error";

    private ProblemDetail() {
        // utility class
    }

    /** Request body is not valid JSON (400). */
    public static JsonNode badRequest(String detail, String instancePath) {
        return build(URN_BAD_REQUEST, "Bad Request", 400, detail, instancePath);
    }

    /** Spec failed to parse or violated the schema (400). */
    public static JsonNode invalidSpec(VizSpecException e, String instancePath) {
        return withFailure(build(URN_INVALID_SPEC, "Invalid Spec", 400, e.getMessage(), instancePath), e);
    }

    /** Spec uses a combination the normalizer or compiler does not support (422). */
    public static JsonNode unsupportedSpec(VizSpecException e, String instancePath) {
        return withFailure(build(URN_UNSUPPORTED_SPEC, "Unsupported Spec", 422, e.getMessage(), instancePath), e);
    }

    /** Request body exceeds {@code server.max-body-bytes} (413). */
    public static JsonNode bodyTooLarge(String detail, String instancePath) {
        return build(URN_BODY_TOO_LARGE, "Payload Too Large", 413, detail, instancePath);
    }

    /** Unexpected failure (500). */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    static ObjectNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }

    private static ObjectNode withFailure(ObjectNode node, VizSpecException e) {
        node.put("stage", e.stage().name());
        if (e.specName() != null) {
            node.put("specName", e.specName());
        }
        return node;
    }
}
