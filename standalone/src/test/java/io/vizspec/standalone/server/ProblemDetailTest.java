package io.vizspec.standalone.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.vizspec.core.error.SpecParseException;
import io.vizspec.core.error.UnsupportedSpecException;
import io.vizspec.core.error.VizSpecException;
import org.junit.jupiter.api.Test;

class ProblemDetailTest {

    @Test
    void badRequestCarriesTheStandardMembers() {
        JsonNode problem = ProblemDetail.badRequest("Request body is not valid JSON", "/compile");

        assertThat(problem.get("type").asText()).isEqualTo(ProblemDetail.URN_BAD_REQUEST);
        assertThat(problem.get("title").asText()).isEqualTo("Bad Request");
        assertThat(problem.get("status").asInt()).isEqualTo(400);
        assertThat(problem.get("detail").asText()).isEqualTo("Request body is not valid JSON");
        assertThat(problem.get("instance").asText()).isEqualTo("/compile");
        assertThat(problem.has("stage")).isFalse();
    }

    @Test
    void missingInstanceIsWrittenAsNull() {
        JsonNode problem = ProblemDetail.internalError("boom", null);

        assertThat(problem.get("status").asInt()).isEqualTo(500);
        assertThat(problem.get("instance").isNull()).isTrue();
    }

    @Test
    void invalidSpecAddsTheFailedStage() {
        JsonNode problem = ProblemDetail.invalidSpec(
                new SpecParseException("'encoding' must be an object", null, "<request>"), "/normalize");

        assertThat(problem.get("type").asText()).isEqualTo(ProblemDetail.URN_INVALID_SPEC);
        assertThat(problem.get("title").asText()).isEqualTo("Invalid Spec");
        assertThat(problem.get("stage").asText()).isEqualTo("PARSE");
        assertThat(problem.has("specName")).isFalse();
    }

    @Test
    void unsupportedSpecAddsStageAndSpecName() {
        JsonNode problem = ProblemDetail.unsupportedSpec(
                new UnsupportedSpecException("Unsupported mark type 'sankey'", "flows", VizSpecException.Stage.COMPILE),
                "/compile");

        assertThat(problem.get("type").asText()).isEqualTo(ProblemDetail.URN_UNSUPPORTED_SPEC);
        assertThat(problem.get("status").asInt()).isEqualTo(422);
        assertThat(problem.get("detail").asText()).isEqualTo("Unsupported mark type 'sankey'");
        assertThat(problem.get("stage").asText()).isEqualTo("COMPILE");
        assertThat(problem.get("specName").asText()).isEqualTo("flows");
    }

    @Test
    void bodyTooLarge() {
        JsonNode problem = ProblemDetail.bodyTooLarge("Request body exceeds 10 bytes", "/compile");

        assertThat(problem.get("type").asText()).isEqualTo(ProblemDetail.URN_BODY_TOO_LARGE);
        assertThat(problem.get("title").asText()).isEqualTo("Payload Too Large");
        assertThat(problem.get("status").asInt()).isEqualTo(413);
    }
}
