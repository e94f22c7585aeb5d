package io.stubmatch.core.spec;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stubmatch.core.matcher.Expectation;
import io.stubmatch.core.matcher.Expectations;
import io.stubmatch.core.model.Request;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExpectationWriter}. */
@DisplayName("ExpectationWriter")
class ExpectationWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("keyed rules carry key plus equals or absent")
    void keyedRuleShapes() throws Exception {
        assertThat(ExpectationWriter.toNode(new Expectation.QueryExists("a")))
                .isEqualTo(MAPPER.readTree("{\"query\": {\"key\": \"a\"}}"));
        assertThat(ExpectationWriter.toNode(new Expectation.HeaderMiss("X")))
                .isEqualTo(MAPPER.readTree("{\"header\": {\"key\": \"X\", \"absent\": true}}"));
        assertThat(ExpectationWriter.toNode(new Expectation.QueryEq("p", "2")))
                .isEqualTo(MAPPER.readTree("{\"query\": {\"key\": \"p\", \"equals\": \"2\"}}"));
    }

    @Test
    @DisplayName("scalar and unit rules")
    void scalarAndUnitRuleShapes() throws Exception {
        assertThat(ExpectationWriter.toNode(new Expectation.Method("GET")))
                .isEqualTo(MAPPER.readTree("{\"method\": \"GET\"}"));
        assertThat(ExpectationWriter.toNode(new Expectation.FragmentMiss()))
                .isEqualTo(MAPPER.readTree("{\"fragment\": {\"absent\": true}}"));
        assertThat(ExpectationWriter.toNode(new Expectation.BodyEq("{}")))
                .isEqualTo(MAPPER.readTree("{\"body\": {\"equals\": \"{}\"}}"));
    }

    @Test
    @DisplayName("diagnostics can be persisted as a corrected expectation set")
    void correctedExpectationsMatch() {
        Expectations configured = Expectations.of(
                new Expectation.Method("POST"),
                new Expectation.Path("/users"),
                new Expectation.QueryEq("page", "2"),
                new Expectation.HeaderExists("X-Id"),
                new Expectation.FragmentMiss(),
                new Expectation.BodyEq("{\"name\": \"x\"}"));
        Request request = Request.parse("/users?page#top").withBody("line1\nline2");

        List<Expectation> diagnostics = configured.validate(request).orElseThrow();
        Expectations corrected = ExpectationParser.parse(ExpectationWriter.toYaml(diagnostics));

        assertThat(corrected.rules()).isEqualTo(diagnostics);
        assertThat(corrected.isMatched(request)).isTrue();
    }

    @Test
    @DisplayName("report lists each mismatch with both sides and a message")
    void report() {
        Expectations expectations = Expectations.of(new Expectation.Method("GET"), new Expectation.HeaderMiss("X"));
        Request request = Request.defaults().withMethod("PUT").withHeader("X", "1");

        JsonNode report = ExpectationWriter.report(request, expectations.explain(request));

        assertThat(report.path("request").asText()).isEqualTo("[PUT / | with headers {\"X\" = \"1\"}]");
        assertThat(report.path("matched").asBoolean()).isFalse();
        assertThat(report.path("mismatches")).hasSize(2);
        assertThat(report.path("mismatches").get(0).path("actual").path("method").asText()).isEqualTo("PUT");
        assertThat(report.path("mismatches").get(1).path("message").asText())
                .isEqualTo("expected header \"X\" is absent but header \"X\" is present");
    }

    @Test
    @DisplayName("report of a matching request is empty")
    void matchingReport() throws Exception {
        String json = ExpectationWriter.reportJson(Expectations.of(new Expectation.Path("/")), Request.defaults());

        JsonNode report = MAPPER.readTree(json);
        assertThat(report.path("matched").asBoolean()).isTrue();
        assertThat(report.path("mismatches")).isEmpty();
    }
}
