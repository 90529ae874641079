package com.codesmith.orchestrator.client;

import com.codesmith.orchestrator.client.CodeValidator.ValidationReport;
import com.codesmith.orchestrator.model.RankedSnippet;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HTTP clients against a local mock server: request shape, response parsing
 * and error mapping.
 */
class AgentClientsHttpTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper json = new ObjectMapper();

    private HttpServer server;
    private String     serverUrl;

    // path -> last request body / headers
    private final Map<String, String>  bodies  = new ConcurrentHashMap<>();
    private final Map<String, String>  headers = new ConcurrentHashMap<>();

    // path -> canned response
    private final Map<String, Integer> statuses  = new ConcurrentHashMap<>();
    private final Map<String, String>  responses = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        serverUrl = "http://localhost:" + server.getAddress().getPort() + "/";
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    // ------------------------------------------------------------------
    // Memory agent
    // ------------------------------------------------------------------

    @Test
    void memorySearch_sortsByScoreAndLimits() throws Exception {
        respond("/api/mcp/call", 200, """
                {"results":[
                  {"source":"a.java","content":"A","score":0.2,"extra":"ignored"},
                  {"source":"b.java","content":"B","score":0.9},
                  {"source":"c.java","content":"C","score":0.5}
                ]}""");
        MemoryAgentClient client = new MemoryAgentClient(serverUrl, TIMEOUT, json);

        List<RankedSnippet> hits = client.search("csv parser", 2);

        assertThat(hits).extracting(RankedSnippet::source).containsExactly("b.java", "c.java");
        JsonNode request = json.readTree(bodies.get("/api/mcp/call"));
        assertThat(request.path("name").asText()).isEqualTo("smartsearch");
        assertThat(request.path("arguments").path("query").asText()).isEqualTo("csv parser");
        assertThat(request.path("arguments").path("limit").asInt()).isEqualTo(2);
    }

    @Test
    void memorySearch_zeroLimit_skipsTheCall() {
        MemoryAgentClient client = new MemoryAgentClient(serverUrl, TIMEOUT, json);

        assertThat(client.search("anything", 0)).isEmpty();
        assertThat(bodies).isEmpty();
    }

    @Test
    void memorySearch_noResultsField_returnsEmpty() {
        respond("/api/mcp/call", 200, "{}");
        MemoryAgentClient client = new MemoryAgentClient(serverUrl, TIMEOUT, json);

        assertThat(client.search("anything", 5)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Validation agent
    // ------------------------------------------------------------------

    @Test
    void validate_parsesReportAndClampsScore() throws Exception {
        respond("/api/agent/validate", 200, """
                {"score":12.5,"summary":"ok","buildErrors":null,
                 "issues":[{"severity":"high","location":"A.java:1","message":"unused import"}]}""");
        ValidationAgentClient client = new ValidationAgentClient(serverUrl, TIMEOUT, json);

        ValidationReport report = client.validate("class A {}", "java");

        assertThat(report.score()).isEqualTo(10.0);
        assertThat(report.issues()).singleElement()
                .satisfies(i -> assertThat(i.message()).isEqualTo("unused import"));
        JsonNode request = json.readTree(bodies.get("/api/agent/validate"));
        assertThat(request.path("code").asText()).isEqualTo("class A {}");
        assertThat(request.path("language").asText()).isEqualTo("java");
    }

    @Test
    void validate_nanScore_readsAsZero() {
        respond("/api/agent/validate", 200, """
                {"score":"NaN","summary":"confused","buildErrors":null,"issues":[]}""");
        ValidationAgentClient client = new ValidationAgentClient(serverUrl, TIMEOUT, json);

        ValidationReport report = client.validate("class A {}", "java");

        assertThat(report.score()).isZero();
        assertThat(new ValidationReport(Double.NaN, null, null, null).score()).isZero();
    }

    @Test
    void validate_serverError_throwsWithStatus() {
        respond("/api/agent/validate", 503, "busy");
        ValidationAgentClient client = new ValidationAgentClient(serverUrl, TIMEOUT, json);

        assertThatThrownBy(() -> client.validate("class A {}", "java"))
                .isInstanceOfSatisfying(ClientException.class, e -> assertThat(e.statusCode()).isEqualTo(503))
                .hasMessageContaining("HTTP 503");
    }

    @Test
    void validate_blankArtifact_throwsWithoutCalling() {
        ValidationAgentClient client = new ValidationAgentClient(serverUrl, TIMEOUT, json);

        assertThatThrownBy(() -> client.validate("  ", "java")).isInstanceOf(ClientException.class);
        assertThat(bodies).isEmpty();
    }

    // ------------------------------------------------------------------
    // Model clients
    // ------------------------------------------------------------------

    @Test
    void ollamaGenerate_sendsNonStreamingRequest() throws Exception {
        respond("/api/generate", 200, """
                {"model":"qwen","response":"```java\\nclass A {}\\n```","done":true}""");
        OllamaClient client = new OllamaClient(serverUrl, TIMEOUT, json);

        String reply = client.generate("qwen", "be terse", "write A");

        assertThat(reply).contains("class A {}");
        JsonNode request = json.readTree(bodies.get("/api/generate"));
        assertThat(request.path("stream").asBoolean(true)).isFalse();
        assertThat(request.path("system").asText()).isEqualTo("be terse");
    }

    @Test
    void ollamaGenerate_emptyResponse_throws() {
        respond("/api/generate", 200, "{\"model\":\"qwen\",\"response\":\"\",\"done\":true}");
        OllamaClient client = new OllamaClient(serverUrl, TIMEOUT, json);

        assertThatThrownBy(() -> client.generate("qwen", null, "write A"))
                .isInstanceOf(ClientException.class)
                .hasMessageContaining("empty response");
    }

    @Test
    void claudeComplete_sendsAuthHeadersAndReturnsFirstTextBlock() throws Exception {
        respond("/v1/messages", 200, """
                {"model":"claude","content":[{"type":"text","text":"class B {}"}]}""");
        ClaudeClient client = new ClaudeClient(serverUrl, "secret", TIMEOUT, json);

        String reply = client.complete("claude", "system", "write B");

        assertThat(reply).isEqualTo("class B {}");
        assertThat(headers.get("/v1/messages")).contains("secret").contains("2023-06-01");
        JsonNode request = json.readTree(bodies.get("/v1/messages"));
        assertThat(request.path("messages").get(0).path("content").asText()).isEqualTo("write B");
    }

    @Test
    void claudeComplete_missingKey_throwsBeforeCalling() {
        ClaudeClient client = new ClaudeClient(serverUrl, "", TIMEOUT, json);

        assertThatThrownBy(() -> client.complete("claude", null, "write B"))
                .isInstanceOf(ClientException.class)
                .hasMessageContaining("api-key");
        assertThat(bodies).isEmpty();
    }

    // ------------------------------------------------------------------
    // Mock server
    // ------------------------------------------------------------------

    private void respond(String path, int status, String body) {
        statuses.put(path, status);
        responses.put(path, body);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        bodies.put(path, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        headers.put(path, exchange.getRequestHeaders().getFirst("x-api-key") + " "
                + exchange.getRequestHeaders().getFirst("anthropic-version"));

        byte[] out = responses.getOrDefault(path, "").getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statuses.getOrDefault(path, 404), out.length == 0 ? -1 : out.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(out);
        }
    }
}
