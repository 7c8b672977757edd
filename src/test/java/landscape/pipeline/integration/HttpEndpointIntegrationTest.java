package landscape.pipeline.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import landscape.pipeline.TestDatabases;
import landscape.pipeline.config.Dependencies;
import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.model.PhaseName;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints through the Netty server.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TEST_PORT = 18080;
    private static final String BASE_URL = "http://localhost:" + TEST_PORT;

    private Dependencies deps;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws Exception {
        PipelineConfig config = PipelineConfig.defaults()
                .withDatabaseUrl(TestDatabases.memUrl("http"))
                .withPollInterval(Duration.ofMillis(20))
                .withHeartbeatInterval(Duration.ofMillis(100));
        deps = Dependencies.create(config);
        for (PhaseName phase : PhaseName.values()) {
            deps.handlers().register(ScriptedPhaseHandler.completing(phase, 2));
        }
        deps.httpServer().start(TEST_PORT);

        // Wait for server to be ready
        TimeUnit.MILLISECONDS.sleep(200);

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder().uri(URI.create(BASE_URL + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
                .uri(URI.create(BASE_URL + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> delete(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder().uri(URI.create(BASE_URL + path)).DELETE().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode awaitFinished(String executionId) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
        while (true) {
            HttpResponse<String> response = get("/api/v1/pipelines/" + executionId);
            assertEquals(200, response.statusCode(), response.body());
            JsonNode status = MAPPER.readTree(response.body());
            String value = status.get("status").asText();
            if (!value.equals("PENDING") && !value.equals("RUNNING")) {
                return status;
            }
            if (System.nanoTime() > deadline) {
                fail("execution " + executionId + " still " + value);
            }
            TimeUnit.MILLISECONDS.sleep(50);
        }
    }

    @Test
    void healthReportsDatabaseAndVersion() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode health = MAPPER.readTree(response.body());
        assertEquals("healthy", health.get("status").asText());
        assertEquals("ok", health.get("database").asText());
        assertEquals("1.0.0", health.get("version").asText());
        assertEquals(0, health.get("openCircuits").asInt());
    }

    @Test
    @DisplayName("Full HTTP flow: start, poll status, list, cancel after finish")
    void startAndTrackExecution() throws Exception {
        HttpResponse<String> created = post("/api/v1/pipelines", """
                {"phases": ["keyword_metrics", "serp_collection"],
                 "phaseSettings": {"serp_collection": {"concurrency": 2}},
                 "parameters": {"landscapeId": "7"}}
                """);

        assertEquals(201, created.statusCode(), created.body());
        JsonNode body = MAPPER.readTree(created.body());
        assertTrue(body.get("success").asBoolean());
        assertEquals("PENDING", body.get("status").asText());
        String executionId = body.get("executionId").asText();

        JsonNode status = awaitFinished(executionId);
        assertEquals("COMPLETED", status.get("status").asText());
        assertEquals("API", status.get("triggerMode").asText());
        assertEquals(100.0, status.get("progressPercent").asDouble(), 0.01);
        assertEquals(9, status.get("phases").size());

        JsonNode serp = status.get("phases").get(1);
        assertEquals("serp_collection", serp.get("phase").asText());
        assertEquals("COMPLETED", serp.get("status").asText());
        assertEquals(2, serp.get("itemsSucceeded").asInt());
        assertEquals("SKIPPED", status.get("phases").get(2).get("status").asText());

        HttpResponse<String> list = get("/api/v1/pipelines?limit=5");
        assertEquals(200, list.statusCode());
        JsonNode executions = MAPPER.readTree(list.body());
        assertEquals(1, executions.get("count").asInt());
        assertEquals(executionId, executions.get("executions").get(0).get("executionId").asText());

        HttpResponse<String> cancel = delete("/api/v1/pipelines/" + executionId);
        assertEquals(409, cancel.statusCode());
        assertEquals("execution already finished", MAPPER.readTree(cancel.body()).get("error").asText());

        HttpResponse<String> resume = post("/api/v1/pipelines/" + executionId + "/resume", "");
        assertEquals(409, resume.statusCode());
    }

    @Test
    void emptyBodyStartsAllPhases() throws Exception {
        HttpResponse<String> created = post("/api/v1/pipelines", "");

        assertEquals(201, created.statusCode(), created.body());
        JsonNode status = awaitFinished(MAPPER.readTree(created.body()).get("executionId").asText());
        assertEquals("COMPLETED", status.get("status").asText());
        for (JsonNode phase : status.get("phases")) {
            assertEquals("COMPLETED", phase.get("status").asText(), phase.get("phase").asText());
        }
    }

    @Test
    void invalidRequestsAreRejected() throws Exception {
        HttpResponse<String> unknownPhase = post("/api/v1/pipelines", "{\"phases\": [\"serp\"]}");
        assertEquals(400, unknownPhase.statusCode());
        assertEquals("Unknown phase: serp", MAPPER.readTree(unknownPhase.body()).get("error").asText());

        HttpResponse<String> malformed = post("/api/v1/pipelines", "{\"phases\": ");
        assertEquals(400, malformed.statusCode());

        HttpResponse<String> badOverride = post("/api/v1/pipelines", """
                {"dependencyOverrides": [
                    {"phase": "keyword_metrics", "dependsOn": "landscape_dsi", "kind": "soft"}]}
                """);
        assertEquals(400, badOverride.statusCode());

        HttpResponse<String> badLimit = get("/api/v1/pipelines?limit=0");
        assertEquals(400, badLimit.statusCode());
    }

    @Test
    void unknownResourcesReturn404() throws Exception {
        assertEquals(404, get("/api/v1/pipelines/does-not-exist").statusCode());
        assertEquals(404, delete("/api/v1/pipelines/does-not-exist").statusCode());
        assertEquals(404, get("/api/v1/circuit-breakers/nobody").statusCode());
        assertEquals(404, post("/api/v1/circuit-breakers/nobody/reset", "").statusCode());
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
    }

    @Test
    @DisplayName("Circuit breakers and queue stats reflect a finished run")
    void resilienceEndpoints() throws Exception {
        HttpResponse<String> created = post("/api/v1/pipelines", "{\"phases\": [\"serp_collection\"]}");
        awaitFinished(MAPPER.readTree(created.body()).get("executionId").asText());

        HttpResponse<String> breakers = get("/api/v1/circuit-breakers");
        assertEquals(200, breakers.statusCode());
        JsonNode all = MAPPER.readTree(breakers.body());
        assertEquals(1, all.get("count").asInt());

        HttpResponse<String> serpBreaker = get("/api/v1/circuit-breakers/test-serp_collection");
        assertEquals(200, serpBreaker.statusCode());
        JsonNode breaker = MAPPER.readTree(serpBreaker.body());
        assertEquals("CLOSED", breaker.get("state").asText());
        assertEquals(2, breaker.get("totalSuccesses").asLong());

        HttpResponse<String> reset = post("/api/v1/circuit-breakers/test-serp_collection/reset", "");
        assertEquals(200, reset.statusCode());
        assertEquals("CLOSED", MAPPER.readTree(reset.body()).get("state").asText());

        HttpResponse<String> queue = get("/api/v1/queues/serp");
        assertEquals(200, queue.statusCode());
        JsonNode stats = MAPPER.readTree(queue.body());
        assertEquals("serp", stats.get("queue").asText());
        assertEquals(2, stats.get("completed").asInt());
        assertEquals(0, stats.get("pending").asInt());

        HttpResponse<String> retry = post("/api/v1/queues/serp/dead-letters/retry", "");
        assertEquals(200, retry.statusCode());
        assertEquals(0, MAPPER.readTree(retry.body()).get("requeued").asInt());
    }
}
