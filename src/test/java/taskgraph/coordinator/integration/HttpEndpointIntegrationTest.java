package taskgraph.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import taskgraph.coordinator.config.CoordinatorConfig;
import taskgraph.coordinator.config.Dependencies;
import taskgraph.coordinator.exec.ExecutionOutcome;
import taskgraph.coordinator.server.CoordinatorNettyServer;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits the real HTTP endpoints through Netty.
 * Tasks are scheduled an hour ahead so nothing fires during a test.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path outputDir;

    private HttpClient httpClient;
    private String baseUrl;
    private long later;

    @BeforeEach
    void setUp() {
        if (CoordinatorNettyServer.isRunning()) {
            CoordinatorNettyServer.stop();
        }

        CoordinatorConfig config = CoordinatorConfig.defaults().withOutputDirectory(outputDir);
        Dependencies deps = Dependencies.create(config, task -> ExecutionOutcome.exited(0, 0));
        assertTrue(CoordinatorNettyServer.start(0, "127.0.0.1", deps));

        baseUrl = "http://127.0.0.1:" + CoordinatorNettyServer.boundPort();
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        later = System.currentTimeMillis() + 3_600_000;
    }

    @AfterEach
    void tearDown() {
        CoordinatorNettyServer.stop();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> delete(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).DELETE().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private String task(String name, long time, String... deps) throws Exception {
        ObjectNode node = MAPPER.createObjectNode()
                .put("name", name)
                .put("programPath", "/opt/jobs/" + name + ".py")
                .put("scheduledTime", time);
        ArrayNode array = node.putArray("dependsOn");
        for (String dep : deps) {
            array.add(dep);
        }
        return MAPPER.writeValueAsString(node);
    }

    @Test
    @DisplayName("Schedule, inspect and cancel a dependency chain over HTTP")
    void scheduleInspectCancel() throws Exception {
        HttpResponse<String> created = post("/api/v1/tasks", task("extract", later));
        assertEquals(201, created.statusCode(), created.body());
        JsonNode createdJson = MAPPER.readTree(created.body());
        assertEquals("extract", createdJson.get("name").asText());
        assertTrue(createdJson.get("waitMs").asLong() > 3_500_000);

        assertEquals(201, post("/api/v1/tasks", task("load", later + 1000, "extract")).statusCode());

        HttpResponse<String> list = get("/api/v1/tasks");
        assertEquals(200, list.statusCode());
        JsonNode listJson = MAPPER.readTree(list.body());
        assertEquals(2, listJson.get("count").asInt());
        assertEquals("extract", listJson.get("tasks").get(0).get("name").asText());

        HttpResponse<String> load = get("/api/v1/tasks/load");
        assertEquals(200, load.statusCode());
        JsonNode loadJson = MAPPER.readTree(load.body());
        assertEquals("PENDING", loadJson.get("status").asText());
        assertEquals("extract", loadJson.get("dependsOn").get(0).asText());
        assertTrue(loadJson.get("outputFile").asText().startsWith(outputDir.toAbsolutePath().normalize().toString()));

        HttpResponse<String> cancelled = delete("/api/v1/tasks/extract");
        assertEquals(200, cancelled.statusCode());
        assertEquals("CANCELLED", MAPPER.readTree(cancelled.body()).get("status").asText());

        JsonNode freed = MAPPER.readTree(get("/api/v1/tasks/load").body());
        assertEquals("ARMED", freed.get("status").asText());
        assertEquals(0, freed.get("dependsOn").size());

        assertEquals(404, delete("/api/v1/tasks/extract").statusCode());
    }

    @Test
    void duplicateNameIsConflict() throws Exception {
        assertEquals(201, post("/api/v1/tasks", task("a", later)).statusCode());

        HttpResponse<String> dup = post("/api/v1/tasks", task("a", later));

        assertEquals(409, dup.statusCode());
        assertTrue(MAPPER.readTree(dup.body()).has("error"));
    }

    @Test
    void orderingViolationIsUnprocessable() throws Exception {
        assertEquals(201, post("/api/v1/tasks", task("a", later)).statusCode());

        HttpResponse<String> early = post("/api/v1/tasks", task("b", later - 1000, "a"));

        assertEquals(422, early.statusCode());
        assertEquals(404, get("/api/v1/tasks/b").statusCode());
    }

    @Test
    void cascadeCancelReturnsAllRemoved() throws Exception {
        post("/api/v1/tasks", task("a", later));
        post("/api/v1/tasks", task("b", later, "a"));
        post("/api/v1/tasks", task("c", later, "b"));
        post("/api/v1/tasks", task("other", later));

        HttpResponse<String> response = delete("/api/v1/tasks/a?cascade=true");

        assertEquals(200, response.statusCode());
        JsonNode cancelled = MAPPER.readTree(response.body()).get("cancelled");
        assertEquals(3, cancelled.size());
        assertEquals("a", cancelled.get(0).get("name").asText());
        assertEquals(1, MAPPER.readTree(get("/api/v1/tasks").body()).get("count").asInt());
    }

    @Test
    void encodedNamesAreDecoded() throws Exception {
        assertEquals(201, post("/api/v1/tasks", task("daily report", later)).statusCode());

        assertEquals(200, get("/api/v1/tasks/daily%20report").statusCode());
        assertEquals(200, delete("/api/v1/tasks/daily%20report").statusCode());
    }

    @Test
    void badRequests() throws Exception {
        assertEquals(400, post("/api/v1/tasks", "{not json").statusCode());
        assertEquals(400, post("/api/v1/tasks", "").statusCode());
        assertEquals(400, post("/api/v1/tasks", "{\"name\":\"x\"}").statusCode());
        assertEquals(400, post("/api/v1/tasks", "{\"name\":\"a/b\",\"programPath\":\"p\"}").statusCode());
    }

    @Test
    void unknownRoutesAreNotFound() throws Exception {
        assertEquals(404, get("/api/v1/nothing").statusCode());
        assertEquals(404, get("/api/v1/tasks/missing").statusCode());
        assertEquals(404, delete("/api/v1/tasks").statusCode());
    }

    @Test
    void healthReportsCounts() throws Exception {
        post("/api/v1/tasks", task("a", later));
        post("/api/v1/tasks", task("b", later, "a"));

        HttpResponse<String> health = get("/api/v1/health");

        assertEquals(200, health.statusCode());
        JsonNode json = MAPPER.readTree(health.body());
        assertEquals("healthy", json.get("status").asText());
        assertEquals(1, json.get("armedTasks").asInt());
        assertEquals(1, json.get("pendingTasks").asInt());
        assertEquals(0, json.get("runningTasks").asInt());
    }
}
