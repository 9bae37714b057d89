package docintel.tasks.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import docintel.tasks.config.Dependencies;
import docintel.tasks.config.TaskQueueConfig;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 * Submits registered work through the Netty server and polls it to completion.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TEST_PORT = 18080;
    private static final String BASE_URL = "http://127.0.0.1:" + TEST_PORT;

    private Dependencies deps;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        TaskQueueConfig config = TaskQueueConfig.defaults()
                .withServerHost("127.0.0.1")
                .withServerPort(TEST_PORT)
                .withMaxWorkers(2);
        deps = start(config);

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

    @Test
    @DisplayName("Full HTTP flow: submit work, poll until completed")
    void submitAndPollToCompletion() throws Exception {
        HttpResponse<String> submit = post("/api/v1/tasks", "{\"work\":\"add\",\"args\":[2,3]}");
        assertEquals(202, submit.statusCode(), submit.body());

        JsonNode accepted = MAPPER.readTree(submit.body());
        String taskId = accepted.get("task_id").asText();
        assertEquals("PENDING", accepted.get("status").asText());
        assertFalse(taskId.isBlank());

        JsonNode done = awaitTerminal(taskId);
        assertEquals("COMPLETED", done.get("status").asText());
        assertEquals(5, done.get("result").asInt());
        assertFalse(done.has("error"));
        assertTrue(done.get("updated_at").asDouble() >= done.get("created_at").asDouble());
    }

    @Test
    @DisplayName("Failing work ends FAILED with its error text")
    void failingWorkIsReported() throws Exception {
        HttpResponse<String> submit = post("/api/v1/tasks", "{\"work\":\"fail\",\"args\":[\"no pages\"]}");
        assertEquals(202, submit.statusCode());
        String taskId = MAPPER.readTree(submit.body()).get("task_id").asText();

        JsonNode done = awaitTerminal(taskId);
        assertEquals("FAILED", done.get("status").asText());
        assertEquals("no pages", done.get("error").asText());
        assertFalse(done.has("result"));
    }

    @Test
    void unknownTaskIs404() throws Exception {
        HttpResponse<String> response = get("/api/v1/tasks/does-not-exist");

        assertEquals(404, response.statusCode());
        assertEquals("task not found", MAPPER.readTree(response.body()).get("error").asText());
    }

    @Test
    void badSubmissionsAre400() throws Exception {
        assertEquals(400, post("/api/v1/tasks", "{\"work\":\"no-such-work\"}").statusCode());
        assertEquals(400, post("/api/v1/tasks", "{\"args\":[1]}").statusCode());
        assertEquals(400, post("/api/v1/tasks", "{not json").statusCode());
        assertEquals(400, post("/api/v1/tasks", "").statusCode());
    }

    @Test
    void staleEndpointListsNothingForIdleQueue() throws Exception {
        HttpResponse<String> response = get("/api/v1/tasks/stale?older_than_seconds=60");

        assertEquals(200, response.statusCode());
        JsonNode json = MAPPER.readTree(response.body());
        assertEquals(60, json.get("threshold_seconds").asLong());
        assertEquals(0, json.get("count").asInt());

        assertEquals(400, get("/api/v1/tasks/stale?older_than_seconds=soon").statusCode());
    }

    @Test
    void healthReportsLocalStore() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode json = MAPPER.readTree(response.body());
        assertEquals("healthy", json.get("status").asText());
        assertEquals("memory", json.get("taskStore").asText());
        assertFalse(json.get("sharedState").asBoolean());
        assertFalse(json.get("degraded").asBoolean());
        assertEquals(2, json.get("maxWorkers").asInt());
    }

    @Test
    void healthShowsDegradedWhenRedisIsUnreachable() throws Exception {
        deps.close();
        deps = start(TaskQueueConfig.defaults()
                .withServerHost("127.0.0.1")
                .withServerPort(TEST_PORT)
                .withRedisUrl("redis://127.0.0.1:1")
                .withRedisTimeout(Duration.ofMillis(500)));

        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode json = MAPPER.readTree(response.body());
        assertEquals("degraded", json.get("status").asText());
        assertEquals("memory-fallback", json.get("taskStore").asText());
        assertTrue(json.get("degraded").asBoolean());

        // Tasks still run, locally
        String taskId = MAPPER.readTree(post("/api/v1/tasks", "{\"work\":\"add\",\"args\":[1,1]}").body())
                .get("task_id").asText();
        assertEquals(2, awaitTerminal(taskId).get("result").asInt());
    }

    @Test
    @DisplayName("Cached work is computed once until the cache is cleared")
    void cachedWorkAndCacheClear() throws Exception {
        String body = "{\"work\":\"counted\",\"args\":[\"report.pdf\"]}";

        JsonNode first = awaitTerminal(submitId(body));
        JsonNode second = awaitTerminal(submitId(body));
        assertEquals(1, first.get("result").asInt());
        assertEquals(1, second.get("result").asInt());

        HttpResponse<String> cleared = delete("/api/v1/cache");
        assertEquals(200, cleared.statusCode(), cleared.body());
        assertEquals("Cache cleared successfully", MAPPER.readTree(cleared.body()).get("message").asText());

        assertEquals(2, awaitTerminal(submitId(body)).get("result").asInt());
    }

    @Test
    void cacheClearWhenDisabledIs400() throws Exception {
        deps.close();
        deps = start(TaskQueueConfig.defaults()
                .withServerHost("127.0.0.1")
                .withServerPort(TEST_PORT)
                .withCacheEnabled(false));

        assertEquals(400, delete("/api/v1/cache").statusCode());
    }

    @Test
    void unknownPathIs404() throws Exception {
        assertEquals(404, get("/api/v2/tasks").statusCode());
    }

    private static Dependencies start(TaskQueueConfig config) {
        Dependencies deps = Dependencies.create(config);
        deps.workRegistry()
                .register("add", args -> ((Number) args[0]).intValue() + ((Number) args[1]).intValue())
                .register("fail", args -> {
                    throw new IllegalStateException(String.valueOf(args[0]));
                });
        AtomicInteger computations = new AtomicInteger();
        deps.registerCachedWork("counted", args -> computations.incrementAndGet());
        deps.startServer();
        return deps;
    }

    private JsonNode awaitTerminal(String taskId) throws Exception {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            HttpResponse<String> response = get("/api/v1/tasks/" + taskId);
            assertEquals(200, response.statusCode(), response.body());
            JsonNode json = MAPPER.readTree(response.body());
            String status = json.get("status").asText();
            if ("COMPLETED".equals(status) || "FAILED".equals(status)) {
                return json;
            }
            Thread.sleep(20);
        }
        fail("Task " + taskId + " did not finish in time");
        return null;
    }

    private String submitId(String body) throws Exception {
        HttpResponse<String> response = post("/api/v1/tasks", body);
        assertEquals(202, response.statusCode(), response.body());
        return MAPPER.readTree(response.body()).get("task_id").asText();
    }

    private HttpResponse<String> delete(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(BASE_URL + path)).DELETE().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(BASE_URL + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(BASE_URL + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }
}
