package testlab.master.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import testlab.master.TestSupport;
import testlab.master.TestSupport.ScriptedPipelines;
import testlab.master.config.Dependencies;
import testlab.master.model.JobStatus;
import testlab.master.server.MasterNettyServer;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hits the HTTP endpoints through a real Netty server. The scheduler daemon
 * is not started, so submitted jobs stay queued.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String AGENT_KEY = "test-agent-key";

    private Dependencies deps;
    private MasterNettyServer server;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(TestSupport.config("http").withAgentKey(AGENT_KEY), new ScriptedPipelines());
        server = new MasterNettyServer(deps.config(), deps.routerHandler());
        server.start();
        baseUrl = "http://127.0.0.1:" + server.port();

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.close();
        deps.close();
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(10));
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(request(path).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(postRequest(path, body, null), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> postInternal(String path, String body) throws Exception {
        return httpClient.send(postRequest(path, body, AGENT_KEY), HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest postRequest(String path, String body, String key) {
        HttpRequest.Builder builder = request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (key != null) {
            builder.header("X-Lab-Key", key);
        }
        return builder.build();
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    // ==================== Jobs ====================

    @Test
    @DisplayName("Submit, inspect and cancel a job over HTTP")
    void jobLifecycle() throws Exception {
        HttpResponse<String> created = post("/api/v1/jobs", """
                {
                    "description": "boot test",
                    "submitter": "alice",
                    "priority": "high",
                    "device": {"deviceType": "pixel", "tags": ["nfc"]}
                }
                """);
        assertEquals(201, created.statusCode(), created.body());
        long jobId = json(created).get("jobId").asLong();
        assertEquals("HIGH", json(created).get("priority").asText());
        assertEquals(1, json(created).get("device").get("count").asInt());

        HttpResponse<String> fetched = get("/api/v1/jobs/" + jobId);
        assertEquals(200, fetched.statusCode());
        assertEquals("SUBMITTED", json(fetched).get("status").asText());

        HttpResponse<String> queue = get("/api/v1/queue");
        assertEquals(1, json(queue).get("depth").asInt());
        assertEquals(1, json(queue).get("pendingByDeviceType").get("pixel").asInt());

        HttpResponse<String> canceled = post("/api/v1/jobs/" + jobId + "/cancel", "");
        assertEquals(200, canceled.statusCode());
        assertEquals("CANCELED", json(canceled).get("result").asText());

        HttpResponse<String> again = post("/api/v1/jobs/" + jobId + "/cancel", "");
        assertEquals("ALREADY_TERMINAL", json(again).get("result").asText());

        HttpResponse<String> resubmitted = post("/api/v1/jobs/" + jobId + "/resubmit", "");
        assertEquals(201, resubmitted.statusCode());
        assertNotEquals(jobId, json(resubmitted).get("jobId").asLong());

        HttpResponse<String> list = get("/api/v1/jobs?limit=1");
        assertEquals(1, json(list).size());
    }

    @Test
    @DisplayName("MultiNode job shows its roles")
    void multinodeSubmission() throws Exception {
        HttpResponse<String> created = post("/api/v1/jobs", """
                {
                    "roles": {
                        "server": {"deviceType": "pixel", "essential": true},
                        "client": {"deviceType": "pixel", "count": 2}
                    }
                }
                """);

        assertEquals(201, created.statusCode(), created.body());
        JsonNode roles = json(created).get("roles");
        assertTrue(roles.get("server").get("essential").asBoolean());
        assertEquals(2, roles.get("client").get("count").asInt());
        assertEquals("MEDIUM", json(created).get("priority").asText());
    }

    @Test
    @DisplayName("Errors map to 400, 404 and 409")
    void errorMapping() throws Exception {
        assertEquals(400, post("/api/v1/jobs", "{not json").statusCode());
        assertEquals(400, post("/api/v1/jobs", "{}").statusCode());
        assertEquals(400, post("/api/v1/jobs", """
                {"priority": "urgent", "device": {"deviceType": "pixel"}}
                """).statusCode());
        assertEquals(400, post("/api/v1/jobs", """
                {"device": {"deviceType": "pixel"}, "roles": {"a": {"deviceType": "pixel"}}}
                """).statusCode());

        HttpResponse<String> missing = get("/api/v1/jobs/987654");
        assertEquals(404, missing.statusCode());
        assertTrue(json(missing).has("error"));
        assertEquals(404, post("/api/v1/jobs/987654/cancel", "").statusCode());
        assertEquals(404, post("/api/v1/jobs/987654/resubmit", "").statusCode());
        assertEquals(404, get("/api/v1/nothing-here").statusCode());

        long queued = json(post("/api/v1/jobs", """
                {"device": {"deviceType": "pixel"}}
                """)).get("jobId").asLong();
        assertEquals(409, post("/api/v1/jobs/" + queued + "/resubmit", "").statusCode());
    }

    // ==================== Devices ====================

    @Test
    @DisplayName("Register devices and change their state")
    void deviceAdministration() throws Exception {
        HttpResponse<String> registered = post("/api/v1/devices", """
                {"hostname": "pixel-7", "deviceType": "pixel", "tags": ["nfc", "5g"]}
                """);
        assertEquals(201, registered.statusCode(), registered.body());
        assertEquals("IDLE", json(registered).get("status").asText());
        assertEquals("UNKNOWN", json(registered).get("health").asText());

        assertEquals(400, post("/api/v1/devices", """
                {"hostname": "pixel-7", "deviceType": "pixel"}
                """).statusCode());

        HttpResponse<String> failed = post("/api/v1/devices/pixel-7/health", """
                {"result": "FAIL"}
                """);
        assertEquals("BAD", json(failed).get("health").asText());
        assertEquals("OFFLINE", json(failed).get("status").asText());

        HttpResponse<String> online = post("/api/v1/devices/pixel-7/online", "");
        assertEquals("IDLE", json(online).get("status").asText());
        assertEquals("UNKNOWN", json(online).get("health").asText());

        HttpResponse<String> maintenance = post("/api/v1/devices/pixel-7/maintenance", "");
        assertEquals("MAINTENANCE", json(maintenance).get("health").asText());

        HttpResponse<String> types = get("/api/v1/device-types");
        assertEquals(1, json(types).size());

        assertEquals(200, get("/api/v1/devices/pixel-7").statusCode());
        assertEquals(404, get("/api/v1/devices/ghost").statusCode());
        assertEquals(404, post("/api/v1/devices/ghost/retire", "").statusCode());
        assertEquals(1, json(get("/api/v1/devices")).size());
    }

    @Test
    @DisplayName("Health endpoint reports components")
    void health() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("healthy", body.get("status").asText());
        assertEquals(0, body.get("queueDepth").asInt());
        assertFalse(body.get("schedulerRunning").asBoolean());
    }

    // ==================== Internal API ====================

    @Test
    @DisplayName("Internal endpoints require the agent key")
    void internalAuth() throws Exception {
        String body = """
                {"role": "server", "hostname": "h1", "messageId": "m"}
                """;
        HttpResponse<String> noKey = httpClient.send(postRequest("/internal/v1/groups/g/send", body, null),
                HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> wrongKey = httpClient.send(postRequest("/internal/v1/groups/g/send", body, "nope"),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(403, noKey.statusCode());
        assertEquals(403, wrongKey.statusCode());
        assertEquals(200, postInternal("/internal/v1/groups/g/send", body).statusCode());
    }

    @Test
    @DisplayName("Barrier over HTTP releases once every role arrives")
    void barrierOverHttp() throws Exception {
        deps.coordinator().declareGroup("g-http", Map.of("h1", "server", "h2", "client"));

        CompletableFuture<HttpResponse<String>> server = httpClient.sendAsync(
                postRequest("/internal/v1/groups/g-http/barrier", """
                        {"role": "server", "hostname": "h1", "syncId": "ready", "payload": {"port": "9000"}}
                        """, AGENT_KEY),
                HttpResponse.BodyHandlers.ofString());
        Thread.sleep(200);
        assertFalse(server.isDone());

        HttpResponse<String> client = postInternal("/internal/v1/groups/g-http/barrier", """
                {"role": "client", "hostname": "h2", "syncId": "ready", "timeoutMs": 5000}
                """);

        assertEquals("OK", json(client).get("status").asText());
        assertEquals("9000", json(client).get("payloads").get("server").get("port").asText());
        HttpResponse<String> serverResponse = server.get(5, TimeUnit.SECONDS);
        assertEquals("OK", json(serverResponse).get("status").asText());
    }

    @Test
    @DisplayName("Send, receive and failure statuses over HTTP")
    void messagesOverHttp() throws Exception {
        deps.coordinator().declareGroup("g-msg", Map.of("h1", "server", "h2", "client"));

        HttpResponse<String> sent = postInternal("/internal/v1/groups/g-msg/send", """
                {"role": "server", "hostname": "h1", "messageId": "addr", "toRoles": ["client"],
                 "payload": {"ip": "10.1.1.1"}}
                """);
        assertEquals("OK", json(sent).get("status").asText());

        HttpResponse<String> received = postInternal("/internal/v1/groups/g-msg/receive", """
                {"role": "client", "hostname": "h2", "messageId": "addr", "timeoutMs": 1000}
                """);
        assertEquals("OK", json(received).get("status").asText());
        assertEquals("10.1.1.1", json(received).get("message").get("payload").get("ip").asText());

        HttpResponse<String> timeout = postInternal("/internal/v1/groups/g-msg/receive", """
                {"role": "client", "hostname": "h2", "messageId": "addr", "timeoutMs": 100}
                """);
        assertEquals("TIMEOUT", json(timeout).get("status").asText());
        assertFalse(json(timeout).has("message"));

        HttpResponse<String> unknown = postInternal("/internal/v1/groups/nope/barrier", """
                {"role": "client", "hostname": "h2", "syncId": "x", "timeoutMs": 100}
                """);
        assertEquals("CANCELED", json(unknown).get("status").asText());

        assertEquals(400, postInternal("/internal/v1/groups/g-msg/barrier", """
                {"role": "client", "hostname": "stranger", "syncId": "x"}
                """).statusCode());
        assertEquals(400, postInternal("/internal/v1/groups/g-msg/receive", """
                {"role": "client", "hostname": "h2"}
                """).statusCode());
        assertEquals(400, postInternal("/internal/v1/groups/g-msg/barrier", """
                {"role": "client", "hostname": "h2", "syncId": "x", "payload": {"k": null}}
                """).statusCode());
        assertEquals(400, postInternal("/internal/v1/groups/g-msg/send", """
                {"role": "server", "hostname": "h1", "messageId": "m", "payload": {"k": null}}
                """).statusCode());
    }

    @Test
    @DisplayName("Dispatch callbacks map results to status codes")
    void dispatchCallbacks() throws Exception {
        deps.deviceRegistry().register("pixel-1", "pixel", List.of());
        long jobId = json(post("/api/v1/jobs", """
                {"device": {"deviceType": "pixel"}}
                """)).get("jobId").asLong();

        assertEquals(404, postInternal("/internal/v1/jobs/987654/devices/pixel-1/started", "").statusCode());
        assertEquals(409, postInternal("/internal/v1/jobs/" + jobId + "/devices/pixel-1/started", "").statusCode());

        deps.jobScheduler().runPass();
        TestSupport.await("job running",
                () -> deps.jobQueue().find(jobId).orElseThrow().status() == JobStatus.RUNNING);

        HttpResponse<String> outcome = postInternal("/internal/v1/jobs/" + jobId + "/devices/pixel-1/outcome", """
                {"status": "INCOMPLETE", "reason": "usb reset"}
                """);
        assertEquals(200, outcome.statusCode(), outcome.body());
        assertEquals("RECORDED", json(outcome).get("result").asText());

        JsonNode job = json(get("/api/v1/jobs/" + jobId));
        assertEquals("INCOMPLETE", job.get("status").asText());
        assertEquals("INFRASTRUCTURE", job.get("failureKind").asText());

        HttpResponse<String> repeat = postInternal("/internal/v1/jobs/" + jobId + "/devices/pixel-1/outcome", """
                {"status": "COMPLETE"}
                """);
        assertEquals("ALREADY_TERMINAL", json(repeat).get("result").asText());
    }
}
