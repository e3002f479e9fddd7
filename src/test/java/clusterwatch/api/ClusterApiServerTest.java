package clusterwatch.api;

import clusterwatch.api.v1.HealthController;
import clusterwatch.api.v1.JobController;
import clusterwatch.api.v1.NodeController;
import clusterwatch.api.v1.PartitionController;
import clusterwatch.api.v1.StatusController;
import clusterwatch.model.ClusterState;
import clusterwatch.model.JobStatus;
import clusterwatch.producer.MockSnapshotSource;
import clusterwatch.store.ClusterStore;
import clusterwatch.store.Database;
import clusterwatch.store.JdbcClusterStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hits the read API over real HTTP against an in-memory store.
 */
class ClusterApiServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant T1 = Instant.parse("2026-02-01T09:00:00Z");

    private static Database db;
    private static JdbcClusterStore store;
    private static ClusterState snapshot;

    private ClusterApiServer server;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeAll
    static void setupStore() {
        db = new Database("jdbc:h2:mem:test-api;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        store = new JdbcClusterStore(db);
        snapshot = new MockSnapshotSource(new Random(11), Clock.fixed(T1, ZoneOffset.UTC)).snapshot();
        store.applyDiff(ClusterState.empty().diff(snapshot));
        store.putMetadata(ClusterStore.LAST_UPDATED, T1.toString());
    }

    @AfterAll
    static void teardownStore() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setUp() {
        server = new ClusterApiServer(router(store));
        server.start("127.0.0.1", 0);
        baseUrl = "http://127.0.0.1:" + server.port();
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private static RouterHandler router(ClusterStore store) {
        return new RouterHandler()
                .registerController(new HealthController(store))
                .registerController(new StatusController(store))
                .registerController(new NodeController(store))
                .registerController(new PartitionController(store))
                .registerController(new JobController(store));
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void healthReportsLastUpdate() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("healthy", body.get("status").asText());
        assertEquals("1.0.0", body.get("version").asText());
        assertEquals(T1.toString(), body.get("last_updated").asText());
    }

    @Test
    void statusReturnsWholeState() throws Exception {
        HttpResponse<String> response = get("/api/v1/status");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("content-type").orElse("").startsWith("application/json"));
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals(snapshot.nodes().size(), body.get("nodes").size());
        assertEquals(snapshot.nodeResources().size(), body.get("node_resources").size());
        assertEquals(snapshot.jobAllocations().size(), body.get("job_allocations").size());
        assertEquals("2026-02-01T09:00:00Z", body.get("updated_at").asText());
    }

    @Test
    void listsNodesAndPartitions() throws Exception {
        JsonNode nodes = MAPPER.readTree(get("/api/v1/nodes").body()).get("nodes");
        JsonNode partitions = MAPPER.readTree(get("/api/v1/partitions").body()).get("partitions");

        assertEquals(10, nodes.size());
        assertEquals("node01", nodes.get(0).get("name").asText());
        assertEquals(64, nodes.get(0).get("cpus").asInt());
        assertEquals(2, partitions.size());
        assertEquals("gpu", partitions.get(0).get("name").asText());
    }

    @Test
    void filtersJobsByStatus() throws Exception {
        long running = snapshot.jobs().values().stream()
                .filter(j -> j.status() == JobStatus.RUNNING).count();

        JsonNode all = MAPPER.readTree(get("/api/v1/jobs").body()).get("jobs");
        JsonNode filtered = MAPPER.readTree(get("/api/v1/jobs?status=running").body()).get("jobs");

        assertEquals(5, all.size());
        assertEquals(running, filtered.size());
        for (JsonNode job : filtered) {
            assertEquals("RUNNING", job.get("status").asText());
        }
    }

    @Test
    void unknownJobStatusIsBadRequest() throws Exception {
        HttpResponse<String> response = get("/api/v1/jobs?status=bogus");

        assertEquals(400, response.statusCode());
        assertTrue(MAPPER.readTree(response.body()).get("error").asText().contains("bogus"));
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        assertEquals(404, get("/api/v1/nope").statusCode());
        assertEquals(404, get("/").statusCode());
    }

    @Test
    void writesAreNotRouted() throws Exception {
        HttpResponse<String> response = httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/api/v1/nodes"))
                        .POST(HttpRequest.BodyPublishers.ofString("{}"))
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(404, response.statusCode());
    }

    @Test
    @DisplayName("Health is 503 once the database is gone")
    void healthUnavailableWhenDatabaseClosed() throws Exception {
        Database closed = new Database("jdbc:h2:mem:test-api-closed;DB_CLOSE_DELAY=-1", 1);
        closed.close();
        ClusterApiServer other = new ClusterApiServer(router(new JdbcClusterStore(closed)));
        other.start("127.0.0.1", 0);
        try {
            HttpResponse<String> response = httpClient.send(
                    HttpRequest.newBuilder()
                            .uri(URI.create("http://127.0.0.1:" + other.port() + "/api/v1/health"))
                            .GET().build(),
                    HttpResponse.BodyHandlers.ofString());

            assertEquals(503, response.statusCode());
            assertEquals("unhealthy", MAPPER.readTree(response.body()).get("status").asText());
        } finally {
            other.stop();
        }
    }
}
