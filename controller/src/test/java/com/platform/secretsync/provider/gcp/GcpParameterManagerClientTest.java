package com.platform.secretsync.provider.gcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.secretsync.canonical.ConfigEntry;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ProviderException;
import com.platform.secretsync.provider.ProviderTestSupport;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GcpParameterManagerClientTest {

    private static final String PARENT = "projects/billing-prod/locations/global";
    private static final ConfigEntry ENTRY = new ConfigEntry("billing-timeout", "30", "prod", null,
        "billing/profiles/prod/application.properties", Map.of("managed-by", "secret-sync", "sync-target", "team-a.billing"));

    private final ObjectMapper mapper = new ObjectMapper();
    private final FakeParameterManager fake = new FakeParameterManager();
    private HttpServer server;
    private GcpParameterManagerClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/v1/", fake::handle);
        server.start();
        client = new GcpParameterManagerClient(
            HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), mapper, ProviderTestSupport.executor(),
            () -> "token-1", "http://localhost:" + server.getAddress().getPort() + "/v1/", "billing-prod", "global",
            Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void missingParameterHasNoValue() {
        assertThat(client.getValue(ENTRY)).isEmpty();
    }

    @Test
    void firstWriteCreatesParameterAndFirstVersion() {
        client.putValue(ENTRY);

        assertThat(fake.requests).containsExactly(
            "GET /v1/" + PARENT + "/parameters/billing-timeout/versions",
            "POST /v1/" + PARENT + "/parameters?parameterId=billing-timeout",
            "POST /v1/" + PARENT + "/parameters/billing-timeout/versions?parameterVersionId=v1");
        assertThat(fake.labels.get("billing-timeout").path("sync-target").asText()).isEqualTo("team-a_billing");
        assertThat(fake.authorizations).containsOnly("Bearer token-1");
        assertThat(client.getValue(ENTRY)).contains("30");
    }

    @Test
    void laterWritesAppendNextVersion() {
        client.putValue(ENTRY);
        client.putValue(new ConfigEntry(ENTRY.name(), "45", ENTRY.label(), null, ENTRY.sourcePath(), ENTRY.tags()));

        assertThat(fake.requests).filteredOn(r -> r.startsWith("POST"))
            .containsExactly(
                "POST /v1/" + PARENT + "/parameters?parameterId=billing-timeout",
                "POST /v1/" + PARENT + "/parameters/billing-timeout/versions?parameterVersionId=v1",
                "POST /v1/" + PARENT + "/parameters/billing-timeout/versions?parameterVersionId=v2");
        assertThat(client.getValue(ENTRY)).contains("45");
    }

    @Test
    void disabledNewestVersionIsSkipped() {
        fake.addVersion("billing-timeout", "v1", "10", false);
        fake.addVersion("billing-timeout", "v2", "20", true);

        assertThat(client.getValue(ENTRY)).contains("10");
    }

    @Test
    void versionsArePagedThrough() {
        fake.pageSize = 1;
        fake.addVersion("billing-timeout", "v1", "10", false);
        fake.addVersion("billing-timeout", "v2", "20", false);
        fake.addVersion("billing-timeout", "v3", "30", false);

        assertThat(client.getValue(ENTRY)).contains("30");
        client.putValue(ENTRY);

        assertThat(fake.requests.get(fake.requests.size() - 1)).endsWith("parameterVersionId=v4");
    }

    @Test
    void forbiddenIsAuthFailure() {
        fake.forcedStatus = 403;

        assertThatThrownBy(() -> client.getValue(ENTRY))
            .isInstanceOf(ProviderException.class)
            .extracting(e -> ((ProviderException) e).getErrorCode())
            .isEqualTo(ErrorCode.PROVIDER_AUTH_FAILED);
        assertThat(fake.requests).hasSize(1);
    }

    @Test
    void serverErrorsAreRetriedThenReported() {
        fake.forcedStatus = 503;

        assertThatThrownBy(() -> client.getValue(ENTRY))
            .isInstanceOf(ProviderException.class)
            .extracting(e -> ((ProviderException) e).getErrorCode())
            .isEqualTo(ErrorCode.PROVIDER_UNAVAILABLE);
        assertThat(fake.requests).hasSize(3);
    }

    @Test
    void regionalLocationUsesRegionalEndpoint() {
        assertThat(GcpParameterManagerClient.endpoint("https://parametermanager.googleapis.com/v1/", "global"))
            .isEqualTo("https://parametermanager.googleapis.com/v1");
        assertThat(GcpParameterManagerClient.endpoint("https://parametermanager.googleapis.com/v1", "europe-west1"))
            .isEqualTo("https://parametermanager.europe-west1.rep.googleapis.com/v1");
    }

    @Test
    void nextVersionIgnoresForeignVersionNames() {
        List<JsonNode> versions = List.of(
            mapper.createObjectNode().put("name", PARENT + "/parameters/p/versions/v7"),
            mapper.createObjectNode().put("name", PARENT + "/parameters/p/versions/manual"),
            mapper.createObjectNode().put("name", PARENT + "/parameters/p/versions/v12"));

        assertThat(GcpParameterManagerClient.nextVersionId(versions)).isEqualTo("v13");
        assertThat(GcpParameterManagerClient.nextVersionId(List.of())).isEqualTo("v1");
    }

    /**
     * Minimal in-memory Parameter Manager REST surface.
     */
    private final class FakeParameterManager {

        final List<String> requests = new CopyOnWriteArrayList<>();
        final List<String> authorizations = new CopyOnWriteArrayList<>();
        final Map<String, List<ObjectNode>> versions = new LinkedHashMap<>();
        final Map<String, JsonNode> labels = new LinkedHashMap<>();
        volatile int forcedStatus;
        volatile int pageSize = 50;
        private long clock;

        void addVersion(String parameter, String id, String value, boolean disabled) {
            ObjectNode version = mapper.createObjectNode();
            version.put("name", PARENT + "/parameters/" + parameter + "/versions/" + id);
            version.put("createTime", Instant.parse("2024-05-01T00:00:00Z").plusSeconds(++clock).toString());
            version.put("disabled", disabled);
            version.putObject("payload").put("data",
                Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8)));
            versions.computeIfAbsent(parameter, p -> new ArrayList<>()).add(version);
        }

        synchronized void handle(HttpExchange exchange) throws IOException {
            String query = exchange.getRequestURI().getRawQuery();
            String path = exchange.getRequestURI().getRawPath();
            String method = exchange.getRequestMethod();
            if (query == null || !query.startsWith("view=") && !query.startsWith("pageToken=")) {
                requests.add(method + " " + path + (query == null ? "" : "?" + query));
            }
            authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] body = exchange.getRequestBody().readAllBytes();
            if (forcedStatus != 0) {
                respond(exchange, forcedStatus, mapper.createObjectNode().put("error", "forced"));
                return;
            }
            String relative = path.substring(("/v1/" + PARENT + "/parameters").length());
            if ("POST".equals(method) && relative.isEmpty()) {
                String id = query.substring("parameterId=".length());
                versions.putIfAbsent(id, new ArrayList<>());
                labels.put(id, mapper.readTree(body).path("labels"));
                respond(exchange, 200, mapper.createObjectNode().put("name", PARENT + "/parameters/" + id));
                return;
            }
            String[] segments = relative.substring(1).split("/");
            List<ObjectNode> known = versions.get(segments[0]);
            if (known == null) {
                respond(exchange, 404, mapper.createObjectNode().put("error", "NOT_FOUND"));
                return;
            }
            if ("POST".equals(method)) {
                String id = query.substring("parameterVersionId=".length());
                String data = mapper.readTree(body).path("payload").path("data").asText();
                addVersion(segments[0], id, new String(Base64.getDecoder().decode(data), StandardCharsets.UTF_8),
                    false);
                respond(exchange, 200, known.get(known.size() - 1));
            } else if (segments.length == 2) {
                int offset = query == null ? 0 : Integer.parseInt(query.substring("pageToken=".length()));
                ObjectNode page = mapper.createObjectNode();
                ArrayNode items = page.putArray("parameterVersions");
                for (int i = offset; i < Math.min(known.size(), offset + pageSize); i++) {
                    ObjectNode summary = known.get(i).deepCopy();
                    summary.remove("payload");
                    items.add(summary);
                }
                if (offset + pageSize < known.size()) {
                    page.put("nextPageToken", String.valueOf(offset + pageSize));
                }
                respond(exchange, 200, page);
            } else {
                String name = PARENT + "/parameters/" + segments[0] + "/versions/" + segments[2];
                respond(exchange, 200, known.stream()
                    .filter(v -> v.path("name").asText().equals(name))
                    .findFirst()
                    .orElseThrow());
            }
        }

        private void respond(HttpExchange exchange, int status, JsonNode body) throws IOException {
            byte[] bytes = mapper.writeValueAsBytes(body);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
    }
}
