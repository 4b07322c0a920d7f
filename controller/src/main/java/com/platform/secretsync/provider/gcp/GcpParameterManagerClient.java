package com.platform.secretsync.provider.gcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.secretsync.canonical.ConfigEntry;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ProviderException;
import com.platform.secretsync.provider.ConfigStoreClient;
import com.platform.secretsync.provider.ProviderCallExecutor;
import com.platform.secretsync.provider.ProviderType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parameter Manager over its REST API. Each write creates a new parameter version named
 * {@code v<n>}; the newest enabled version is the current value.
 */
@Slf4j
public class GcpParameterManagerClient implements ConfigStoreClient {

    static final String GLOBAL = "global";

    private static final Pattern VERSION_ID = Pattern.compile("v(\\d+)");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProviderCallExecutor executor;
    private final Supplier<String> accessToken;
    private final String endpoint;
    private final String parent;
    private final Duration timeout;

    /**
     * @param globalEndpoint endpoint used for the {@code global} location; other locations use the
     *                       regional endpoint
     * @param accessToken    supplies a fresh OAuth2 bearer token per request
     */
    public GcpParameterManagerClient(HttpClient httpClient, ObjectMapper objectMapper, ProviderCallExecutor executor,
                                     Supplier<String> accessToken, String globalEndpoint, String projectId,
                                     String location, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.accessToken = accessToken;
        String resolvedLocation = location == null || location.isBlank() ? GLOBAL : location;
        this.endpoint = endpoint(globalEndpoint, resolvedLocation);
        this.parent = "projects/" + projectId + "/locations/" + resolvedLocation;
        this.timeout = timeout;
    }

    static String endpoint(String globalEndpoint, String location) {
        String base = GLOBAL.equals(location)
            ? globalEndpoint
            : "https://parametermanager." + location + ".rep.googleapis.com/v1";
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public ProviderType type() {
        return ProviderType.GCP;
    }

    @Override
    public Optional<String> getValue(ConfigEntry entry) {
        return executor.call(type(), "getParameterVersion", entry.name(), () -> {
            Optional<List<JsonNode>> versions = listVersions(entry.name());
            if (versions.isEmpty()) {
                return Optional.empty();
            }
            Optional<JsonNode> current = versions.get().stream()
                .filter(v -> !v.path("disabled").asBoolean(false))
                .max(Comparator.comparing(v -> Instant.parse(v.path("createTime").asText())));
            if (current.isEmpty()) {
                return Optional.empty();
            }
            String versionName = current.get().path("name").asText();
            JsonNode full = send("GET", versionName + "?view=FULL", null, entry.name())
                .orElseThrow(() -> notFound(versionName));
            String data = full.path("payload").path("data").asText("");
            return Optional.of(new String(Base64.getDecoder().decode(data), StandardCharsets.UTF_8));
        });
    }

    @Override
    public void putValue(ConfigEntry entry) {
        executor.run(type(), "createParameterVersion", entry.name(), () -> {
            String parameter = parameterName(entry.name());
            Optional<List<JsonNode>> versions = listVersions(entry.name());
            if (versions.isEmpty()) {
                ObjectNode body = objectMapper.createObjectNode();
                body.put("format", "UNFORMATTED");
                ObjectNode labels = body.putObject("labels");
                GcpLabels.sanitize(entry.tags()).forEach(labels::put);
                send("POST", parent + "/parameters?parameterId=" + encode(entry.name()), body, entry.name());
                log.info("Created GCP parameter {}", parameter);
            }
            String versionId = nextVersionId(versions.orElse(List.of()));
            ObjectNode body = objectMapper.createObjectNode();
            body.putObject("payload").put("data",
                Base64.getEncoder().encodeToString(entry.value().getBytes(StandardCharsets.UTF_8)));
            send("POST", parameter + "/versions?parameterVersionId=" + versionId, body, entry.name());
            log.info("Wrote GCP parameter {} version {}", parameter, versionId);
        });
    }

    static String nextVersionId(List<JsonNode> versions) {
        long highest = 0;
        for (JsonNode version : versions) {
            String name = version.path("name").asText();
            Matcher matcher = VERSION_ID.matcher(name.substring(name.lastIndexOf('/') + 1));
            if (matcher.matches()) {
                highest = Math.max(highest, Long.parseLong(matcher.group(1)));
            }
        }
        return "v" + (highest + 1);
    }

    /**
     * Versions of the parameter, or empty when the parameter itself does not exist.
     */
    private Optional<List<JsonNode>> listVersions(String parameterId) {
        List<JsonNode> versions = new ArrayList<>();
        String pageToken = null;
        do {
            String path = parameterName(parameterId) + "/versions"
                + (pageToken == null ? "" : "?pageToken=" + encode(pageToken));
            Optional<JsonNode> page = send("GET", path, null, parameterId);
            if (page.isEmpty()) {
                return Optional.empty();
            }
            page.get().path("parameterVersions").forEach(versions::add);
            pageToken = page.get().path("nextPageToken").asText(null);
        } while (pageToken != null && !pageToken.isEmpty());
        return Optional.of(versions);
    }

    private Optional<JsonNode> send(String method, String path, JsonNode body, String resource) {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(endpoint + "/" + path))
            .timeout(timeout)
            .header("Authorization", "Bearer " + accessToken.get())
            .header("Accept", "application/json");
        try {
            if (body == null) {
                request.method(method, HttpRequest.BodyPublishers.noBody());
            } else {
                request.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)));
            }
            HttpResponse<byte[]> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() == 404) {
                return Optional.empty();
            }
            if (response.statusCode() >= 300) {
                String message = new String(response.body(), StandardCharsets.UTF_8);
                throw ProviderException.fromStatus(response.statusCode(), GcpErrors.PROVIDER, resource, message, null);
            }
            return Optional.of(response.body().length == 0
                ? objectMapper.createObjectNode()
                : objectMapper.readTree(response.body()));
        } catch (IOException e) {
            throw new ProviderException(ErrorCode.PROVIDER_UNAVAILABLE, GcpErrors.PROVIDER, resource,
                "Parameter Manager unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ErrorCode.PROVIDER_UNAVAILABLE, GcpErrors.PROVIDER, resource,
                "Interrupted while calling Parameter Manager", e);
        }
    }

    private String parameterName(String parameterId) {
        return parent + "/parameters/" + encode(parameterId);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static ProviderException notFound(String resource) {
        return ProviderException.fromStatus(404, GcpErrors.PROVIDER, resource, "version disappeared", null);
    }
}
