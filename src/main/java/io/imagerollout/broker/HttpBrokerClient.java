package io.imagerollout.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.imagerollout.models.EndpointHealth;
import io.imagerollout.models.Machine;
import io.imagerollout.models.PowerActionStatus;
import io.imagerollout.models.Session;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.imagerollout.config.Constants.*;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Broker client speaking JSON over HTTP to the broker's REST facade.
 * Each endpoint is the base URL of one management service (e.g. "http://broker-1.example:8090").
 */
@Slf4j
public class HttpBrokerClient implements BrokerClient {

    private static final int HTTP_NOT_FOUND = 404;
    private static final String CONTENT_TYPE_JSON = "application/json";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpBrokerClient(ObjectMapper objectMapper, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(), objectMapper, requestTimeout);
    }

    HttpBrokerClient(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public EndpointHealth probe(String endpoint) {
        try {
            HttpResponse<String> response = send(endpoint, get(endpoint, PATH_HEALTH));
            EndpointHealth health = decode(endpoint, response, EndpointHealth.class);
            return health != null ? health : EndpointHealth.offline();
        } catch (BrokerException e) {
            log.warn("Health probe failed for endpoint {}: {}", endpoint, e.getMessage());
            return EndpointHealth.offline();
        }
    }

    @Override
    public Optional<String> siteOf(String endpoint) throws BrokerException {
        HttpResponse<String> response = send(endpoint, get(endpoint, PATH_SITE));
        JsonNode node = decode(endpoint, response, JsonNode.class);
        String siteId = node != null ? node.path("site_id").asText(null) : null;
        return siteId == null || siteId.isBlank() ? Optional.empty() : Optional.of(siteId);
    }

    @Override
    public List<Machine> listAvailableMachines(String endpoint, String groupFilter, int maxRecords) throws BrokerException {
        String path = PATH_MACHINES + "?available=true&desktopGroup=" + encodeQuery(groupFilter) + "&max=" + maxRecords;
        HttpResponse<String> response = send(endpoint, get(endpoint, path));
        List<Machine> machines = decode(endpoint, response, new TypeReference<List<Machine>>() {});
        return machines != null ? machines : List.of();
    }

    @Override
    public List<Session> listSessions(String endpoint, String groupFilter, int maxRecords) throws BrokerException {
        String path = PATH_SESSIONS + "?desktopGroup=" + encodeQuery(groupFilter) + "&max=" + maxRecords;
        HttpResponse<String> response = send(endpoint, get(endpoint, path));
        List<Session> sessions = decode(endpoint, response, new TypeReference<List<Session>>() {});
        return sessions != null ? sessions : List.of();
    }

    @Override
    public Optional<Machine> refreshMachine(String endpoint, String machineId) throws BrokerException {
        HttpResponse<String> response = send(endpoint, get(endpoint, PATH_MACHINES + "/" + encodePath(machineId)));
        if (response.statusCode() == HTTP_NOT_FOUND) {
            return Optional.empty();
        }
        return Optional.ofNullable(decode(endpoint, response, Machine.class));
    }

    @Override
    public Optional<Session> refreshSession(String endpoint, String sessionId) throws BrokerException {
        HttpResponse<String> response = send(endpoint, get(endpoint, PATH_SESSIONS + "/" + encodePath(sessionId)));
        if (response.statusCode() == HTTP_NOT_FOUND) {
            return Optional.empty();
        }
        return Optional.ofNullable(decode(endpoint, response, Session.class));
    }

    @Override
    public String submitRestart(String endpoint, String machineId) throws BrokerException {
        String path = PATH_MACHINES + "/" + encodePath(machineId) + "/" + SUFFIX_POWER_ACTIONS;
        HttpResponse<String> response = send(endpoint, post(endpoint, path, Map.of("action", POWER_ACTION_RESTART)));
        JsonNode node = decode(endpoint, response, JsonNode.class);
        String taskId = node != null ? node.path("task_id").asText(null) : null;
        if (taskId == null || taskId.isBlank()) {
            throw new BrokerException(endpoint, response.statusCode(),
                    "Restart of machine " + machineId + " was accepted without a task id");
        }
        return taskId;
    }

    @Override
    public boolean submitNotification(String endpoint, String sessionId, String title, String text) throws BrokerException {
        String path = PATH_SESSIONS + "/" + encodePath(sessionId) + "/" + SUFFIX_MESSAGES;
        HttpResponse<String> response = send(endpoint, post(endpoint, path, Map.of("title", title, "text", text)));
        JsonNode node = decode(endpoint, response, JsonNode.class);
        return node == null || node.path("accepted").asBoolean(true);
    }

    @Override
    public PowerActionStatus pollTask(String endpoint, String taskId) throws BrokerException {
        HttpResponse<String> response = send(endpoint, get(endpoint, PATH_POWER_ACTIONS + "/" + encodePath(taskId)));
        PowerActionStatus status = decode(endpoint, response, PowerActionStatus.class);
        if (status == null) {
            throw new BrokerException(endpoint, response.statusCode(), "Empty status for power action " + taskId);
        }
        if (status.getTaskId() == null) {
            status.setTaskId(taskId);
        }
        return status;
    }

    private HttpRequest get(String endpoint, String path) throws BrokerException {
        return baseRequest(endpoint, path).GET().build();
    }

    private HttpRequest post(String endpoint, String path, Object body) throws BrokerException {
        try {
            String json = objectMapper.writeValueAsString(body);
            return baseRequest(endpoint, path)
                    .header("Content-Type", CONTENT_TYPE_JSON)
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();
        } catch (JsonProcessingException e) {
            throw new BrokerException(endpoint, "Failed to encode request body for " + path, e);
        }
    }

    private HttpRequest.Builder baseRequest(String endpoint, String path) throws BrokerException {
        if (endpoint == null || endpoint.isBlank()) {
            throw new BrokerException(endpoint, "Endpoint cannot be null or empty");
        }
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        try {
            return HttpRequest.newBuilder()
                    .uri(URI.create(base + path))
                    .timeout(requestTimeout)
                    .header("Accept", CONTENT_TYPE_JSON);
        } catch (IllegalArgumentException e) {
            throw new BrokerException(endpoint, "Invalid endpoint URL: " + base + path, e);
        }
    }

    private HttpResponse<String> send(String endpoint, HttpRequest request) throws BrokerException {
        try {
            log.debug("{} {}", request.method(), request.uri());
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            log.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
            return response;
        } catch (IOException e) {
            throw new BrokerException(endpoint, "Request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException(endpoint, "Interrupted while calling " + request.uri(), e);
        }
    }

    private <T> T decode(String endpoint, HttpResponse<String> response, Class<T> type) throws BrokerException {
        String body = checkedBody(endpoint, response);
        try {
            return body.isBlank() ? null : objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new BrokerException(endpoint, response.statusCode(),
                    "Failed to decode " + type.getSimpleName() + " from " + response.uri() + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> T decode(String endpoint, HttpResponse<String> response, TypeReference<T> type) throws BrokerException {
        String body = checkedBody(endpoint, response);
        try {
            return body.isBlank() ? null : objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new BrokerException(endpoint, response.statusCode(),
                    "Failed to decode response from " + response.uri() + ": " + e.getOriginalMessage(), e);
        }
    }

    private String checkedBody(String endpoint, HttpResponse<String> response) throws BrokerException {
        int status = response.statusCode();
        String body = response.body() != null ? response.body() : "";
        if (status < 200 || status >= 300) {
            throw new BrokerException(endpoint, status,
                    "Broker returned HTTP " + status + " for " + response.uri() + (body.isBlank() ? "" : " -> " + body));
        }
        return body;
    }

    private static String encodeQuery(String value) {
        return URLEncoder.encode(value != null ? value : "", UTF_8);
    }

    private static String encodePath(String value) {
        return URLEncoder.encode(value, UTF_8).replace("+", "%20");
    }
}
