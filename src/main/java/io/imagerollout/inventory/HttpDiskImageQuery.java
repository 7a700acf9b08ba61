package io.imagerollout.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Queries the disk image agent running on each desktop host.
 * The agent answers {@code GET http://{host}:{port}{path}} with {@code {"disk_image": "..."}}.
 */
@Slf4j
public class HttpDiskImageQuery implements DiskImageQuery {

    private static final int HTTP_NOT_FOUND = 404;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final int port;
    private final String path;

    public HttpDiskImageQuery(ObjectMapper objectMapper, int port, String path, Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        this.objectMapper = objectMapper;
        this.port = port;
        this.path = path.startsWith("/") ? path : "/" + path;
    }

    @Override
    public Optional<String> queryDiskImage(String host, Duration timeout) throws IOException, InterruptedException {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host cannot be null or empty");
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://" + host.trim() + ":" + port + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() == HTTP_NOT_FOUND) {
            log.debug("Host {} reports no disk image", host);
            return Optional.empty();
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Disk image agent on " + host + " returned HTTP " + response.statusCode());
        }
        if (response.body() == null || response.body().isBlank()) {
            return Optional.empty();
        }
        JsonNode node = objectMapper.readTree(response.body());
        String diskImage = node.path("disk_image").asText(null);
        return diskImage == null || diskImage.isBlank() ? Optional.empty() : Optional.of(diskImage.trim());
    }
}
