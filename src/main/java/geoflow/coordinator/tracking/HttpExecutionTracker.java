package geoflow.coordinator.tracking;

import com.fasterxml.jackson.databind.JsonNode;
import geoflow.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Queries a workflow engine over HTTP: {@code GET <base>/workflows/<jobId>} answering
 * {@code {"phase": "Running" | "Succeeded" | "Failed" | "Error" | ...}}, 404 when unknown.
 */
public class HttpExecutionTracker implements ExecutionTracker {

    private static final Logger log = LoggerFactory.getLogger(HttpExecutionTracker.class);

    private final String baseUrl;
    private final HttpClient httpClient;

    public HttpExecutionTracker(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public RunStatus getRunStatus(String jobId) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/workflows/" + URLEncoder.encode(jobId, StandardCharsets.UTF_8)))
                .timeout(Duration.ofSeconds(10))
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TrackerException("Execution tracker unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackerException("Interrupted while querying the execution tracker", e);
        }

        if (response.statusCode() == 404) {
            return RunStatus.ABSENT;
        }
        if (response.statusCode() != 200) {
            throw new TrackerException("Execution tracker returned HTTP " + response.statusCode());
        }

        String phase = Json.read(response.body(), JsonNode.class).path("phase").asText("");
        log.debug("Run of job {} is in phase '{}'", jobId, phase);
        return RunStatus.of(toPhase(phase));
    }

    static RunPhase toPhase(String phase) {
        return switch (phase.toLowerCase(Locale.ROOT)) {
            case "failed", "error" -> RunPhase.FAILED;
            case "succeeded" -> RunPhase.SUCCEEDED;
            default -> RunPhase.ACTIVE;
        };
    }
}
