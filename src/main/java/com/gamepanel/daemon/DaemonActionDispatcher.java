package com.gamepanel.daemon;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamepanel.config.DaemonProperties;
import com.gamepanel.scheduler.dispatch.ActionDispatcher;
import com.gamepanel.scheduler.dispatch.DispatchResult;
import com.gamepanel.scheduler.model.PowerAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link ActionDispatcher} backed by the daemon's HTTP API.
 *
 * <p>Endpoints, relative to {@code panel.daemon.base-url}:</p>
 * <ul>
 *   <li>{@code POST /api/servers/{id}/power} with {@code {"action": "start|stop|restart"}}</li>
 *   <li>{@code POST /api/servers/{id}/backup} with {@code {"uuid": ..., "ignore": []}}</li>
 *   <li>{@code POST /api/servers/{id}/commands} with {@code {"command": ...}}</li>
 * </ul>
 *
 * <p>Every request carries {@code panel.daemon.request-timeout}. Errors are reported as results, never thrown.</p>
 */
@Slf4j
@Service
public class DaemonActionDispatcher implements ActionDispatcher {

    private final DaemonProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public DaemonActionDispatcher(DaemonProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
    }

    @Override
    public DispatchResult powerAction(String serverId, PowerAction action) {
        return post(serverId, "/power", Map.of("action", action.wireValue()), "power " + action.wireValue());
    }

    @Override
    public DispatchResult createBackup(String serverId) {
        String backupId = UUID.randomUUID().toString();
        return post(serverId, "/backup", Map.of("uuid", backupId, "ignore", List.of()), "backup " + backupId);
    }

    @Override
    public DispatchResult runCommand(String serverId, String command) {
        return post(serverId, "/commands", Map.of("command", command), "command");
    }

    private DispatchResult post(String serverId, String path, Map<String, Object> body, String description) {
        long startTime = System.currentTimeMillis();
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(serverUri(serverId, path))
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .timeout(properties.getRequestTimeout())
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
            if (properties.getToken() != null && !properties.getToken().isBlank()) {
                builder.header("Authorization", "Bearer " + properties.getToken());
            }

            log.debug("Daemon {} for server {}", description, serverId);
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            long duration = System.currentTimeMillis() - startTime;

            if (response.statusCode() / 100 == 2) {
                return DispatchResult.success(response.body(), duration);
            }
            String error = "Daemon returned " + response.statusCode() + " for " + description
                    + (response.body() != null && !response.body().isBlank() ? ": " + response.body() : "");
            return DispatchResult.failure(error, duration);
        } catch (HttpTimeoutException e) {
            long duration = System.currentTimeMillis() - startTime;
            log.warn("Daemon {} for server {} timed out after {}ms", description, serverId, duration);
            return DispatchResult.timedOut("Timed out after " + duration + "ms: " + e.getMessage(), duration);
        } catch (JsonProcessingException e) {
            return DispatchResult.failure("Could not encode request: " + e.getMessage(),
                    System.currentTimeMillis() - startTime);
        } catch (IOException e) {
            long duration = System.currentTimeMillis() - startTime;
            log.warn("Daemon {} for server {} failed: {}", description, serverId, e.getMessage());
            return DispatchResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DispatchResult.failure("Interrupted while waiting for the daemon",
                    System.currentTimeMillis() - startTime);
        }
    }

    private URI serverUri(String serverId, String path) {
        String base = properties.getBaseUrl().endsWith("/")
                ? properties.getBaseUrl().substring(0, properties.getBaseUrl().length() - 1)
                : properties.getBaseUrl();
        return URI.create(base + "/api/servers/" + URLEncoder.encode(serverId, StandardCharsets.UTF_8) + path);
    }
}
