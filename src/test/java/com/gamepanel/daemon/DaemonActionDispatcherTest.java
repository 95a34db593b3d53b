package com.gamepanel.daemon;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamepanel.config.DaemonProperties;
import com.gamepanel.scheduler.dispatch.DispatchResult;
import com.gamepanel.scheduler.model.PowerAction;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DaemonActionDispatcher Tests")
class DaemonActionDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final CountDownLatch releaseSlowHandler = new CountDownLatch(1);

    private HttpServer server;
    private ExecutorService serverExecutor;
    private DaemonProperties properties;

    private record RecordedRequest(String method, String path, String authorization, Map<String, Object> body) {
    }

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/servers/", this::handle);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.start();

        properties = new DaemonProperties();
        properties.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        properties.setToken("secret-token");
        properties.setConnectTimeout(Duration.ofSeconds(2));
        properties.setRequestTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        releaseSlowHandler.countDown();
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @SuppressWarnings("unchecked")
    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        byte[] raw = exchange.getRequestBody().readAllBytes();
        Map<String, Object> body = raw.length > 0 ? objectMapper.readValue(raw, Map.class) : Map.of();
        requests.add(new RecordedRequest(exchange.getRequestMethod(), path,
                exchange.getRequestHeaders().getFirst("Authorization"), body));

        if (path.startsWith("/api/servers/slow/")) {
            try {
                releaseSlowHandler.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (path.startsWith("/api/servers/broken/")) {
            respond(exchange, 500, "{\"error\":\"server is not running\"}");
        } else {
            respond(exchange, 200, "{\"ok\":true}");
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    @DisplayName("Power action posts the lowercase action with the bearer token")
    void powerAction() {
        DaemonActionDispatcher dispatcher = new DaemonActionDispatcher(properties);

        DispatchResult result = dispatcher.powerAction("srv-1", PowerAction.RESTART);

        assertTrue(result.isSuccess(), result.getError());
        assertEquals("{\"ok\":true}", result.getOutput());
        RecordedRequest request = requests.get(0);
        assertEquals("POST", request.method());
        assertEquals("/api/servers/srv-1/power", request.path());
        assertEquals("Bearer secret-token", request.authorization());
        assertEquals(Map.of("action", "restart"), request.body());
    }

    @Test
    @DisplayName("Backup posts a fresh backup id with an empty ignore list")
    void createBackup() {
        DaemonActionDispatcher dispatcher = new DaemonActionDispatcher(properties);

        DispatchResult result = dispatcher.createBackup("srv-1");

        assertTrue(result.isSuccess());
        RecordedRequest request = requests.get(0);
        assertEquals("/api/servers/srv-1/backup", request.path());
        assertNotNull(request.body().get("uuid"));
        assertEquals(List.of(), request.body().get("ignore"));
    }

    @Test
    @DisplayName("Command posts the raw command text without a token when none is set")
    void runCommandWithoutToken() {
        properties.setToken("");
        DaemonActionDispatcher dispatcher = new DaemonActionDispatcher(properties);

        DispatchResult result = dispatcher.runCommand("srv-1", "say \"hi\" & bye");

        assertTrue(result.isSuccess());
        RecordedRequest request = requests.get(0);
        assertEquals("/api/servers/srv-1/commands", request.path());
        assertEquals(Map.of("command", "say \"hi\" & bye"), request.body());
        assertNull(request.authorization());
    }

    @Test
    @DisplayName("A non-2xx answer is a failure carrying the status and body")
    void errorStatusIsFailure() {
        DaemonActionDispatcher dispatcher = new DaemonActionDispatcher(properties);

        DispatchResult result = dispatcher.powerAction("broken", PowerAction.START);

        assertEquals(DispatchResult.Status.FAILED, result.getStatus());
        assertTrue(result.getError().contains("500"));
        assertTrue(result.getError().contains("server is not running"));
    }

    @Test
    @DisplayName("A daemon slower than the request timeout is reported as timed out")
    void slowDaemonTimesOut() {
        properties.setRequestTimeout(Duration.ofMillis(300));
        DaemonActionDispatcher dispatcher = new DaemonActionDispatcher(properties);

        DispatchResult result = dispatcher.createBackup("slow");

        assertEquals(DispatchResult.Status.TIMED_OUT, result.getStatus());
        assertTrue(result.getDurationMs() >= 250, "took " + result.getDurationMs() + "ms");
    }

    @Test
    @DisplayName("An unreachable daemon is a failure, not an exception")
    void unreachableDaemon() {
        properties.setBaseUrl("http://127.0.0.1:1");
        DaemonActionDispatcher dispatcher = new DaemonActionDispatcher(properties);

        DispatchResult result = assertDoesNotThrow(() -> dispatcher.powerAction("srv-1", PowerAction.STOP));

        assertEquals(DispatchResult.Status.FAILED, result.getStatus());
        assertNotNull(result.getError());
    }
}
