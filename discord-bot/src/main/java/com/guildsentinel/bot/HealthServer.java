package com.guildsentinel.bot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guildsentinel.core.action.ApiEndpoint;
import com.guildsentinel.core.action.EndpointBreaker;
import com.guildsentinel.core.pipeline.ProtectionPipeline;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} - {@code 200} with pipeline status, circuit states
 * and queue depth while the pipeline runs, {@code 503} otherwise</li>
 * <li>{@code GET /readiness} - same body; Kubernetes readiness probe
 * target</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final ProtectionPipeline pipeline;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer server;

    public HealthServer(ProtectionPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", this::handle);
            server.createContext("/readiness", this::handle);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return bound port, or -1 when not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    /**
     * Current health document.
     */
    Map<String, Object> snapshot() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", pipeline.isRunning() ? "UP" : "DOWN");
        body.put("queueDepth", pipeline.queueDepth());
        Map<String, String> circuits = new LinkedHashMap<>();
        for (Map.Entry<ApiEndpoint, EndpointBreaker> e : pipeline.getExecutor().getBreakers().entrySet()) {
            circuits.put(e.getKey().label(), e.getValue().getState().name());
        }
        body.put("circuits", circuits);
        return body;
    }

    // ---------------------------------------------------------------
    // Handler (shared between /health and /readiness)
    // ---------------------------------------------------------------

    private void handle(HttpExchange exchange) throws IOException {
        byte[] response;
        int status = pipeline.isRunning() ? 200 : 503;
        try {
            response = mapper.writeValueAsBytes(snapshot());
        } catch (JsonProcessingException e) {
            LOG.error("Failed to render health document: {}", e.getMessage(), e);
            response = "{\"status\":\"UNKNOWN\"}".getBytes(StandardCharsets.UTF_8);
            status = 500;
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }
}
