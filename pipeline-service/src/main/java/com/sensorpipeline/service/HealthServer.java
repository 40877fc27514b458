package com.sensorpipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorpipeline.core.pipeline.HealthSnapshot;
import com.sensorpipeline.core.pipeline.PipelineOrchestrator;
import com.sensorpipeline.core.pipeline.PipelineState;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server exposing the orchestrator's health and statistics
 * to orchestrator health checks and operators. It is read-only: the
 * pipeline cannot be started or stopped through it.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} returns {@code 200} with the health snapshot when
 * healthy, {@code 503} with the same body otherwise</li>
 * <li>{@code GET /readiness} returns {@code 200} while the pipeline is running or
 * paused, {@code 503} when stopped</li>
 * <li>{@code GET /stats} returns pipeline and writer statistics</li>
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
    static final String HANDLER_THREAD = "health-server";

    private final PipelineOrchestrator orchestrator;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(PipelineOrchestrator orchestrator) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "PipelineOrchestrator must not be null");
        this.mapper = JsonSupport.newObjectMapper();
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; must be in range [1, 65535]
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [1, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start health server on port " + port, e);
        }
        server.createContext("/health", this::handleHealth);
        server.createContext("/readiness", this::handleReadiness);
        server.createContext("/stats", this::handleStats);
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, HANDLER_THREAD);
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("Health server started on port {}", port);
    }

    /**
     * Stop the server and its handler thread.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        HealthSnapshot health = orchestrator.healthCheck();
        respond(exchange, health.isHealthy() ? 200 : 503, health);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        PipelineState state = orchestrator.getState();
        boolean ready = state != PipelineState.STOPPED;
        respond(exchange, ready ? 200 : 503, Map.of("ready", ready, "state", state));
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        respond(exchange, 200, orchestrator.getStats());
    }

    private void respond(HttpExchange exchange, int status, Object body) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }
        byte[] payload = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }
}
