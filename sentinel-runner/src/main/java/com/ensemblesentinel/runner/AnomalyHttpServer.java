package com.ensemblesentinel.runner;

import com.ensemblesentinel.core.model.DataPoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server that hands the anomaly snapshot to a visualizer
 * and answers container probes.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /anomalies}: JSON array of the anomalous points recorded so
 * far, e.g. {@code [{"time":35.0,"value":27.4}]}</li>
 * <li>{@code GET /health}: {@code 200} with {@code {"status":"UP"}} while
 * the server runs</li>
 * <li>{@code GET /readiness}: {@code 200 UP} while the ensemble is running,
 * {@code 503 DOWN} otherwise</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}; responses are written with
 * Jackson.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyHttpServer.class);
    private static final byte[] UP_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] DOWN_RESPONSE = "{\"status\":\"DOWN\"}".getBytes(StandardCharsets.UTF_8);

    private final Supplier<List<DataPoint>> anomalies;
    private final BooleanSupplier ready;
    private final ObjectMapper mapper = new ObjectMapper();

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param anomalies source of the anomaly snapshot
     * @param ready     readiness check, typically the ensemble's running flag
     */
    public AnomalyHttpServer(Supplier<List<DataPoint>> anomalies, BooleanSupplier ready) {
        this.anomalies = Objects.requireNonNull(anomalies, "anomalies supplier must not be null");
        this.ready = Objects.requireNonNull(ready, "readiness check must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to, or 0 for any free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "HTTP port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind HTTP server on port " + port, e);
        }
        server.createContext("/anomalies", this::handleAnomalies);
        server.createContext("/health", exchange -> respond(exchange, 200, UP_RESPONSE));
        server.createContext("/readiness", this::handleReadiness);

        server.setExecutor(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "anomaly-http");
            t.setDaemon(true);
            return t;
        }));

        server.start();
        running.set(true);
        LOG.info("HTTP server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("HTTP server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the server has not been started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("HTTP server has not been started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleAnomalies(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "GET");
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(anomalies.get());
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to serialize anomaly snapshot: {}", e.getMessage(), e);
            respond(exchange, 500, "{\"error\":\"snapshot unavailable\"}".getBytes(StandardCharsets.UTF_8));
            return;
        }
        respond(exchange, 200, body);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (ready.getAsBoolean()) {
            respond(exchange, 200, UP_RESPONSE);
        } else {
            respond(exchange, 503, DOWN_RESPONSE);
        }
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
