package io.trading.marketstream.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.Supplier;

/**
 * HTTP server exposing Prometheus metrics and a health summary.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final CollectorRegistry registry;
    private final Supplier<HealthStatus> healthSupplier;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final long startTime = System.currentTimeMillis();
    private HttpServer server;

    /**
     * Health summary served on /health; 200 when healthy, 503 otherwise.
     *
     * @param healthy     whether every subscription is active
     * @param message     human-readable summary
     * @param streams     subscription count per lifecycle state
     */
    public record HealthStatus(boolean healthy, String message, Map<String, Long> streams) {}

    private record HealthResponse(boolean healthy, String message, long uptimeMs, Map<String, Long> streams) {}

    /**
     * @param port           listening port, 0 for an ephemeral port
     * @param registry       registry scraped on /metrics
     * @param healthSupplier computes the health summary per request
     */
    public MetricsServer(int port, CollectorRegistry registry, Supplier<HealthStatus> healthSupplier) {
        this.port = port;
        this.registry = registry;
        this.healthSupplier = healthSupplier;
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/metrics", handleMetrics());
        server.createContext("/health", handleHealth());
        server.setExecutor(null);
        server.start();

        LOGGER.info("HTTP server started on port {}", getPort());
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", getPort());
        LOGGER.info("  Health:     http://localhost:{}/health", getPort());
    }

    /**
     * Returns the bound port, which differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                send(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            } finally {
                exchange.close();
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                HealthStatus status = healthSupplier.get();
                HealthResponse health = new HealthResponse(
                    status.healthy(),
                    status.message(),
                    System.currentTimeMillis() - startTime,
                    status.streams()
                );
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(health);
                send(exchange, status.healthy() ? 200 : 503, "application/json", response);
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                send(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            } finally {
                exchange.close();
            }
        };
    }

    private static void send(HttpExchange exchange, int statusCode, String contentType, String response)
        throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
    }
}
