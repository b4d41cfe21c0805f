package com.strv.newsletter.metrics;

import com.strv.newsletter.worker.EmailWorkerPool;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Monitoring endpoint.
 *
 * <p>Embedded HTTP server exposing the Prometheus scrape output and a JSON health check
 * <br>describing the email worker pool.
 *
 * <p>Endpoints:
 * <br>/prometheus - metrics in Prometheus exposition format.
 * <br>/health - status, uptime, pool state, queue size and capacity, workers.
 */
public class MetricsEndpoint {
    private static final Logger log = LogManager.getLogger(MetricsEndpoint.class);

    private final EmailWorkerPool pool;
    private final long startTime = System.currentTimeMillis();
    private HttpServer server;
    private PrometheusMeterRegistry prometheusRegistry;

    /**
     * Constructs a new MetricsEndpoint instance.
     *
     * @param pool EmailWorkerPool instance reported by the health check.
     */
    public MetricsEndpoint(EmailWorkerPool pool) {
        this.pool = pool;
    }

    /**
     * Starts the embedded HTTP server.
     * <p>Uses the registry held by {@link MetricsRegistry}, creating and registering one if none exists yet.
     *
     * @param port Port to listen on, 0 picks a free one.
     * @throws IOException If the server cannot bind.
     */
    public void start(int port) throws IOException {
        prometheusRegistry = MetricsRegistry.getPrometheusRegistry();
        if (prometheusRegistry == null) {
            prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
            MetricsRegistry.register(prometheusRegistry);
        }
        bindJvmMetrics();

        server = HttpServer.create(new InetSocketAddress(port), 10);
        server.createContext("/prometheus", this::handlePrometheus);
        server.createContext("/health", this::handleHealth);
        server.start();

        log.info("Metrics endpoint started: port={}", getPort());
    }

    /**
     * Stops the HTTP server.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            log.info("Metrics endpoint stopped");
        }
    }

    /**
     * Gets the bound port.
     *
     * @return Port number or -1 if not started.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    private void bindJvmMetrics() {
        new JvmMemoryMetrics().bindTo(prometheusRegistry);
        new JvmThreadMetrics().bindTo(prometheusRegistry);
        new ProcessorMetrics().bindTo(prometheusRegistry);
    }

    /**
     * Handles requests for metrics in Prometheus exposition format.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    private void handlePrometheus(HttpExchange exchange) throws IOException {
        log.debug("Handling /prometheus: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());
        sendResponse(exchange, 200, "text/plain; charset=utf-8", prometheusRegistry.scrape());
    }

    /**
     * Handles health check requests.
     * <p>Reports DOWN once the pool has stopped.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        log.debug("Handling /health: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());
        Duration uptime = Duration.ofMillis(System.currentTimeMillis() - startTime);
        String uptimeString = String.format("%dd %dh %dm %ds",
                uptime.toDays(),
                uptime.toHoursPart(),
                uptime.toMinutesPart(),
                uptime.toSecondsPart());

        String state = pool.getState().name();
        String status = "STOPPED".equals(state) ? "DOWN" : "UP";
        String response = String.format("{\"status\":\"%s\", \"uptime\":\"%s\", \"pool\":{\"state\":\"%s\", " +
                        "\"queueSize\":%d, \"queueCapacity\":%d, \"workers\":%d, \"liveWorkers\":%d}}",
                status, uptimeString, state, pool.getQueueSize(), pool.getQueueCapacity(),
                pool.getWorkerCount(), pool.getLiveWorkers());

        sendResponse(exchange, "UP".equals(status) ? 200 : 503, "application/json; charset=utf-8", response);
    }

    /**
     * Sends an HTTP response.
     *
     * @param exchange    The HTTP exchange object.
     * @param code        The HTTP status code.
     * @param contentType The content type of the response.
     * @param response    The response body.
     * @throws IOException If an I/O error occurs.
     */
    private void sendResponse(HttpExchange exchange, int code, String contentType, String response) throws IOException {
        byte[] responseBytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(code, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
        log.trace("Sent response: status={}, contentType={}, bytes={}", code, contentType, responseBytes.length);
    }
}
