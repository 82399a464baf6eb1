package com.mimecast.mailhealth.endpoints;

import com.mimecast.mailhealth.metrics.HealthMetrics;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
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
 * Exporter HTTP endpoint.
 *
 * <p>Serves three paths from one JDK {@link HttpServer}:
 * <ul>
 *     <li><b>/metrics</b> - Prometheus text exposition of the mail health metrics and JVM metrics.</li>
 *     <li><b>/status</b> - Human readable status page.</li>
 *     <li><b>/health</b> - Liveness JSON with uptime, never behind authentication.</li>
 * </ul>
 * <p>Paths match exactly; anything else is a 404 and any method other than GET or HEAD a 405.
 */
public class ExporterEndpoint {
    private static final Logger log = LogManager.getLogger(ExporterEndpoint.class);

    /**
     * Prometheus text format content type.
     */
    public static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final HealthMetrics metrics;
    private final StatusRenderer renderer;
    private final String spamTestUrl;

    protected HttpServer server;
    private PrometheusMeterRegistry prometheusRegistry;
    private JvmGcMetrics jvmGcMetrics;
    protected final long startTime = System.currentTimeMillis();
    protected HttpBasicAuth auth;

    /**
     * Constructs a new ExporterEndpoint instance.
     *
     * @param metrics     HealthMetrics instance.
     * @param renderer    StatusRenderer instance.
     * @param spamTestUrl Score page URL shown on the status page.
     */
    public ExporterEndpoint(HealthMetrics metrics, StatusRenderer renderer, String spamTestUrl) {
        this.metrics = metrics;
        this.renderer = renderer;
        this.spamTestUrl = spamTestUrl;
    }

    /**
     * Starts the endpoint without authentication.
     *
     * @param port Port to bind, 0 for an ephemeral one.
     * @throws IOException If the port cannot be bound.
     */
    public void start(int port) throws IOException {
        start(port, null, null);
    }

    /**
     * Starts the endpoint.
     *
     * @param port     Port to bind, 0 for an ephemeral one.
     * @param username Basic auth username, null to disable.
     * @param password Basic auth password, null to disable.
     * @throws IOException If the port cannot be bound.
     */
    public void start(int port, String username, String password) throws IOException {
        this.auth = new HttpBasicAuth(username, password, "Mail Health Exporter");

        prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        metrics.bindTo(prometheusRegistry);
        bindJvmMetrics();

        server = HttpServer.create(new InetSocketAddress(port), 10);
        server.createContext("/", this::handle);
        server.start();

        int bound = getPort();
        log.info("Metrics available at http://localhost:{}/metrics", bound);
        log.info("Status page available at http://localhost:{}/status", bound);
        log.info("Health available at http://localhost:{}/health", bound);
        if (auth.isAuthEnabled()) {
            log.info("HTTP Basic Authentication is enabled for metrics and status");
        }
    }

    /**
     * Gets bound port.
     *
     * @return Port number.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Stops the endpoint and releases the registry.
     */
    public void stop() {
        if (server != null) server.stop(0);
        if (jvmGcMetrics != null) jvmGcMetrics.close();
        if (prometheusRegistry != null) prometheusRegistry.close();
        log.info("Exporter endpoint stopped");
    }

    /**
     * Binds JVM metrics.
     */
    private void bindJvmMetrics() {
        new JvmMemoryMetrics().bindTo(prometheusRegistry);
        jvmGcMetrics = new JvmGcMetrics();
        jvmGcMetrics.bindTo(prometheusRegistry);
        new JvmThreadMetrics().bindTo(prometheusRegistry);
        new ProcessorMetrics().bindTo(prometheusRegistry);
    }

    /**
     * Routes a request.
     *
     * @param exchange HttpExchange instance.
     * @throws IOException If an I/O error occurs.
     */
    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        log.debug("Handling request: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());

        try {
            if (!"/metrics".equals(path) && !"/status".equals(path) && !"/health".equals(path)) {
                sendError(exchange, 404, "Not Found");
                return;
            }

            String method = exchange.getRequestMethod();
            if (!"GET".equals(method) && !"HEAD".equals(method)) {
                exchange.getResponseHeaders().set("Allow", "GET, HEAD");
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            if ("/health".equals(path)) {
                handleHealth(exchange);
                return;
            }

            if (!auth.isAuthenticated(exchange)) {
                auth.sendAuthRequired(exchange);
                return;
            }

            if ("/metrics".equals(path)) {
                handleMetrics(exchange);
            } else {
                handleStatus(exchange);
            }
        } finally {
            exchange.close();
        }
    }

    /**
     * Handles /metrics.
     * <p>The scrape runs under the metrics read lock so paired values are rendered together.
     *
     * @param exchange HttpExchange instance.
     * @throws IOException If an I/O error occurs.
     */
    private void handleMetrics(HttpExchange exchange) throws IOException {
        String response = metrics.read(prometheusRegistry::scrape);
        sendResponse(exchange, 200, PROMETHEUS_CONTENT_TYPE, response);
    }

    /**
     * Handles /status.
     *
     * @param exchange HttpExchange instance.
     * @throws IOException If an I/O error occurs.
     */
    private void handleStatus(HttpExchange exchange) throws IOException {
        String response;
        try {
            response = renderer.render(StatusSnapshot.from(metrics.snapshot(), spamTestUrl));
        } catch (IOException | RuntimeException e) {
            log.error("Could not render status page", e);
            sendError(exchange, 500, "Internal Server Error");
            return;
        }
        sendResponse(exchange, 200, "text/html; charset=utf-8", response);
    }

    /**
     * Handles /health.
     *
     * @param exchange HttpExchange instance.
     * @throws IOException If an I/O error occurs.
     */
    protected void handleHealth(HttpExchange exchange) throws IOException {
        Duration uptime = Duration.ofMillis(System.currentTimeMillis() - startTime);
        String uptimeString = String.format("%dd %dh %dm %ds",
                uptime.toDays(),
                uptime.toHoursPart(),
                uptime.toMinutesPart(),
                uptime.toSecondsPart());

        String response = String.format("{\"status\":\"UP\",\"uptime\":\"%s\"}", uptimeString);
        sendResponse(exchange, 200, "application/json; charset=utf-8", response);
    }

    /**
     * Sends a response, headers only for HEAD requests.
     *
     * @param exchange    HttpExchange instance.
     * @param code        Status code.
     * @param contentType Content type.
     * @param response    Body.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendResponse(HttpExchange exchange, int code, String contentType, String response) throws IOException {
        byte[] responseBytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        if ("HEAD".equals(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Content-Length", String.valueOf(responseBytes.length));
            exchange.sendResponseHeaders(code, -1);
            return;
        }
        exchange.sendResponseHeaders(code, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
        log.trace("Sent response: status={}, contentType={}, bytes={}", code, contentType, responseBytes.length);
    }

    /**
     * Sends a plain text error.
     *
     * @param exchange HttpExchange instance.
     * @param code     Status code.
     * @param message  Body.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendError(HttpExchange exchange, int code, String message) throws IOException {
        byte[] responseBytes = message.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(code, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
        log.debug("Sent error response: status={}, bytes={}", code, responseBytes.length);
    }
}
