package fr.lapetina.aimux.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.aimux.domain.strategy.LoadBalancer;
import fr.lapetina.aimux.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.aimux.domain.strategy.StrategyFactory;
import fr.lapetina.aimux.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.aimux.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.aimux.infrastructure.registry.ProviderRegistry;
import fr.lapetina.aimux.infrastructure.registry.RegistryStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Status and admin HTTP endpoint on the JDK's built-in HttpServer. Does not route requests.
 *
 * Endpoints:
 * - GET /health - Overall availability (200 when at least one provider can take traffic)
 * - GET /status - Registry snapshot as JSON, secrets masked
 * - GET /metrics - Prometheus metrics
 * - GET /admin/strategy - Current and available strategies
 * - POST /admin/strategy - Change load balancing strategy
 * - POST /admin/providers/{id}/reset - Reset circuit and latency window of a provider
 * - POST /admin/reload - Reload configuration
 */
public final class StatusServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StatusServer.class);

    private static final Pattern RESET_PATH = Pattern.compile("/admin/providers/([^/]+)/reset");
    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final ProviderRegistry registry;
    private final LoadBalancer loadBalancer;
    private final MetricsRegistry metricsRegistry;
    private final Runnable reloadAction;

    /**
     * @param metricsRegistry may be null, in which case /metrics answers 404
     * @param reloadAction    re-reads and applies the configuration; throws
     *                        {@link ConfigurationException} when the new configuration is rejected
     */
    public StatusServer(
            String host,
            int port,
            int backlog,
            int threads,
            ProviderRegistry registry,
            LoadBalancer loadBalancer,
            MetricsRegistry metricsRegistry,
            Runnable reloadAction
    ) throws IOException {
        this.registry = registry;
        this.loadBalancer = loadBalancer;
        this.metricsRegistry = metricsRegistry;
        this.reloadAction = reloadAction;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        InetSocketAddress address = host == null || host.isBlank()
                ? new InetSocketAddress(port)
                : new InetSocketAddress(host, port);
        this.server = HttpServer.create(address, backlog);

        AtomicInteger counter = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "status-http-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/health", new HealthHandler());
        server.createContext("/status", new StatusHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("Status server configured on {}:{}", host, port);
    }

    public void start() {
        server.start();
        log.info("Status server started on port {}", getPort());
    }

    /**
     * The bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Status server stopped");
    }

    // ==================== READ-ONLY HANDLERS ====================

    /**
     * Answers GET only; any other method gets 405.
     */
    private abstract class ReadOnlyHandler implements HttpHandler {
        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                writeError(exchange, 405, "Method " + exchange.getRequestMethod() + " not allowed");
                return;
            }
            try {
                respond(exchange);
            } catch (RuntimeException e) {
                log.error("Error serving {}", exchange.getRequestURI().getPath(), e);
                writeError(exchange, 500, e.getMessage());
            }
        }

        protected abstract void respond(HttpExchange exchange) throws IOException;
    }

    private class HealthHandler extends ReadOnlyHandler {
        @Override
        protected void respond(HttpExchange exchange) throws IOException {
            RegistryStatus status = registry.snapshot();
            int total = status.providers().size();
            long available = status.providers().stream()
                    .filter(RegistryStatus.ProviderStatus::available)
                    .count();

            String overall = available == 0 ? "DOWN" : available < total ? "DEGRADED" : "UP";

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", overall);
            body.put("generation", status.generation());
            body.put("providers", total);
            body.put("available", available);
            body.put("strategy", loadBalancer.getStrategy().getName());
            writeJson(exchange, available == 0 ? 503 : 200, body);
        }
    }

    private class StatusHandler extends ReadOnlyHandler {
        @Override
        protected void respond(HttpExchange exchange) throws IOException {
            writeJson(exchange, 200, registry.snapshot());
        }
    }

    private class MetricsHandler extends ReadOnlyHandler {
        @Override
        protected void respond(HttpExchange exchange) throws IOException {
            if (metricsRegistry == null) {
                writeError(exchange, 404, "Metrics are disabled");
                return;
            }
            writeBody(exchange, 200, PROMETHEUS_CONTENT_TYPE,
                    metricsRegistry.scrape().getBytes(StandardCharsets.UTF_8));
        }
    }

    // ==================== ADMIN HANDLER ====================

    /**
     * Admin operations. Unknown paths and wrong methods both answer 404.
     */
    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String route = exchange.getRequestMethod().toUpperCase(Locale.ROOT) + " " + path;

            try {
                Matcher reset = RESET_PATH.matcher(path);
                if (reset.matches() && route.startsWith("POST ")) {
                    resetProvider(exchange, reset.group(1));
                    return;
                }
                switch (route) {
                    case "GET /admin/strategy" -> describeStrategy(exchange);
                    case "POST /admin/strategy" -> changeStrategy(exchange);
                    case "POST /admin/reload" -> reload(exchange);
                    default -> writeError(exchange, 404, "No admin operation for " + route);
                }
            } catch (IOException | RuntimeException e) {
                log.error("Admin operation failed: route={}", route, e);
                writeError(exchange, 500, e.getMessage());
            }
        }

        private void resetProvider(HttpExchange exchange, String providerId) throws IOException {
            if (!registry.resetProvider(providerId)) {
                writeError(exchange, 404, "Unknown provider: " + providerId);
                return;
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("provider", providerId);
            body.put("action", "reset");
            writeJson(exchange, 200, body);
        }

        private void describeStrategy(HttpExchange exchange) throws IOException {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("current", loadBalancer.getStrategy().getName());
            body.put("available", StrategyFactory.getRegisteredNames());
            writeJson(exchange, 200, body);
        }

        private void changeStrategy(HttpExchange exchange) throws IOException {
            JsonNode request;
            try (InputStream body = exchange.getRequestBody()) {
                request = objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                writeError(exchange, 400, "Request body is not valid JSON");
                return;
            }

            JsonNode name = request != null ? request.get("strategy") : null;
            if (name == null || !name.isTextual() || name.asText().isBlank()) {
                writeError(exchange, 400, "Field 'strategy' is required");
                return;
            }

            Optional<LoadBalancingStrategy> strategy = StrategyFactory.create(name.asText());
            if (strategy.isEmpty()) {
                writeError(exchange, 400, "Unknown strategy '" + name.asText()
                        + "', available " + StrategyFactory.getRegisteredNames());
                return;
            }

            loadBalancer.setStrategy(strategy.get());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("strategy", strategy.get().getName());
            body.put("message", "Load balancing strategy switched");
            writeJson(exchange, 200, body);
        }

        private void reload(HttpExchange exchange) throws IOException {
            Map<String, Object> body = new LinkedHashMap<>();
            try {
                reloadAction.run();
            } catch (ConfigurationException e) {
                body.put("error", e.getMessage());
                body.put("problems", e.getProblems());
                writeJson(exchange, 422, body);
                return;
            }
            body.put("message", "Configuration applied");
            body.put("generation", registry.getGeneration());
            body.put("providers", registry.currentSnapshot().size());
            writeJson(exchange, 200, body);
        }
    }

    // ==================== RESPONSES ====================

    private void writeJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        writeBody(exchange, statusCode, "application/json", objectMapper.writeValueAsBytes(body));
    }

    private void writeError(HttpExchange exchange, int statusCode, String message) throws IOException {
        writeJson(exchange, statusCode, Map.of("error", message != null ? message : "Unknown error"));
    }

    private static void writeBody(HttpExchange exchange, int statusCode, String contentType, byte[] bytes)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
