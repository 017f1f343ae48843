package com.ordermetrics.streams;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ordermetrics.common.ReportingConfig;
import com.ordermetrics.common.model.OrderRecord;
import com.ordermetrics.common.serde.JsonSerde;
import com.ordermetrics.streams.derivation.DerivationPass;
import com.ordermetrics.streams.model.MetricsRecord;
import com.ordermetrics.streams.model.MetricsSummary;
import com.ordermetrics.streams.model.ReportingFilter;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * HTTP server for Interactive Queries on the order state stores.
 * Metrics are never read from storage: every request runs a fresh derivation
 * pass over the current order records, with {@code now} captured once per request.
 */
public class InteractiveQueryServer {

    private static final Logger LOG = LoggerFactory.getLogger(InteractiveQueryServer.class);
    private static final ObjectMapper MAPPER = JsonSerde.getObjectMapper();

    private static final String ORDER_STATE_PATH = "/state/" + OrderMetricsTopology.ORDER_STATE_STORE;
    private static final String ORDERS_BY_STATUS_PATH = "/state/" + OrderMetricsTopology.ORDERS_BY_STATUS_STORE;
    private static final String ORDER_METRICS_PATH = "/metrics/orders";
    private static final String SUMMARY_PATH = "/metrics/summary";

    private final OrderStateReader reader;
    private final DerivationPass derivationPass;
    private final LocalDate windowStart;
    private final int port;
    private final Clock clock;
    private HttpServer server;

    public InteractiveQueryServer(OrderStateReader reader, DerivationPass derivationPass, ReportingConfig config) {
        this(reader, derivationPass, config.windowStart(), config.queryServerPort(), config.clock());
    }

    /**
     * @param port listening port, 0 for an ephemeral one
     */
    public InteractiveQueryServer(OrderStateReader reader, DerivationPass derivationPass,
                                  LocalDate windowStart, int port, Clock clock) {
        this.reader = reader;
        this.derivationPass = derivationPass;
        this.windowStart = windowStart;
        this.port = port;
        this.clock = clock;
    }

    /**
     * Start the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/health", this::handleHealth);

        // State store query endpoints
        server.createContext(ORDER_STATE_PATH, this::handleOrderState);
        server.createContext(ORDERS_BY_STATUS_PATH, this::handleOrdersByStatus);

        // Derived metrics endpoints
        server.createContext(ORDER_METRICS_PATH, this::handleOrderMetrics);
        server.createContext(SUMMARY_PATH, this::handleSummary);

        server.setExecutor(null); // Use default executor
        server.start();

        LOG.info("Interactive Query Server started on port {}", getPort());
        logAvailableEndpoints();
    }

    /**
     * Stop the HTTP server.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            LOG.info("Interactive Query Server stopped");
        }
    }

    /**
     * Port actually bound, once started.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    // ===========================================
    // Health
    // ===========================================

    private void handleHealth(HttpExchange exchange) throws IOException {
        sendResponse(exchange, 200, "{\"status\":\"UP\"}");
    }

    // ===========================================
    // State stores
    // ===========================================

    private void handleOrderState(HttpExchange exchange) throws IOException {
        if (!requireGet(exchange)) {
            return;
        }
        try {
            String key = pathRemainder(exchange, ORDER_STATE_PATH);
            if (key == null) {
                sendError(exchange, 400, "Order key required. Use " + ORDER_STATE_PATH + "/{orderKey}");
                return;
            }

            OrderRecord order = reader.order(key);
            if (order == null) {
                sendError(exchange, 404, "Order not found: " + key);
                return;
            }
            sendJsonResponse(exchange, order);
            LOG.debug("Served query: {}", exchange.getRequestURI());

        } catch (Exception e) {
            LOG.error("Error processing order-current-state query", e);
            sendError(exchange, 500, String.valueOf(e.getMessage()));
        }
    }

    private void handleOrdersByStatus(HttpExchange exchange) throws IOException {
        if (!requireGet(exchange)) {
            return;
        }
        try {
            String status = pathRemainder(exchange, ORDERS_BY_STATUS_PATH);
            if (status != null) {
                Map<String, Object> result = new LinkedHashMap<>();
                result.put("status", status);
                result.put("count", reader.statusCount(status));
                sendJsonResponse(exchange, result);
            } else {
                sendJsonResponse(exchange, reader.statusCounts());
            }
            LOG.debug("Served query: {}", exchange.getRequestURI());

        } catch (Exception e) {
            LOG.error("Error processing orders-by-status query", e);
            sendError(exchange, 500, String.valueOf(e.getMessage()));
        }
    }

    // ===========================================
    // Derived metrics
    // ===========================================

    private void handleOrderMetrics(HttpExchange exchange) throws IOException {
        if (!requireGet(exchange)) {
            return;
        }
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            String key = pathRemainder(exchange, ORDER_METRICS_PATH);

            if (key != null) {
                OrderRecord order = reader.order(key);
                if (order == null) {
                    sendError(exchange, 404, "Order not found: " + key);
                    return;
                }
                sendJsonResponse(exchange, derivationPass.run(List.of(order), now).get(0));
            } else {
                ReportingFilter filter = ReportingFilter.fromQuery(exchange.getRequestURI().getRawQuery(), windowStart);
                sendJsonResponse(exchange, derive(filter, now));
            }
            LOG.debug("Served query: {}", exchange.getRequestURI());

        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage());
        } catch (Exception e) {
            LOG.error("Error processing order metrics query", e);
            sendError(exchange, 500, String.valueOf(e.getMessage()));
        }
    }

    private void handleSummary(HttpExchange exchange) throws IOException {
        if (!requireGet(exchange)) {
            return;
        }
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            ReportingFilter filter = ReportingFilter.fromQuery(exchange.getRequestURI().getRawQuery(), windowStart);
            sendJsonResponse(exchange, MetricsSummary.of(derive(filter, now), now));
            LOG.debug("Served query: {}", exchange.getRequestURI());

        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage());
        } catch (Exception e) {
            LOG.error("Error processing metrics summary query", e);
            sendError(exchange, 500, String.valueOf(e.getMessage()));
        }
    }

    private List<MetricsRecord> derive(ReportingFilter filter, LocalDateTime now) {
        List<OrderRecord> selected = reader.allOrders().stream()
            .filter(filter)
            .collect(Collectors.toList());
        return derivationPass.run(selected, now);
    }

    // ===========================================
    // Helper Methods
    // ===========================================

    /**
     * Decoded path after {@code prefix + "/"}, lower-cased, or null when absent.
     * Order keys may themselves contain slashes.
     */
    private static String pathRemainder(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getRawPath();
        if (path.length() <= prefix.length() + 1) {
            return null;
        }
        String remainder = URLDecoder.decode(path.substring(prefix.length() + 1), StandardCharsets.UTF_8);
        if (prefix.equals(ORDERS_BY_STATUS_PATH)) {
            return remainder;
        }
        return remainder.toLowerCase(Locale.ROOT);
    }

    private boolean requireGet(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed: " + exchange.getRequestMethod());
            return false;
        }
        return true;
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String response) throws IOException {
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendJsonResponse(HttpExchange exchange, Object data) throws IOException {
        String json = MAPPER.writeValueAsString(data);
        sendResponse(exchange, 200, json);
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message);
        sendResponse(exchange, statusCode, MAPPER.writeValueAsString(error));
    }

    private void logAvailableEndpoints() {
        LOG.info("Available endpoints:");
        LOG.info("  GET /health");
        LOG.info("  GET {}/{{orderKey}}", ORDER_STATE_PATH);
        LOG.info("  GET {}", ORDERS_BY_STATUS_PATH);
        LOG.info("  GET {}/{{status}}", ORDERS_BY_STATUS_PATH);
        LOG.info("  GET {}?from=&category=&seller=", ORDER_METRICS_PATH);
        LOG.info("  GET {}/{{orderKey}}", ORDER_METRICS_PATH);
        LOG.info("  GET {}?from=&category=&seller=", SUMMARY_PATH);
    }
}
