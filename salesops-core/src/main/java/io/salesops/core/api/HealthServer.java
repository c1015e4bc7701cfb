package io.salesops.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.salesops.core.dispatch.CycleReport;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Liveness endpoint for hosting platforms: {@code GET /} answers with a plain-text line and
 * {@code GET /healthz} with the mode and the statistics of the last finished cycle.
 */
public final class HealthServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    static final String LIVENESS_LINE = "SalesOps auditor is running";

    private final int requestedPort;
    private final String host;
    private final String mode;
    private final Supplier<Optional<CycleReport>> lastCycle;
    private final ObjectMapper mapper;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Undertow server;
    private int actualPort;

    public HealthServer(String host, int port, String mode, Supplier<Optional<CycleReport>> lastCycle) {
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.requestedPort = port;
        this.actualPort = port;
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.lastCycle = Objects.requireNonNull(lastCycle, "lastCycle must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        PathHandler routes = Handlers.path(this::handleRoot)
            .addExactPath("/healthz", this::handleHealth);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Health endpoint listening on http://{}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
            server = null;
        }
    }

    private void handleRoot(HttpServerExchange exchange) throws IOException {
        String path = exchange.getRelativePath();
        if (!path.isEmpty() && !"/".equals(path)) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        if (!isGet(exchange)) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        byte[] body = LIVENESS_LINE.getBytes(StandardCharsets.UTF_8);
        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isGet(exchange)) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", "ok");
        payload.put("mode", mode);
        payload.put("lastCycle", lastCycle.get().orElse(null));
        sendJson(exchange, 200, payload);
    }

    private boolean isGet(HttpServerExchange exchange) {
        return "GET".equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        if (undertow.getListenerInfo().isEmpty()) {
            return fallbackPort;
        }
        Object address = undertow.getListenerInfo().get(0).getAddress();
        if (address instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
