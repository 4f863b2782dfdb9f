package io.chatrelay.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatrelay.core.gateway.InferenceFailureException;
import io.chatrelay.core.gateway.InvalidImageReferenceException;
import io.chatrelay.core.gateway.SessionGateway;
import io.chatrelay.core.model.HistoryEntry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-over-HTTP surface of the relay: health, session creation, chat, history and visit tracking.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_CREDENTIALS = new HttpString("Access-Control-Allow-Credentials");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final SessionGateway gateway;
    private final Set<String> allowedOrigins;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(int port, SessionGateway gateway) {
        this(port, "0.0.0.0", gateway, List.of());
    }

    public GatewayServer(int port, String host, SessionGateway gateway, List<String> allowedOrigins) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.allowedOrigins = allowedOrigins == null ? Set.of() : Set.copyOf(allowedOrigins);
        this.mapper = new ObjectMapper();
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/health", this::handleHealth)
            .addExactPath("/api/new_session", this::handleNewSession)
            .addExactPath("/api/chat", exchange -> dispatch(exchange, this::handleChat))
            .addExactPath("/api/history", this::handleHistory)
            .addExactPath("/api/track_visit", exchange -> dispatch(exchange, this::handleTrackVisit));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (server != null) {
            server.stop();
        }
    }

    private void handleWithCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = header(exchange, "Origin");
        if (origin.isBlank() || !allowedOrigins.contains(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_CREDENTIALS, "true");
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type,Authorization");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "600");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", true);
        response.put("model", gateway.modelIdentifier());
        response.put("sessions", gateway.sessionCount());
        sendJson(exchange, 200, response);
    }

    private void handleNewSession(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("session_id", gateway.newSession()));
    }

    private void handleChat(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        JsonNode body = readJsonBody(exchange);
        String sessionId = requiredText(body, "session_id");
        String message = requiredText(body, "message");
        if (sessionId == null || message == null) {
            sendJson(exchange, 422, Map.of("detail", "session_id and message are required"));
            return;
        }
        JsonNode imageNode = body.path("image_urls");
        List<String> imageUrls = readStringList(imageNode);
        if (imageUrls == null) {
            sendJson(exchange, 422, Map.of("detail", "image_urls must be a list of strings"));
            return;
        }

        try {
            String reply = gateway.chat(sessionId, message, imageUrls);
            sendJson(exchange, 200, Map.of("reply", reply));
        } catch (InvalidImageReferenceException e) {
            sendJson(exchange, 400, Map.of("detail", e.getMessage()));
        } catch (InferenceFailureException e) {
            sendJson(exchange, 502, Map.of("detail", e.getMessage()));
        }
    }

    private void handleHistory(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        String sessionId = queryParam(exchange, "session_id");
        if (sessionId == null) {
            sendJson(exchange, 422, Map.of("detail", "session_id is required"));
            return;
        }
        List<Map<String, String>> messages = new ArrayList<>();
        for (HistoryEntry entry : gateway.history(sessionId)) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("sender", entry.sender());
            row.put("text", entry.text());
            messages.add(row);
        }
        sendJson(exchange, 200, Map.of("messages", messages));
    }

    private void handleTrackVisit(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        JsonNode body = readJsonBody(exchange);
        String visitorId = requiredText(body, "visitor_id");
        String page = requiredText(body, "page");
        if (visitorId == null || page == null) {
            sendJson(exchange, 422, Map.of("detail", "visitor_id and page are required"));
            return;
        }
        List<String> pages = gateway.trackVisit(visitorId, page);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("visitor_id", visitorId);
        response.put("pages", pages);
        sendJson(exchange, 200, response);
    }

    private void dispatch(HttpServerExchange exchange, ExchangeHandler handler) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> dispatch(exchange, handler));
            return;
        }
        try {
            handler.handle(exchange);
        } catch (MalformedBodyException e) {
            sendQuietly(exchange, 400, Map.of("detail", e.getMessage()));
        } catch (Exception e) {
            LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendInternalError(exchange, e);
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(bytes);
        } catch (IOException e) {
            throw new MalformedBodyException("request body is not valid JSON");
        }
    }

    private String requiredText(JsonNode body, String field) {
        JsonNode node = body.path(field);
        if (!node.isTextual()) {
            return null;
        }
        return node.asText();
    }

    /**
     * Reads an optional array of strings. Returns {@code null} when the node is present but is not
     * an array, or holds any non-string item.
     */
    private List<String> readStringList(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                return null;
            }
            values.add(item.asText());
        }
        return values;
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        sendQuietly(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
    }

    private void sendQuietly(HttpServerExchange exchange, int status, Map<String, ?> payload) {
        try {
            sendJson(exchange, status, payload);
        } catch (IOException e) {
            LOG.debug("Failed to write {} response", status, e);
        }
    }

    private boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.peekFirst();
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port, using {}", fallbackPort, e);
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }

    private static final class MalformedBodyException extends IOException {
        MalformedBodyException(String message) {
            super(message);
        }
    }
}
