package io.ledger.core.api;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.ledger.core.ledger.LedgerEngine;
import io.ledger.core.metrics.HttpMetrics;
import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.ErrorKind;
import io.ledger.core.protocol.LedgerError;
import io.ledger.core.protocol.ValidationResult;
import io.ledger.core.state.OutputRecord;
import io.ledger.core.validation.BlockValidator;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * REST front end of the ledger.
 *
 * Every handler runs the same envelope: method check, optional token check, the route body, and
 * an {@code http.server.requests} sample tagged with the context path. Errors are returned as
 * {@code {"error": code, "message": text}}.
 */
public class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "UTXO Ledger REST API",
    "version": "1.0.0"
  },
  "paths": {
    "/": {
      "get": {
        "summary": "Health check with the current ledger height",
        "responses": { "200": { "description": "Ledger is up" } }
      }
    },
    "/blocks": {
      "post": {
        "summary": "Submit the next block",
        "description": "The block must sit exactly one above the current height, carry the SHA-256 of height and transaction ids as its id, spend only existing unspent outputs and balance inputs against outputs (except the genesis block).",
        "requestBody": {
          "required": true,
          "content": {
            "application/json": {
              "schema": { "$ref": "#/components/schemas/Block" }
            }
          }
        },
        "responses": {
          "200": { "description": "Block applied" },
          "400": { "description": "Malformed or invalid block" },
          "409": { "description": "Double spend or duplicate transaction" }
        }
      }
    },
    "/balance/{address}": {
      "get": {
        "summary": "Sum of unspent outputs owned by an address",
        "parameters": [
          { "name": "address", "in": "path", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Balance (0 for unknown addresses)" },
          "400": { "description": "Missing address" }
        }
      }
    },
    "/outputs/{txId}/{index}": {
      "get": {
        "summary": "Look up one output and its spend status",
        "parameters": [
          { "name": "txId", "in": "path", "required": true, "schema": { "type": "string" } },
          { "name": "index", "in": "path", "required": true, "schema": { "type": "integer", "minimum": 0 } }
        ],
        "responses": {
          "200": { "description": "Output record" },
          "400": { "description": "Malformed output reference" },
          "404": { "description": "Unknown output" }
        }
      }
    },
    "/rollback": {
      "post": {
        "summary": "Undo every block above the target height",
        "parameters": [
          { "name": "height", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Rolled back" },
          "400": { "description": "Invalid, future or too deep target height" }
        }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Plain-text metrics scrape",
        "responses": { "200": { "description": "Metrics" } }
      }
    },
    "/openapi.json": {
      "get": {
        "summary": "Return this OpenAPI document",
        "responses": { "200": { "description": "OpenAPI specification" } }
      }
    }
  },
  "components": {
    "schemas": {
      "Block": {
        "type": "object",
        "required": ["id", "height", "transactions"],
        "properties": {
          "id": { "type": "string" },
          "height": { "type": "integer", "minimum": 1 },
          "transactions": { "type": "array", "items": { "$ref": "#/components/schemas/Transaction" } }
        }
      },
      "Transaction": {
        "type": "object",
        "required": ["id", "inputs", "outputs"],
        "properties": {
          "id": { "type": "string" },
          "inputs": { "type": "array", "items": { "$ref": "#/components/schemas/Input" } },
          "outputs": { "type": "array", "items": { "$ref": "#/components/schemas/Output" } }
        }
      },
      "Input": {
        "type": "object",
        "required": ["txId", "index"],
        "properties": {
          "txId": { "type": "string" },
          "index": { "type": "integer", "minimum": 0 }
        }
      },
      "Output": {
        "type": "object",
        "required": ["address", "value"],
        "properties": {
          "address": { "type": "string" },
          "value": { "type": "number", "minimum": 0 }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final LedgerEngine engine;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(LedgerEngine engine, String bindAddress, int port, String authToken) {
        this.engine = engine;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "0.0.0.0" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true)
                .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("API server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/", new HealthHandler());
        server.createContext("/blocks", new BlocksHandler());
        server.createContext("/balance", new BalanceHandler());
        server.createContext("/outputs", new OutputHandler());
        server.createContext("/rollback", new RollbackHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "API server listening on http://" + bindAddress + ':' + boundPort()
                + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /** Actual listening port; differs from the configured one when that was 0. */
    public int boundPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    static int statusFor(ErrorKind kind) {
        if (kind == ErrorKind.CONFLICT) {
            return 409;
        }
        return kind.isClientError() ? 400 : 500;
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    /** Shared request envelope; subclasses only implement {@link #serve}. */
    abstract class Route implements HttpHandler {
        private final String allowedMethod;
        private final boolean authenticated;

        Route(String allowedMethod, boolean authenticated) {
            this.allowedMethod = allowedMethod;
            this.authenticated = authenticated;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                if (authenticated) {
                    status = ensureAuthorized(exchange);
                    if (status != -1) {
                        return;
                    }
                }
                status = serve(exchange);
            } catch (Exception e) {
                LOG.log(Level.WARNING, method + " " + exchange.getRequestURI().getPath() + " failed", e);
                status = sendError(exchange, 500, LedgerError.INTERNAL_ERROR, "Internal server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }

        abstract int serve(HttpExchange exchange) throws IOException;
    }

    final class HealthHandler extends Route {
        HealthHandler() {
            super("GET", false);
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            // "/" is also the fallback context for every unknown path
            if (!"/".equals(exchange.getRequestURI().getPath())) {
                return sendError(exchange, 404, "not_found", "No route for " + exchange.getRequestURI().getPath());
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("status", "ok")
                    .put("currentHeight", engine.getCurrentHeight());
            return sendJson(exchange, 200, resp);
        }
    }

    final class BlocksHandler extends Route {
        BlocksHandler() {
            super("POST", true);
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            JsonNode body;
            try {
                body = mapper.readTree(exchange.getRequestBody());
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse block request");
            }
            ValidationResult<Block> block = BlockValidator.validateBlock(body);
            if (!block.ok) {
                return sendLedgerError(exchange, block.error);
            }
            ValidationResult<Long> result = engine.submitBlock(block.value);
            if (!result.ok) {
                return sendLedgerError(exchange, result.error);
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("success", true)
                    .put("height", result.value);
            return sendJson(exchange, 200, resp);
        }
    }

    final class BalanceHandler extends Route {
        BalanceHandler() {
            super("GET", true);
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            List<String> segments = pathSegments(exchange);
            String address = segments.size() == 1 ? segments.get(0) : "";
            if (address.isEmpty()) {
                return sendError(exchange, 400, "missing_address", "Path parameter 'address' is required");
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("address", address)
                    .put("balance", engine.getBalance(address).stripTrailingZeros());
            return sendJson(exchange, 200, resp);
        }
    }

    final class OutputHandler extends Route {
        OutputHandler() {
            super("GET", true);
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            List<String> segments = pathSegments(exchange);
            if (segments.size() != 2 || segments.get(0).isEmpty()) {
                return sendError(exchange, 400, "invalid_outpoint", "Expected /outputs/{txId}/{index}");
            }
            int index;
            try {
                index = Integer.parseInt(segments.get(1));
            } catch (NumberFormatException e) {
                index = -1;
            }
            if (index < 0) {
                return sendError(exchange, 400, "invalid_outpoint", "Output index must be an integer >= 0");
            }
            String txId = segments.get(0);
            Optional<OutputRecord> output = engine.getOutput(txId, index);
            if (output.isEmpty()) {
                return sendError(exchange, 404, "output_not_found", "Unknown output: " + txId + ":" + index);
            }
            OutputRecord record = output.get();
            ObjectNode resp = mapper.createObjectNode()
                    .put("txId", record.txId())
                    .put("index", record.index())
                    .put("address", record.address())
                    .put("value", record.value().stripTrailingZeros())
                    .put("spent", record.spent());
            if (record.spent()) {
                resp.put("spentByTx", record.spentByTx());
                resp.put("spentByIndex", record.spentByIndex());
            }
            return sendJson(exchange, 200, resp);
        }
    }

    final class RollbackHandler extends Route {
        RollbackHandler() {
            super("POST", true);
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            ValidationResult<Long> target = BlockValidator.validateRollbackHeight(queryParam(exchange, "height"));
            if (!target.ok) {
                return sendLedgerError(exchange, target.error);
            }
            ValidationResult<Long> result = engine.rollback(target.value);
            if (!result.ok) {
                return sendLedgerError(exchange, result.error);
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("success", true)
                    .put("height", result.value);
            return sendJson(exchange, 200, resp);
        }
    }

    final class OpenApiHandler extends Route {
        OpenApiHandler() {
            super("GET", false);
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    private int sendLedgerError(HttpExchange exchange, LedgerError error) throws IOException {
        if (error.kind() == ErrorKind.INTERNAL) {
            return sendError(exchange, 500, LedgerError.INTERNAL_ERROR, "Internal server error");
        }
        return sendError(exchange, statusFor(error.kind()), error.code(), error.message());
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else if (body instanceof String str) {
            payload = str.getBytes(StandardCharsets.UTF_8);
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    /** Decoded path below the handler's context, without the leading slash. */
    /** Path segments after the context path, each decoded on its own so an encoded '/' stays inside it. */
    private static List<String> pathSegments(HttpExchange exchange) {
        String context = exchange.getHttpContext().getPath();
        String raw = exchange.getRequestURI().getRawPath();
        String rest = raw.length() > context.length() ? raw.substring(context.length()) : "";
        if (rest.startsWith("/")) {
            rest = rest.substring(1);
        }
        List<String> segments = new ArrayList<>();
        for (String segment : rest.split("/", -1)) {
            // '+' is literal in a path segment
            segments.add(URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8));
        }
        return segments;
    }

    private static String queryParam(HttpExchange exchange, String key) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String part : query.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            String[] kv = part.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String k = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (key.equals(k)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
