package io.ledger.core.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.ledger.core.metrics.HttpMetrics;
import io.ledger.core.metrics.LedgerMetrics;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

public final class MetricsHandler implements HttpHandler {
    @Override
    public void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getHttpContext().getPath();
        var sample = HttpMetrics.start();
        int status = 500;
        try {
            if (!"GET".equalsIgnoreCase(method)) {
                status = sendPlain(exchange, 405, "Method Not Allowed");
                return;
            }
            status = sendPlain(exchange, 200, LedgerMetrics.scrapeMetrics());
        } finally {
            HttpMetrics.stop(sample, method, path, status);
            exchange.close();
        }
    }

    private int sendPlain(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        return status;
    }
}
