package io.ledger.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

public final class HttpMetrics {
    private static final MeterRegistry REGISTRY = LedgerMetrics.registry();

    private HttpMetrics() {}

    public static Timer.Sample start() {
        return Timer.start(REGISTRY);
    }

    public static void stop(Timer.Sample sample, String method, String route, int status) {
        Timer timer = Timer
                .builder("http.server.requests")
                .description("HTTP server request duration")
                .tag("method", method)
                .tag("route", route)
                .tag("status", Integer.toString(status))
                .register(REGISTRY);
        sample.stop(timer);
    }
}
