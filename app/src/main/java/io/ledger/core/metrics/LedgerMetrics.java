package io.ledger.core.metrics;

import io.ledger.core.protocol.ErrorKind;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksAccepted = registry.counter("ledger.blocks.accepted");
    private static final Timer applyTime = Timer.builder("ledger.block.apply.time")
            .description("Time spent validating and applying a block")
            .register(registry);
    private static final Counter rollbacks = registry.counter("ledger.rollbacks");
    private static final DistributionSummary rollbackDepth = DistributionSummary.builder("ledger.rollback.depth")
            .baseUnit("blocks")
            .description("Blocks removed per rollback")
            .register(registry);

    private LedgerMetrics() {}

    public static <T> T recordApply(Supplier<T> admission) {
        return applyTime.record(admission);
    }

    public static void blockAccepted() {
        blocksAccepted.increment();
    }

    public static void blockRejected(ErrorKind kind) {
        Counter.builder("ledger.blocks.rejected")
                .tag("kind", kind.name())
                .register(registry)
                .increment();
    }

    public static void rolledBack(long depth) {
        rollbacks.increment();
        rollbackDepth.record(depth);
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{");
                for (Tag tag : m.getId().getTags()) {
                    sb.append(tag.getKey()).append('=').append(tag.getValue()).append(',');
                }
                sb.append("stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
