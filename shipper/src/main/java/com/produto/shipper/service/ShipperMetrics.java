package com.produto.shipper.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Micrometer meters for the Loki shipper. Counts are exposed to the metrics
 * subsystem; the shipper itself never reads them back.
 */
public class ShipperMetrics {

    public enum DropReason {
        STOPPED,
        OVERFLOW,
        SERIALIZATION,
        SHUTDOWN
    }

    private final MeterRegistry meterRegistry;
    private final String job;
    private final Counter logsSentCounter;
    private final Counter logsFailedCounter;
    private final Counter batchesSentCounter;
    private final Counter batchesFailedCounter;
    private final Map<DropReason, Counter> droppedCounters = new EnumMap<>(DropReason.class);
    private final Timer pushLatencyTimer;

    public ShipperMetrics(MeterRegistry meterRegistry, String job) {
        this.meterRegistry = meterRegistry;
        this.job = job;
        this.logsSentCounter = Counter.builder("loki.logs.sent")
            .description("Total number of log records pushed to Loki")
            .tag("job", job)
            .register(meterRegistry);
        this.logsFailedCounter = Counter.builder("loki.logs.failed")
            .description("Total number of log records lost to failed pushes")
            .tag("job", job)
            .register(meterRegistry);
        this.batchesSentCounter = Counter.builder("loki.batches.sent")
            .description("Total number of successful push requests")
            .tag("job", job)
            .register(meterRegistry);
        this.batchesFailedCounter = Counter.builder("loki.batches.failed")
            .description("Total number of failed push requests")
            .tag("job", job)
            .register(meterRegistry);
        for (DropReason reason : DropReason.values()) {
            droppedCounters.put(reason, Counter.builder("loki.logs.dropped")
                .description("Log records dropped before reaching Loki")
                .tag("job", job)
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        }
        this.pushLatencyTimer = Timer.builder("loki.push.latency")
            .description("Time taken to push one batch to Loki")
            .tag("job", job)
            .register(meterRegistry);
    }

    void bindQueue(Collection<?> queue) {
        Gauge.builder("loki.queue.size", queue, Collection::size)
            .description("Log records waiting to be shipped")
            .tag("job", job)
            .register(meterRegistry);
    }

    void recordSent(int records) {
        logsSentCounter.increment(records);
        batchesSentCounter.increment();
    }

    void recordFailed(int records) {
        logsFailedCounter.increment(records);
        batchesFailedCounter.increment();
    }

    void recordDropped(DropReason reason, int records) {
        if (records > 0) {
            droppedCounters.get(reason).increment(records);
        }
    }

    Timer pushLatency() {
        return pushLatencyTimer;
    }
}
