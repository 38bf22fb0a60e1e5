package com.produto.shipper.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for one Loki shipper instance.
 * Values come from the host application's configuration; defaults match the stock deployment.
 */
@Value
@Builder(toBuilder = true)
public class ShipperSettings {

    public static final String PUSH_PATH = "/loki/api/v1/push";

    @Builder.Default
    String url = "http://localhost:3100";

    @Builder.Default
    String job = "MONITORAMENTO_PRODUTO";

    @Builder.Default
    String application = "produto-api";

    @Builder.Default
    int batchSize = 10;

    @Builder.Default
    Duration flushInterval = Duration.ofSeconds(5);

    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(5);

    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(5);

    @Builder.Default
    Duration shutdownTimeout = Duration.ofSeconds(10);

    /**
     * Maximum queued records; 0 keeps the queue unbounded. When positive the oldest record is evicted on overflow.
     */
    @Builder.Default
    int queueCapacity = 0;

    /**
     * Extra static labels attached to every stream, e.g. environment.
     */
    @Singular
    Map<String, String> labels;

    public String pushEndpoint() {
        String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return base + PUSH_PATH;
    }

    /**
     * Labels stamped on every record: job and application first, then the configured extras.
     */
    public Map<String, String> recordLabels() {
        Map<String, String> result = new LinkedHashMap<>();
        result.put("job", job);
        result.put("application", application);
        result.putAll(labels);
        return result;
    }

    public void validate() {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Loki url must be set");
        }
        if (job == null || job.isBlank()) {
            throw new IllegalArgumentException("Loki job must be set");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
        }
        if (flushInterval == null || flushInterval.isNegative() || flushInterval.isZero()) {
            throw new IllegalArgumentException("flushInterval must be positive");
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity must not be negative");
        }
    }
}
