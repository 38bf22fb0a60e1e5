package com.produto.api.config;

import com.produto.shipper.config.ShipperSettings;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for shipping logs to Grafana Loki.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "loki")
public class LokiProperties {

    /**
     * Enable the Loki appender.
     */
    private boolean enabled = true;

    /**
     * Loki base URL; the push path is appended.
     */
    @NotBlank
    private String url = "http://localhost:3100";

    /**
     * Job label identifying this service in Loki.
     */
    @NotBlank
    private String job = "MONITORAMENTO_PRODUTO";

    /**
     * Application label.
     */
    private String application = "produto-api";

    /**
     * Number of log records per push.
     */
    @Min(1)
    private int batchSize = 10;

    /**
     * Maximum time a record waits before its batch is pushed.
     */
    private Duration flushInterval = Duration.ofSeconds(5);

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration requestTimeout = Duration.ofSeconds(5);

    /**
     * How long shutdown waits for the final flush.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    /**
     * Queue bound; 0 means unbounded. When set, the oldest records are dropped on overflow.
     */
    @Min(0)
    private int queueCapacity = 0;

    /**
     * Extra labels added to every stream, e.g. environment.
     */
    private Map<String, String> labels = new LinkedHashMap<>();

    public ShipperSettings toSettings() {
        return ShipperSettings.builder()
            .url(url)
            .job(job)
            .application(application)
            .batchSize(batchSize)
            .flushInterval(flushInterval)
            .connectTimeout(connectTimeout)
            .requestTimeout(requestTimeout)
            .shutdownTimeout(shutdownTimeout)
            .queueCapacity(queueCapacity)
            .labels(labels)
            .build();
    }
}
