package com.produto.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.produto.shipper.config.ShipperSettings;
import com.produto.shipper.service.LokiLogShipper;
import com.produto.shipper.transport.HttpLokiSender;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the process-wide Loki shipper. Skipped entirely when {@code loki.enabled=false}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(LokiProperties.class)
@ConditionalOnProperty(prefix = "loki", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LokiLoggingConfig {

    @Bean
    public LokiLogShipper lokiLogShipper(LokiProperties properties,
                                         ObjectMapper objectMapper,
                                         MeterRegistry meterRegistry) {
        ShipperSettings settings = properties.toSettings();
        return new LokiLogShipper(settings, new HttpLokiSender(settings, objectMapper), meterRegistry);
    }

    @Bean
    public LokiLoggingLifecycle lokiLoggingLifecycle(LokiLogShipper lokiLogShipper, LokiProperties properties) {
        return new LokiLoggingLifecycle(lokiLogShipper, properties.getShutdownTimeout());
    }
}
