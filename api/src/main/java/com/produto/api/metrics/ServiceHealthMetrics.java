package com.produto.api.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Service map gauges: liveness and readiness of this service, whether its database
 * dependency is reachable, and a constant application info series.
 * Values are 1 for healthy or active and 0 otherwise.
 */
@Component
public class ServiceHealthMetrics {

    public static final String SERVICE_NAME = "produto-api";

    private final AtomicInteger liveness = new AtomicInteger(1);
    private final AtomicInteger readiness = new AtomicInteger(0);
    private final AtomicInteger databaseDependency = new AtomicInteger(0);

    public ServiceHealthMetrics(MeterRegistry meterRegistry,
                                @Value("${app.environment:development}") String environment,
                                @Value("${app.version:1.0.0}") String version) {
        Gauge.builder("service.health.status", liveness, AtomicInteger::get)
            .description("Health of the service by check type")
            .tag("service_name", SERVICE_NAME)
            .tag("check_type", "liveness")
            .register(meterRegistry);
        Gauge.builder("service.health.status", readiness, AtomicInteger::get)
            .description("Health of the service by check type")
            .tag("service_name", SERVICE_NAME)
            .tag("check_type", "readiness")
            .register(meterRegistry);
        Gauge.builder("service.dependency.active", databaseDependency, AtomicInteger::get)
            .description("Whether a dependency of the service is reachable")
            .tag("source_service", SERVICE_NAME)
            .tag("target_service", "postgresql")
            .tag("dependency_type", "database")
            .register(meterRegistry);
        Gauge.builder("application.info", () -> 1)
            .description("Application information")
            .tag("version", version)
            .tag("environment", environment)
            .register(meterRegistry);
    }

    /**
     * Readiness follows the database: the service is ready exactly when PostgreSQL answers.
     */
    public void recordDatabaseCheck(boolean reachable) {
        int value = reachable ? 1 : 0;
        readiness.set(value);
        databaseDependency.set(value);
    }
}
