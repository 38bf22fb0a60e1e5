package com.produto.api.controller;

import com.produto.api.metrics.ServiceHealthMetrics;
import com.produto.shipper.model.ShipperState;
import com.produto.shipper.service.LokiLogShipper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root, liveness and readiness endpoints.
 * Readiness fails only on the database; Loki being unavailable or disabled is not critical.
 * Every database check also updates the service health gauges.
 */
@Slf4j
@RestController
public class StatusController {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectProvider<LokiLogShipper> lokiLogShipper;
    private final ServiceHealthMetrics healthMetrics;
    private final String environment;
    private final String version;

    public StatusController(JdbcTemplate jdbcTemplate,
                            ObjectProvider<LokiLogShipper> lokiLogShipper,
                            ServiceHealthMetrics healthMetrics,
                            @Value("${app.environment:development}") String environment,
                            @Value("${app.version:1.0.0}") String version) {
        this.jdbcTemplate = jdbcTemplate;
        this.lokiLogShipper = lokiLogShipper;
        this.healthMetrics = healthMetrics;
        this.environment = environment;
        this.version = version;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "API Produto");
        response.put("version", version);
        response.put("metrics", "/actuator/prometheus");
        return response;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("service", ServiceHealthMetrics.SERVICE_NAME);
        response.put("environment", environment);
        response.put("version", version);
        return response;
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        boolean database = checkDatabase();

        Map<String, Object> checks = new LinkedHashMap<>();
        checks.put("database", database);
        checks.put("loki", lokiStatus());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", database ? "ready" : "not_ready");
        response.put("checks", checks);
        response.put("service", ServiceHealthMetrics.SERVICE_NAME);
        response.put("environment", environment);
        response.put("version", version);

        HttpStatus status = database ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recordStartupHealth() {
        boolean database = checkDatabase();
        log.info("Startup database check: {}", database ? "reachable" : "unreachable");
    }

    private boolean checkDatabase() {
        boolean reachable;
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            reachable = result != null && result == 1;
        } catch (Exception e) {
            log.error("Database health check failed: {}", e.getMessage());
            reachable = false;
        }
        healthMetrics.recordDatabaseCheck(reachable);
        return reachable;
    }

    private String lokiStatus() {
        LokiLogShipper shipper = lokiLogShipper.getIfAvailable();
        if (shipper == null) {
            return "disabled";
        }
        return shipper.getState() == ShipperState.RUNNING ? "running" : "stopped";
    }
}
