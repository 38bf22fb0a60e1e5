package com.produto.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Produto API: CRUD over PostgreSQL with application logs shipped to Grafana Loki
 * and metrics exposed via Spring Boot Actuator for Prometheus scraping.
 */
@SpringBootApplication
public class ProdutoApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProdutoApiApplication.class, args);
    }
}
