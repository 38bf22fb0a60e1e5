package com.produto.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the browser front ends.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final String[] allowedOrigins;
    private final boolean allowCredentials;

    public WebConfig(@Value("${cors.allowed-origins:http://localhost:3000,http://localhost:8080}") String[] allowedOrigins,
                     @Value("${cors.allow-credentials:true}") boolean allowCredentials) {
        this.allowedOrigins = allowedOrigins;
        this.allowCredentials = allowCredentials;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
            .allowedOrigins(allowedOrigins)
            .allowCredentials(allowCredentials)
            .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS", "PATCH")
            .allowedHeaders("Content-Type", "Authorization", "Accept", "Origin", "X-Requested-With", "X-Request-ID")
            .exposedHeaders("X-Request-ID", "X-Process-Time");
    }
}
