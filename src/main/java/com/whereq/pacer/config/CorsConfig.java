package com.whereq.pacer.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * CORS setup for the browser front end that submits and polls plans
 */
@Configuration
@RequiredArgsConstructor
public class CorsConfig implements WebFluxConfigurer {

    private final PacerProperties properties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
            .allowedOriginPatterns(properties.getCors().getAllowedOrigins().toArray(String[]::new))
            .allowedMethods("GET", "POST", "OPTIONS")
            .allowedHeaders("*")
            .exposedHeaders("Content-Disposition", "Location");
    }
}
