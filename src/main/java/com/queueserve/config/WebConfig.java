package com.queueserve.config;

import com.queueserve.api.controller.OrderController;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the REST API. Ordering kiosks and the kitchen display are served from a
 * separate origin and identify the customer through {@value OrderController#CUSTOMER_HEADER}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${queueserve.cors.allowed-origin}")
    private String allowedOrigin;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(allowedOrigin)
                .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE")
                .allowedHeaders("Content-Type", OrderController.CUSTOMER_HEADER)
                .maxAge(3600);
    }
}
