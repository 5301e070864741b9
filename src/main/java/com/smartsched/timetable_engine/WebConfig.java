package com.smartsched.timetable_engine;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the orchestration front end, origins driven by {@code cors.allowed-origins}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("#{'${cors.allowed-origins:http://localhost:3000,http://127.0.0.1:3000}'.split(',')}")
    private List<String> allowedOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(allowedOrigins.toArray(new String[0]))
                .allowedMethods("GET", "POST", "PUT", "OPTIONS")
                .allowedHeaders("Cache-Control", "Content-Type", "Accept")
                .allowCredentials(true);
    }
}
