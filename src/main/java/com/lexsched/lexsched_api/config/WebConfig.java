package com.lexsched.lexsched_api.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Global CORS configuration with origins from {@code lexsched.cors.allowed-origins}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final SchedulerProperties properties;

    public WebConfig(SchedulerProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = properties.getCors().getAllowedOrigins().toArray(new String[0]);
        registry.addMapping("/api/**")
                .allowedOrigins(origins)
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("Cache-Control", "Content-Type", "Accept")
                .exposedHeaders("Content-Disposition");
        registry.addMapping("/")
                .allowedOrigins(origins)
                .allowedMethods("GET", "OPTIONS")
                .allowedHeaders("*");
    }
}
