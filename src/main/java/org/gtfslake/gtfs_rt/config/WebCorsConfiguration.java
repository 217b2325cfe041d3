package org.gtfslake.gtfs_rt.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Opens the feed endpoints to cross-origin GET requests when {@code app.cors_enabled} is set.
 *
 * @since 1.0
 */
@Configuration
public class WebCorsConfiguration implements WebMvcConfigurer {

    private final AppProperties appProperties;

    public WebCorsConfiguration(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (!appProperties.isCorsEnabled()) {
            return;
        }
        registry.addMapping("/**")
            .allowedOriginPatterns("*")
            .allowCredentials(true)
            .allowedMethods("GET")
            .allowedHeaders("*");
    }
}
