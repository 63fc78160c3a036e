package dev.leaddispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the external lookup provider, its rate gate and cache.
 * Loaded from application.yml under 'lookup' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "lookup")
public class LookupConfig {

    private String baseUrl = "https://nominatim.openstreetmap.org";
    private String userAgent = "LeadDispatch/1.0";
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * Minimum spacing between two calls to the provider, shared by all queries.
     */
    private Duration minSpacing = Duration.ofMillis(1200);

    private Duration cacheTtl = Duration.ofHours(24);
    private Duration cacheRetention = Duration.ofDays(30);
    private int maxResults = 50;
}
