package dev.leaddispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for worker scoring and batch matching.
 * Loaded from application.yml under 'matching' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig {

    /**
     * Distance used when either side has no known location.
     */
    private double unknownDistancePenaltyKm = 999.0;

    /**
     * Kilometers subtracted from the score per rating point.
     */
    private double ratingWeight = 2.0;

    private int defaultBatchSize = 50;
    private double defaultPrice = 0.0;
}
