package dev.leaddispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for chat and email outreach.
 * Loaded from application.yml under 'outreach' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "outreach")
public class OutreachConfig {

    private String defaultSender = "Team";
    private String senderPhone = "";
    private String emailFrom = "";
    private Chat chat = new Chat();

    @Data
    public static class Chat {
        /**
         * "none" keeps chat messages pending, "webhook" posts them to {@link #webhookUrl}.
         */
        private String provider = "none";
        private String webhookUrl = "";
        private String token = "";
    }
}
