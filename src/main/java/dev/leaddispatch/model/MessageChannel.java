package dev.leaddispatch.model;

import java.util.Locale;

/**
 * Outbound outreach channel.
 */
public enum MessageChannel {
    CHAT,
    EMAIL;

    /**
     * Name of the template file used for this channel.
     */
    public String templateName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
