package dev.leaddispatch.channel;

import reactor.core.publisher.Mono;

/**
 * Outbound chat channel. Implementations are selected by
 * {@code outreach.chat.provider}.
 */
public interface ChatGateway {

    /**
     * Deliver a text message to a phone number.
     *
     * @return Mono emitting true when the provider accepted the message
     */
    Mono<Boolean> send(String phone, String text);

    /**
     * Whether a real provider is configured. When false, messages are kept
     * as pending instead of being sent.
     */
    boolean isEnabled();
}
