package dev.leaddispatch.channel;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Used when no chat provider is configured. Never delivers anything.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "outreach.chat.provider", havingValue = "none", matchIfMissing = true)
public class NoOpChatGateway implements ChatGateway {

    public NoOpChatGateway() {
        log.debug("Chat provider disabled - chat messages stay pending");
    }

    @Override
    public Mono<Boolean> send(String phone, String text) {
        return Mono.just(false);
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
