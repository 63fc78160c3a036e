package dev.leaddispatch.channel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.leaddispatch.config.OutreachConfig;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;

/**
 * Posts chat messages as JSON to an HTTP webhook (a messaging bridge or
 * business-API relay). Any 2xx response counts as delivered.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "outreach.chat.provider", havingValue = "webhook")
public class WebhookChatGateway implements ChatGateway {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final WebClient webClient;
    private final String webhookUrl;

    public WebhookChatGateway(WebClient.Builder webClientBuilder, OutreachConfig outreachConfig) {
        OutreachConfig.Chat chat = outreachConfig.getChat();
        this.webhookUrl = chat.getWebhookUrl();

        WebClient.Builder builder = webClientBuilder
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (chat.getToken() != null && !chat.getToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + chat.getToken());
        }
        this.webClient = builder.build();

        if (isEnabled()) {
            log.info("Chat webhook enabled: {}", webhookUrl);
        } else {
            log.warn("Chat provider is 'webhook' but no webhook URL is set - chat messages stay pending");
        }
    }

    @Override
    @SuppressWarnings("null")
    public Mono<Boolean> send(String phone, String text) {
        if (!isEnabled()) {
            return Mono.just(false);
        }
        return webClient.post()
                .uri(Objects.requireNonNull(webhookUrl))
                .bodyValue(new ChatPayload(phone, text))
                .retrieve()
                .toBodilessEntity()
                .timeout(TIMEOUT)
                .map(response -> response.getStatusCode().is2xxSuccessful())
                .doOnNext(ok -> log.debug("Webhook delivery to {}: {}", phone, ok))
                .onErrorResume(e -> {
                    log.error("Chat webhook failed for {}: {}", phone, e.getMessage());
                    return Mono.just(false);
                });
    }

    @Override
    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatPayload {
        private String to;
        private String text;
    }
}
