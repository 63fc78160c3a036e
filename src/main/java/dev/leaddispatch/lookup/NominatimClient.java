package dev.leaddispatch.lookup;

import dev.leaddispatch.config.LookupConfig;
import dev.leaddispatch.exception.LookupTimeoutException;
import dev.leaddispatch.metrics.DispatchMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * WebClient for the OpenStreetMap Nominatim search endpoint. Returns the raw
 * JSON body so it can be cached verbatim.
 */
@Slf4j
@Component
public class NominatimClient {

    static final String SEARCH_PATH = "/search";
    static final int PROVIDER_MAX_LIMIT = 50;

    private final WebClient webClient;
    private final DispatchMetrics metrics;
    private final Duration timeout;

    public NominatimClient(WebClient.Builder webClientBuilder, LookupConfig lookupConfig, DispatchMetrics metrics) {
        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .baseUrl(lookupConfig.getBaseUrl())
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", lookupConfig.getUserAgent())
                .defaultHeader("Accept", "application/json")
                .build();
        this.metrics = metrics;
        this.timeout = lookupConfig.getTimeout();
    }

    /**
     * Search for places matching {@code "query, city"}.
     *
     * @param limit requested result count, capped at the provider maximum
     * @return the response body; errors with {@link LookupTimeoutException} on timeout
     *         and with the WebClient exception on HTTP or transport failure
     */
    @SuppressWarnings("null")
    public Mono<String> search(String city, String query, int limit) {
        int cappedLimit = Math.max(1, Math.min(limit, PROVIDER_MAX_LIMIT));
        long start = System.currentTimeMillis();

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(SEARCH_PATH)
                        .queryParam("q", query + ", " + city)
                        .queryParam("format", "jsonv2")
                        .queryParam("limit", cappedLimit)
                        .queryParam("addressdetails", 1)
                        .queryParam("extratags", 1)
                        .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new LookupTimeoutException(timeout, e))
                .doOnSubscribe(s -> log.debug("Nominatim search: '{}' in '{}' (limit {})", query, city, cappedLimit))
                .doOnTerminate(() -> metrics.recordLookupLatency(
                        Duration.ofMillis(System.currentTimeMillis() - start)));
    }
}
