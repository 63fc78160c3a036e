package dev.leaddispatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.leaddispatch.exception.LookupTimeoutException;
import dev.leaddispatch.lookup.NominatimClient;
import dev.leaddispatch.lookup.NominatimPlace;
import dev.leaddispatch.metrics.DispatchMetrics;
import dev.leaddispatch.model.LookupFailure;
import dev.leaddispatch.model.LookupResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Optional;

/**
 * Cached, rate-limited search against the lookup provider.
 * Cache hits never touch the rate gate. Failed calls are reported as a
 * tagged {@link LookupResult} and never cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LookupService {

    private static final String COMPONENT = "lookup";
    private static final TypeReference<List<NominatimPlace>> PLACES = new TypeReference<>() {
    };

    private final NominatimClient nominatimClient;
    private final LookupCacheService cacheService;
    private final RateGate rateGate;
    private final ObjectMapper objectMapper;
    private final DispatchMetrics metrics;
    private final AuditLogService auditLogService;

    public LookupResult search(String city, String query, int limit) {
        String fingerprint = cacheService.fingerprint(city, query);

        Optional<String> cached = cacheService.findLive(fingerprint);
        if (cached.isPresent()) {
            Optional<List<NominatimPlace>> places = parse(cached.get());
            if (places.isPresent()) {
                log.info("Cache hit for '{}' in '{}' ({} results)", query, city, places.get().size());
                metrics.recordCacheHit();
                return LookupResult.cached(places.get());
            }
            log.warn("Cached payload for '{}' in '{}' is unreadable, refetching", query, city);
        }

        rateGate.acquire();
        metrics.recordLookupCall();

        String body;
        try {
            body = nominatimClient.search(city, query, limit).block();
        } catch (LookupTimeoutException e) {
            return failure(LookupFailure.TIMEOUT, e.getMessage());
        } catch (WebClientResponseException e) {
            return failure(LookupFailure.HTTP_ERROR, "HTTP " + e.getStatusCode().value() + " from lookup provider");
        } catch (RuntimeException e) {
            return failure(LookupFailure.TRANSPORT, e.getMessage());
        }

        Optional<List<NominatimPlace>> places = body == null ? Optional.empty() : parse(body);
        if (places.isEmpty()) {
            return failure(LookupFailure.MALFORMED_RESPONSE, "Lookup provider returned an unreadable body");
        }

        cacheService.store(fingerprint, city + "|" + query + "|" + limit, body);
        log.info("Fetched {} results for '{}' in '{}'", places.get().size(), query, city);
        return LookupResult.fetched(places.get());
    }

    private LookupResult failure(LookupFailure failure, String message) {
        log.warn("Lookup failed ({}): {}", failure, message);
        metrics.recordLookupError(failure);
        auditLogService.warn(COMPONENT, "Lookup failed (" + failure + "): " + message);
        return LookupResult.failed(failure, message);
    }

    private Optional<List<NominatimPlace>> parse(String body) {
        try {
            List<NominatimPlace> places = objectMapper.readValue(body, PLACES);
            return Optional.ofNullable(places);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable lookup payload: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
