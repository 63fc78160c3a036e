package dev.leaddispatch.service;

import dev.leaddispatch.config.LookupConfig;
import dev.leaddispatch.entity.CachedQuery;
import dev.leaddispatch.repository.CachedQueryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Memoizes lookup responses by query fingerprint. Expired entries are treated
 * as absent and only removed by the maintenance sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LookupCacheService {

    private final CachedQueryRepository cachedQueryRepository;
    private final LookupConfig lookupConfig;
    private final Clock clock;

    /**
     * Fingerprint of a (city, query) pair: MD5 over the case-folded, trimmed values.
     */
    public String fingerprint(String city, String query) {
        String key = normalize(city) + ":" + normalize(query);
        return DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Find the live payload for a fingerprint.
     */
    public Optional<String> findLive(String fingerprint) {
        LocalDateTime now = LocalDateTime.now(clock);
        return cachedQueryRepository.findByFingerprint(fingerprint)
                .filter(entry -> entry.isLiveAt(now))
                .map(CachedQuery::getResponseData);
    }

    /**
     * Store a successful response with a fresh TTL, replacing any previous entry
     * for the same fingerprint.
     */
    @Transactional
    public void store(String fingerprint, String queryParams, String responseData) {
        LocalDateTime now = LocalDateTime.now(clock);
        CachedQuery entry = cachedQueryRepository.findByFingerprint(fingerprint)
                .orElseGet(() -> CachedQuery.builder().fingerprint(fingerprint).build());

        entry.setQueryParams(queryParams);
        entry.setResponseData(responseData);
        entry.setCreatedAt(now);
        entry.setExpiresAt(now.plus(lookupConfig.getCacheTtl()));

        cachedQueryRepository.save(entry);
        log.debug("Cached lookup {} until {}", fingerprint, entry.getExpiresAt());
    }

    private String normalize(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }
}
