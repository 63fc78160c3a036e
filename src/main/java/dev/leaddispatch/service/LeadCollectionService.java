package dev.leaddispatch.service;

import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.exception.InvalidInputException;
import dev.leaddispatch.lookup.NominatimPlace;
import dev.leaddispatch.metrics.DispatchMetrics;
import dev.leaddispatch.model.BatchSummary;
import dev.leaddispatch.model.GeoPoint;
import dev.leaddispatch.model.LeadStatus;
import dev.leaddispatch.model.LookupResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns lookup results into stored leads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadCollectionService {

    static final int MAX_CITY_LENGTH = 100;
    static final int MAX_SERVICE_LENGTH = 100;
    static final String SOURCE = "nominatim";
    private static final String COMPONENT = "collect";

    private final LookupService lookupService;
    private final LeadService leadService;
    private final InputValidator validator;
    private final DispatchMetrics metrics;
    private final AuditLogService auditLogService;

    /**
     * Collection outcome. {@code lookupResult} tells whether the candidates
     * came from the cache or whether the lookup failed.
     */
    public record CollectionReport(String city, String service, BatchSummary summary, LookupResult lookupResult) {

        public boolean lookupFailed() {
            return lookupResult.isFailure();
        }
    }

    public CollectionReport collect(String city, String service, int limit) {
        String cleanCity = validator.sanitize(city, MAX_CITY_LENGTH);
        String cleanService = validator.sanitize(service, MAX_SERVICE_LENGTH);
        if (cleanCity.isEmpty() || cleanService.isEmpty()) {
            throw new InvalidInputException("City and service are required");
        }

        log.info("Collecting '{}' leads in '{}' (limit {})", cleanService, cleanCity, limit);
        LookupResult result = lookupService.search(cleanCity, cleanService, limit);
        if (result.isFailure()) {
            log.warn("No leads collected for '{}' in '{}': {}", cleanService, cleanCity, result.failureMessage());
            return new CollectionReport(cleanCity, cleanService, BatchSummary.EMPTY, result);
        }

        int stored = 0;
        int duplicates = 0;
        int errors = 0;

        for (NominatimPlace place : result.places()) {
            Optional<Lead> candidate = toLead(place, cleanService);
            if (candidate.isEmpty()) {
                errors++;
                continue;
            }
            try {
                switch (leadService.register(candidate.get())) {
                    case CREATED -> stored++;
                    case DUPLICATE -> duplicates++;
                }
            } catch (DataAccessException e) {
                errors++;
                log.warn("Failed to store lead '{}': {}", candidate.get().getName(), e.getMessage());
            }
        }

        BatchSummary summary = new BatchSummary(stored, duplicates, errors);
        metrics.recordLeadsCollected(stored);
        metrics.recordLeadsDuplicate(duplicates);
        log.info("Collect '{}' in '{}': {}", cleanService, cleanCity, summary.describe());
        auditLogService.info(COMPONENT, "Collected " + cleanService + " in " + cleanCity + ": " + summary.describe());
        return new CollectionReport(cleanCity, cleanService, summary, result);
    }

    /**
     * Map one candidate to a lead. Candidates without a usable location are
     * rejected; bad contact details are cleared.
     */
    Optional<Lead> toLead(NominatimPlace place, String service) {
        String displayName = stripHtml(place.getDisplayName());
        String rawName = displayName.isBlank() ? "Unknown" : displayName;

        InputValidator.SanitizedContact contact = validator.sanitizeContact(
                rawName,
                place.tag("phone", "contact:phone").orElse(null),
                place.tag("email", "contact:email").orElse(null),
                place.getLat(),
                place.getLon());

        if (contact.location().isEmpty()) {
            log.debug("Skipping '{}': no usable coordinates ({}, {})", rawName, place.getLat(), place.getLon());
            return Optional.empty();
        }
        if (!contact.downgradedFields().isEmpty()) {
            log.debug("Lead '{}' stored with cleared fields {}", contact.name(), contact.downgradedFields());
        }

        GeoPoint location = contact.location().get();
        return Optional.of(Lead.builder()
                .name(contact.name())
                .category(service)
                .address(validator.sanitize(displayName, InputValidator.MAX_ADDRESS_LENGTH))
                .latitude(location.latitude())
                .longitude(location.longitude())
                .phone(emptyToNull(contact.phone()))
                .email(emptyToNull(contact.email()))
                .source(SOURCE)
                .status(LeadStatus.NEW)
                .build());
    }

    private String stripHtml(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return Jsoup.parse(text).text();
    }

    private String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
