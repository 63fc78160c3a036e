package dev.leaddispatch.service;

import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.exception.RecordNotFoundException;
import dev.leaddispatch.model.GeoPoint;
import dev.leaddispatch.repository.LeadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Stores and reads leads. A lead is identified by (name, latitude, longitude);
 * registering the same business twice leaves the first row untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadService {

    public enum RegisterOutcome {
        CREATED,
        DUPLICATE
    }

    private final LeadRepository leadRepository;
    private final Clock clock;

    /**
     * Insert a lead unless one with the same identity exists.
     * The lead's creation timestamp is set here.
     */
    public RegisterOutcome register(Lead lead) {
        Double lat = lead.getLocation().map(GeoPoint::latitude).orElse(null);
        Double lon = lead.getLocation().map(GeoPoint::longitude).orElse(null);
        lead.setLatitude(lat);
        lead.setLongitude(lon);

        if (leadRepository.existsByNameAndLatitudeAndLongitude(lead.getName(), lat, lon)) {
            log.debug("Lead '{}' already stored", lead.getName());
            return RegisterOutcome.DUPLICATE;
        }

        lead.setCreatedAt(LocalDateTime.now(clock));
        try {
            leadRepository.save(lead);
            return RegisterOutcome.CREATED;
        } catch (DataIntegrityViolationException e) {
            log.debug("Lead '{}' rejected by unique constraint", lead.getName());
            return RegisterOutcome.DUPLICATE;
        }
    }

    public List<Lead> listRecent(int limit) {
        return leadRepository.findAllByOrderByIdDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    public Lead get(Long id) {
        return leadRepository.findById(id).orElseThrow(() -> RecordNotFoundException.lead(id));
    }
}
