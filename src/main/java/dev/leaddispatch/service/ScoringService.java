package dev.leaddispatch.service;

import dev.leaddispatch.config.MatchingConfig;
import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.entity.Worker;
import dev.leaddispatch.geo.GeoDistance;
import dev.leaddispatch.model.WorkerMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Ranks workers against a lead. Score is distance minus a rating bonus;
 * lower is better.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringService {

    private final MatchingConfig matchingConfig;

    /**
     * Score one worker. An unknown location on either side substitutes the
     * penalty distance.
     */
    public WorkerMatch score(Lead lead, Worker worker) {
        OptionalDouble distance = GeoDistance.distanceKm(lead.getLocation(), worker.getLocation());
        double distanceKm = distance.orElse(matchingConfig.getUnknownDistancePenaltyKm());
        double score = distanceKm - matchingConfig.getRatingWeight() * worker.getRating();
        return new WorkerMatch(worker, distanceKm, distance.isPresent(), score);
    }

    /**
     * Pick the lowest score among {@code candidates}. On exact ties the
     * earlier candidate wins, so the caller's ordering is the tie-break.
     */
    public Optional<WorkerMatch> selectBest(Lead lead, List<Worker> candidates) {
        WorkerMatch best = null;
        for (Worker worker : candidates) {
            WorkerMatch match = score(lead, worker);
            log.debug("Lead {} vs worker {}: {} km, score {}", lead.getId(), worker.getId(),
                    String.format("%.2f", match.distanceKm()), String.format("%.2f", match.score()));
            if (best == null || match.score() < best.score()) {
                best = match;
            }
        }
        return Optional.ofNullable(best);
    }
}
