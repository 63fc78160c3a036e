package dev.leaddispatch.model;

import dev.leaddispatch.entity.Worker;

/**
 * The worker selected for a lead.
 *
 * @param distanceKm    haversine distance, or the penalty distance when unknown
 * @param distanceKnown false when the penalty distance was substituted
 * @param score         ranking value, lower is better
 */
public record WorkerMatch(Worker worker, double distanceKm, boolean distanceKnown, double score) {
}
