package dev.leaddispatch.model;

import java.util.List;

/**
 * Per-lead outcomes of a {@code match} batch.
 */
public record MatchReport(String service, List<LeadOutcome> outcomes) {

    public enum Status {
        MATCHED,
        NO_WORKER,
        DISPATCH_FAILED
    }

    public record LeadOutcome(
            Long leadId,
            String leadName,
            Status status,
            Long workerId,
            String workerName,
            Double distanceKm,
            Long jobId,
            String reason) {
    }

    public int jobsCreated() {
        return count(Status.MATCHED);
    }

    public int count(Status status) {
        return (int) outcomes.stream().filter(o -> o.status() == status).count();
    }

    public BatchSummary toSummary() {
        return new BatchSummary(count(Status.MATCHED), 0, count(Status.NO_WORKER) + count(Status.DISPATCH_FAILED));
    }
}
