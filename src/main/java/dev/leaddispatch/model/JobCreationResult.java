package dev.leaddispatch.model;

/**
 * Outcome of creating a job for a lead. Not-found is reported separately from
 * other failures so callers can branch on it.
 */
public record JobCreationResult(Outcome outcome, Long jobId, String reason) {

    public enum Outcome {
        CREATED,
        NOT_FOUND,
        FAILED
    }

    public static JobCreationResult created(Long jobId) {
        return new JobCreationResult(Outcome.CREATED, jobId, null);
    }

    public static JobCreationResult notFound(String reason) {
        return new JobCreationResult(Outcome.NOT_FOUND, null, reason);
    }

    public static JobCreationResult failed(String reason) {
        return new JobCreationResult(Outcome.FAILED, null, reason);
    }

    public boolean isCreated() {
        return outcome == Outcome.CREATED;
    }
}
