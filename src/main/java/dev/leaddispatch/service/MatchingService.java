package dev.leaddispatch.service;

import dev.leaddispatch.config.MatchingConfig;
import dev.leaddispatch.entity.Job;
import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.entity.Worker;
import dev.leaddispatch.exception.RecordNotFoundException;
import dev.leaddispatch.metrics.DispatchMetrics;
import dev.leaddispatch.model.JobCreationResult;
import dev.leaddispatch.model.LeadStatus;
import dev.leaddispatch.model.MatchReport;
import dev.leaddispatch.model.MatchReport.LeadOutcome;
import dev.leaddispatch.model.WorkerMatch;
import dev.leaddispatch.model.WorkerStatus;
import dev.leaddispatch.repository.LeadRepository;
import dev.leaddispatch.repository.WorkerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Matching engine: selects the best worker for a lead and dispatches jobs.
 * <p>
 * Allocation is greedy. A worker chosen for one lead stays eligible for the
 * next; there is no capacity limit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingService {

    private static final String COMPONENT = "matching";

    private final LeadRepository leadRepository;
    private final WorkerRepository workerRepository;
    private final ScoringService scoringService;
    private final JobLedgerService jobLedgerService;
    private final MatchingConfig matchingConfig;
    private final DispatchMetrics metrics;
    private final AuditLogService auditLogService;

    /**
     * Best active worker whose skills contain {@code service}.
     * Empty when no worker is eligible.
     *
     * @throws RecordNotFoundException if the lead does not exist
     */
    public Optional<WorkerMatch> findBestWorker(Long leadId, String service) {
        Lead lead = leadRepository.findById(leadId).orElseThrow(() -> RecordNotFoundException.lead(leadId));
        return findBestWorker(lead, service);
    }

    Optional<WorkerMatch> findBestWorker(Lead lead, String service) {
        List<Worker> eligible = workerRepository.findByStatusOrderByRatingDescCompletedJobsDescIdAsc(WorkerStatus.ACTIVE)
                .stream()
                .filter(worker -> worker.hasSkill(service))
                .toList();

        if (eligible.isEmpty()) {
            log.debug("No active worker with skill '{}'", service);
            return Optional.empty();
        }
        return scoringService.selectBest(lead, eligible);
    }

    /**
     * Create a dispatched job and transition the lead, as one unit.
     */
    public JobCreationResult createJob(Long leadId, Long workerId, String service, double price) {
        try {
            Job job = jobLedgerService.createJob(leadId, workerId, service, price);
            metrics.recordJobCreated();
            return JobCreationResult.created(job.getId());
        } catch (RecordNotFoundException e) {
            log.warn("Job not created: {}", e.getMessage());
            return JobCreationResult.notFound(e.getMessage());
        } catch (DataAccessException | TransactionException e) {
            log.error("Job creation failed for lead {} / worker {}: {}", leadId, workerId, e.getMessage());
            metrics.recordDispatchFailure();
            auditLogService.error(COMPONENT, "Job creation failed for lead " + leadId + ": " + e.getMessage());
            return JobCreationResult.failed(e.getMessage());
        }
    }

    public JobCreationResult createJob(Long leadId, Long workerId, String service) {
        return createJob(leadId, workerId, service, matchingConfig.getDefaultPrice());
    }

    /**
     * Match up to {@code maxMatches} new leads of the given service, in id
     * order. Each lead's outcome is reported; failures do not stop the batch.
     */
    public MatchReport matchAllLeads(String service, int maxMatches) {
        if (maxMatches <= 0) {
            log.info("Batch size {} leaves nothing to match for '{}'", maxMatches, service);
            metrics.updateLastMatchStats(0, 0);
            return new MatchReport(service, List.of());
        }

        List<Lead> leads = leadRepository.findByStatusAndCategoryContainingIgnoreCaseOrderByIdAsc(
                LeadStatus.NEW, service, PageRequest.of(0, maxMatches));

        if (leads.isEmpty()) {
            log.info("No new leads found for service '{}'", service);
            metrics.updateLastMatchStats(0, 0);
            return new MatchReport(service, List.of());
        }

        log.info("Matching {} leads for '{}'", leads.size(), service);
        List<LeadOutcome> outcomes = new ArrayList<>();

        for (Lead lead : leads) {
            outcomes.add(matchLead(lead, service));
        }

        MatchReport report = new MatchReport(service, outcomes);
        metrics.updateLastMatchStats(leads.size(), report.jobsCreated());
        log.info("Match '{}': {}", service, report.toSummary().describe());
        auditLogService.info(COMPONENT, "Matched " + report.jobsCreated() + " of " + leads.size()
                + " leads for " + service);
        return report;
    }

    private LeadOutcome matchLead(Lead lead, String service) {
        Optional<WorkerMatch> match;
        try {
            match = findBestWorker(lead, service);
        } catch (DataAccessException e) {
            log.warn("Worker lookup failed for lead {}: {}", lead.getId(), e.getMessage());
            metrics.recordDispatchFailure();
            return new LeadOutcome(lead.getId(), lead.getName(), MatchReport.Status.DISPATCH_FAILED,
                    null, null, null, null, e.getMessage());
        }

        if (match.isEmpty()) {
            log.warn("No worker found for {}", lead.getName());
            metrics.recordMatchMiss();
            return new LeadOutcome(lead.getId(), lead.getName(), MatchReport.Status.NO_WORKER,
                    null, null, null, null, "No eligible worker");
        }

        WorkerMatch best = match.get();
        Worker worker = best.worker();
        JobCreationResult result = createJob(lead.getId(), worker.getId(), service);
        if (!result.isCreated()) {
            return new LeadOutcome(lead.getId(), lead.getName(), MatchReport.Status.DISPATCH_FAILED,
                    worker.getId(), worker.getName(), best.distanceKm(), null, result.reason());
        }

        log.info("Matched {} -> {} ({} km)", lead.getName(), worker.getName(),
                best.distanceKnown() ? String.format("%.1f", best.distanceKm()) : "unknown");
        return new LeadOutcome(lead.getId(), lead.getName(), MatchReport.Status.MATCHED,
                worker.getId(), worker.getName(), best.distanceKm(), result.jobId(), null);
    }
}
