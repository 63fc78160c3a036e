package dev.leaddispatch.service;

import dev.leaddispatch.entity.Job;
import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.entity.Worker;
import dev.leaddispatch.exception.InvalidInputException;
import dev.leaddispatch.exception.RecordNotFoundException;
import dev.leaddispatch.model.JobStatus;
import dev.leaddispatch.repository.JobRepository;
import dev.leaddispatch.repository.LeadRepository;
import dev.leaddispatch.repository.WorkerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Owns job rows: creation together with the lead transition, listing and
 * status changes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLedgerService {

    private final JobRepository jobRepository;
    private final LeadRepository leadRepository;
    private final WorkerRepository workerRepository;
    private final Clock clock;

    /**
     * Insert a dispatched job and move its lead to contacted in one
     * transaction. Any failure rolls back both writes.
     *
     * @throws RecordNotFoundException if the lead or worker does not exist
     */
    @Transactional
    public Job createJob(Long leadId, Long workerId, String service, double price) {
        Lead lead = leadRepository.findById(leadId).orElseThrow(() -> RecordNotFoundException.lead(leadId));
        Worker worker = workerRepository.findById(workerId).orElseThrow(() -> RecordNotFoundException.worker(workerId));

        LocalDateTime now = LocalDateTime.now(clock);
        Job job = jobRepository.save(Job.builder()
                .lead(lead)
                .worker(worker)
                .service(service)
                .price(price)
                .status(JobStatus.DISPATCHED)
                .createdAt(now)
                .build());

        lead.markContacted(now);
        leadRepository.saveAndFlush(lead);

        log.debug("Job {} created: lead {} -> worker {}", job.getId(), leadId, workerId);
        return job;
    }

    /**
     * Most recent jobs first, optionally filtered by status.
     */
    @Transactional(readOnly = true)
    public List<Job> listJobs(JobStatus status, int limit) {
        Pageable page = PageRequest.of(0, Math.max(1, limit));
        return status == null
                ? jobRepository.findAllByOrderByIdDesc(page)
                : jobRepository.findByStatusOrderByIdDesc(status, page);
    }

    /**
     * Move a job along its lifecycle. Completing a job credits the worker
     * and folds the optional rating into the worker's average.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    @Transactional
    public Job advanceStatus(Long jobId, JobStatus target, Double rating) {
        Job job = jobRepository.findById(jobId).orElseThrow(() -> RecordNotFoundException.job(jobId));
        if (!job.getStatus().canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Job " + jobId + " cannot move from " + job.getStatus() + " to " + target);
        }
        if (rating != null && (rating < 0 || rating > 5)) {
            throw new InvalidInputException("Rating must be between 0 and 5");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        job.setStatus(target);
        job.setUpdatedAt(now);

        if (target == JobStatus.COMPLETE) {
            job.setCompletedAt(now);
            Worker worker = job.getWorker();
            worker.recordCompletion(rating, now);
            workerRepository.save(worker);
        }

        Job saved = jobRepository.save(job);
        log.info("Job {} -> {}", jobId, target);
        return saved;
    }
}
