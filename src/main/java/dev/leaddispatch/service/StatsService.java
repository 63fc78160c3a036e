package dev.leaddispatch.service;

import dev.leaddispatch.model.JobStatus;
import dev.leaddispatch.model.LeadStatus;
import dev.leaddispatch.model.MessageChannel;
import dev.leaddispatch.model.WorkerStatus;
import dev.leaddispatch.repository.JobRepository;
import dev.leaddispatch.repository.LeadRepository;
import dev.leaddispatch.repository.MessageRepository;
import dev.leaddispatch.repository.WorkerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate counts across leads, workers, jobs and messages.
 */
@Service
@RequiredArgsConstructor
public class StatsService {

    private final LeadRepository leadRepository;
    private final WorkerRepository workerRepository;
    private final JobRepository jobRepository;
    private final MessageRepository messageRepository;

    public record DispatchStats(
            long totalLeads,
            long leadCategories,
            Map<LeadStatus, Long> leadsByStatus,
            long activeWorkers,
            double averageRating,
            long completedJobs,
            long totalJobs,
            double totalRevenue,
            Map<JobStatus, Long> jobsByStatus,
            Map<MessageChannel, Long> messagesByChannel) {
    }

    @Transactional(readOnly = true)
    public DispatchStats collect() {
        Map<LeadStatus, Long> leadsByStatus = new EnumMap<>(LeadStatus.class);
        leadRepository.countByStatusGrouped().forEach(c -> leadsByStatus.put(c.getStatus(), c.getTotal()));

        Map<JobStatus, Long> jobsByStatus = new EnumMap<>(JobStatus.class);
        jobRepository.countByStatusGrouped().forEach(c -> jobsByStatus.put(c.getStatus(), c.getTotal()));

        Map<MessageChannel, Long> messagesByChannel = new EnumMap<>(MessageChannel.class);
        messageRepository.countByChannelGrouped().forEach(c -> messagesByChannel.put(c.getChannel(), c.getTotal()));

        Double averageRating = workerRepository.averageRating();
        Long completedJobs = workerRepository.totalCompletedJobs();
        Double revenue = jobRepository.totalRevenue();

        return new DispatchStats(
                leadRepository.count(),
                leadRepository.countCategories(),
                leadsByStatus,
                workerRepository.countByStatus(WorkerStatus.ACTIVE),
                averageRating == null ? 0.0 : averageRating,
                completedJobs == null ? 0L : completedJobs,
                jobRepository.count(),
                revenue == null ? 0.0 : revenue,
                jobsByStatus,
                messagesByChannel);
    }
}
