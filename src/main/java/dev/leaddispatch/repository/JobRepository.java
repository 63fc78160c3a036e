package dev.leaddispatch.repository;

import dev.leaddispatch.entity.Job;
import dev.leaddispatch.model.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for dispatch jobs. Lead and worker are fetched with the job.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    interface StatusCount {
        JobStatus getStatus();

        Long getTotal();
    }

    List<Job> findByStatusOrderByIdDesc(JobStatus status, Pageable pageable);

    List<Job> findAllByOrderByIdDesc(Pageable pageable);

    List<Job> findAllByOrderByIdAsc();

    List<Job> findByLeadId(Long leadId);

    @Query("SELECT COALESCE(SUM(j.price), 0) FROM Job j")
    Double totalRevenue();

    @Query("SELECT j.status AS status, COUNT(j) AS total FROM Job j GROUP BY j.status")
    List<StatusCount> countByStatusGrouped();
}
