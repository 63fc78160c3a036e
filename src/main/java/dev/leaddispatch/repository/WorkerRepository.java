package dev.leaddispatch.repository;

import dev.leaddispatch.entity.Worker;
import dev.leaddispatch.model.WorkerStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkerRepository extends JpaRepository<Worker, Long> {

    boolean existsByPhone(String phone);

    /**
     * Candidate order for matching: rating desc, completed jobs desc, then id.
     */
    List<Worker> findByStatusOrderByRatingDescCompletedJobsDescIdAsc(WorkerStatus status);

    List<Worker> findByStatusOrderByCompletedJobsDescIdDesc(WorkerStatus status, Pageable pageable);

    List<Worker> findAllByOrderByIdAsc();

    long countByStatus(WorkerStatus status);

    @Query("SELECT AVG(w.rating) FROM Worker w")
    Double averageRating();

    @Query("SELECT COALESCE(SUM(w.completedJobs), 0) FROM Worker w")
    Long totalCompletedJobs();
}
