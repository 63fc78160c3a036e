package dev.leaddispatch.entity;

import dev.leaddispatch.model.GeoPoint;
import dev.leaddispatch.model.WorkerStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * A field operative. Identified by phone number; skills are a lower-cased,
 * comma-joined keyword list.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "workers", indexes = {
        @Index(name = "idx_workers_skills", columnList = "skills")
})
public class Worker {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 500)
    private String name;

    @Column(nullable = false, length = 500)
    private String skills;

    @Column(unique = true, length = 20)
    private String phone;

    @Column(length = 100)
    private String email;

    @Column(name = "lat")
    private Double latitude;

    @Column(name = "lon")
    private Double longitude;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkerStatus status = WorkerStatus.ACTIVE;

    @Builder.Default
    @Column(nullable = false)
    private double rating = 0.0;

    @Builder.Default
    @Column(name = "jobs_completed", nullable = false)
    private int completedJobs = 0;

    private String note;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public Optional<GeoPoint> getLocation() {
        return GeoPoint.of(latitude, longitude);
    }

    public boolean isActive() {
        return status == WorkerStatus.ACTIVE;
    }

    /**
     * Case-insensitive substring match of a service keyword against the skill list.
     */
    public boolean hasSkill(String service) {
        if (skills == null || service == null || service.isBlank()) {
            return false;
        }
        return skills.toLowerCase(Locale.ROOT).contains(service.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Fold a finished job into the worker's counters. A supplied rating is
     * averaged over all completed jobs.
     */
    public void recordCompletion(Double jobRating, LocalDateTime now) {
        this.completedJobs++;
        if (jobRating != null) {
            this.rating = ((rating * (completedJobs - 1)) + jobRating) / completedJobs;
        }
        this.updatedAt = now;
    }
}
