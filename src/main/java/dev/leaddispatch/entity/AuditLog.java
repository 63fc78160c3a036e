package dev.leaddispatch.entity;

import dev.leaddispatch.model.AuditLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only operational log row.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "system_logs")
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AuditLevel level;

    @Column(nullable = false)
    private String component;

    @Column(nullable = false)
    private String message;

    private String details;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
