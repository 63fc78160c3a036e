package dev.leaddispatch.repository;

import dev.leaddispatch.entity.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Write-only sink for the audit table.
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
}
