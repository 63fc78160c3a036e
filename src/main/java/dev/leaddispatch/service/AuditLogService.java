package dev.leaddispatch.service;

import dev.leaddispatch.entity.AuditLog;
import dev.leaddispatch.model.AuditLevel;
import dev.leaddispatch.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Appends operational events to the audit table. The audit table is a
 * write-only sink: a failed write is logged and never propagated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogService {

    private static final int MAX_MESSAGE_LENGTH = 1000;

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public void info(String component, String message) {
        record(AuditLevel.INFO, component, message, null);
    }

    public void warn(String component, String message) {
        record(AuditLevel.WARN, component, message, null);
    }

    public void error(String component, String message) {
        record(AuditLevel.ERROR, component, message, null);
    }

    public void record(AuditLevel level, String component, String message, String details) {
        try {
            auditLogRepository.save(AuditLog.builder()
                    .level(level)
                    .component(component)
                    .message(truncate(message))
                    .details(details)
                    .createdAt(LocalDateTime.now(clock))
                    .build());
        } catch (DataAccessException e) {
            log.warn("Audit log write failed ({} {}): {}", level, component, e.getMessage());
        }
    }

    private String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) : message;
    }
}
