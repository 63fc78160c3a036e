package dev.leaddispatch.service;

import dev.leaddispatch.config.LookupConfig;
import dev.leaddispatch.repository.CachedQueryRepository;
import dev.leaddispatch.repository.LeadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Store housekeeping: removes unusable and duplicate leads and stale cache
 * rows, then compacts the database file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MaintenanceService {

    private static final String COMPONENT = "cleanup";

    private final LeadRepository leadRepository;
    private final CachedQueryRepository cachedQueryRepository;
    private final LookupConfig lookupConfig;
    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public record CleanupReport(int degenerateLeads, int duplicateLeads, int expiredCacheEntries) {

        public int leadsRemoved() {
            return degenerateLeads + duplicateLeads;
        }
    }

    /**
     * Leads referenced by jobs or messages are never removed.
     */
    public CleanupReport cleanup() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(lookupConfig.getCacheRetention());

        CleanupReport report = transactionTemplate.execute(status -> new CleanupReport(
                leadRepository.deleteDegenerate(),
                leadRepository.deleteDuplicates(),
                cachedQueryRepository.deleteCreatedBefore(cutoff)));

        vacuum();

        log.info("Cleanup complete: {} invalid leads, {} duplicates, {} old cache entries",
                report.degenerateLeads(), report.duplicateLeads(), report.expiredCacheEntries());
        auditLogService.info(COMPONENT, "Removed " + report.leadsRemoved() + " entries");
        return report;
    }

    private void vacuum() {
        try {
            jdbcTemplate.execute("VACUUM");
        } catch (DataAccessException e) {
            log.warn("VACUUM skipped: {}", e.getMessage());
        }
    }
}
