package dev.leaddispatch.service;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvMalformedLineException;
import com.opencsv.exceptions.CsvValidationException;
import dev.leaddispatch.entity.Worker;
import dev.leaddispatch.exception.DispatchException;
import dev.leaddispatch.exception.DuplicateRecordException;
import dev.leaddispatch.exception.InvalidInputException;
import dev.leaddispatch.exception.RecordNotFoundException;
import dev.leaddispatch.model.BatchSummary;
import dev.leaddispatch.model.GeoPoint;
import dev.leaddispatch.model.WorkerStatus;
import dev.leaddispatch.repository.WorkerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Worker registration: bulk CSV import and single additions.
 * <p>
 * Import is lenient per row (bad contact details are cleared, bad rows are
 * counted and skipped). A single addition fails closed instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkerService {

    private static final String COMPONENT = "workers";

    private final WorkerRepository workerRepository;
    private final InputValidator validator;
    private final AuditLogService auditLogService;
    private final Clock clock;

    /**
     * Import workers from a header-aware CSV file with columns
     * {@code name} (or {@code full_name}), {@code skills}, {@code phone},
     * {@code email}, {@code lat}, {@code lon}.
     */
    public BatchSummary importFromCsv(Path csvPath) {
        if (!Files.isRegularFile(csvPath)) {
            throw new RecordNotFoundException("File not found: " + csvPath);
        }

        int imported = 0;
        int duplicates = 0;
        int errors = 0;

        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReaderBuilder(reader).build()) {

            String[] header = csv.readNext();
            if (header == null) {
                log.warn("{} is empty", csvPath);
                return BatchSummary.EMPTY;
            }
            Map<String, Integer> columns = indexColumns(header);

            int rowNum = 1;
            while (true) {
                String[] row;
                try {
                    row = csv.readNext();
                } catch (CsvMalformedLineException e) {
                    // the reader has consumed the rest of the file looking for the closing quote
                    log.warn("Row {}: malformed CSV ({}), stopping import", rowNum + 1, e.getMessage());
                    errors++;
                    break;
                } catch (CsvValidationException e) {
                    rowNum++;
                    log.warn("Row {}: rejected by CSV reader: {}", rowNum, e.getMessage());
                    errors++;
                    continue;
                }
                if (row == null) {
                    break;
                }
                rowNum++;
                if (isBlankRow(row)) {
                    continue;
                }
                Optional<Worker> worker = toWorker(row, columns, rowNum);
                if (worker.isEmpty()) {
                    errors++;
                    continue;
                }
                Worker candidate = worker.get();
                if (candidate.getPhone() != null && workerRepository.existsByPhone(candidate.getPhone())) {
                    log.warn("Row {}: duplicate phone number, skipping", rowNum);
                    duplicates++;
                    continue;
                }
                try {
                    workerRepository.save(candidate);
                    imported++;
                } catch (DataIntegrityViolationException e) {
                    log.warn("Row {}: duplicate phone number, skipping", rowNum);
                    duplicates++;
                } catch (DataAccessException e) {
                    log.warn("Row {}: failed to store worker: {}", rowNum, e.getMessage());
                    errors++;
                }
            }
        } catch (IOException | CsvValidationException e) {
            auditLogService.error(COMPONENT, "CSV import failed: " + e.getMessage());
            throw new DispatchException("CSV import failed: " + e.getMessage(), e);
        }

        BatchSummary summary = new BatchSummary(imported, duplicates, errors);
        log.info("Imported workers from {}: {}", csvPath, summary.describe());
        auditLogService.info(COMPONENT, "Imported workers from " + csvPath.getFileName() + ": " + summary.describe());
        return summary;
    }

    /**
     * Add one worker. Invalid contact details are rejected, invalid
     * coordinates are stored as unknown.
     */
    public Worker addWorker(String name, String skills, String phone, String email, Double lat, Double lon) {
        InputValidator.SanitizedContact contact = validator.sanitizeContact(name, phone, email, lat, lon);
        String cleanSkills = validator.normalizeSkills(skills);

        if (contact.name().isEmpty() || cleanSkills.isEmpty()) {
            throw new InvalidInputException("Name and skills are required");
        }
        if (contact.isDowngraded(InputValidator.FIELD_PHONE)) {
            throw new InvalidInputException("Invalid phone format: " + phone);
        }
        if (contact.isDowngraded(InputValidator.FIELD_EMAIL)) {
            throw new InvalidInputException("Invalid email format: " + email);
        }

        Worker worker = newWorker(contact, cleanSkills);
        if (worker.getPhone() != null && workerRepository.existsByPhone(worker.getPhone())) {
            throw new DuplicateRecordException("Worker with phone " + worker.getPhone() + " already exists", null);
        }

        try {
            Worker saved = workerRepository.save(worker);
            log.info("Added worker {} (ID: {})", saved.getName(), saved.getId());
            auditLogService.info(COMPONENT, "Added worker " + saved.getName());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateRecordException("Worker with phone " + worker.getPhone() + " already exists", e);
        }
    }

    /**
     * Active workers, most experienced first.
     */
    public List<Worker> listActive(int limit) {
        return workerRepository.findByStatusOrderByCompletedJobsDescIdDesc(
                WorkerStatus.ACTIVE, PageRequest.of(0, Math.max(1, limit)));
    }

    private Optional<Worker> toWorker(String[] row, Map<String, Integer> columns, int rowNum) {
        String name = column(row, columns, "name");
        if (name.isBlank()) {
            name = column(row, columns, "full_name");
        }
        InputValidator.SanitizedContact contact = validator.sanitizeContact(
                name,
                column(row, columns, "phone"),
                column(row, columns, "email"),
                column(row, columns, "lat"),
                column(row, columns, "lon"));
        String skills = validator.normalizeSkills(column(row, columns, "skills"));

        if (contact.name().isEmpty() || skills.isEmpty()) {
            log.warn("Row {}: missing name or skills, skipping", rowNum);
            return Optional.empty();
        }
        if (contact.isDowngraded(InputValidator.FIELD_PHONE)) {
            log.warn("Row {}: invalid phone format, clearing", rowNum);
        }
        if (contact.isDowngraded(InputValidator.FIELD_EMAIL)) {
            log.warn("Row {}: invalid email format, clearing", rowNum);
        }
        if (contact.isDowngraded(InputValidator.FIELD_LOCATION)) {
            log.warn("Row {}: invalid coordinates, location unknown", rowNum);
        }
        return Optional.of(newWorker(contact, skills));
    }

    private Worker newWorker(InputValidator.SanitizedContact contact, String skills) {
        return Worker.builder()
                .name(contact.name())
                .skills(skills)
                .phone(emptyToNull(contact.phone()))
                .email(emptyToNull(contact.email()))
                .latitude(contact.location().map(GeoPoint::latitude).orElse(null))
                .longitude(contact.location().map(GeoPoint::longitude).orElse(null))
                .status(WorkerStatus.ACTIVE)
                .createdAt(LocalDateTime.now(clock))
                .build();
    }

    private Map<String, Integer> indexColumns(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String key = header[i].replace("\uFEFF", "").strip().toLowerCase(Locale.ROOT);
            columns.putIfAbsent(key, i);
        }
        return columns;
    }

    private String column(String[] row, Map<String, Integer> columns, String name) {
        Integer index = columns.get(name);
        if (index == null || index >= row.length || row[index] == null) {
            return "";
        }
        return row[index];
    }

    private boolean isBlankRow(String[] row) {
        for (String cell : row) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
