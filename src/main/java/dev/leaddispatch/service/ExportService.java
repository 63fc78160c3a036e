package dev.leaddispatch.service;

import com.opencsv.CSVWriter;
import dev.leaddispatch.entity.Job;
import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.entity.Worker;
import dev.leaddispatch.exception.DispatchException;
import dev.leaddispatch.model.ExportType;
import dev.leaddispatch.repository.JobRepository;
import dev.leaddispatch.repository.LeadRepository;
import dev.leaddispatch.repository.WorkerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Full-table CSV dumps of leads, workers and jobs. Read-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportService {

    static final String[] LEAD_HEADERS = {
            "ID", "Name", "Category", "Address", "Lat", "Lon",
            "Phone", "Email", "Status", "Source", "Contact Count",
            "Last Contact", "Created At"
    };

    static final String[] WORKER_HEADERS = {
            "ID", "Name", "Skills", "Phone", "Email", "Lat", "Lon",
            "Status", "Jobs Completed", "Rating", "Created At"
    };

    static final String[] JOB_HEADERS = {
            "Job ID", "Service", "Status", "Price", "Created At",
            "Lead Name", "Lead Phone", "Worker Name", "Worker Phone"
    };

    private final LeadRepository leadRepository;
    private final WorkerRepository workerRepository;
    private final JobRepository jobRepository;

    /**
     * Write every row of the given table to {@code output}, in id order.
     * Nothing is written when the table is empty.
     *
     * @return number of data rows written
     */
    @Transactional(readOnly = true)
    public int export(ExportType type, Path output) {
        List<String[]> rows = switch (type) {
            case LEADS -> leadRepository.findAllByOrderByIdAsc().stream().map(this::toRow).toList();
            case WORKERS -> workerRepository.findAllByOrderByIdAsc().stream().map(this::toRow).toList();
            case JOBS -> jobRepository.findAllByOrderByIdAsc().stream().map(this::toRow).toList();
        };

        if (rows.isEmpty()) {
            log.info("No {} to export", type.name().toLowerCase(Locale.ROOT));
            return 0;
        }

        String[] headers = switch (type) {
            case LEADS -> LEAD_HEADERS;
            case WORKERS -> WORKER_HEADERS;
            case JOBS -> JOB_HEADERS;
        };

        ensureParent(output);
        try (Writer fileWriter = Files.newBufferedWriter(output, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(
                     fileWriter,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(headers);
            writer.writeAll(rows);
            log.info("Exported {} {} to {}", rows.size(), type.name().toLowerCase(Locale.ROOT), output);
            return rows.size();

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", output, e.getMessage(), e);
            throw new DispatchException("Export failed: " + e.getMessage(), e);
        }
    }

    private String[] toRow(Lead l) {
        return new String[]{
                str(l.getId()),
                str(l.getName()),
                str(l.getCategory()),
                str(l.getAddress()),
                str(l.getLatitude()),
                str(l.getLongitude()),
                str(l.getPhone()),
                str(l.getEmail()),
                str(l.getStatus()),
                str(l.getSource()),
                str(l.getContactCount()),
                str(l.getLastContact()),
                str(l.getCreatedAt())
        };
    }

    private String[] toRow(Worker w) {
        return new String[]{
                str(w.getId()),
                str(w.getName()),
                str(w.getSkills()),
                str(w.getPhone()),
                str(w.getEmail()),
                str(w.getLatitude()),
                str(w.getLongitude()),
                str(w.getStatus()),
                str(w.getCompletedJobs()),
                str(w.getRating()),
                str(w.getCreatedAt())
        };
    }

    private String[] toRow(Job j) {
        return new String[]{
                str(j.getId()),
                str(j.getService()),
                str(j.getStatus()),
                str(j.getPrice()),
                str(j.getCreatedAt()),
                str(j.getLead().getName()),
                str(j.getLead().getPhone()),
                str(j.getWorker().getName()),
                str(j.getWorker().getPhone())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureParent(Path output) {
        Path parent = output.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new DispatchException("Cannot create output directory: " + parent, e);
        }
    }
}
