package dev.leaddispatch.service;

import com.opencsv.CSVReader;
import dev.leaddispatch.entity.Job;
import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.entity.Worker;
import dev.leaddispatch.model.ExportType;
import dev.leaddispatch.model.JobStatus;
import dev.leaddispatch.model.LeadStatus;
import dev.leaddispatch.repository.JobRepository;
import dev.leaddispatch.repository.LeadRepository;
import dev.leaddispatch.repository.WorkerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExportServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private WorkerRepository workerRepository;

    @Mock
    private JobRepository jobRepository;

    private ExportService exportService;

    @BeforeEach
    void setUp() {
        exportService = new ExportService(leadRepository, workerRepository, jobRepository);
    }

    @Test
    @DisplayName("Should write leads with header and blank cells for missing values")
    void shouldExportLeads() throws Exception {
        Lead lead = Lead.builder().id(1L).name("Sharma, Residency").category("plumbing")
                .latitude(19.07).longitude(72.87).status(LeadStatus.NEW).source("nominatim")
                .createdAt(LocalDateTime.of(2026, 3, 1, 10, 0)).build();
        when(leadRepository.findAllByOrderByIdAsc()).thenReturn(List.of(lead));
        Path output = tempDir.resolve("out/leads.csv");

        int written = exportService.export(ExportType.LEADS, output);

        List<String[]> rows = read(output);
        assertThat(written).isEqualTo(1);
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).containsExactly(ExportService.LEAD_HEADERS);
        assertThat(rows.get(1)[1]).isEqualTo("Sharma, Residency");
        assertThat(rows.get(1)[4]).isEqualTo("19.07");
        assertThat(rows.get(1)[6]).isEmpty();
        assertThat(rows.get(1)[8]).isEqualTo("NEW");
    }

    @Test
    @DisplayName("Should join lead and worker names into job rows")
    void shouldExportJobs() throws Exception {
        Lead lead = Lead.builder().id(1L).name("Sharma Residency").phone("+919876543210").build();
        Worker worker = Worker.builder().id(5L).name("Ravi").phone("+919812345678").build();
        Job job = Job.builder().id(7L).lead(lead).worker(worker).service("plumbing").price(500.0)
                .status(JobStatus.DISPATCHED).createdAt(LocalDateTime.of(2026, 3, 1, 10, 0)).build();
        when(jobRepository.findAllByOrderByIdAsc()).thenReturn(List.of(job));
        Path output = tempDir.resolve("jobs.csv");

        exportService.export(ExportType.JOBS, output);

        List<String[]> rows = read(output);
        assertThat(rows.get(0)).containsExactly(ExportService.JOB_HEADERS);
        assertThat(rows.get(1)).containsExactly("7", "plumbing", "DISPATCHED", "500.0", "2026-03-01T10:00",
                "Sharma Residency", "+919876543210", "Ravi", "+919812345678");
    }

    @Test
    @DisplayName("Should write nothing for an empty table")
    void shouldSkipEmptyTable() {
        when(workerRepository.findAllByOrderByIdAsc()).thenReturn(List.of());
        Path output = tempDir.resolve("workers.csv");

        assertThat(exportService.export(ExportType.WORKERS, output)).isZero();
        assertThat(output).doesNotExist();
    }

    private List<String[]> read(Path file) throws Exception {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            return csv.readAll();
        }
    }
}
