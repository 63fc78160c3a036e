package dev.leaddispatch;

import dev.leaddispatch.config.MatchingConfig;
import dev.leaddispatch.entity.Job;
import dev.leaddispatch.entity.Worker;
import dev.leaddispatch.exception.InvalidInputException;
import dev.leaddispatch.exception.RecordNotFoundException;
import dev.leaddispatch.model.BatchSummary;
import dev.leaddispatch.model.ExportType;
import dev.leaddispatch.model.JobStatus;
import dev.leaddispatch.model.LookupResult;
import dev.leaddispatch.model.MatchReport;
import dev.leaddispatch.model.MessageChannel;
import dev.leaddispatch.model.MessageStatus;
import dev.leaddispatch.service.ExportService;
import dev.leaddispatch.service.JobLedgerService;
import dev.leaddispatch.service.LeadCollectionService;
import dev.leaddispatch.service.LeadService;
import dev.leaddispatch.service.MaintenanceService;
import dev.leaddispatch.service.MatchingService;
import dev.leaddispatch.service.OutreachService;
import dev.leaddispatch.service.StatsService;
import dev.leaddispatch.service.WorkerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommandRunnerTest {

    @Mock
    private LeadCollectionService leadCollectionService;

    @Mock
    private LeadService leadService;

    @Mock
    private WorkerService workerService;

    @Mock
    private MatchingService matchingService;

    @Mock
    private JobLedgerService jobLedgerService;

    @Mock
    private OutreachService outreachService;

    @Mock
    private ExportService exportService;

    @Mock
    private StatsService statsService;

    @Mock
    private MaintenanceService maintenanceService;

    private CommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new CommandRunner(leadCollectionService, leadService, workerService, matchingService,
                jobLedgerService, outreachService, exportService, statsService, maintenanceService,
                new MatchingConfig());
    }

    @Test
    @DisplayName("Should print usage and fail without a command")
    void shouldFailWithoutCommand() {
        assertThat(runner.execute()).isEqualTo(1);
        verifyNoInteractions(leadCollectionService, matchingService);
    }

    @Test
    void shouldFailForUnknownCommand() {
        assertThat(runner.execute("launch")).isEqualTo(1);
    }

    @Nested
    @DisplayName("Collection and workers")
    class CollectionTests {

        @Test
        void shouldCollectWithDefaultLimit() {
            when(leadCollectionService.collect("Mumbai", "plumber", 20)).thenReturn(
                    new LeadCollectionService.CollectionReport("Mumbai", "plumber", new BatchSummary(2, 1, 0),
                            LookupResult.fetched(List.of())));

            assertThat(runner.execute("collect", "--city=Mumbai", "--service=plumber")).isZero();
        }

        @Test
        void shouldFailWhenRequiredOptionMissing() {
            assertThat(runner.execute("collect", "--city=Mumbai")).isEqualTo(1);
            verifyNoInteractions(leadCollectionService);
        }

        @Test
        void shouldRejectNonNumericLimit() {
            assertThat(runner.execute("collect", "--city=Mumbai", "--service=plumber", "--limit=lots")).isEqualTo(1);
        }

        @Test
        void shouldImportWorkersFromPositionalPath() {
            when(workerService.importFromCsv(Path.of("workers.csv"))).thenReturn(new BatchSummary(3, 0, 0));

            assertThat(runner.execute("import-workers", "workers.csv")).isZero();
        }

        @Test
        void shouldAddWorkerWithCoordinates() {
            when(workerService.addWorker("Ravi", "plumbing", "+919812345678", null, 19.08, 72.88))
                    .thenReturn(Worker.builder().id(5L).name("Ravi").build());

            int status = runner.execute("add-worker", "--name=Ravi", "--skills=plumbing",
                    "--phone=+919812345678", "--lat=19.08", "--lon=72.88");

            assertThat(status).isZero();
        }

        @Test
        void shouldReportInvalidWorkerPhone() {
            when(workerService.addWorker(any(), any(), any(), any(), any(), any()))
                    .thenThrow(new InvalidInputException("Invalid phone format: 12"));

            assertThat(runner.execute("add-worker", "--name=Ravi", "--skills=plumbing", "--phone=12")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Matching and jobs")
    class MatchingTests {

        @Test
        void shouldUseConfiguredBatchSize() {
            when(matchingService.matchAllLeads("plumbing", 50)).thenReturn(new MatchReport("plumbing", List.of(
                    new MatchReport.LeadOutcome(1L, "Sharma Residency", MatchReport.Status.MATCHED,
                            5L, "Ravi", 1.5, 7L, null))));

            assertThat(runner.execute("match", "--service=plumbing")).isZero();
        }

        @Test
        void shouldCompleteJobWithRating() {
            when(jobLedgerService.advanceStatus(7L, JobStatus.COMPLETE, 4.5))
                    .thenReturn(Job.builder().id(7L).status(JobStatus.COMPLETE).build());

            assertThat(runner.execute("complete-job", "7", "--rating=4.5")).isZero();
        }

        @Test
        void shouldIgnoreRatingWhenCancelling() {
            when(jobLedgerService.advanceStatus(7L, JobStatus.CANCELLED, null))
                    .thenReturn(Job.builder().id(7L).status(JobStatus.CANCELLED).build());

            assertThat(runner.execute("cancel-job", "7", "--rating=4")).isZero();
        }

        @Test
        void shouldFailOnIllegalTransition() {
            when(jobLedgerService.advanceStatus(7L, JobStatus.PAID, null))
                    .thenThrow(new IllegalStateException("Job 7 cannot move from DISPATCHED to PAID"));

            assertThat(runner.execute("mark-paid", "7")).isEqualTo(1);
        }

        @Test
        void shouldRejectInvalidJobId() {
            assertThat(runner.execute("complete-job", "seven")).isEqualTo(1);
            verifyNoInteractions(jobLedgerService);
        }

        @Test
        void shouldRejectUnknownStatusFilter() {
            assertThat(runner.execute("list-jobs", "--status=lost")).isEqualTo(1);
        }

        @Test
        void shouldFilterJobsByStatus() {
            when(jobLedgerService.listJobs(JobStatus.PAID, 50)).thenReturn(List.of());

            assertThat(runner.execute("list-jobs", "--status=paid")).isZero();
        }
    }

    @Nested
    @DisplayName("Outreach")
    class OutreachTests {

        @Test
        void shouldUseHindiTemplateForChatByDefault() {
            when(outreachService.send(1L, MessageChannel.CHAT, "intro_hindi", "Mumbai", "plumbing", null))
                    .thenReturn(new OutreachService.OutreachResult(MessageStatus.SENT, 9L, null));

            assertThat(runner.execute("send-chat", "1", "--city=Mumbai", "--service=plumbing")).isZero();
        }

        @Test
        void shouldFailWhenMessageNotDelivered() {
            when(outreachService.send(1L, MessageChannel.EMAIL, "followup_english", "Mumbai", "plumbing", "Asha"))
                    .thenReturn(new OutreachService.OutreachResult(MessageStatus.PENDING, 10L,
                            "EMAIL channel not configured"));

            int status = runner.execute("send-email", "1", "--city=Mumbai", "--service=plumbing",
                    "--template=followup_english", "--sender=Asha");

            assertThat(status).isEqualTo(1);
        }

        @Test
        void shouldFailForUnknownLead() {
            when(outreachService.send(any(), any(), any(), any(), any(), any()))
                    .thenThrow(RecordNotFoundException.lead(99L));

            assertThat(runner.execute("send-chat", "99", "--city=Mumbai", "--service=plumbing")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Export and maintenance")
    class MaintenanceTests {

        @Test
        void shouldExportToDefaultFile() {
            when(exportService.export(ExportType.WORKERS, Path.of("workers_export.csv"))).thenReturn(0);

            assertThat(runner.execute("export", "--type=workers")).isZero();
            verify(exportService).export(ExportType.WORKERS, Path.of("workers_export.csv"));
        }

        @Test
        void shouldRejectUnknownExportType() {
            assertThat(runner.execute("export", "--type=messages")).isEqualTo(1);
            verifyNoInteractions(exportService);
        }

        @Test
        void shouldRunCleanup() {
            when(maintenanceService.cleanup()).thenReturn(new MaintenanceService.CleanupReport(1, 2, 3));

            assertThat(runner.execute("cleanup")).isZero();
        }

        @Test
        void shouldListLeadsWithLimit() {
            when(leadService.listRecent(anyInt())).thenReturn(List.of());

            assertThat(runner.execute("list-leads", "--limit=5")).isZero();
            verify(leadService).listRecent(5);
        }
    }
}
