package dev.leaddispatch;

import dev.leaddispatch.config.MatchingConfig;
import dev.leaddispatch.entity.Job;
import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.entity.Worker;
import dev.leaddispatch.exception.DispatchException;
import dev.leaddispatch.exception.InvalidInputException;
import dev.leaddispatch.model.BatchSummary;
import dev.leaddispatch.model.ExportType;
import dev.leaddispatch.model.JobStatus;
import dev.leaddispatch.model.MatchReport;
import dev.leaddispatch.model.MessageChannel;
import dev.leaddispatch.service.ExportService;
import dev.leaddispatch.service.JobLedgerService;
import dev.leaddispatch.service.LeadCollectionService;
import dev.leaddispatch.service.LeadCollectionService.CollectionReport;
import dev.leaddispatch.service.LeadService;
import dev.leaddispatch.service.MaintenanceService;
import dev.leaddispatch.service.MatchingService;
import dev.leaddispatch.service.OutreachService;
import dev.leaddispatch.service.OutreachService.OutreachResult;
import dev.leaddispatch.service.StatsService;
import dev.leaddispatch.service.StatsService.DispatchStats;
import dev.leaddispatch.service.WorkerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Routes a command line to the matching service call and reports the
 * outcome. Each invocation runs exactly one command.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandRunner {

    private static final String SEPARATOR = "========================================";
    private static final int DEFAULT_LIST_LIMIT = 50;
    private static final int DEFAULT_COLLECT_LIMIT = 20;

    static final String USAGE = """
            Usage: lead-dispatch <command> [options]
              collect --city=<city> --service=<service> [--limit=20]
              import-workers <csv>
              add-worker --name=<name> --skills=<a,b> [--phone=] [--email=] [--lat=] [--lon=]
              list-leads [--limit=50]
              list-workers [--limit=50]
              list-jobs [--status=dispatched|complete|paid|cancelled] [--limit=50]
              match --service=<service> [--max=50]
              send-chat <leadId> --city=<city> --service=<service> [--template=intro_hindi] [--sender=Team]
              send-email <leadId> --city=<city> --service=<service> [--template=intro_english] [--sender=Team]
              complete-job <jobId> [--rating=<0-5>]
              cancel-job <jobId>
              mark-paid <jobId>
              export --type=leads|workers|jobs [--output=<file>]
              stats
              cleanup""";

    private final LeadCollectionService leadCollectionService;
    private final LeadService leadService;
    private final WorkerService workerService;
    private final MatchingService matchingService;
    private final JobLedgerService jobLedgerService;
    private final OutreachService outreachService;
    private final ExportService exportService;
    private final StatsService statsService;
    private final MaintenanceService maintenanceService;
    private final MatchingConfig matchingConfig;

    /**
     * Run one command.
     *
     * @return process exit status, 0 on success
     */
    public int execute(String... rawArgs) {
        ApplicationArguments args = new DefaultApplicationArguments(rawArgs);
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            log.info(USAGE);
            return 1;
        }

        String command = positional.get(0).toLowerCase(Locale.ROOT);
        log.info(SEPARATOR);
        log.info("Lead Dispatch: {}", command);
        log.info(SEPARATOR);

        try {
            int status = dispatch(command, args);
            log.info(SEPARATOR);
            return status;
        } catch (DispatchException | IllegalStateException | IllegalArgumentException e) {
            log.error("{} failed: {}", command, e.getMessage());
            return 1;
        }
    }

    private int dispatch(String command, ApplicationArguments args) {
        return switch (command) {
            case "collect" -> collect(args);
            case "import-workers" -> importWorkers(args);
            case "add-worker" -> addWorker(args);
            case "list-leads" -> listLeads(args);
            case "list-workers" -> listWorkers(args);
            case "list-jobs" -> listJobs(args);
            case "match" -> match(args);
            case "send-chat" -> send(args, MessageChannel.CHAT, "intro_hindi");
            case "send-email" -> send(args, MessageChannel.EMAIL, "intro_english");
            case "complete-job" -> advance(args, JobStatus.COMPLETE);
            case "cancel-job" -> advance(args, JobStatus.CANCELLED);
            case "mark-paid" -> advance(args, JobStatus.PAID);
            case "export" -> export(args);
            case "stats" -> stats();
            case "cleanup" -> cleanup();
            default -> {
                log.error("Unknown command: {}", command);
                log.info(USAGE);
                yield 1;
            }
        };
    }

    private int collect(ApplicationArguments args) {
        CollectionReport report = leadCollectionService.collect(
                required(args, "city"), required(args, "service"), intOption(args, "limit", DEFAULT_COLLECT_LIMIT));
        if (report.lookupFailed()) {
            log.warn("Lookup failed ({}): {}", report.lookupResult().failure(), report.lookupResult().failureMessage());
        }
        logSummary("Collect", report.summary());
        return 0;
    }

    private int importWorkers(ApplicationArguments args) {
        Path csv = Path.of(positional(args, 1, "csv file"));
        BatchSummary summary = workerService.importFromCsv(csv);
        logSummary("Import", summary);
        return 0;
    }

    private int addWorker(ApplicationArguments args) {
        Worker worker = workerService.addWorker(
                required(args, "name"),
                required(args, "skills"),
                option(args, "phone").orElse(null),
                option(args, "email").orElse(null),
                doubleOption(args, "lat"),
                doubleOption(args, "lon"));
        log.info("Added worker: {} (ID: {})", worker.getName(), worker.getId());
        return 0;
    }

    private int listLeads(ApplicationArguments args) {
        List<Lead> leads = leadService.listRecent(intOption(args, "limit", DEFAULT_LIST_LIMIT));
        if (leads.isEmpty()) {
            log.info("No leads found. Collect leads with: collect --city=<city> --service=<service>");
            return 0;
        }
        log.info(String.format("%-5s %-35s %-15s %-15s %-10s %-9s", "ID", "Name", "Category", "Phone", "Status", "Contacts"));
        for (Lead lead : leads) {
            log.info(String.format("%-5d %-35s %-15s %-15s %-10s %-9d",
                    lead.getId(), cut(lead.getName(), 34), cut(lead.getCategory(), 14), cut(lead.getPhone(), 14),
                    lead.getStatus(), lead.getContactCount()));
        }
        log.info("Showing {} leads", leads.size());
        return 0;
    }

    private int listWorkers(ApplicationArguments args) {
        List<Worker> workers = workerService.listActive(intOption(args, "limit", DEFAULT_LIST_LIMIT));
        if (workers.isEmpty()) {
            log.info("No workers found. Import workers with: import-workers <csv>");
            return 0;
        }
        log.info(String.format("%-5s %-25s %-30s %-15s %-5s %-6s", "ID", "Name", "Skills", "Phone", "Jobs", "Rating"));
        for (Worker worker : workers) {
            log.info(String.format("%-5d %-25s %-30s %-15s %-5d %-6.1f",
                    worker.getId(), cut(worker.getName(), 24), cut(worker.getSkills(), 29), cut(worker.getPhone(), 14),
                    worker.getCompletedJobs(), worker.getRating()));
        }
        log.info("Showing {} active workers", workers.size());
        return 0;
    }

    private int listJobs(ApplicationArguments args) {
        JobStatus status = option(args, "status").map(JobStatus::fromText).orElse(null);
        List<Job> jobs = jobLedgerService.listJobs(status, intOption(args, "limit", DEFAULT_LIST_LIMIT));
        if (jobs.isEmpty()) {
            log.info("No jobs found");
            return 0;
        }
        log.info(String.format("%-5s %-25s %-20s %-12s %-12s", "ID", "Lead", "Worker", "Service", "Status"));
        for (Job job : jobs) {
            log.info(String.format("%-5d %-25s %-20s %-12s %-12s",
                    job.getId(), cut(job.getLead().getName(), 24), cut(job.getWorker().getName(), 19),
                    cut(job.getService(), 11), job.getStatus()));
        }
        log.info("Showing {} jobs", jobs.size());
        return 0;
    }

    private int match(ApplicationArguments args) {
        MatchReport report = matchingService.matchAllLeads(
                required(args, "service"), intOption(args, "max", matchingConfig.getDefaultBatchSize()));
        for (MatchReport.LeadOutcome outcome : report.outcomes()) {
            switch (outcome.status()) {
                case MATCHED -> log.info("Lead {} ({}) -> worker {} ({}), job {}", outcome.leadId(),
                        outcome.leadName(), outcome.workerId(), outcome.workerName(), outcome.jobId());
                case NO_WORKER -> log.warn("Lead {} ({}): no eligible worker", outcome.leadId(), outcome.leadName());
                case DISPATCH_FAILED -> log.warn("Lead {} ({}): dispatch failed: {}", outcome.leadId(),
                        outcome.leadName(), outcome.reason());
            }
        }
        logSummary("Match", report.toSummary());
        return 0;
    }

    private int send(ApplicationArguments args, MessageChannel channel, String defaultTemplate) {
        OutreachResult result = outreachService.send(
                longPositional(args, "lead id"),
                channel,
                option(args, "template").orElse(defaultTemplate),
                required(args, "city"),
                required(args, "service"),
                option(args, "sender").orElse(null));
        if (result.isDelivered()) {
            log.info("{} message sent (message {})", channel, result.messageId());
            return 0;
        }
        log.warn("{} message not sent: {}", channel, result.reason());
        return 1;
    }

    private int advance(ApplicationArguments args, JobStatus target) {
        Double rating = target == JobStatus.COMPLETE ? doubleOption(args, "rating") : null;
        Job job = jobLedgerService.advanceStatus(longPositional(args, "job id"), target, rating);
        log.info("Job {} is now {}", job.getId(), job.getStatus());
        return 0;
    }

    private int export(ApplicationArguments args) {
        ExportType type = ExportType.fromText(required(args, "type"));
        Path output = Path.of(option(args, "output").orElse(type.defaultFileName()));
        int rows = exportService.export(type, output);
        if (rows == 0) {
            log.info("Nothing to export");
        }
        return 0;
    }

    private int stats() {
        DispatchStats stats = statsService.collect();
        log.info("LEADS");
        log.info("  Total: {}", stats.totalLeads());
        log.info("  Categories: {}", stats.leadCategories());
        stats.leadsByStatus().forEach((status, count) -> log.info("    - {}: {}", status, count));
        log.info("WORKERS");
        log.info("  Active: {}", stats.activeWorkers());
        log.info("  Average rating: {}/5.0", String.format("%.2f", stats.averageRating()));
        log.info("  Total jobs completed: {}", stats.completedJobs());
        log.info("JOBS");
        log.info("  Total: {}", stats.totalJobs());
        log.info("  Total revenue: {}", String.format("%.2f", stats.totalRevenue()));
        stats.jobsByStatus().forEach((status, count) -> log.info("    - {}: {}", status, count));
        log.info("OUTREACH");
        stats.messagesByChannel().forEach((channel, count) -> log.info("  {}: {} messages", channel, count));
        return 0;
    }

    private int cleanup() {
        MaintenanceService.CleanupReport report = maintenanceService.cleanup();
        log.info("Removed {} invalid leads", report.degenerateLeads());
        log.info("Removed {} duplicate entries", report.duplicateLeads());
        log.info("Cleared {} old cache entries", report.expiredCacheEntries());
        return 0;
    }

    private void logSummary(String operation, BatchSummary summary) {
        log.info("{} summary: {}", operation, summary.describe());
    }

    private Optional<String> option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.strip());
    }

    private String required(ApplicationArguments args, String name) {
        return option(args, name).orElseThrow(() -> new InvalidInputException("Missing required option --" + name));
    }

    private int intOption(ApplicationArguments args, String name, int defaultValue) {
        Optional<String> value = option(args, name);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.get());
        } catch (NumberFormatException e) {
            throw new InvalidInputException("--" + name + " must be a whole number");
        }
    }

    private Double doubleOption(ApplicationArguments args, String name) {
        Optional<String> value = option(args, name);
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(value.get());
        } catch (NumberFormatException e) {
            throw new InvalidInputException("--" + name + " must be a number");
        }
    }

    private String positional(ApplicationArguments args, int index, String what) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.size() <= index) {
            throw new InvalidInputException("Missing " + what);
        }
        return positional.get(index);
    }

    private Long longPositional(ApplicationArguments args, String what) {
        String value = positional(args, 1, what);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Invalid " + what + ": " + value);
        }
    }

    private String cut(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
