package dev.leaddispatch.metrics;

import dev.leaddispatch.model.LookupFailure;
import dev.leaddispatch.model.MessageChannel;
import dev.leaddispatch.model.MessageStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for collection, lookup, matching and outreach.
 */
@Component
public class DispatchMetrics {

    private static final String TAG_REASON = "reason";

    private final MeterRegistry registry;

    private final Counter leadsCollectedCounter;
    private final Counter leadsDuplicateCounter;
    private final Counter lookupCallsCounter;
    private final Counter cacheHitsCounter;
    private final Counter jobsCreatedCounter;
    private final Counter matchMissesCounter;
    private final Counter dispatchFailuresCounter;
    private final Timer lookupTimer;

    private final AtomicInteger lastMatchLeads = new AtomicInteger(0);
    private final AtomicInteger lastMatchJobs = new AtomicInteger(0);

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.leadsCollectedCounter = Counter.builder("dispatch_leads_collected_total")
                .description("Leads stored from lookup results")
                .register(registry);

        this.leadsDuplicateCounter = Counter.builder("dispatch_leads_duplicate_total")
                .description("Lookup results skipped because the lead already existed")
                .register(registry);

        this.lookupCallsCounter = Counter.builder("dispatch_lookup_calls_total")
                .description("Calls made to the external lookup provider")
                .register(registry);

        this.cacheHitsCounter = Counter.builder("dispatch_lookup_cache_hits_total")
                .description("Lookups answered from the cache")
                .register(registry);

        this.jobsCreatedCounter = Counter.builder("dispatch_jobs_created_total")
                .description("Jobs dispatched by the matching engine")
                .register(registry);

        this.matchMissesCounter = Counter.builder("dispatch_match_misses_total")
                .description("Leads for which no eligible worker existed")
                .register(registry);

        this.dispatchFailuresCounter = Counter.builder("dispatch_job_failures_total")
                .description("Job creations that failed and were rolled back")
                .register(registry);

        this.lookupTimer = Timer.builder("dispatch_lookup_duration")
                .description("Latency of external lookup calls")
                .register(registry);

        Gauge.builder("dispatch_last_match_leads", lastMatchLeads, AtomicInteger::get)
                .description("Leads considered in the last match run")
                .register(registry);

        Gauge.builder("dispatch_last_match_jobs", lastMatchJobs, AtomicInteger::get)
                .description("Jobs created in the last match run")
                .register(registry);
    }

    public void recordLeadsCollected(int count) {
        leadsCollectedCounter.increment(count);
    }

    public void recordLeadsDuplicate(int count) {
        leadsDuplicateCounter.increment(count);
    }

    public void recordLookupCall() {
        lookupCallsCounter.increment();
    }

    public void recordCacheHit() {
        cacheHitsCounter.increment();
    }

    public void recordLookupLatency(Duration latency) {
        lookupTimer.record(latency);
    }

    /**
     * Record a failed lookup, tagged by failure reason.
     */
    public void recordLookupError(LookupFailure failure) {
        Counter.builder("dispatch_lookup_errors_total")
                .tag(TAG_REASON, failure.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordJobCreated() {
        jobsCreatedCounter.increment();
    }

    public void recordMatchMiss() {
        matchMissesCounter.increment();
    }

    public void recordDispatchFailure() {
        dispatchFailuresCounter.increment();
    }

    /**
     * Record an outreach attempt by channel and outcome.
     */
    public void recordMessage(MessageChannel channel, MessageStatus status) {
        Counter.builder("dispatch_messages_total")
                .tag("channel", channel.name().toLowerCase(Locale.ROOT))
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void updateLastMatchStats(int leads, int jobs) {
        lastMatchLeads.set(leads);
        lastMatchJobs.set(jobs);
    }
}
