package dev.leaddispatch.service;

import dev.leaddispatch.config.LookupConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Enforces a minimum spacing between calls to the external lookup provider.
 * One gate is shared by every query: the provider grants a single rate budget.
 * The wait is a plain throttle and cannot be cancelled early.
 */
@Slf4j
@Component
public class RateGate {

    /**
     * Blocking pause, replaceable in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Clock clock;
    private final Duration minSpacing;
    private final Sleeper sleeper;

    private Instant lastCall;

    @Autowired
    public RateGate(Clock clock, LookupConfig lookupConfig) {
        this(clock, lookupConfig.getMinSpacing(), duration -> Thread.sleep(duration.toMillis()));
    }

    public RateGate(Clock clock, Duration minSpacing, Sleeper sleeper) {
        this.clock = clock;
        this.minSpacing = minSpacing;
        this.sleeper = sleeper;
    }

    /**
     * Block until the minimum spacing since the previous call has passed,
     * then record this call.
     *
     * @return how long the caller was held back
     */
    public synchronized Duration acquire() {
        Duration waited = Duration.ZERO;
        if (lastCall != null) {
            Duration elapsed = Duration.between(lastCall, clock.instant());
            if (elapsed.compareTo(minSpacing) < 0) {
                waited = minSpacing.minus(elapsed);
                log.debug("Rate gate holding lookup for {} ms", waited.toMillis());
                pause(waited);
            }
        }
        lastCall = clock.instant();
        return waited;
    }

    public Duration getMinSpacing() {
        return minSpacing;
    }

    private void pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Rate gate wait interrupted");
        }
    }
}
