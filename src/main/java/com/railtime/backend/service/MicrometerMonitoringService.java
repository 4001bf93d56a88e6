package com.railtime.backend.service;

import com.railtime.backend.model.CacheStatistics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records cache and upstream metrics in the application's {@link MeterRegistry}.
 * <p>
 * Meters (all low-cardinality):
 * <ul>
 *   <li>{@code marta.cache.lookups} counter, tagged {@code outcome=hit|stale|miss}</li>
 *   <li>{@code marta.upstream.refresh} timer, tagged {@code status=success|failed}</li>
 *   <li>{@code marta.upstream.refresh.last} gauge, duration of the latest refresh in ms</li>
 *   <li>{@code marta.cache.retries} counter</li>
 * </ul>
 */
@Service
@Slf4j
public class MicrometerMonitoringService implements MonitoringService {

    static final String LOOKUPS = "marta.cache.lookups";
    static final String REFRESH = "marta.upstream.refresh";
    static final String LAST_REFRESH = "marta.upstream.refresh.last";
    static final String RETRIES = "marta.cache.retries";

    private final Counter freshHits;
    private final Counter staleServes;
    private final Counter misses;
    private final Counter retriesFired;
    private final Timer refreshSuccess;
    private final Timer refreshFailed;
    private final AtomicLong lastRefreshDurationMs;

    public MicrometerMonitoringService(MeterRegistry registry) {
        this.freshHits = lookupCounter(registry, "hit");
        this.staleServes = lookupCounter(registry, "stale");
        this.misses = lookupCounter(registry, "miss");
        this.retriesFired = Counter.builder(RETRIES)
                .description("Background refresh retries fired")
                .register(registry);
        this.refreshSuccess = refreshTimer(registry, "success");
        this.refreshFailed = refreshTimer(registry, "failed");
        this.lastRefreshDurationMs = registry.gauge(LAST_REFRESH, new AtomicLong(-1L));
    }

    @Override
    public void recordLookup(String outcome) {
        if (HIT.equals(outcome)) {
            freshHits.increment();
        } else if (STALE.equals(outcome)) {
            staleServes.increment();
        } else if (MISS.equals(outcome)) {
            misses.increment();
        } else {
            log.warn("Unknown lookup outcome: {}", outcome);
        }
    }

    @Override
    public void recordRefresh(long durationMs, String status) {
        Timer timer = FAILED.equals(status) ? refreshFailed : refreshSuccess;
        timer.record(durationMs, TimeUnit.MILLISECONDS);
        lastRefreshDurationMs.set(durationMs);
        log.debug("Refresh recorded: {} in {}ms", status, durationMs);
    }

    @Override
    public void recordRetry() {
        retriesFired.increment();
    }

    @Override
    public CacheStatistics getStatistics() {
        long last = lastRefreshDurationMs.get();
        return CacheStatistics.builder()
                .freshHits((long) freshHits.count())
                .staleServes((long) staleServes.count())
                .misses((long) misses.count())
                .upstreamCalls(refreshSuccess.count() + refreshFailed.count())
                .upstreamFailures(refreshFailed.count())
                .retriesFired((long) retriesFired.count())
                .lastRefreshDurationMs(last < 0 ? null : last)
                .build();
    }

    private static Counter lookupCounter(MeterRegistry registry, String outcome) {
        return Counter.builder(LOOKUPS)
                .description("Arrivals lookups by how they were answered")
                .tag("outcome", outcome)
                .register(registry);
    }

    private static Timer refreshTimer(MeterRegistry registry, String status) {
        return Timer.builder(REFRESH)
                .description("Upstream MARTA refresh calls")
                .tag("status", status)
                .register(registry);
    }
}
