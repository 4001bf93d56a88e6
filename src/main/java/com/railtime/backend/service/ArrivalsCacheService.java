package com.railtime.backend.service;

import com.railtime.backend.client.MartaApi;
import com.railtime.backend.exception.MissingCredentialException;
import com.railtime.backend.exception.UpstreamException;
import com.railtime.backend.model.ArrivalsResult;
import com.railtime.backend.model.CacheEntry;
import com.railtime.backend.model.CacheSnapshot;
import com.railtime.backend.model.RefreshSummary;
import com.railtime.backend.util.SingleFlight;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the cached MARTA arrivals snapshot.
 * <p>
 * Fresh entries are served without touching the upstream. Expired entries
 * trigger a refresh shared by all concurrent callers; if that refresh fails the
 * previous payload is served as stale and, for upstream-internal errors, a
 * background retry is armed until a refresh succeeds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArrivalsCacheService {

    public static final long DEFAULT_TTL_MS = 60_000L;
    public static final String STALE_MESSAGE = "Serving stale cache while MARTA API recovers.";

    private final MartaApi martaApi;
    private final RefreshRetryLoop retryLoop;
    private final MonitoringService monitoringService;
    private final Clock clock;

    private final AtomicReference<CacheEntry> cache = new AtomicReference<>(CacheEntry.EMPTY);
    private final SingleFlight<CacheEntry> refreshFlight = new SingleFlight<>();

    @Value("${marta.cache.ttl-ms:60000}")
    private long ttlMs = DEFAULT_TTL_MS;

    /**
     * Returns arrivals for a request, refreshing from MARTA when the cached copy has expired.
     *
     * @param apiKey MARTA API key
     * @return arrivals plus cache metadata
     * @throws MissingCredentialException if no API key is configured
     * @throws UpstreamException          if nothing is cached and MARTA cannot be reached
     */
    public ArrivalsResult getArrivals(String apiKey) {
        requireCredential(apiKey);

        Instant now = clock.instant();
        CacheEntry entry = cache.get();
        if (entry.isFresh(now, ttlMs)) {
            long ageMs = entry.ageMillis(now);
            log.info("CACHE: 🟢 HIT | {} arrivals | Age: {}ms", entry.getPayload().size(), ageMs);
            monitoringService.recordLookup(MonitoringService.HIT);
            return ArrivalsResult.fresh(entry.getPayload(), ageMs);
        }

        log.info("CACHE: ⚪ MISS | {}. Refreshing from MARTA...",
                entry.isPopulated() ? "Entry expired" : "Cache empty");
        monitoringService.recordLookup(MonitoringService.MISS);
        try {
            CacheEntry refreshed = refresh(apiKey);
            return ArrivalsResult.refreshed(refreshed.getPayload());
        } catch (UpstreamException e) {
            CacheEntry previous = cache.get();
            if (previous.isPopulated()) {
                return serveStale(previous, e);
            }

            // Cold start: one more attempt through the same single-flight slot
            log.warn("CACHE: 🔴 EMPTY | MARTA error {}. Making one more attempt...", e.getStatus());
            try {
                CacheEntry retried = refresh(apiKey);
                return ArrivalsResult.refreshed(retried.getPayload());
            } catch (UpstreamException fallbackFailure) {
                // Another request may have filled the cache meanwhile
                CacheEntry latest = cache.get();
                if (latest.isPopulated()) {
                    return serveStale(latest, fallbackFailure);
                }
                throw fallbackFailure;
            }
        }
    }

    /**
     * Refreshes the cache ignoring the TTL. Upstream failures are reported in the summary.
     */
    public RefreshSummary forceRefresh(String apiKey) {
        requireCredential(apiKey);
        LocalDateTime startTime = LocalDateTime.now(clock);
        long startMillis = clock.millis();

        try {
            CacheEntry entry = refresh(apiKey);
            long duration = clock.millis() - startMillis;
            return RefreshSummary.builder()
                    .timestamp(startTime)
                    .status(MonitoringService.SUCCESS)
                    .recordsReceived(entry.getPayload().size())
                    .processingTimeMs(duration)
                    .message(String.format("Cache refreshed with %d arrivals", entry.getPayload().size()))
                    .build();
        } catch (UpstreamException e) {
            long duration = clock.millis() - startMillis;
            return RefreshSummary.builder()
                    .timestamp(startTime)
                    .status(MonitoringService.FAILED)
                    .recordsReceived(0)
                    .upstreamStatus(e.getStatus())
                    .processingTimeMs(duration)
                    .message(e.getMessage() + " " + e.getDetail())
                    .build();
        }
    }

    public CacheSnapshot snapshot() {
        Instant now = clock.instant();
        CacheEntry entry = cache.get();
        return CacheSnapshot.builder()
                .populated(entry.isPopulated())
                .recordCount(entry.isPopulated() ? entry.getPayload().size() : 0)
                .fetchedAt(entry.getFetchedAt())
                .ageMs(entry.isPopulated() ? entry.ageMillis(now) : null)
                .fresh(entry.isFresh(now, ttlMs))
                .ttlMs(ttlMs)
                .refreshInFlight(refreshFlight.isInFlight())
                .retryArmed(retryLoop.isArmed())
                .statistics(monitoringService.getStatistics())
                .build();
    }

    @PreDestroy
    public void shutdown() {
        if (retryLoop.disarm()) {
            log.info("Arrivals cache shut down with a pending retry cancelled");
        }
    }

    CacheEntry currentEntry() {
        return cache.get();
    }

    int refreshCallers() {
        return refreshFlight.callers();
    }

    /**
     * Single-flight refresh: concurrent callers share one upstream call and its outcome.
     */
    CacheEntry refresh(String apiKey) {
        return refreshFlight.execute(() -> fetchAndStore(apiKey));
    }

    private CacheEntry fetchAndStore(String apiKey) {
        long startMillis = clock.millis();
        List<Map<String, Object>> records;
        try {
            records = martaApi.fetchArrivals(apiKey);
        } catch (RuntimeException e) {
            long duration = clock.millis() - startMillis;
            monitoringService.recordRefresh(duration, MonitoringService.FAILED);
            UpstreamException failure = e instanceof UpstreamException
                    ? (UpstreamException) e
                    : UpstreamException.of(UpstreamException.INTERNAL_ERROR_STATUS, e.getMessage(), e);
            log.error("❌ REFRESH FAILED | MARTA status {} | {} | Took: {}ms",
                    failure.getStatus(), failure.getDetail(), duration);

            if (cache.get().isPopulated() && failure.isRetryable()) {
                armRetry(apiKey);
            }
            throw failure;
        }

        CacheEntry entry = CacheEntry.of(records, clock.instant());
        cache.set(entry);
        retryLoop.disarm();

        long duration = clock.millis() - startMillis;
        monitoringService.recordRefresh(duration, MonitoringService.SUCCESS);
        log.info("✅ REFRESH OK | {} arrivals cached | Took: {}ms", entry.getPayload().size(), duration);
        return entry;
    }

    private ArrivalsResult serveStale(CacheEntry entry, UpstreamException failure) {
        long ageMs = entry.ageMillis(clock.instant());
        log.warn("CACHE: 🟡 STALE | MARTA error {} | Serving {} arrivals aged {}ms",
                failure.getStatus(), entry.getPayload().size(), ageMs);
        monitoringService.recordLookup(MonitoringService.STALE);
        return ArrivalsResult.stale(entry.getPayload(), ageMs, STALE_MESSAGE);
    }

    private void armRetry(String apiKey) {
        retryLoop.arm(() -> retry(apiKey));
    }

    private void retry(String apiKey) {
        monitoringService.recordRetry();
        log.info("🔁 Retrying MARTA refresh in background...");
        try {
            refresh(apiKey);
        } catch (UpstreamException e) {
            log.warn("🔁 Background retry failed with status {}. Re-arming.", e.getStatus());
            armRetry(apiKey);
        }
    }

    private void requireCredential(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            log.error("❌ MARTA API key is not configured");
            throw new MissingCredentialException();
        }
    }
}
