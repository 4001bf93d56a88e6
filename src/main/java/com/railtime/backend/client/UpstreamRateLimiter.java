package com.railtime.backend.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Rate limiter that keeps a minimum gap between MARTA API requests.
 */
@Component
@Slf4j
public class UpstreamRateLimiter {

    private final long minRequestIntervalMs;

    private long nextAvailableTime = System.currentTimeMillis();

    public UpstreamRateLimiter(@Value("${marta.api.min-request-interval-ms:1000}") long minRequestIntervalMs) {
        this.minRequestIntervalMs = minRequestIntervalMs;
    }

    /**
     * Blocks until a request permit is available.
     * Thread-safe.
     */
    public synchronized void acquire() {
        if (minRequestIntervalMs <= 0) {
            return;
        }
        long now = System.currentTimeMillis();
        if (now < nextAvailableTime) {
            long waitTime = nextAvailableTime - now;
            log.debug("⏳ Upstream rate limit: waiting {}ms", waitTime);
            try {
                TimeUnit.MILLISECONDS.sleep(waitTime);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("⚠️ Rate limiter interrupted during wait", e);
            }
            // Advance relative to the planned time to keep cadence
            nextAvailableTime += minRequestIntervalMs;
        } else {
            nextAvailableTime = now + minRequestIntervalMs;
        }
    }
}
