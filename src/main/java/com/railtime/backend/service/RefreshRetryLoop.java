package com.railtime.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Background retry timer for failed cache refreshes.
 * <p>
 * At most one attempt is armed at a time. The armed attempt runs once after the
 * retry interval; whoever supplied it decides whether to arm again. Disarming
 * cancels the pending attempt, and an attempt that was already handed to the
 * scheduler when it got disarmed does not run.
 */
@Component
@Slf4j
public class RefreshRetryLoop {

    private final TaskScheduler scheduler;
    private final Duration retryInterval;

    private Object armedToken;
    private ScheduledFuture<?> pending;

    public RefreshRetryLoop(@Qualifier("martaRetryScheduler") TaskScheduler scheduler,
            @Value("${marta.cache.retry-interval-ms:2000}") long retryIntervalMs) {
        this.scheduler = scheduler;
        this.retryInterval = Duration.ofMillis(retryIntervalMs);
    }

    /**
     * Arms a retry attempt unless one is already armed.
     *
     * @return true if this call armed the timer
     */
    public synchronized boolean arm(Runnable attempt) {
        if (armedToken != null) {
            return false;
        }
        Object token = new Object();
        armedToken = token;
        pending = scheduler.schedule(() -> fire(token, attempt), Instant.now().plus(retryInterval));
        log.info("⏰ Retry armed | Fires in {}ms", retryInterval.toMillis());
        return true;
    }

    /**
     * Cancels the armed attempt, if any.
     *
     * @return true if an attempt was armed
     */
    public synchronized boolean disarm() {
        if (armedToken == null) {
            return false;
        }
        if (pending != null) {
            pending.cancel(false);
        }
        armedToken = null;
        pending = null;
        log.info("🛑 Retry disarmed");
        return true;
    }

    public synchronized boolean isArmed() {
        return armedToken != null;
    }

    public Duration getRetryInterval() {
        return retryInterval;
    }

    private void fire(Object token, Runnable attempt) {
        synchronized (this) {
            if (armedToken != token) {
                return;
            }
            armedToken = null;
            pending = null;
        }
        attempt.run();
    }
}
