package com.railtime.backend.service;

import com.railtime.backend.model.CacheStatistics;

public interface MonitoringService {

    String HIT = "HIT";
    String STALE = "STALE";
    String MISS = "MISS";

    String SUCCESS = "SUCCESS";
    String FAILED = "FAILED";

    /**
     * Records how a cache lookup was answered.
     *
     * @param outcome One of {@link #HIT}, {@link #STALE} or {@link #MISS}
     */
    void recordLookup(String outcome);

    /**
     * Records the duration and status of one upstream refresh.
     *
     * @param durationMs The duration of the upstream call in milliseconds
     * @param status     {@link #SUCCESS} or {@link #FAILED}
     */
    void recordRefresh(long durationMs, String status);

    /**
     * Records that the background retry timer fired.
     */
    void recordRetry();

    CacheStatistics getStatistics();
}
