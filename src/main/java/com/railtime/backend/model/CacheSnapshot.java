package com.railtime.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheSnapshot {
    private boolean populated;
    private int recordCount;
    private Instant fetchedAt;
    private Long ageMs;
    private boolean fresh;
    private long ttlMs;
    private boolean refreshInFlight;
    private boolean retryArmed;
    private CacheStatistics statistics;
}
