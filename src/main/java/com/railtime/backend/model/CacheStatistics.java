package com.railtime.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {
    private long freshHits;
    private long staleServes;
    private long misses;
    private long upstreamCalls;
    private long upstreamFailures;
    private long retriesFired;
    private Long lastRefreshDurationMs;
}
