package com.railtime.backend.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the upstream payload. Immutable; a refresh replaces the whole entry.
 */
@Getter
public final class CacheEntry {

    public static final CacheEntry EMPTY = new CacheEntry(null, null);

    private final List<Map<String, Object>> payload;
    private final Instant fetchedAt;

    private CacheEntry(List<Map<String, Object>> payload, Instant fetchedAt) {
        this.payload = payload;
        this.fetchedAt = fetchedAt;
    }

    public static CacheEntry of(List<Map<String, Object>> payload, Instant fetchedAt) {
        List<Map<String, Object>> records = payload == null ? List.of() : new ArrayList<>(payload);
        return new CacheEntry(Collections.unmodifiableList(records), fetchedAt);
    }

    public boolean isPopulated() {
        return payload != null;
    }

    public long ageMillis(Instant now) {
        return fetchedAt == null ? 0L : now.toEpochMilli() - fetchedAt.toEpochMilli();
    }

    public boolean isFresh(Instant now, long ttlMs) {
        return isPopulated() && ageMillis(now) < ttlMs;
    }
}
