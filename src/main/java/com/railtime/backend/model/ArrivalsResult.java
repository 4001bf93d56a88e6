package com.railtime.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArrivalsResult {
    private List<Map<String, Object>> data; // upstream records, passed through verbatim
    private CacheStatus cache;
    private String message; // only set when serving stale data

    public static ArrivalsResult fresh(List<Map<String, Object>> data, long ageMs) {
        return ArrivalsResult.builder()
                .data(data)
                .cache(CacheStatus.builder().hit(true).stale(false).ageMs(ageMs).build())
                .build();
    }

    public static ArrivalsResult refreshed(List<Map<String, Object>> data) {
        return ArrivalsResult.builder()
                .data(data)
                .cache(CacheStatus.builder().hit(false).stale(false).ageMs(0L).build())
                .build();
    }

    public static ArrivalsResult stale(List<Map<String, Object>> data, long ageMs, String message) {
        return ArrivalsResult.builder()
                .data(data)
                .cache(CacheStatus.builder().hit(true).stale(true).ageMs(ageMs).build())
                .message(message)
                .build();
    }
}
