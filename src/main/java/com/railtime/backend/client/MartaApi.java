package com.railtime.backend.client;

import java.util.List;
import java.util.Map;

/**
 * Upstream fetcher for MARTA real-time rail arrivals.
 * Implementations throw {@link com.railtime.backend.exception.UpstreamException} on failure.
 */
public interface MartaApi {
    List<Map<String, Object>> fetchArrivals(String apiKey);
}
