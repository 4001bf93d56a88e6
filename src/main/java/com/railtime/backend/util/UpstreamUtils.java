package com.railtime.backend.util;

public class UpstreamUtils {

    // Upstream error bodies are capped before they reach logs or API responses
    public static final int MAX_DETAIL_LENGTH = 500;

    public static final String NO_RESPONSE_BODY = "No response body.";

    public static final String UNKNOWN_ERROR = "Unknown error.";

    public static String truncateDetail(String detail) {
        if (detail == null || detail.isEmpty()) {
            return NO_RESPONSE_BODY;
        }
        return detail.length() > MAX_DETAIL_LENGTH ? detail.substring(0, MAX_DETAIL_LENGTH) : detail;
    }
}
