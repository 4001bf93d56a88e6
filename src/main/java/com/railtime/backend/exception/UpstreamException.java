package com.railtime.backend.exception;

import com.railtime.backend.util.UpstreamUtils;
import lombok.Getter;

/**
 * Failure reported by the MARTA upstream. Carries the HTTP status and a
 * diagnostic body already capped at {@link UpstreamUtils#MAX_DETAIL_LENGTH}.
 */
@Getter
public abstract class UpstreamException extends RuntimeException {

    public static final int INTERNAL_ERROR_STATUS = 500;

    private final int status;
    private final String detail;

    protected UpstreamException(int status, String detail, Throwable cause) {
        super("MARTA API error (" + status + ").", cause);
        this.status = status;
        this.detail = UpstreamUtils.truncateDetail(detail);
    }

    /**
     * Classifies a failure by status: 500 is transient, everything else is permanent.
     */
    public static UpstreamException of(int status, String detail) {
        return of(status, detail, null);
    }

    public static UpstreamException of(int status, String detail, Throwable cause) {
        if (status == INTERNAL_ERROR_STATUS) {
            return new UpstreamTransientException(detail, cause);
        }
        return new UpstreamPermanentException(status, detail, cause);
    }

    public abstract boolean isRetryable();
}
