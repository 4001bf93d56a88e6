package com.railtime.backend.exception;

/**
 * Upstream-internal (500) failure. Retried in the background while stale data can be served.
 */
public class UpstreamTransientException extends UpstreamException {

    public UpstreamTransientException(String detail, Throwable cause) {
        super(INTERNAL_ERROR_STATUS, detail, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
