package com.railtime.backend.exception;

public class UpstreamPermanentException extends UpstreamException {

    public UpstreamPermanentException(int status, String detail, Throwable cause) {
        super(status, detail, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
