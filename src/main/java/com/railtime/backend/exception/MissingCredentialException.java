package com.railtime.backend.exception;

/**
 * Raised when no MARTA API key is configured. Checked before any cache logic runs.
 */
public class MissingCredentialException extends RuntimeException {

    public MissingCredentialException() {
        super("Missing credential");
    }
}
