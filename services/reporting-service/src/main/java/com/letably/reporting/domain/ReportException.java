package com.letably.reporting.domain;

/**
 * Thrown when a report request fails validation. Carries a {@link ReportErrorCode} the HTTP layer
 * maps to a status (404 for an unknown report, 403 for access, 400 otherwise).
 */
public class ReportException extends RuntimeException {

    private final ReportErrorCode code;

    public ReportException(ReportErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ReportErrorCode code() {
        return code;
    }
}
