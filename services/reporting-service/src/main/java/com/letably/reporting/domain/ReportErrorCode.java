package com.letably.reporting.domain;

/** Reasons a report request is rejected before any query runs. */
public enum ReportErrorCode {

    /** No report with the requested code. */
    INVALID_REPORT_TYPE,

    /** The caller's role may not run the report. */
    ACCESS_DENIED,

    /** A landlord caller without a landlord id. */
    MISSING_LANDLORD_ID,

    /** The caller carries no agency. */
    MISSING_AGENCY_ID
}
