package com.letably.reporting.domain;

import com.letably.security.AgencyId;
import com.letably.security.CallerContext;

/**
 * A validated report request: the report to run, who asked for it, and the effective filters
 * and options after defaults and role rules were applied.
 *
 * <p>Built per call by {@link com.letably.reporting.service.ReportService#createRequest} and
 * never persisted.
 */
public record ReportRequest(ReportType type, CallerContext caller, ReportFilters filters, ReportOptions options) {

    public ReportRequest {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (caller == null) {
            throw new IllegalArgumentException("caller must not be null");
        }
        if (filters == null) {
            filters = type.defaultFilters();
        }
        if (options == null) {
            options = type.defaultOptions();
        }
    }

    /** Agency the report runs under, taken from the caller. */
    public AgencyId agencyId() {
        return caller.agencyId();
    }

    /** Whether this is an agency-wide report by an admin (no landlord filter). */
    public boolean isAgencyWide() {
        return caller.isAdmin() && filters.landlordId() == null;
    }
}
