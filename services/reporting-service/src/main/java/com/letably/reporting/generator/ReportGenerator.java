package com.letably.reporting.generator;

import com.letably.reporting.domain.ReportRequest;
import com.letably.reporting.domain.ReportType;
import com.letably.reporting.payload.ReportPayload;
import com.letably.security.AgencyId;

/**
 * Produces one kind of report.
 *
 * <p>Implementations compose their queries with {@link com.letably.database.query.QueryBuilder}
 * and run every one of them through
 * {@link com.letably.database.gateway.ExecutionGateway#scopedQuery} with the agency passed in, so
 * a generator can never see another agency's rows. Gateway failures propagate unchanged.
 */
public interface ReportGenerator {

    /** The report this generator produces. */
    ReportType type();

    /**
     * Generates the report.
     *
     * @param request  validated request; the landlord filter is already forced for landlord callers
     * @param agencyId agency of the authenticated caller
     * @return the payload
     */
    ReportPayload generate(ReportRequest request, AgencyId agencyId);
}
