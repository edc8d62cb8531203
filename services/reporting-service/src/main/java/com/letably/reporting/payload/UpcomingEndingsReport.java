package com.letably.reporting.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.letably.reporting.domain.ReportType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Tenancies ending within the requested window, soonest first.
 */
public record UpcomingEndingsReport(List<EndingTenancy> tenancies, Summary summary, Instant generatedAt)
        implements ReportPayload {

    public UpcomingEndingsReport {
        tenancies = List.copyOf(tenancies);
    }

    @Override
    public ReportType reportType() {
        return ReportType.UPCOMING_ENDINGS;
    }

    /**
     * @param tenants         member names joined with ", "
     * @param totalWeeklyRent sum of the members' weekly rent
     * @param daysUntilEnd    days from today to the end date
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EndingTenancy(
            long tenancyId,
            LocalDate endDate,
            String status,
            boolean rollingMonthly,
            String propertyAddress,
            long propertyId,
            String tenants,
            long tenantCount,
            BigDecimal totalWeeklyRent,
            long daysUntilEnd,
            Long landlordId,
            String landlordName) {
    }

    /**
     * @param potentialRentLoss weekly rent of all ending tenancies combined
     */
    public record Summary(long endingCount, BigDecimal potentialRentLoss) {
    }
}
