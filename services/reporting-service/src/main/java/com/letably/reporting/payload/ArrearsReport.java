package com.letably.reporting.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.letably.reporting.domain.ReportType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Tenants owing rent, largest debt first.
 */
public record ArrearsReport(List<TenantArrears> tenants, Summary summary, Instant generatedAt)
        implements ReportPayload {

    public ArrearsReport {
        tenants = List.copyOf(tenants);
    }

    @Override
    public ReportType reportType() {
        return ReportType.ARREARS;
    }

    /**
     * One tenancy member in arrears.
     *
     * @param overduePayments schedules counted towards the arrears
     * @param totalArrears    amount due minus amount paid over those schedules, always positive
     * @param oldestDueDate   earliest due date among them
     * @param daysOverdue     days from the oldest due date to today
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TenantArrears(
            long memberId,
            String tenantName,
            String tenantEmail,
            String tenantPhone,
            String propertyAddress,
            String bedroomName,
            long tenancyId,
            long overduePayments,
            BigDecimal totalArrears,
            LocalDate oldestDueDate,
            long daysOverdue,
            Long landlordId,
            String landlordName) {
    }

    public record Summary(long tenantsInArrears, BigDecimal totalArrears, long totalOverduePayments) {
    }
}
