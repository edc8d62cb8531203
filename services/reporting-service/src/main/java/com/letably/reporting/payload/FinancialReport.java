package com.letably.reporting.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.letably.reporting.domain.ReportType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Rent due and collected for one year, or for one month of it.
 *
 * <p>A single-month report carries {@code month} and {@code data}; a full-year report carries
 * twelve {@code monthly} rows and the {@code annual} total, which is the sum of those rows.
 *
 * @param byProperty per-property totals for the same period; absent when not requested
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FinancialReport(
        int year,
        Integer month,
        Totals data,
        List<Totals> monthly,
        Totals annual,
        List<PropertyTotals> byProperty,
        Instant generatedAt) implements ReportPayload {

    public FinancialReport {
        monthly = monthly == null ? null : List.copyOf(monthly);
        byProperty = byProperty == null ? null : List.copyOf(byProperty);
    }

    @Override
    public ReportType reportType() {
        return ReportType.FINANCIAL;
    }

    /**
     * Totals of one month, or of the whole year when {@code month} is {@code null}.
     *
     * @param monthName      short English month name, {@code null} for the annual row
     * @param paymentCount   payment schedules due
     * @param paidCount      schedules marked paid
     * @param overdueCount   schedules overdue, or unpaid and past due
     * @param collectionRate paid share of due in whole percent
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Totals(
            Integer month,
            String monthName,
            BigDecimal totalDue,
            BigDecimal totalPaid,
            BigDecimal outstanding,
            long paymentCount,
            long paidCount,
            long overdueCount,
            int collectionRate) {
    }

    /**
     * One property's totals.
     *
     * @param tenantCount distinct tenancy members with a schedule in the period
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PropertyTotals(
            long id,
            String address,
            BigDecimal totalDue,
            BigDecimal totalPaid,
            BigDecimal outstanding,
            long tenantCount,
            Long landlordId,
            String landlordName) {
    }
}
