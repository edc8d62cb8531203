package com.letably.reporting.domain;

/**
 * Caller-supplied filters of a report request. Every field is optional; a {@code null} field
 * means "not filtered" unless the report's defaults supply a value.
 *
 * <p>There is deliberately no agency field: the agency always comes from the authenticated
 * caller.
 *
 * @param landlordId    restrict to one landlord's properties
 * @param propertyId    restrict to one property
 * @param daysAhead     window for upcoming endings, in days from today
 * @param year          financial year (calendar year of the due date)
 * @param month         financial month, 1 to 12
 * @param tenancyStatus tenancy status, or {@code all}
 * @param paymentStatus payment status for arrears, or {@code all}
 */
public record ReportFilters(
        Long landlordId,
        Long propertyId,
        Integer daysAhead,
        Integer year,
        Integer month,
        String tenancyStatus,
        String paymentStatus) {

    public ReportFilters {
        if (daysAhead != null && daysAhead < 0) {
            throw new IllegalArgumentException("daysAhead must not be negative, was " + daysAhead);
        }
        if (month != null && (month < 1 || month > 12)) {
            throw new IllegalArgumentException("month must be between 1 and 12, was " + month);
        }
    }

    /** No filters at all. */
    public static ReportFilters none() {
        return new ReportFilters(null, null, null, null, null, null, null);
    }

    /**
     * Fills every field left {@code null} here from {@code defaults}.
     */
    public ReportFilters withDefaults(ReportFilters defaults) {
        return new ReportFilters(
                landlordId != null ? landlordId : defaults.landlordId,
                propertyId != null ? propertyId : defaults.propertyId,
                daysAhead != null ? daysAhead : defaults.daysAhead,
                year != null ? year : defaults.year,
                month != null ? month : defaults.month,
                tenancyStatus != null ? tenancyStatus : defaults.tenancyStatus,
                paymentStatus != null ? paymentStatus : defaults.paymentStatus);
    }

    public ReportFilters withLandlordId(Long value) {
        return new ReportFilters(value, propertyId, daysAhead, year, month, tenancyStatus, paymentStatus);
    }

    public ReportFilters withPropertyId(Long value) {
        return new ReportFilters(landlordId, value, daysAhead, year, month, tenancyStatus, paymentStatus);
    }

    public ReportFilters withDaysAhead(Integer value) {
        return new ReportFilters(landlordId, propertyId, value, year, month, tenancyStatus, paymentStatus);
    }

    public ReportFilters withYear(Integer value) {
        return new ReportFilters(landlordId, propertyId, daysAhead, value, month, tenancyStatus, paymentStatus);
    }

    public ReportFilters withMonth(Integer value) {
        return new ReportFilters(landlordId, propertyId, daysAhead, year, value, tenancyStatus, paymentStatus);
    }

    public ReportFilters withTenancyStatus(String value) {
        return new ReportFilters(landlordId, propertyId, daysAhead, year, month, value, paymentStatus);
    }

    public ReportFilters withPaymentStatus(String value) {
        return new ReportFilters(landlordId, propertyId, daysAhead, year, month, tenancyStatus, value);
    }
}
