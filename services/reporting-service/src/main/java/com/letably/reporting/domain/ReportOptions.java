package com.letably.reporting.domain;

/**
 * Presentation switches of a report request. A {@code null} switch takes the report's default.
 *
 * @param includeLandlordInfo add landlord id and name to rows (default off; forced on for an
 *                            admin running an unfiltered report)
 * @param includeNextTenant   occupancy: show the next tenant of each room (default on)
 * @param includeRoomDetails  portfolio: list every bedroom (default on)
 * @param groupByProperty     financial: add the per-property breakdown (default on)
 */
public record ReportOptions(
        Boolean includeLandlordInfo,
        Boolean includeNextTenant,
        Boolean includeRoomDetails,
        Boolean groupByProperty) {

    /** Defaults shared by every report. */
    public static ReportOptions defaults() {
        return new ReportOptions(false, true, true, true);
    }

    /** No options set. */
    public static ReportOptions none() {
        return new ReportOptions(null, null, null, null);
    }

    /**
     * Fills every switch left {@code null} here from {@code defaults}.
     */
    public ReportOptions withDefaults(ReportOptions defaults) {
        return new ReportOptions(
                includeLandlordInfo != null ? includeLandlordInfo : defaults.includeLandlordInfo,
                includeNextTenant != null ? includeNextTenant : defaults.includeNextTenant,
                includeRoomDetails != null ? includeRoomDetails : defaults.includeRoomDetails,
                groupByProperty != null ? groupByProperty : defaults.groupByProperty);
    }

    public ReportOptions withIncludeLandlordInfo(Boolean value) {
        return new ReportOptions(value, includeNextTenant, includeRoomDetails, groupByProperty);
    }

    public ReportOptions withIncludeNextTenant(Boolean value) {
        return new ReportOptions(includeLandlordInfo, value, includeRoomDetails, groupByProperty);
    }

    public ReportOptions withIncludeRoomDetails(Boolean value) {
        return new ReportOptions(includeLandlordInfo, includeNextTenant, value, groupByProperty);
    }

    public ReportOptions withGroupByProperty(Boolean value) {
        return new ReportOptions(includeLandlordInfo, includeNextTenant, includeRoomDetails, value);
    }

    public boolean landlordInfo() {
        return Boolean.TRUE.equals(includeLandlordInfo);
    }

    public boolean nextTenant() {
        return !Boolean.FALSE.equals(includeNextTenant);
    }

    public boolean roomDetails() {
        return !Boolean.FALSE.equals(includeRoomDetails);
    }

    public boolean byProperty() {
        return !Boolean.FALSE.equals(groupByProperty);
    }
}
