package com.letably.reporting.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.letably.reporting.domain.ReportType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Portfolio overview.
 *
 * @param properties       number of properties
 * @param bedrooms         number of bedrooms
 * @param occupiedBedrooms bedrooms with a current occupant
 * @param vacantBedrooms   bedrooms without one
 * @param occupancyRate    occupied share in whole percent
 * @param activeTenancies  tenancies with status active
 * @param totalTenants     members of active tenancies
 * @param landlordCount    landlords of the agency; only for an agency-wide admin report
 * @param bedroomDetails   one row per bedroom; absent when room details are switched off
 * @param generatedAt      generation time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PortfolioReport(
        long properties,
        long bedrooms,
        long occupiedBedrooms,
        long vacantBedrooms,
        int occupancyRate,
        long activeTenancies,
        long totalTenants,
        Long landlordCount,
        List<BedroomDetail> bedroomDetails,
        Instant generatedAt) implements ReportPayload {

    public PortfolioReport {
        bedroomDetails = bedroomDetails == null ? null : List.copyOf(bedroomDetails);
    }

    @Override
    public ReportType reportType() {
        return ReportType.PORTFOLIO;
    }

    /**
     * One bedroom and its current occupant, if any. The landlord name is only present when
     * landlord info was requested.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BedroomDetail(
            long id,
            String bedroomName,
            String addressLine1,
            boolean occupied,
            @JsonInclude(JsonInclude.Include.ALWAYS) String tenantName,
            @JsonInclude(JsonInclude.Include.ALWAYS) LocalDate tenancyEndDate,
            String landlordName) {
    }
}
