package com.letably.reporting.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.letably.reporting.domain.ReportType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Room-by-room occupancy per property.
 */
public record OccupancyReport(List<PropertyOccupancy> properties, Summary summary, Instant generatedAt)
        implements ReportPayload {

    public OccupancyReport {
        properties = List.copyOf(properties);
    }

    @Override
    public ReportType reportType() {
        return ReportType.OCCUPANCY;
    }

    /**
     * One property. A current whole-house tenancy occupies every room.
     *
     * @param wholeHouseTenancy     current whole-house tenancy, if any
     * @param nextWholeHouseTenancy next whole-house tenancy, if any (only when next tenants are requested)
     * @param landlordId            only with landlord info
     * @param landlordName          only with landlord info; {@code Unassigned} for a property without landlord
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PropertyOccupancy(
            long id,
            String address,
            String city,
            String postcode,
            String location,
            List<Room> bedrooms,
            @JsonInclude(JsonInclude.Include.ALWAYS) WholeHouseTenancy wholeHouseTenancy,
            WholeHouseTenancy nextWholeHouseTenancy,
            Occupancy occupancy,
            Long landlordId,
            String landlordName) {

        public PropertyOccupancy {
            bedrooms = List.copyOf(bedrooms);
        }
    }

    /**
     * One bedroom with its current and next occupant.
     *
     * @param baseRent advertised rent per person per week
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Room(
            long id,
            String name,
            BigDecimal baseRent,
            boolean occupied,
            @JsonInclude(JsonInclude.Include.ALWAYS) Occupant tenant,
            Occupant nextTenant) {
    }

    /** A tenancy member living in, or about to move into, a room. */
    public record Occupant(String name, BigDecimal rentPppw, LocalDate tenancyStart, LocalDate tenancyEnd) {
    }

    /**
     * A whole-house tenancy.
     *
     * @param tenants   member names joined with ", "
     * @param totalRent sum of the members' weekly rent
     */
    public record WholeHouseTenancy(
            long id,
            String tenants,
            long tenantCount,
            BigDecimal totalRent,
            LocalDate startDate,
            LocalDate endDate) {
    }

    /** Occupied rooms, all rooms and the occupied share in whole percent. */
    public record Occupancy(long occupied, long total, int rate) {
    }

    public record Summary(long properties, long bedrooms, long occupied, long vacant, int occupancyRate) {
    }
}
