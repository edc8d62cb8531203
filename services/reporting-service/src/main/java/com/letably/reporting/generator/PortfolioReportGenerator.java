package com.letably.reporting.generator;

import com.letably.database.ResultRow;
import com.letably.database.gateway.ExecutionGateway;
import com.letably.database.query.QueryBuilder;
import com.letably.reporting.domain.ReportFilters;
import com.letably.reporting.domain.ReportRequest;
import com.letably.reporting.domain.ReportType;
import com.letably.reporting.payload.PortfolioReport;
import com.letably.reporting.payload.PortfolioReport.BedroomDetail;
import com.letably.security.AgencyId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Portfolio overview: property, bedroom, occupancy and tenant counts, plus one row per bedroom.
 */
@Component
public class PortfolioReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(PortfolioReportGenerator.class);

    private final ExecutionGateway gateway;
    private final Clock clock;

    public PortfolioReportGenerator(ExecutionGateway gateway, Clock clock) {
        this.gateway = gateway;
        this.clock = clock;
    }

    @Override
    public ReportType type() {
        return ReportType.PORTFOLIO;
    }

    @Override
    public PortfolioReport generate(ReportRequest request, AgencyId agencyId) {
        ReportFilters filters = request.filters();
        boolean landlordInfo = request.options().landlordInfo();

        ResultRow counts = gateway.scopedQuery(countsQuery(filters), agencyId).get(0);
        List<ResultRow> rooms = gateway.scopedQuery(bedroomQuery(filters), agencyId);

        List<BedroomDetail> details = new ArrayList<>(rooms.size());
        long occupied = 0;
        for (ResultRow room : rooms) {
            String tenant = ReportQueries.fullName(room.getString("occupant_first_name"),
                    room.getString("occupant_surname"));
            if (tenant != null) {
                occupied++;
            }
            details.add(new BedroomDetail(
                    room.getLong("id"),
                    room.getString("bedroom_name"),
                    room.getString("address_line1"),
                    tenant != null,
                    tenant,
                    room.getLocalDate("tenancy_end_date"),
                    landlordInfo ? ReportQueries.landlordName(room.getString("landlord_name")) : null));
        }

        Long landlordCount = request.isAgencyWide() ? counts.getLongOrZero("landlords") : null;

        long bedrooms = rooms.size();
        log.debug("Portfolio for {}: {} properties, {}/{} bedrooms occupied",
                agencyId, counts.getLongOrZero("properties"), occupied, bedrooms);

        return new PortfolioReport(
                counts.getLongOrZero("properties"),
                bedrooms,
                occupied,
                bedrooms - occupied,
                Money.percent(occupied, bedrooms),
                counts.getLongOrZero("active_tenancies"),
                counts.getLongOrZero("total_tenants"),
                landlordCount,
                request.options().roomDetails() ? details : null,
                Instant.now(clock));
    }

    /**
     * Property and landlord counts with the tenancy and tenant counts as scalar sub-selects. The
     * sub-selects carry their own landlord and property restriction, bound ahead of the outer WHERE.
     * Landlords are counted from the selected properties, so one without property is not counted.
     */
    QueryBuilder countsQuery(ReportFilters filters) {
        List<Object> tenancyValues = new ArrayList<>();
        tenancyValues.add(ReportQueries.ACTIVE);
        String scope = subSelectScope(filters, tenancyValues);

        return QueryBuilder.create(clock)
                .select("COUNT(*) AS properties", "COUNT(DISTINCT p.landlord_id) AS landlords")
                .selectBound("(SELECT COUNT(*) FROM tenancies st INNER JOIN properties sp ON st.property_id = sp.id "
                        + "WHERE st.status = ?" + scope + ") AS active_tenancies", tenancyValues.toArray())
                .selectBound("(SELECT COUNT(*) FROM tenancy_members sm INNER JOIN tenancies st ON sm.tenancy_id = st.id "
                        + "INNER JOIN properties sp ON st.property_id = sp.id "
                        + "WHERE st.status = ?" + scope + ") AS total_tenants", tenancyValues.toArray())
                .from("properties", "p")
                .whereLandlord(filters.landlordId())
                .whereProperty(filters.propertyId());
    }

    QueryBuilder bedroomQuery(ReportFilters filters) {
        return ReportQueries.withCurrentOccupant(QueryBuilder.create(clock), ReportQueries.ACTIVE)
                .select("b.id", "b.bedroom_name", "p.address_line1", "l.name AS landlord_name",
                        "co.first_name AS occupant_first_name", "co.surname AS occupant_surname",
                        "co.end_date AS tenancy_end_date")
                .from("bedrooms", "b")
                .join("properties", "p", "b.property_id = p.id")
                .leftJoin("landlords", "l", "p.landlord_id = l.id")
                .leftJoin(ReportQueries.CURRENT_OCCUPANT, "co", "co.bedroom_id = b.id AND co.rn = ?", 1)
                .whereLandlord(filters.landlordId())
                .whereProperty(filters.propertyId())
                .orderBy("p.address_line1")
                .orderBy("b.display_order")
                .orderBy("b.id");
    }

    private static String subSelectScope(ReportFilters filters, List<Object> values) {
        StringBuilder scope = new StringBuilder();
        if (filters.landlordId() != null) {
            scope.append(" AND sp.landlord_id = ?");
            values.add(filters.landlordId());
        }
        if (filters.propertyId() != null) {
            scope.append(" AND sp.id = ?");
            values.add(filters.propertyId());
        }
        return scope.toString();
    }
}
