package com.letably.reporting.generator;

import com.letably.database.ResultRow;
import com.letably.database.gateway.ExecutionGateway;
import com.letably.database.query.QueryBuilder;
import com.letably.reporting.domain.ReportFilters;
import com.letably.reporting.domain.ReportOptions;
import com.letably.reporting.domain.ReportRequest;
import com.letably.reporting.domain.ReportType;
import com.letably.reporting.payload.OccupancyReport;
import com.letably.reporting.payload.OccupancyReport.Occupancy;
import com.letably.reporting.payload.OccupancyReport.Occupant;
import com.letably.reporting.payload.OccupancyReport.PropertyOccupancy;
import com.letably.reporting.payload.OccupancyReport.Room;
import com.letably.reporting.payload.OccupancyReport.Summary;
import com.letably.reporting.payload.OccupancyReport.WholeHouseTenancy;
import com.letably.security.AgencyId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Occupancy per property and room.
 *
 * <p>Runs four queries (properties, rooms, current and next whole-house tenancies) and stitches
 * them together by property id rather than querying per property. A property with a current
 * whole-house tenancy counts every room as occupied.
 */
@Component
public class OccupancyReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(OccupancyReportGenerator.class);

    private final ExecutionGateway gateway;
    private final Clock clock;

    public OccupancyReportGenerator(ExecutionGateway gateway, Clock clock) {
        this.gateway = gateway;
        this.clock = clock;
    }

    @Override
    public ReportType type() {
        return ReportType.OCCUPANCY;
    }

    @Override
    public OccupancyReport generate(ReportRequest request, AgencyId agencyId) {
        ReportFilters filters = request.filters();
        ReportOptions options = request.options();

        List<ResultRow> properties = gateway.scopedQuery(propertyQuery(filters), agencyId);
        Map<Long, List<Room>> roomsByProperty = new HashMap<>();
        for (ResultRow row : gateway.scopedQuery(roomQuery(filters, options.nextTenant()), agencyId)) {
            roomsByProperty.computeIfAbsent(row.getLong("property_id"), id -> new ArrayList<>())
                    .add(toRoom(row, options.nextTenant()));
        }
        Map<Long, WholeHouseTenancy> currentHouses =
                wholeHouseTenancies(wholeHouseQuery(filters, false), agencyId);
        Map<Long, WholeHouseTenancy> nextHouses = options.nextTenant()
                ? wholeHouseTenancies(wholeHouseQuery(filters, true), agencyId)
                : Map.of();

        List<PropertyOccupancy> result = new ArrayList<>(properties.size());
        long totalRooms = 0;
        long totalOccupied = 0;
        for (ResultRow property : properties) {
            long id = property.getLong("id");
            List<Room> rooms = roomsByProperty.getOrDefault(id, List.of());
            WholeHouseTenancy house = currentHouses.get(id);
            long occupied = house != null ? rooms.size() : rooms.stream().filter(Room::occupied).count();
            totalRooms += rooms.size();
            totalOccupied += occupied;

            result.add(new PropertyOccupancy(
                    id,
                    ReportQueries.address(property.getString("address_line1"), property.getString("address_line2")),
                    property.getString("city"),
                    property.getString("postcode"),
                    property.getString("location"),
                    rooms,
                    house,
                    nextHouses.get(id),
                    new Occupancy(occupied, rooms.size(), Money.percent(occupied, rooms.size())),
                    options.landlordInfo() ? property.getLong("landlord_id") : null,
                    options.landlordInfo() ? ReportQueries.landlordName(property.getString("landlord_name")) : null));
        }

        log.debug("Occupancy for {}: {} properties, {}/{} rooms occupied",
                agencyId, result.size(), totalOccupied, totalRooms);

        Summary summary = new Summary(result.size(), totalRooms, totalOccupied, totalRooms - totalOccupied,
                Money.percent(totalOccupied, totalRooms));
        return new OccupancyReport(result, summary, Instant.now(clock));
    }

    QueryBuilder propertyQuery(ReportFilters filters) {
        return QueryBuilder.create(clock)
                .select("p.id", "p.address_line1", "p.address_line2", "p.city", "p.postcode", "p.location",
                        "p.landlord_id", "l.name AS landlord_name")
                .from("properties", "p")
                .leftJoin("landlords", "l", "p.landlord_id = l.id")
                .whereLandlord(filters.landlordId())
                .whereProperty(filters.propertyId())
                .orderBy("p.address_line1")
                .orderBy("p.id");
    }

    QueryBuilder roomQuery(ReportFilters filters, boolean includeNext) {
        QueryBuilder query = ReportQueries.withCurrentOccupant(QueryBuilder.create(clock), filters.tenancyStatus());
        if (includeNext) {
            query = ReportQueries.withNextOccupant(query);
        }
        query = query
                .select("b.id", "b.property_id", "b.bedroom_name", "b.price_pppw",
                        "co.first_name AS current_first_name", "co.surname AS current_surname",
                        "co.rent_pppw AS current_rent", "co.start_date AS current_start", "co.end_date AS current_end")
                .from("bedrooms", "b")
                .join("properties", "p", "b.property_id = p.id")
                .leftJoin(ReportQueries.CURRENT_OCCUPANT, "co", "co.bedroom_id = b.id AND co.rn = ?", 1);
        if (includeNext) {
            query = query
                    .select("nx.first_name AS next_first_name", "nx.surname AS next_surname",
                            "nx.rent_pppw AS next_rent", "nx.start_date AS next_start", "nx.end_date AS next_end")
                    .leftJoin(ReportQueries.NEXT_OCCUPANT, "nx", "nx.bedroom_id = b.id AND nx.rn = ?", 1);
        }
        return query
                .whereLandlord(filters.landlordId())
                .whereProperty(filters.propertyId())
                .orderBy("b.property_id")
                .orderBy("b.display_order")
                .orderBy("b.id");
    }

    QueryBuilder wholeHouseQuery(ReportFilters filters, boolean upcoming) {
        QueryBuilder query = upcoming
                ? ReportQueries.withNextWholeHouse(QueryBuilder.create(clock))
                : ReportQueries.withCurrentWholeHouse(QueryBuilder.create(clock), filters.tenancyStatus());
        return query
                .select("h.id", "h.property_id", "h.start_date", "h.end_date",
                        "STRING_AGG(tm.first_name || ' ' || tm.surname, ', ') AS tenants",
                        "COUNT(tm.id) AS tenant_count",
                        "SUM(tm.rent_pppw) AS total_rent")
                .from(upcoming ? ReportQueries.NEXT_HOUSE : ReportQueries.CURRENT_HOUSE, "h")
                .join("properties", "p", "h.property_id = p.id")
                .join("tenancy_members", "tm", "tm.tenancy_id = h.id")
                .where("h.rn = ?", 1)
                .whereLandlord(filters.landlordId())
                .whereProperty(filters.propertyId())
                .groupBy("h.id", "h.property_id", "h.start_date", "h.end_date");
    }

    private Map<Long, WholeHouseTenancy> wholeHouseTenancies(QueryBuilder query, AgencyId agencyId) {
        Map<Long, WholeHouseTenancy> byProperty = new LinkedHashMap<>();
        for (ResultRow row : gateway.scopedQuery(query, agencyId)) {
            byProperty.put(row.getLong("property_id"), new WholeHouseTenancy(
                    row.getLong("id"),
                    row.getString("tenants"),
                    row.getLongOrZero("tenant_count"),
                    Money.amount(row.getBigDecimal("total_rent")),
                    row.getLocalDate("start_date"),
                    row.getLocalDate("end_date")));
        }
        return byProperty;
    }

    private static Room toRoom(ResultRow row, boolean includeNext) {
        Occupant current = occupant(row, "current");
        Occupant next = includeNext ? occupant(row, "next") : null;
        return new Room(
                row.getLong("id"),
                row.getString("bedroom_name"),
                row.getBigDecimal("price_pppw") == null ? null : Money.amount(row.getBigDecimal("price_pppw")),
                current != null,
                current,
                next);
    }

    private static Occupant occupant(ResultRow row, String prefix) {
        String name = ReportQueries.fullName(row.getString(prefix + "_first_name"), row.getString(prefix + "_surname"));
        if (name == null) {
            return null;
        }
        BigDecimal rent = row.getBigDecimal(prefix + "_rent");
        return new Occupant(name, rent == null ? null : Money.amount(rent),
                row.getLocalDate(prefix + "_start"), row.getLocalDate(prefix + "_end"));
    }
}
