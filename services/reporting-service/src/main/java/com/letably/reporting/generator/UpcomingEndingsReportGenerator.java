package com.letably.reporting.generator;

import com.letably.database.ResultRow;
import com.letably.database.gateway.ExecutionGateway;
import com.letably.database.query.QueryBuilder;
import com.letably.reporting.domain.ReportFilters;
import com.letably.reporting.domain.ReportRequest;
import com.letably.reporting.domain.ReportType;
import com.letably.reporting.payload.UpcomingEndingsReport;
import com.letably.reporting.payload.UpcomingEndingsReport.EndingTenancy;
import com.letably.reporting.payload.UpcomingEndingsReport.Summary;
import com.letably.security.AgencyId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Tenancies whose end date falls in {@code (today, today + daysAhead]}, soonest first.
 */
@Component
public class UpcomingEndingsReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(UpcomingEndingsReportGenerator.class);

    static final int DEFAULT_DAYS_AHEAD = 90;

    private final ExecutionGateway gateway;
    private final Clock clock;

    public UpcomingEndingsReportGenerator(ExecutionGateway gateway, Clock clock) {
        this.gateway = gateway;
        this.clock = clock;
    }

    @Override
    public ReportType type() {
        return ReportType.UPCOMING_ENDINGS;
    }

    @Override
    public UpcomingEndingsReport generate(ReportRequest request, AgencyId agencyId) {
        LocalDate today = LocalDate.now(clock);
        boolean landlordInfo = request.options().landlordInfo();

        List<EndingTenancy> tenancies = new ArrayList<>();
        BigDecimal weeklyRent = BigDecimal.ZERO;
        for (ResultRow row : gateway.scopedQuery(endingsQuery(request.filters()), agencyId)) {
            LocalDate endDate = row.getLocalDate("end_date");
            BigDecimal rent = Money.amount(row.getBigDecimal("total_weekly_rent"));
            tenancies.add(new EndingTenancy(
                    row.getLong("tenancy_id"),
                    endDate,
                    row.getString("status"),
                    Boolean.TRUE.equals(row.getBoolean("is_rolling_monthly")),
                    ReportQueries.address(row.getString("address_line1"), row.getString("address_line2")),
                    row.getLong("property_id"),
                    row.getString("tenants"),
                    row.getLongOrZero("tenant_count"),
                    rent,
                    ChronoUnit.DAYS.between(today, endDate),
                    landlordInfo ? row.getLong("landlord_id") : null,
                    landlordInfo ? ReportQueries.landlordName(row.getString("landlord_name")) : null));
            weeklyRent = weeklyRent.add(rent);
        }

        log.debug("Upcoming endings for {}: {} tenancies, {} weekly rent", agencyId, tenancies.size(), weeklyRent);
        return new UpcomingEndingsReport(tenancies, new Summary(tenancies.size(), Money.amount(weeklyRent)),
                Instant.now(clock));
    }

    QueryBuilder endingsQuery(ReportFilters filters) {
        int daysAhead = filters.daysAhead() != null ? filters.daysAhead() : DEFAULT_DAYS_AHEAD;
        String tenancyStatus = filters.tenancyStatus() != null ? filters.tenancyStatus() : ReportQueries.ACTIVE;
        return QueryBuilder.create(clock)
                .select("t.id AS tenancy_id", "t.end_date", "t.status", "t.is_rolling_monthly",
                        "p.id AS property_id", "p.address_line1", "p.address_line2",
                        "p.landlord_id", "l.name AS landlord_name",
                        "STRING_AGG(tm.first_name || ' ' || tm.surname, ', ') AS tenants",
                        "COUNT(tm.id) AS tenant_count",
                        "COALESCE(SUM(tm.rent_pppw), 0) AS total_weekly_rent")
                .from("tenancies", "t")
                .join("properties", "p", "t.property_id = p.id")
                .leftJoin("landlords", "l", "p.landlord_id = l.id")
                .leftJoin("tenancy_members", "tm", "tm.tenancy_id = t.id")
                .whereTenancyStatus(tenancyStatus)
                .whereDaysAhead("t.end_date", daysAhead)
                .whereLandlord(filters.landlordId())
                .whereProperty(filters.propertyId())
                .groupBy("t.id", "t.end_date", "t.status", "t.is_rolling_monthly",
                        "p.id", "p.address_line1", "p.address_line2", "p.landlord_id", "l.name")
                .orderBy("t.end_date")
                .orderBy("t.id");
    }
}
