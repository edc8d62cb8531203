package com.letably.reporting.generator;

import com.letably.database.ResultRow;
import com.letably.database.gateway.ExecutionGateway;
import com.letably.database.query.QueryBuilder;
import com.letably.database.query.SortDirection;
import com.letably.reporting.domain.ReportFilters;
import com.letably.reporting.domain.ReportRequest;
import com.letably.reporting.domain.ReportType;
import com.letably.reporting.payload.FinancialReport;
import com.letably.reporting.payload.FinancialReport.PropertyTotals;
import com.letably.reporting.payload.FinancialReport.Totals;
import com.letably.security.AgencyId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rent due against rent collected.
 *
 * <p>With a month filter the report covers that month only. Otherwise it has one row per calendar
 * month, zero-filled, and an annual row summed from those twelve rows in Java. There is no
 * separate annual query, so the annual row always agrees with the months.
 */
@Component
public class FinancialReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(FinancialReportGenerator.class);

    static final String PAID = "paid";
    static final String OVERDUE = "overdue";

    private final ExecutionGateway gateway;
    private final Clock clock;

    public FinancialReportGenerator(ExecutionGateway gateway, Clock clock) {
        this.gateway = gateway;
        this.clock = clock;
    }

    @Override
    public ReportType type() {
        return ReportType.FINANCIAL;
    }

    @Override
    public FinancialReport generate(ReportRequest request, AgencyId agencyId) {
        ReportFilters filters = request.filters();
        int year = filters.year() != null ? filters.year() : LocalDate.now(clock).getYear();
        Integer month = filters.month();

        Map<Integer, Totals> byMonth = new HashMap<>();
        for (ResultRow row : gateway.scopedQuery(monthlyQuery(filters, year), agencyId)) {
            int rowMonth = row.getInt("due_month");
            byMonth.put(rowMonth, totals(rowMonth,
                    row.getBigDecimal("total_due"),
                    row.getBigDecimal("total_paid"),
                    row.getLongOrZero("payment_count"),
                    row.getLongOrZero("paid_count"),
                    row.getLongOrZero("overdue_count")));
        }

        List<PropertyTotals> byProperty = null;
        if (request.options().byProperty()) {
            boolean landlordInfo = request.options().landlordInfo();
            byProperty = new ArrayList<>();
            for (ResultRow row : gateway.scopedQuery(propertyQuery(filters, year), agencyId)) {
                BigDecimal due = Money.amount(row.getBigDecimal("total_due"));
                BigDecimal paid = Money.amount(row.getBigDecimal("total_paid"));
                byProperty.add(new PropertyTotals(
                        row.getLong("id"),
                        ReportQueries.address(row.getString("address_line1"), row.getString("address_line2")),
                        due,
                        paid,
                        due.subtract(paid),
                        row.getLongOrZero("tenant_count"),
                        landlordInfo ? row.getLong("landlord_id") : null,
                        landlordInfo ? ReportQueries.landlordName(row.getString("landlord_name")) : null));
            }
        }

        Instant generatedAt = Instant.now(clock);
        if (month != null) {
            Totals data = byMonth.getOrDefault(month, empty(month));
            log.debug("Financial report for {} {}/{}: due {}, paid {}",
                    agencyId, month, year, data.totalDue(), data.totalPaid());
            return new FinancialReport(year, month, data, null, null, byProperty, generatedAt);
        }

        List<Totals> monthly = new ArrayList<>(12);
        for (int m = 1; m <= 12; m++) {
            monthly.add(byMonth.getOrDefault(m, empty(m)));
        }
        Totals annual = sum(monthly);
        log.debug("Financial report for {} {}: due {}, paid {}", agencyId, year, annual.totalDue(), annual.totalPaid());
        return new FinancialReport(year, null, null, monthly, annual, byProperty, generatedAt);
    }

    QueryBuilder monthlyQuery(ReportFilters filters, int year) {
        return ReportQueries.withPaySum(QueryBuilder.create(clock))
                .select("EXTRACT(MONTH FROM ps.due_date) AS due_month",
                        "SUM(ps.amount_due) AS total_due",
                        "SUM(COALESCE(pay.amount_paid, 0)) AS total_paid",
                        "COUNT(ps.id) AS payment_count")
                .selectBound("COUNT(CASE WHEN ps.status = ? THEN 1 END) AS paid_count", PAID)
                .selectBound("COUNT(CASE WHEN ps.status = ? OR (ps.status <> ? AND ps.due_date < ?) THEN 1 END) "
                        + "AS overdue_count", OVERDUE, PAID, LocalDate.now(clock))
                .from("payment_schedules", "ps")
                .join("tenancy_members", "tm", "ps.tenancy_member_id = tm.id")
                .join("tenancies", "t", "ps.tenancy_id = t.id")
                .join("properties", "p", "t.property_id = p.id")
                .leftJoin(ReportQueries.PAY_SUM, "pay", "pay.payment_schedule_id = ps.id")
                .whereLandlord(filters.landlordId())
                .whereProperty(filters.propertyId())
                .whereYearMonth("ps.due_date", year, filters.month())
                .groupBy("EXTRACT(MONTH FROM ps.due_date)")
                .orderBy("due_month");
    }

    /**
     * Per-property totals. The period restriction sits in the schedule join so that properties
     * with nothing due still appear with zero totals.
     */
    QueryBuilder propertyQuery(ReportFilters filters, int year) {
        String scheduleJoin = "ps.tenancy_id = t.id AND EXTRACT(YEAR FROM ps.due_date) = ?";
        Object[] periodValues = {year};
        if (filters.month() != null) {
            scheduleJoin += " AND EXTRACT(MONTH FROM ps.due_date) = ?";
            periodValues = new Object[] {year, filters.month()};
        }
        return ReportQueries.withPaySum(QueryBuilder.create(clock))
                .select("p.id", "p.address_line1", "p.address_line2", "p.landlord_id", "l.name AS landlord_name",
                        "COALESCE(SUM(ps.amount_due), 0) AS total_due",
                        "COALESCE(SUM(pay.amount_paid), 0) AS total_paid",
                        "COUNT(DISTINCT ps.tenancy_member_id) AS tenant_count")
                .from("properties", "p")
                .leftJoin("landlords", "l", "p.landlord_id = l.id")
                .leftJoin("tenancies", "t", "t.property_id = p.id")
                .leftJoin("payment_schedules", "ps", scheduleJoin, periodValues)
                .leftJoin(ReportQueries.PAY_SUM, "pay", "pay.payment_schedule_id = ps.id")
                .whereLandlord(filters.landlordId())
                .whereProperty(filters.propertyId())
                .groupBy("p.id", "p.address_line1", "p.address_line2", "p.landlord_id", "l.name")
                .orderBy("total_due", SortDirection.DESC)
                .orderBy("p.id");
    }

    static Totals totals(Integer month, BigDecimal due, BigDecimal paid,
                         long paymentCount, long paidCount, long overdueCount) {
        BigDecimal totalDue = Money.amount(due);
        BigDecimal totalPaid = Money.amount(paid);
        return new Totals(
                month,
                month == null ? null : Month.of(month).getDisplayName(TextStyle.SHORT, Locale.UK),
                totalDue,
                totalPaid,
                totalDue.subtract(totalPaid),
                paymentCount,
                paidCount,
                overdueCount,
                Money.percent(totalPaid, totalDue));
    }

    static Totals sum(List<Totals> months) {
        BigDecimal due = BigDecimal.ZERO;
        BigDecimal paid = BigDecimal.ZERO;
        long payments = 0;
        long paidCount = 0;
        long overdue = 0;
        for (Totals month : months) {
            due = due.add(month.totalDue());
            paid = paid.add(month.totalPaid());
            payments += month.paymentCount();
            paidCount += month.paidCount();
            overdue += month.overdueCount();
        }
        return totals(null, due, paid, payments, paidCount, overdue);
    }

    private static Totals empty(int month) {
        return totals(month, BigDecimal.ZERO, BigDecimal.ZERO, 0, 0, 0);
    }
}
